package com.example.relayserver.util.checkbox;

import com.example.relayserver.model.CheckboxMark;
import com.example.relayserver.model.CorrelationResult;
import com.example.relayserver.model.ParameterLine;
import com.example.relayserver.model.RelayModelProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * 复选框 -> 参数行 位置关联
 *
 * 复选框中心 Y（像素）乘以缩放系数换算到文本层坐标后，与参数行的垂直中心比较。
 * 1. 每个复选框只认容差内距离最近的行，距离相同取阅读顺序靠前的行
 * 2. 同一行被多个复选框认领时，最近的复选框胜出，其余记为未匹配
 * 3. 某个未匹配复选框比某行已匹配的复选框离该行更近时，该匹配作废，复选框转为未匹配，直到不再有此类冲突
 * 4. 仍未匹配、且位于某参数行下方子行窗口内的复选框，归入该行（最近的上方行）作为子行复选框
 *
 * 同一复选框的另一候选行距离差在 ambiguityMargin 内时，标记为歧义。
 */
public class CheckboxCorrelator {

    private static final Logger log = LoggerFactory.getLogger(CheckboxCorrelator.class);

    private final double scale;
    private final double tolerance;
    private final double ambiguityMargin;
    private final double subLineMinOffset;
    private final double subLineWindow;

    public CheckboxCorrelator(RelayModelProfile profile) {
        this(profile.effectiveCoordinateScale(), profile.getCorrelationTolerance(), profile.getAmbiguityMargin(),
                profile.getSubLineMinOffset(), profile.getSubLineWindow());
    }

    public CheckboxCorrelator(double scale, double tolerance, double ambiguityMargin) {
        this(scale, tolerance, ambiguityMargin, 0, 0);
    }

    public CheckboxCorrelator(double scale, double tolerance, double ambiguityMargin,
                              double subLineMinOffset, double subLineWindow) {
        this.scale = scale;
        this.tolerance = tolerance;
        this.ambiguityMargin = ambiguityMargin;
        this.subLineMinOffset = subLineMinOffset;
        this.subLineWindow = subLineWindow;
    }

    /**
     * 关联同一页的复选框与参数行
     */
    public CorrelationResult correlate(List<CheckboxMark> checkboxes, List<ParameterLine> lines, int pageIndex) {
        CorrelationResult result = new CorrelationResult(pageIndex);

        // 每个复选框的最近行
        Map<ParameterLine, List<Candidate>> claims = new IdentityHashMap<>();
        Map<CheckboxMark, List<Candidate>> byBox = new IdentityHashMap<>();
        for (CheckboxMark box : checkboxes) {
            List<Candidate> own = new ArrayList<>();
            Candidate nearest = null;
            for (ParameterLine line : lines) {
                double distance = distance(box, line);
                if (distance > tolerance) {
                    continue;
                }
                Candidate c = new Candidate(box, line, distance);
                own.add(c);
                if (nearest == null || distance < nearest.distance
                        || (distance == nearest.distance && line.getOrder() < nearest.line.getOrder())) {
                    nearest = c;
                }
            }
            byBox.put(box, own);
            if (nearest != null) {
                claims.computeIfAbsent(nearest.line, k -> new ArrayList<>()).add(nearest);
            }
        }

        // 每行只留最近的认领者
        List<Candidate> assigned = new ArrayList<>();
        Map<CheckboxMark, Boolean> matchedBoxes = new IdentityHashMap<>();
        for (List<Candidate> lineClaims : claims.values()) {
            lineClaims.sort(Comparator.comparingDouble((Candidate c) -> c.distance)
                    .thenComparingInt(c -> c.box.getY()));
            Candidate winner = lineClaims.get(0);
            assigned.add(winner);
            matchedBoxes.put(winner.box, Boolean.TRUE);
        }

        // 未匹配的复选框更靠近某行时，该行的匹配不可信
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int i = assigned.size() - 1; i >= 0; i--) {
                Candidate c = assigned.get(i);
                CheckboxMark closer = closerUnmatched(c, checkboxes, matchedBoxes);
                if (closer != null) {
                    log.warn("页面 {} 复选框 y={} 与 {} 的匹配被 y={} 的复选框争用，放弃", pageIndex,
                            c.box.getY(), c.line.getCode(), closer.getY());
                    assigned.remove(i);
                    matchedBoxes.remove(c.box);
                    changed = true;
                }
            }
        }

        assigned.sort(Comparator.comparingInt((Candidate c) -> c.line.getOrder()));
        for (Candidate c : assigned) {
            boolean ambiguous = false;
            for (Candidate other : byBox.get(c.box)) {
                if (other.line != c.line && Math.abs(other.distance - c.distance) <= ambiguityMargin) {
                    ambiguous = true;
                    break;
                }
            }
            if (ambiguous) {
                log.warn("页面 {} 复选框 y={} 与多行距离接近，归属 {} 存疑", pageIndex, c.box.getY(), c.line.getCode());
            }
            result.addMatch(new CorrelationResult.Match(c.box, c.line, c.distance, ambiguous));
        }

        for (CheckboxMark box : checkboxes) {
            if (matchedBoxes.containsKey(box)) {
                continue;
            }
            ParameterLine parent = parentAbove(box, lines);
            if (parent != null) {
                result.addChild(parent, box);
                log.debug("页面 {} 复选框 y={} 归入 {} 的子行", pageIndex, box.getY(), parent.getCode());
            } else {
                result.addUnmatched(box);
                log.warn("页面 {} 复选框未匹配到参数行: {}", pageIndex, box);
            }
        }

        log.debug("页面 {} 关联完成: 复选框 {}, 参数行 {}, 匹配 {}, 子行 {}, 未匹配 {}", pageIndex, checkboxes.size(),
                lines.size(), result.getMatches().size(), result.getChildCount(), result.getUnmatched().size());
        return result;
    }

    private double distance(CheckboxMark box, ParameterLine line) {
        return Math.abs(line.getY() - box.getCenterY() * scale);
    }

    private CheckboxMark closerUnmatched(Candidate c, List<CheckboxMark> checkboxes,
                                         Map<CheckboxMark, Boolean> matchedBoxes) {
        for (CheckboxMark box : checkboxes) {
            if (!matchedBoxes.containsKey(box) && distance(box, c.line) < c.distance) {
                return box;
            }
        }
        return null;
    }

    /**
     * 下方 (subLineMinOffset, subLineWindow] 范围内最近的上方参数行；窗口为 0 时不做子行关联
     */
    private ParameterLine parentAbove(CheckboxMark box, List<ParameterLine> lines) {
        if (subLineWindow <= 0) {
            return null;
        }
        double boxY = box.getCenterY() * scale;
        ParameterLine parent = null;
        for (ParameterLine line : lines) {
            double below = boxY - line.getY();
            if (below > subLineMinOffset && below <= subLineWindow && (parent == null || line.getY() > parent.getY())) {
                parent = line;
            }
        }
        return parent;
    }

    private static class Candidate {
        final CheckboxMark box;
        final ParameterLine line;
        final double distance;

        Candidate(CheckboxMark box, ParameterLine line, double distance) {
            this.box = box;
            this.line = line;
            this.distance = distance;
        }
    }
}
