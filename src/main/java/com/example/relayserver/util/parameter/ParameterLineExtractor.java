package com.example.relayserver.util.parameter;

import com.example.relayserver.model.ParameterLine;
import com.example.relayserver.model.RelayModelProfile;
import com.example.relayserver.model.TextRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 参数行提取器
 *
 * 将一页文本层（或一个纯文本导出）转换为有序的 ParameterLine 列表。
 *
 * 设计原则：
 * 1. 先分栏再排行 - 由参数代码的 X 位置聚类出栏带，文本片段只归属一个栏带
 * 2. 栏内按基线聚类成行，行内从左到右拼接
 * 3. 行首定宽代码 = 新参数；无代码的行是续行，追加到上一参数的描述
 * 4. 一个代码都没有的页（封面等）返回空列表，这是正常状态
 *
 * 续行依赖上一行状态，同一文档内必须顺序调用。
 */
public class ParameterLineExtractor {

    private static final Logger log = LoggerFactory.getLogger(ParameterLineExtractor.class);

    /** 片段间距超过该倍数的字高视为"描述 / 值"分隔（em 单位） */
    private static final double VALUE_GAP_EM = 1.5;

    /** 大间距分隔符，解析时作为描述与值的边界 */
    private static final char FIELD_SEPARATOR = '\t';

    private final Pattern codePattern;
    private final Pattern codeTokenPattern;
    private final double columnBandGap;
    private final double lineMergeTolerance;
    private final double continuationGap;

    public ParameterLineExtractor(RelayModelProfile profile) {
        this(profile.getCodePattern(), profile.getColumnBandGap(),
                profile.getLineMergeTolerance(), profile.getContinuationGap());
    }

    public ParameterLineExtractor(String codeRegex, double columnBandGap, double lineMergeTolerance, double continuationGap) {
        // 行首代码：代码本身 + 可选冒号，后面必须是空白、冒号或行尾
        this.codePattern = Pattern.compile("^(" + codeRegex + ")(?=\\s|:|=|$)\\s*[:=]?\\s*(.*)$", Pattern.DOTALL);
        this.codeTokenPattern = Pattern.compile("^(" + codeRegex + "):?$");
        this.columnBandGap = columnBandGap;
        this.lineMergeTolerance = lineMergeTolerance;
        this.continuationGap = continuationGap;
    }

    // ========== PDF 文本层 ==========

    /**
     * 从一页文本片段提取参数行
     *
     * @param runs      一页的文本片段
     * @param pageIndex 页索引
     * @return 参数行（栏优先，栏内自上而下），非参数页返回空列表
     */
    public List<ParameterLine> extract(List<TextRun> runs, int pageIndex) {
        List<ParameterLine> result = new ArrayList<>();
        if (runs == null || runs.isEmpty()) {
            return result;
        }

        List<Double> bandAnchors = findBandAnchors(runs);
        if (bandAnchors.isEmpty()) {
            log.debug("页面 {} 无参数代码，视为非参数页", pageIndex);
            return result;
        }

        // 按栏带分组
        List<List<TextRun>> bands = new ArrayList<>();
        for (int i = 0; i < bandAnchors.size(); i++) {
            bands.add(new ArrayList<>());
        }
        for (TextRun run : runs) {
            bands.get(bandOf(run.getX(), bandAnchors)).add(run);
        }

        int order = 0;
        for (List<TextRun> band : bands) {
            List<List<TextRun>> visualLines = groupIntoLines(band);

            ParameterLine previous = null;
            float previousLineY = Float.NaN;
            for (List<TextRun> visualLine : visualLines) {
                String text = joinLine(visualLine);
                float lineY = centerY(visualLine);

                ParsedLine parsed = parse(text);
                if (parsed != null) {
                    if (previous != null) {
                        result.add(previous);
                    }
                    previous = new ParameterLine(parsed.code, parsed.description, parsed.value,
                            lineY, pageIndex, order++);
                    previousLineY = lineY;
                    continue;
                }

                // 续行：紧邻上一参数行且垂直间距在阈值内
                if (previous != null && lineY - previousLineY <= continuationGap) {
                    previous = appendContinuation(previous, text);
                    previousLineY = lineY;
                }
            }
            if (previous != null) {
                result.add(previous);
            }
        }

        log.debug("页面 {} 提取参数行 {} 条（{} 个栏带）", pageIndex, result.size(), bandAnchors.size());
        return result;
    }

    /**
     * 代码片段的 X 位置聚类为栏带起点
     *
     * 候选代码片段必须是独立片段（左侧 1.5em 内没有紧贴的文字）；
     * 页面上存在带冒号的代码（"0104:"）时，只有带冒号的才参与聚类，避免数值列中的十六进制值被误当作栏起点。
     */
    private List<Double> findBandAnchors(List<TextRun> runs) {
        List<TextRun> candidates = new ArrayList<>();
        boolean anyWithColon = false;
        for (TextRun run : runs) {
            String t = run.getText().trim();
            if (codeTokenPattern.matcher(t).matches() && !gluedToLeft(run, runs)) {
                candidates.add(run);
                anyWithColon |= t.endsWith(":");
            }
        }

        List<Double> codeXs = new ArrayList<>();
        for (TextRun run : candidates) {
            if (!anyWithColon || run.getText().trim().endsWith(":")) {
                codeXs.add((double) run.getX());
            }
        }
        codeXs.sort(Double::compare);

        List<Double> anchors = new ArrayList<>();
        for (double x : codeXs) {
            if (anchors.isEmpty() || x - anchors.get(anchors.size() - 1) > columnBandGap) {
                anchors.add(x);
            }
        }
        return anchors;
    }

    private boolean gluedToLeft(TextRun run, List<TextRun> runs) {
        double em = Math.max(1.0, run.getHeight());
        for (TextRun other : runs) {
            if (other == run || Math.abs(other.getCenterY() - run.getCenterY()) > lineMergeTolerance) {
                continue;
            }
            double gap = run.getX() - other.getRight();
            if (other.getX() < run.getX() && gap < VALUE_GAP_EM * em) {
                return true;
            }
        }
        return false;
    }

    /**
     * 片段所属栏带：起点不大于片段 X（含合并容差）的最后一个栏带
     */
    private int bandOf(float x, List<Double> anchors) {
        int band = 0;
        for (int i = 0; i < anchors.size(); i++) {
            if (anchors.get(i) <= x + lineMergeTolerance) {
                band = i;
            }
        }
        return band;
    }

    /**
     * 栏内按中心线聚类成行，行内按 X 排序
     */
    private List<List<TextRun>> groupIntoLines(List<TextRun> band) {
        List<TextRun> sorted = new ArrayList<>(band);
        sorted.sort(Comparator.comparingDouble(TextRun::getCenterY).thenComparingDouble(TextRun::getX));

        List<List<TextRun>> lines = new ArrayList<>();
        List<TextRun> current = new ArrayList<>();
        float currentY = Float.NaN;
        for (TextRun run : sorted) {
            if (!current.isEmpty() && Math.abs(run.getCenterY() - currentY) > lineMergeTolerance) {
                lines.add(current);
                current = new ArrayList<>();
            }
            if (current.isEmpty()) {
                currentY = run.getCenterY();
            }
            current.add(run);
        }
        if (!current.isEmpty()) {
            lines.add(current);
        }

        for (List<TextRun> line : lines) {
            line.sort(Comparator.comparingDouble(TextRun::getX));
        }
        return lines;
    }

    /**
     * 拼接一行：小间距用空格，大间距用字段分隔符
     */
    private String joinLine(List<TextRun> line) {
        StringBuilder sb = new StringBuilder();
        TextRun prev = null;
        for (TextRun run : line) {
            if (prev != null) {
                double em = Math.max(1.0, Math.max(prev.getHeight(), run.getHeight()));
                double gap = run.getX() - prev.getRight();
                sb.append(gap > VALUE_GAP_EM * em ? FIELD_SEPARATOR : ' ');
            }
            sb.append(run.getText());
            prev = run;
        }
        return sb.toString();
    }

    private static float centerY(List<TextRun> line) {
        float top = Float.MAX_VALUE;
        float bottom = -Float.MAX_VALUE;
        for (TextRun run : line) {
            top = Math.min(top, run.getTop());
            bottom = Math.max(bottom, run.getBottom());
        }
        return (top + bottom) / 2f;
    }

    // ========== 纯文本导出 ==========

    /**
     * 从纯文本导出的行提取参数行（MiCOM/Easergy 文本格式）
     * <pre>
     *   09.0A: Frequency: 60Hz
     *   0104: Line CT primary=: 1000A
     *   35.23: I>1 Function:
     *   DT                      &lt;- 上一行值待定，作为值
     * </pre>
     * 行号作为 Y 位置。空行终止续行。
     */
    public List<ParameterLine> extractFromText(List<String> lines) {
        List<ParameterLine> result = new ArrayList<>();
        ParameterLine previous = null;
        int order = 0;

        for (int i = 0; i < lines.size(); i++) {
            String text = lines.get(i).trim();
            if (text.isEmpty()) {
                if (previous != null) {
                    result.add(previous);
                    previous = null;
                }
                continue;
            }

            ParsedLine parsed = parse(text);
            if (parsed != null) {
                if (previous != null) {
                    result.add(previous);
                }
                previous = new ParameterLine(parsed.code, parsed.description, parsed.value, i, 0, order++);
            } else if (previous != null) {
                previous = appendContinuation(previous, text);
            }
        }
        if (previous != null) {
            result.add(previous);
        }
        return result;
    }

    // ========== 行解析 ==========

    /**
     * 续行：上一行值待定时作为值，否则追加到描述
     */
    private ParameterLine appendContinuation(ParameterLine previous, String text) {
        String clean = text.replace(FIELD_SEPARATOR, ' ').trim();
        if (previous.getRawValue().isEmpty() && previous.getDescription().endsWith(":")) {
            String description = previous.getDescription();
            description = description.substring(0, description.length() - 1).trim();
            return new ParameterLine(previous.getCode(), description, clean,
                    previous.getY(), previous.getPageIndex(), previous.getOrder());
        }
        return previous.withDescription((previous.getDescription() + " " + clean).trim());
    }

    /**
     * 解析一行文本：代码 + 描述 + 值
     *
     * @return 不以代码开头时返回 null
     */
    ParsedLine parse(String lineText) {
        String text = lineText.trim();
        Matcher m = codePattern.matcher(text);
        if (!m.matches()) {
            return null;
        }
        String code = m.group(1);
        String rest = m.group(2).trim();

        String description;
        String value;
        int colon = rest.indexOf(':');
        if (colon >= 0 && colon < rest.length() - 1) {
            // "描述: 值" 或 "描述=: 值"
            description = rest.substring(0, colon);
            value = rest.substring(colon + 1);
        } else if (colon == rest.length() - 1 && colon >= 0) {
            // "描述:" 值在下一行，保留冒号作为待定标记
            description = rest;
            value = "";
        } else {
            int sep = rest.lastIndexOf(FIELD_SEPARATOR);
            if (sep >= 0) {
                description = rest.substring(0, sep);
                value = rest.substring(sep + 1);
            } else {
                description = rest;
                value = "";
            }
        }

        description = clean(description);
        if (description.endsWith("=")) {
            description = description.substring(0, description.length() - 1).trim();
        }
        return new ParsedLine(code, description, clean(value));
    }

    private static String clean(String s) {
        return s.replace(FIELD_SEPARATOR, ' ').replaceAll("\\s+", " ").trim();
    }

    static class ParsedLine {
        final String code;
        final String description;
        final String value;

        ParsedLine(String code, String description, String value) {
            this.code = code;
            this.description = description;
            this.value = value;
        }
    }
}
