package com.example.relayserver.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一页复选框与参数行的关联结果
 */
public class CorrelationResult {

    private final int pageIndex;
    private final List<Match> matches = new ArrayList<>();
    private final List<CheckboxMark> unmatched = new ArrayList<>();
    /** 父参数行 -> 其下方子行上的复选框 */
    private final Map<ParameterLine, List<CheckboxMark>> children = new IdentityHashMap<>();

    public CorrelationResult(int pageIndex) {
        this.pageIndex = pageIndex;
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public List<Match> getMatches() {
        return Collections.unmodifiableList(matches);
    }

    public List<CheckboxMark> getUnmatched() {
        return Collections.unmodifiableList(unmatched);
    }

    public void addMatch(Match match) {
        matches.add(match);
    }

    public void addUnmatched(CheckboxMark mark) {
        unmatched.add(mark);
    }

    public void addChild(ParameterLine parent, CheckboxMark mark) {
        children.computeIfAbsent(parent, k -> new ArrayList<>()).add(mark);
    }

    /**
     * @return 该行子行上的复选框，没有时返回空列表
     */
    public List<CheckboxMark> getChildren(ParameterLine parent) {
        List<CheckboxMark> marks = children.get(parent);
        return marks == null ? Collections.emptyList() : Collections.unmodifiableList(marks);
    }

    public int getChildCount() {
        int count = 0;
        for (List<CheckboxMark> marks : children.values()) {
            count += marks.size();
        }
        return count;
    }

    public List<Match> getAmbiguousMatches() {
        List<Match> result = new ArrayList<>();
        for (Match m : matches) {
            if (m.isAmbiguous()) {
                result.add(m);
            }
        }
        return result;
    }

    /**
     * 一个复选框 -> 一个参数行
     */
    public static class Match {

        private final CheckboxMark checkbox;
        private final ParameterLine line;
        /** 文本层坐标下的垂直距离（pt） */
        private final double distance;
        /** 另有候选行距离差在歧义边界内 */
        private final boolean ambiguous;

        public Match(CheckboxMark checkbox, ParameterLine line, double distance, boolean ambiguous) {
            this.checkbox = checkbox;
            this.line = line;
            this.distance = distance;
            this.ambiguous = ambiguous;
        }

        public CheckboxMark getCheckbox() {
            return checkbox;
        }

        public ParameterLine getLine() {
            return line;
        }

        public double getDistance() {
            return distance;
        }

        public boolean isAmbiguous() {
            return ambiguous;
        }

        @Override
        public String toString() {
            return String.format("Match{code=%s, distance=%.2f, ambiguous=%s, marked=%s}",
                    line.getCode(), distance, ambiguous, checkbox.isMarked());
        }
    }
}
