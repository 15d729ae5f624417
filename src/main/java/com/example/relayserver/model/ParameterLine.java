package com.example.relayserver.model;

/**
 * 一个候选参数行：代码 + 描述 + 原始值 + 垂直位置
 */
public class ParameterLine {

    private final String code;
    private final String description;
    private final String rawValue;
    /** 文本层坐标系下的垂直中心位置（pt） */
    private final float y;
    private final int pageIndex;
    /** 页内阅读顺序（栏优先，栏内自上而下） */
    private final int order;

    public ParameterLine(String code, String description, String rawValue, float y, int pageIndex, int order) {
        this.code = code;
        this.description = description;
        this.rawValue = rawValue;
        this.y = y;
        this.pageIndex = pageIndex;
        this.order = order;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public String getRawValue() {
        return rawValue;
    }

    public float getY() {
        return y;
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public int getOrder() {
        return order;
    }

    /**
     * 续行追加到描述后，返回新实例
     */
    public ParameterLine withDescription(String newDescription) {
        return new ParameterLine(code, newDescription, rawValue, y, pageIndex, order);
    }

    public ParameterLine withRawValue(String newRawValue) {
        return new ParameterLine(code, description, newRawValue, y, pageIndex, order);
    }

    @Override
    public String toString() {
        return String.format("ParameterLine{page=%d, code=%s, desc='%s', value='%s', y=%.2f}",
                pageIndex, code, description, rawValue, y);
    }
}
