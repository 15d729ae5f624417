package com.example.relayserver.model;

/**
 * 设备身份：由文件名约定或文档内容确定性地推导出的位号
 */
public class Equipment {

    private final String tag;
    private final String modelCode;
    /** 位号来源：content / filename */
    private final String tagSource;

    public Equipment(String tag, String modelCode, String tagSource) {
        this.tag = tag;
        this.modelCode = modelCode;
        this.tagSource = tagSource;
    }

    public String getTag() {
        return tag;
    }

    public String getModelCode() {
        return modelCode;
    }

    public String getTagSource() {
        return tagSource;
    }

    @Override
    public String toString() {
        return "Equipment{tag=" + tag + ", model=" + modelCode + ", source=" + tagSource + "}";
    }
}
