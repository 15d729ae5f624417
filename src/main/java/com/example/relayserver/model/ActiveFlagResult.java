package com.example.relayserver.model;

/**
 * 激活功能检测结果，与产生它的策略无关的统一形态
 */
public class ActiveFlagResult {

    private final String functionCode;
    private final String description;
    private final boolean active;
    private final DetectionMethod detectionMethod;
    /** 命中的编号组（KEYED_SECTION 的 activite_N、LABELED_FIELD 的标签序号），可为空 */
    private final Integer groupIndex;
    /**
     * 结果所依据的参数代码或分节名，用于回写 NormalizedSetting.active；可为空
     */
    private final String parameterCode;

    public ActiveFlagResult(String functionCode, String description, boolean active,
                            DetectionMethod detectionMethod, Integer groupIndex, String parameterCode) {
        if (detectionMethod == null) {
            throw new IllegalArgumentException("detectionMethod is required");
        }
        this.functionCode = functionCode;
        this.description = description;
        this.active = active;
        this.detectionMethod = detectionMethod;
        this.groupIndex = groupIndex;
        this.parameterCode = parameterCode;
    }

    public String getFunctionCode() {
        return functionCode;
    }

    public String getDescription() {
        return description;
    }

    public boolean isActive() {
        return active;
    }

    public DetectionMethod getDetectionMethod() {
        return detectionMethod;
    }

    public Integer getGroupIndex() {
        return groupIndex;
    }

    public String getParameterCode() {
        return parameterCode;
    }

    @Override
    public String toString() {
        return String.format("ActiveFlagResult{function=%s, active=%s, method=%s, group=%s}",
                functionCode, active, detectionMethod, groupIndex);
    }
}
