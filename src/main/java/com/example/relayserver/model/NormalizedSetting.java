package com.example.relayserver.model;

/**
 * 持久化的原子参数记录
 *
 * 设备与来源文档引用在持久化阶段填入；同一设备内以 parameterCode 唯一。
 */
public class NormalizedSetting {

    private String parameterCode;
    private String description;
    private NormalizedValue value;
    private boolean multipart;
    private String multipartBase;
    private Integer multipartPartIndex;
    private boolean active;
    private DetectionMethod detectionMethod;
    private String equipmentTag;
    private String sourceFileName;

    public NormalizedSetting(String parameterCode, String description, NormalizedValue value) {
        this.parameterCode = parameterCode;
        this.description = description;
        this.value = value;
    }

    public String getParameterCode() {
        return parameterCode;
    }

    public String getDescription() {
        return description;
    }

    public NormalizedValue getValue() {
        return value;
    }

    public void setValue(NormalizedValue value) {
        this.value = value;
    }

    public boolean isMultipart() {
        return multipart;
    }

    public String getMultipartBase() {
        return multipartBase;
    }

    public Integer getMultipartPartIndex() {
        return multipartPartIndex;
    }

    /**
     * 标记为多段参数的第 partIndex 段
     */
    public void assignMultipart(String base, int partIndex) {
        this.multipart = true;
        this.multipartBase = base;
        this.multipartPartIndex = partIndex;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public DetectionMethod getDetectionMethod() {
        return detectionMethod;
    }

    public void setDetectionMethod(DetectionMethod detectionMethod) {
        this.detectionMethod = detectionMethod;
    }

    public String getEquipmentTag() {
        return equipmentTag;
    }

    public String getSourceFileName() {
        return sourceFileName;
    }

    /**
     * 绑定血缘：设备 + 来源文档
     */
    public void bindLineage(String equipmentTag, String sourceFileName) {
        this.equipmentTag = equipmentTag;
        this.sourceFileName = sourceFileName;
    }

    @Override
    public String toString() {
        return String.format("NormalizedSetting{code=%s, desc='%s', value=%s, multipart=%s/%s, active=%s}",
                parameterCode, description, value, multipartBase, multipartPartIndex, active);
    }
}
