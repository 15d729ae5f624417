package com.example.relayserver.model;

/**
 * 单个文档的处理结果
 */
public class DocumentOutcome {

    public enum Status {
        SUCCESS,
        SKIPPED,
        FAILED
    }

    private final String fileName;
    private final Status status;
    private final String modelCode;
    private final String equipmentTag;
    private final DetectionMethod detectionMethod;
    private final int parameterCount;
    private final int activeFunctionCount;
    private final String message;

    public DocumentOutcome(String fileName, Status status, String modelCode, String equipmentTag,
                           DetectionMethod detectionMethod, int parameterCount, int activeFunctionCount,
                           String message) {
        this.fileName = fileName;
        this.status = status;
        this.modelCode = modelCode;
        this.equipmentTag = equipmentTag;
        this.detectionMethod = detectionMethod;
        this.parameterCount = parameterCount;
        this.activeFunctionCount = activeFunctionCount;
        this.message = message;
    }

    public static DocumentOutcome skipped(String fileName, String modelCode, String message) {
        return new DocumentOutcome(fileName, Status.SKIPPED, modelCode, null, null, 0, 0, message);
    }

    public static DocumentOutcome failed(String fileName, String modelCode, String message) {
        return new DocumentOutcome(fileName, Status.FAILED, modelCode, null, null, 0, 0, message);
    }

    public String getFileName() {
        return fileName;
    }

    public Status getStatus() {
        return status;
    }

    public String getModelCode() {
        return modelCode;
    }

    public String getEquipmentTag() {
        return equipmentTag;
    }

    public DetectionMethod getDetectionMethod() {
        return detectionMethod;
    }

    public int getParameterCount() {
        return parameterCount;
    }

    public int getActiveFunctionCount() {
        return activeFunctionCount;
    }

    public String getMessage() {
        return message;
    }
}
