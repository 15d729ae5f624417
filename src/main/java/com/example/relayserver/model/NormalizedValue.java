package com.example.relayserver.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * 原子化后的参数值 (value, unit, type)
 */
public class NormalizedValue {

    private final BigDecimal numericValue;
    private final String textValue;
    private final String unit;
    private final ValueType valueType;
    /** 原始文本，布尔转换后保留用于审计 */
    private final String originalText;

    public NormalizedValue(BigDecimal numericValue, String textValue, String unit,
                           ValueType valueType, String originalText) {
        this.numericValue = numericValue;
        this.textValue = textValue;
        this.unit = unit;
        this.valueType = valueType;
        this.originalText = originalText;
    }

    public static NormalizedValue numeric(BigDecimal value, String unit, String originalText) {
        return new NormalizedValue(value, null, unit, ValueType.NUMERIC, originalText);
    }

    public static NormalizedValue text(String value) {
        return new NormalizedValue(null, value, null, ValueType.TEXT, value);
    }

    public static NormalizedValue bool(boolean value, String originalText) {
        return new NormalizedValue(value ? BigDecimal.ONE : BigDecimal.ZERO, null, null, ValueType.BOOLEAN, originalText);
    }

    public static NormalizedValue empty(String originalText) {
        return new NormalizedValue(null, null, null, ValueType.EMPTY, originalText);
    }

    public BigDecimal getNumericValue() {
        return numericValue;
    }

    public String getTextValue() {
        return textValue;
    }

    public String getUnit() {
        return unit;
    }

    public ValueType getValueType() {
        return valueType;
    }

    public String getOriginalText() {
        return originalText;
    }

    /**
     * 重新拼成文本（数值 + 单位），用于幂等性校验
     */
    public String render() {
        switch (valueType) {
            case NUMERIC:
                return numericValue.toPlainString() + (unit != null ? unit : "");
            case BOOLEAN:
                return originalText;
            case TEXT:
                return textValue;
            default:
                return "";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NormalizedValue)) return false;
        NormalizedValue that = (NormalizedValue) o;
        return valueType == that.valueType
                && compareNumbers(numericValue, that.numericValue)
                && Objects.equals(textValue, that.textValue)
                && Objects.equals(unit, that.unit);
    }

    private static boolean compareNumbers(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.compareTo(b) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(valueType, numericValue == null ? null : numericValue.stripTrailingZeros(), textValue, unit);
    }

    @Override
    public String toString() {
        return String.format("NormalizedValue{type=%s, number=%s, text=%s, unit=%s}",
                valueType, numericValue, textValue, unit);
    }
}
