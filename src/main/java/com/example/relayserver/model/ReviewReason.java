package com.example.relayserver.model;

/**
 * 人工复核原因
 */
public enum ReviewReason {
    UNKNOWN_MODEL,
    ENCODING_UNRESOLVED,
    UNMATCHED_CHECKBOX,
    AMBIGUOUS_CHECKBOX,
    ZERO_CORRELATION,
    CALIBRATION_FAILED,
    EQUIPMENT_UNRESOLVED,
    INTEGRITY_MISMATCH,
    PROCESSING_ERROR
}
