package com.example.relayserver.exception;

import com.example.relayserver.model.ReviewReason;

/**
 * 单个文档处理失败的基类，携带复核原因，批处理据此记录报告并继续下一个文档
 */
public class RelayExtractionException extends Exception {

    private final ReviewReason reason;

    public RelayExtractionException(ReviewReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RelayExtractionException(ReviewReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public ReviewReason getReason() {
        return reason;
    }
}
