package com.example.relayserver.exception;

import com.example.relayserver.model.ReviewReason;

/**
 * 没有任何型号配置能识别该文档，不猜测默认策略
 */
public class UnknownModelException extends RelayExtractionException {

    public UnknownModelException(String fileName) {
        super(ReviewReason.UNKNOWN_MODEL, "未识别的继电器型号: " + fileName);
    }
}
