package com.example.relayserver.exception;

import com.example.relayserver.model.ReviewReason;

import java.util.List;

/**
 * 所有候选编码都无法无损解析文本
 */
public class EncodingUnresolvedException extends RelayExtractionException {

    public EncodingUnresolvedException(String fileName, List<String> triedEncodings) {
        super(ReviewReason.ENCODING_UNRESOLVED,
                "无法解析文本编码: " + fileName + ", 已尝试 " + triedEncodings);
    }
}
