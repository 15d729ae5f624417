package com.example.relayserver.strategy;

import com.example.relayserver.exception.RelayExtractionException;
import com.example.relayserver.model.DetectionMethod;
import com.example.relayserver.model.RelayModelProfile;
import com.example.relayserver.model.SourceDocument;

import java.io.IOException;

/**
 * 激活功能检测策略
 *
 * 每个文档只由一个策略处理，策略产出的每个 ActiveFlagResult 都带上自己的 DetectionMethod。
 */
public interface DetectionStrategy {

    DetectionMethod getMethod();

    ExtractionResult extract(SourceDocument document, RelayModelProfile profile)
            throws RelayExtractionException, IOException;
}
