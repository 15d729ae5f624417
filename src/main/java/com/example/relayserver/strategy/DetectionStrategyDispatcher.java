package com.example.relayserver.strategy;

import com.example.relayserver.exception.RelayExtractionException;
import com.example.relayserver.model.DetectionMethod;
import com.example.relayserver.model.RelayModelProfile;
import com.example.relayserver.model.ReviewReason;
import com.example.relayserver.model.SourceDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 按型号配置的检测方法选择唯一策略
 */
public class DetectionStrategyDispatcher {

    private static final Logger log = LoggerFactory.getLogger(DetectionStrategyDispatcher.class);

    private final Map<DetectionMethod, DetectionStrategy> strategies = new EnumMap<>(DetectionMethod.class);

    public DetectionStrategyDispatcher(List<DetectionStrategy> strategies) {
        for (DetectionStrategy strategy : strategies) {
            DetectionStrategy previous = this.strategies.put(strategy.getMethod(), strategy);
            if (previous != null) {
                throw new IllegalStateException("duplicate strategy for " + strategy.getMethod());
            }
        }
    }

    public ExtractionResult dispatch(SourceDocument document, RelayModelProfile profile)
            throws RelayExtractionException, IOException {
        DetectionMethod method = profile.getDetectionMethod();
        DetectionStrategy strategy = method == null ? null : strategies.get(method);
        if (strategy == null) {
            throw new RelayExtractionException(ReviewReason.PROCESSING_ERROR,
                    "型号 " + profile.getModelCode() + " 没有可用的检测策略: " + method);
        }
        log.debug("{} 使用 {} 策略（型号 {}）", document.getFileName(), method, profile.getModelCode());
        return strategy.extract(document, profile);
    }
}
