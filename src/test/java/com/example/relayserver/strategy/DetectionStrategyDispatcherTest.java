package com.example.relayserver.strategy;

import com.example.relayserver.exception.RelayExtractionException;
import com.example.relayserver.model.DetectionMethod;
import com.example.relayserver.model.RelayModelProfile;
import com.example.relayserver.model.ReviewReason;
import com.example.relayserver.model.SourceDocument;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DetectionStrategyDispatcherTest {

    private final SourceDocument doc = new SourceDocument(Paths.get("00-MF-12.S40"), "x", 1, 1, "", null);

    private static DetectionStrategy strategy(DetectionMethod method) {
        DetectionStrategy strategy = mock(DetectionStrategy.class);
        when(strategy.getMethod()).thenReturn(method);
        return strategy;
    }

    @Test
    void routesByProfileMethod() throws Exception {
        DetectionStrategy checkbox = strategy(DetectionMethod.CHECKBOX);
        DetectionStrategy keyed = strategy(DetectionMethod.KEYED_SECTION);
        ExtractionResult expected = new ExtractionResult(DetectionMethod.KEYED_SECTION);
        RelayModelProfile profile = new RelayModelProfile();
        profile.setModelCode("SEPAM_S40");
        profile.setDetectionMethod(DetectionMethod.KEYED_SECTION);
        when(keyed.extract(doc, profile)).thenReturn(expected);

        DetectionStrategyDispatcher dispatcher = new DetectionStrategyDispatcher(List.of(checkbox, keyed));

        assertThat(dispatcher.dispatch(doc, profile)).isSameAs(expected);
        verify(keyed).extract(doc, profile);
    }

    @Test
    void missingStrategyIsAnExtractionError() {
        RelayModelProfile profile = new RelayModelProfile();
        profile.setModelCode("MICON_P143");
        profile.setDetectionMethod(DetectionMethod.LABELED_FIELD);
        DetectionStrategyDispatcher dispatcher =
                new DetectionStrategyDispatcher(List.of(strategy(DetectionMethod.CHECKBOX)));

        assertThatThrownBy(() -> dispatcher.dispatch(doc, profile))
                .isInstanceOf(RelayExtractionException.class)
                .satisfies(e -> assertThat(((RelayExtractionException) e).getReason())
                        .isEqualTo(ReviewReason.PROCESSING_ERROR));
    }

    @Test
    void duplicateStrategiesAreRejected() {
        assertThatThrownBy(() -> new DetectionStrategyDispatcher(
                List.of(strategy(DetectionMethod.CHECKBOX), strategy(DetectionMethod.CHECKBOX))))
                .isInstanceOf(IllegalStateException.class);
    }
}
