package com.example.relayserver.service;

import com.example.relayserver.config.RelayProfileLoader;
import com.example.relayserver.exception.IntegrityMismatchException;
import com.example.relayserver.model.ActiveFlagResult;
import com.example.relayserver.model.BatchReport;
import com.example.relayserver.model.DetectionMethod;
import com.example.relayserver.model.DocumentOutcome;
import com.example.relayserver.model.Equipment;
import com.example.relayserver.model.NormalizedSetting;
import com.example.relayserver.model.NormalizedValue;
import com.example.relayserver.model.ParameterLine;
import com.example.relayserver.model.RelayModelProfile;
import com.example.relayserver.model.ReviewItem;
import com.example.relayserver.model.ReviewReason;
import com.example.relayserver.strategy.CheckboxDetectionStrategy;
import com.example.relayserver.strategy.DetectionStrategy;
import com.example.relayserver.strategy.DetectionStrategyDispatcher;
import com.example.relayserver.strategy.ExtractionResult;
import com.example.relayserver.strategy.KeyedSectionDetectionStrategy;
import com.example.relayserver.strategy.LabeledFieldDetectionStrategy;
import com.example.relayserver.strategy.ModelProfileResolver;
import com.example.relayserver.util.identity.EquipmentTagResolver;
import com.example.relayserver.util.normalize.MultipartGrouper;
import com.example.relayserver.util.normalize.UnitValueNormalizer;
import com.example.relayserver.util.text.TextDecoder;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class DocumentProcessorTest {

    private static final String S40 = String.join("\r\n",
            "[Identification]",
            "repere=52-MF-02A",
            "[Protection50]",
            "activite_0=0",
            "activite_1=1",
            "seuil_1=2,5 A",
            "[Protection27]",
            "activite_0=0",
            "seuil_0=80 V",
            "");

    @TempDir
    Path tempDir;

    private DocumentProcessor processor;
    private SettingsPersistenceService persistenceService;
    private ModelProfileResolver resolver;
    private final BatchReport report = new BatchReport("run-1", "inputs");

    @BeforeEach
    void setUp() {
        List<RelayModelProfile> profiles = new RelayProfileLoader(new ObjectMapper()).load(null);
        resolver = new ModelProfileResolver(profiles);
        UnitValueNormalizer normalizer = new UnitValueNormalizer();
        persistenceService = mock(SettingsPersistenceService.class);

        processor = new DocumentProcessor();
        ReflectionTestUtils.setField(processor, "documentLoader", new SourceDocumentLoader());
        ReflectionTestUtils.setField(processor, "modelProfileResolver", resolver);
        ReflectionTestUtils.setField(processor, "dispatcher", new DetectionStrategyDispatcher(List.of(
                new CheckboxDetectionStrategy(false),
                new LabeledFieldDetectionStrategy(TextDecoder.DEFAULT_ENCODINGS),
                new KeyedSectionDetectionStrategy(TextDecoder.DEFAULT_ENCODINGS))));
        ReflectionTestUtils.setField(processor, "equipmentTagResolver", new EquipmentTagResolver(null));
        ReflectionTestUtils.setField(processor, "normalizer", normalizer);
        ReflectionTestUtils.setField(processor, "multipartGrouper", new MultipartGrouper(normalizer));
        ReflectionTestUtils.setField(processor, "persistenceService", persistenceService);
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private static List<ReviewReason> reasons(BatchReport report) {
        return report.getReviewItems().stream().map(ReviewItem::getReason).collect(Collectors.toList());
    }

    @Test
    @SuppressWarnings("unchecked")
    void keyedSectionFileIsPersistedWithActiveSettings() throws Exception {
        Path file = write("00-MF-12_config.S40", S40);

        DocumentOutcome outcome = processor.process(file, Collections.emptyMap(), report);

        assertThat(outcome.getStatus()).isEqualTo(DocumentOutcome.Status.SUCCESS);
        assertThat(outcome.getModelCode()).isEqualTo("SEPAM_S40");
        // repere 优先于文件名
        assertThat(outcome.getEquipmentTag()).isEqualTo("52-MF-02A");
        assertThat(outcome.getDetectionMethod()).isEqualTo(DetectionMethod.KEYED_SECTION);

        ArgumentCaptor<Equipment> equipment = ArgumentCaptor.forClass(Equipment.class);
        ArgumentCaptor<List<NormalizedSetting>> settings = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<List<ActiveFlagResult>> flags = ArgumentCaptor.forClass(List.class);
        verify(persistenceService).persist(any(), equipment.capture(), any(), eq("UTF-8"),
                settings.capture(), flags.capture());

        assertThat(equipment.getValue().getTagSource()).isEqualTo(EquipmentTagResolver.SOURCE_CONTENT);
        Map<String, NormalizedSetting> byCode = settings.getValue().stream()
                .collect(Collectors.toMap(NormalizedSetting::getParameterCode, Function.identity()));
        assertThat(byCode.get("Protection50.seuil_1").isActive()).isTrue();
        assertThat(byCode.get("Protection50.seuil_1").getValue().getUnit()).isEqualTo("A");
        assertThat(byCode.get("Protection27.seuil_0").isActive()).isFalse();
        assertThat(byCode.get("Identification.repere").isActive()).isFalse();
        assertThat(byCode.values()).allSatisfy(s -> assertThat(s.getEquipmentTag()).isEqualTo("52-MF-02A"));

        Map<String, ActiveFlagResult> flagByCode = flags.getValue().stream()
                .collect(Collectors.toMap(ActiveFlagResult::getFunctionCode, Function.identity()));
        assertThat(flagByCode.get("50").isActive()).isTrue();
        assertThat(flagByCode.get("50").getGroupIndex()).isEqualTo(1);
        assertThat(flagByCode.get("27").isActive()).isFalse();
        assertThat(flagByCode).hasSize(15);

        assertThat(report.getOutcomes()).containsExactly(outcome);
    }

    @Test
    void unknownFileIsSkippedForReview() throws Exception {
        Path file = write("notes.docx", "meeting notes");

        DocumentOutcome outcome = processor.process(file, Collections.emptyMap(), report);

        assertThat(outcome.getStatus()).isEqualTo(DocumentOutcome.Status.SKIPPED);
        assertThat(reasons(report)).containsExactly(ReviewReason.UNKNOWN_MODEL);
        verifyNoInteractions(persistenceService);
    }

    @Test
    void missingEquipmentTagIsSkipped() throws Exception {
        Path file = write("config.S40", S40.replace("repere=52-MF-02A", "libelle=depart"));

        DocumentOutcome outcome = processor.process(file, Collections.emptyMap(), report);

        assertThat(outcome.getStatus()).isEqualTo(DocumentOutcome.Status.SKIPPED);
        assertThat(outcome.getModelCode()).isEqualTo("SEPAM_S40");
        assertThat(reasons(report)).containsExactly(ReviewReason.EQUIPMENT_UNRESOLVED);
    }

    @Test
    void undecodableTextIsSkipped() throws Exception {
        Path file = tempDir.resolve("00-MF-12.S40");
        Files.write(file, new byte[]{'r', 'e', 'p', (byte) 0x81, '=', '1'});

        DocumentOutcome outcome = processor.process(file, Collections.emptyMap(), report);

        assertThat(outcome.getStatus()).isEqualTo(DocumentOutcome.Status.SKIPPED);
        assertThat(reasons(report)).containsExactly(ReviewReason.ENCODING_UNRESOLVED);
        verify(persistenceService, never()).persist(any(), any(), any(), any(), anyList(), anyList());
    }

    @Test
    void uncalibratedModelIsSkippedWhenCalibrationRequired() throws Exception {
        resolver.getProfiles().stream()
                .filter(p -> p.getModelCode().equals("SEPAM_S40"))
                .forEach(p -> p.setRequireCalibration(true));
        Path file = write("00-MF-12_config.S40", S40);

        DocumentOutcome outcome = processor.process(file, Collections.emptyMap(), report);

        assertThat(outcome.getStatus()).isEqualTo(DocumentOutcome.Status.SKIPPED);
        assertThat(reasons(report)).containsExactly(ReviewReason.CALIBRATION_FAILED);
    }

    @Test
    void integrityMismatchFailsTheDocument() throws Exception {
        doThrow(new IntegrityMismatchException("52-MF-02A", 4, 3)).when(persistenceService)
                .persist(any(), any(), any(), any(), anyList(), anyList());
        Path file = write("00-MF-12_config.S40", S40);

        DocumentOutcome outcome = processor.process(file, Collections.emptyMap(), report);

        assertThat(outcome.getStatus()).isEqualTo(DocumentOutcome.Status.FAILED);
        assertThat(reasons(report)).containsExactly(ReviewReason.INTEGRITY_MISMATCH);
    }

    @Test
    void extractionReviewItemsSurviveAFailedWrite() throws Exception {
        ExtractionResult extraction = new ExtractionResult(DetectionMethod.KEYED_SECTION);
        extraction.setEquipmentHint("52-MF-02A");
        extraction.addReviewItem(new ReviewItem("00-MF-12_config.S40", ReviewReason.UNMATCHED_CHECKBOX,
                "第 1 页复选框 [300, 700] 未匹配参数行"));
        DetectionStrategy strategy = mock(DetectionStrategy.class);
        when(strategy.getMethod()).thenReturn(DetectionMethod.KEYED_SECTION);
        when(strategy.extract(any(), any())).thenReturn(extraction);
        ReflectionTestUtils.setField(processor, "dispatcher", new DetectionStrategyDispatcher(List.of(strategy)));
        doThrow(new IntegrityMismatchException("52-MF-02A", 4, 3)).when(persistenceService)
                .persist(any(), any(), any(), any(), anyList(), anyList());
        Path file = write("00-MF-12_config.S40", S40);

        DocumentOutcome outcome = processor.process(file, Collections.emptyMap(), report);

        assertThat(outcome.getStatus()).isEqualTo(DocumentOutcome.Status.FAILED);
        assertThat(reasons(report)).containsExactly(ReviewReason.UNMATCHED_CHECKBOX, ReviewReason.INTEGRITY_MISMATCH);
    }

    @Test
    void corruptPdfFails() throws Exception {
        Path file = write("P122 52-MF-02A.pdf", "this is not a pdf");

        DocumentOutcome outcome = processor.process(file, Collections.emptyMap(), report);

        assertThat(outcome.getStatus()).isEqualTo(DocumentOutcome.Status.FAILED);
        assertThat(reasons(report)).containsExactly(ReviewReason.PROCESSING_ERROR);
        verifyNoInteractions(persistenceService);
    }

    @Test
    void metadataAndDuplicateCodesAreDropped() {
        RelayModelProfile profile = new RelayModelProfile();
        profile.setMetadataCodes(List.of("0000"));
        ExtractionResult extraction = new ExtractionResult(DetectionMethod.CHECKBOX);
        extraction.addLines(List.of(
                new ParameterLine("0000", "Model", "P122", 10, 0, 0),
                new ParameterLine("0104", "Line CT primary", "1000A", 20, 0, 1),
                new ParameterLine("0104", "Line CT primary", "5A", 30, 1, 0)));

        List<NormalizedSetting> settings = processor.buildSettings(extraction, profile,
                new Equipment("52-MF-02A", "MICON_P122", "filename"), "P122 52-MF-02A.pdf");

        assertThat(settings).hasSize(1);
        assertThat(settings.get(0).getValue()).isEqualTo(NormalizedValue.numeric(
                new java.math.BigDecimal("1000"), "A", "1000A"));
        assertThat(settings.get(0).getDetectionMethod()).isEqualTo(DetectionMethod.CHECKBOX);
        assertThat(settings.get(0).getSourceFileName()).isEqualTo("P122 52-MF-02A.pdf");
    }

    @Test
    void activeFlagsMarkExactCodesAndSectionMembers() {
        List<NormalizedSetting> settings = new ArrayList<>(List.of(
                new NormalizedSetting("0104", "I>", NormalizedValue.text("x")),
                new NormalizedSetting("01040", "other", NormalizedValue.text("x")),
                new NormalizedSetting("Protection50.seuil_1", "seuil_1", NormalizedValue.text("x")),
                new NormalizedSetting("Protection50N.seuil_1", "seuil_1", NormalizedValue.text("x"))));

        DocumentProcessor.applyActiveFlags(settings, List.of(
                new ActiveFlagResult("0104", "I>", true, DetectionMethod.CHECKBOX, null, "0104"),
                new ActiveFlagResult("50", "ANSI 50", true, DetectionMethod.KEYED_SECTION, 1, "Protection50"),
                new ActiveFlagResult("27", "ANSI 27", false, DetectionMethod.KEYED_SECTION, null, "Protection50N")));

        assertThat(settings).extracting(NormalizedSetting::isActive).containsExactly(true, false, true, false);
    }
}
