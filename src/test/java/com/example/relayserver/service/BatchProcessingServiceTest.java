package com.example.relayserver.service;

import com.example.relayserver.config.ExtractorProperties;
import com.example.relayserver.config.RelayProfileLoader;
import com.example.relayserver.model.BatchReport;
import com.example.relayserver.model.DocumentOutcome;
import com.example.relayserver.model.ReviewItem;
import com.example.relayserver.model.ReviewReason;
import com.example.relayserver.strategy.CheckboxDetectionStrategy;
import com.example.relayserver.strategy.DetectionStrategyDispatcher;
import com.example.relayserver.strategy.KeyedSectionDetectionStrategy;
import com.example.relayserver.strategy.LabeledFieldDetectionStrategy;
import com.example.relayserver.strategy.ModelProfileResolver;
import com.example.relayserver.util.checkbox.ToleranceCalibrator;
import com.example.relayserver.util.identity.EquipmentTagResolver;
import com.example.relayserver.util.normalize.MultipartGrouper;
import com.example.relayserver.util.normalize.UnitValueNormalizer;
import com.example.relayserver.util.text.TextDecoder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class BatchProcessingServiceTest {

    @TempDir
    Path tempDir;

    private Path inputDir;
    private Path reportDir;
    private BatchProcessingService service;
    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @BeforeEach
    void setUp() throws Exception {
        inputDir = Files.createDirectory(tempDir.resolve("inputs"));
        reportDir = tempDir.resolve("reports");

        ExtractorProperties properties = new ExtractorProperties();
        properties.setInputDir(inputDir.toString());
        properties.setReportDir(reportDir.toString());
        properties.setWorkerThreads(2);

        ModelProfileResolver resolver = new ModelProfileResolver(new RelayProfileLoader(objectMapper).load(null));
        UnitValueNormalizer normalizer = new UnitValueNormalizer();

        DocumentProcessor processor = new DocumentProcessor();
        ReflectionTestUtils.setField(processor, "documentLoader", new SourceDocumentLoader());
        ReflectionTestUtils.setField(processor, "modelProfileResolver", resolver);
        ReflectionTestUtils.setField(processor, "dispatcher", new DetectionStrategyDispatcher(List.of(
                new CheckboxDetectionStrategy(false),
                new LabeledFieldDetectionStrategy(TextDecoder.DEFAULT_ENCODINGS),
                new KeyedSectionDetectionStrategy(TextDecoder.DEFAULT_ENCODINGS))));
        ReflectionTestUtils.setField(processor, "equipmentTagResolver", new EquipmentTagResolver(null));
        ReflectionTestUtils.setField(processor, "normalizer", normalizer);
        ReflectionTestUtils.setField(processor, "multipartGrouper", new MultipartGrouper(normalizer));
        ReflectionTestUtils.setField(processor, "persistenceService", mock(SettingsPersistenceService.class));

        BatchReportWriter writer = new BatchReportWriter();
        ReflectionTestUtils.setField(writer, "objectMapper", objectMapper);
        ReflectionTestUtils.setField(writer, "properties", properties);

        service = new BatchProcessingService();
        ReflectionTestUtils.setField(service, "properties", properties);
        ReflectionTestUtils.setField(service, "documentProcessor", processor);
        ReflectionTestUtils.setField(service, "modelProfileResolver", resolver);
        ReflectionTestUtils.setField(service, "calibrator", new ToleranceCalibrator());
        ReflectionTestUtils.setField(service, "reportWriter", writer);
    }

    private void write(String name, String content) throws Exception {
        Files.write(inputDir.resolve(name), content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void mixedDirectoryProducesOneOutcomePerFile() throws Exception {
        write("00-MF-12_config.S40", "[Identification]\nrepere=52-MF-02A\n[Protection50]\nactivite_1=1\n");
        write("notes.docx", "meeting notes");
        write("P122 52-MF-02A.pdf", "truncated");
        Files.createDirectory(inputDir.resolve("archive"));

        BatchReport report = service.run(service.createRun(null));

        assertThat(report.isFinished()).isTrue();
        Map<String, DocumentOutcome> outcomes = report.getOutcomes().stream()
                .collect(Collectors.toMap(DocumentOutcome::getFileName, Function.identity()));
        assertThat(outcomes).hasSize(3);
        assertThat(outcomes.get("00-MF-12_config.S40").getStatus()).isEqualTo(DocumentOutcome.Status.SUCCESS);
        assertThat(outcomes.get("notes.docx").getStatus()).isEqualTo(DocumentOutcome.Status.SKIPPED);
        assertThat(outcomes.get("P122 52-MF-02A.pdf").getStatus()).isEqualTo(DocumentOutcome.Status.FAILED);
        assertThat(report.getReviewItems()).extracting(ReviewItem::getReason)
                .containsExactlyInAnyOrder(ReviewReason.UNKNOWN_MODEL, ReviewReason.PROCESSING_ERROR);
        assertThat(report.getStatusCounts()).containsEntry(DocumentOutcome.Status.SUCCESS, 1);
    }

    @Test
    void reportIsWrittenAsJson() throws Exception {
        write("notes.docx", "meeting notes");

        BatchReport report = service.run(service.createRun(inputDir.toString()));

        Path json = reportDir.resolve("batch-report-" + report.getRunId() + ".json");
        assertThat(json).exists();
        JsonNode root = objectMapper.readTree(json.toFile());
        assertThat(root.path("runId").asText()).isEqualTo(report.getRunId());
        assertThat(root.path("statusCounts").path("SKIPPED").asInt()).isEqualTo(1);
        assertThat(root.path("reviewItems").get(0).path("reason").asText()).isEqualTo("UNKNOWN_MODEL");
        // java.time 模块由 spring-boot-starter-json 带入
        assertThat(root.path("startedAt").isNumber()).isTrue();
        assertThat(root.path("finishedAt").isNumber()).isTrue();
    }

    @Test
    void missingInputDirectoryStillFinishes() {
        BatchReport report = service.run(service.createRun(tempDir.resolve("absent").toString()));

        assertThat(report.isFinished()).isTrue();
        assertThat(report.getOutcomes()).isEmpty();
    }

    @Test
    void runsAreTrackedById() {
        BatchReport report = service.createRun(null);

        assertThat(report.getInputDir()).isEqualTo(inputDir.toString());
        assertThat(service.getReport(report.getRunId())).isSameAs(report);
        assertThat(service.getReport("nope")).isNull();
    }

    @Test
    void onlyTheMostRecentFinishedRunsAreRetained() {
        ReflectionTestUtils.setField(service, "properties", retaining(2));

        BatchReport first = service.run(service.createRun(null));
        BatchReport pending = service.createRun(null);
        BatchReport second = service.run(service.createRun(null));
        BatchReport third = service.run(service.createRun(null));

        assertThat(service.getReport(first.getRunId())).isNull();
        assertThat(service.getReport(second.getRunId())).isSameAs(second);
        assertThat(service.getReport(third.getRunId())).isSameAs(third);
        assertThat(service.getReport(pending.getRunId())).isSameAs(pending);
    }

    private ExtractorProperties retaining(int maxRetainedRuns) {
        ExtractorProperties properties = new ExtractorProperties();
        properties.setInputDir(inputDir.toString());
        properties.setReportDir(reportDir.toString());
        properties.setWorkerThreads(2);
        properties.setMaxRetainedRuns(maxRetainedRuns);
        return properties;
    }
}
