package com.example.relayserver.service;

import com.example.relayserver.config.ExtractorProperties;
import com.example.relayserver.model.BatchReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 批处理报告输出为 JSON：{reportDir}/batch-report-{runId}.json
 */
@Slf4j
@Component
public class BatchReportWriter {

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ExtractorProperties properties;

    public Path write(BatchReport report) throws IOException {
        Path dir = Paths.get(properties.getReportDir());
        Files.createDirectories(dir);
        Path target = dir.resolve("batch-report-" + report.getRunId() + ".json");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), report);
        log.info("[runId: {}] 报告已写入: {}", report.getRunId(), target.toAbsolutePath());
        return target;
    }
}
