package com.example.relayserver.controller;

import com.example.relayserver.model.BatchReport;
import com.example.relayserver.service.BatchProcessingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * 批处理触发与状态查询
 */
@Slf4j
@RestController
@RequestMapping("/api/relay-batch")
public class RelayBatchController {

    @Autowired
    private BatchProcessingService batchProcessingService;

    /**
     * 启动一次批处理（异步），立即返回 runId。
     * 使用 /status/{runId} 轮询处理状态。
     *
     * @param inputDir 输入目录，不传时使用 relay.extractor.input-dir
     */
    @PostMapping("/run")
    public ResponseEntity<Map<String, Object>> run(
            @RequestParam(value = "inputDir", required = false) String inputDir) {
        BatchReport report = batchProcessingService.createRun(inputDir);
        log.info("[runId: {}] 接收批处理请求, 输入目录: {}", report.getRunId(), report.getInputDir());
        batchProcessingService.runAsync(report);

        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("runId", report.getRunId());
        result.put("inputDir", report.getInputDir());
        result.put("message", "批处理已启动");
        return ResponseEntity.ok(result);
    }

    /**
     * 查询批处理状态（进行中时返回已完成部分）
     */
    @GetMapping("/status/{runId}")
    public ResponseEntity<Object> status(@PathVariable("runId") String runId) {
        BatchReport report = batchProcessingService.getReport(runId);
        if (report == null) {
            Map<String, Object> result = new HashMap<>();
            result.put("success", false);
            result.put("message", "未找到批处理: " + runId);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(result);
        }
        return ResponseEntity.ok(report);
    }
}
