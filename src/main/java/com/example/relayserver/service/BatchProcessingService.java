package com.example.relayserver.service;

import com.example.relayserver.config.ExtractorProperties;
import com.example.relayserver.model.BatchReport;
import com.example.relayserver.model.DocumentOutcome;
import com.example.relayserver.model.RelayModelProfile;
import com.example.relayserver.strategy.ModelProfileResolver;
import com.example.relayserver.util.checkbox.ToleranceCalibrator;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 批处理：输入目录下的每个常规文件各自独立处理
 *
 * 固定大小线程池并发处理文档，线程数不超过数据库连接池大小。
 * 单个文档失败只记入报告，不影响其他文档。
 */
@Slf4j
@Service
public class BatchProcessingService {

    @Autowired
    private ExtractorProperties properties;

    @Autowired
    private DocumentProcessor documentProcessor;

    @Autowired
    private ModelProfileResolver modelProfileResolver;

    @Autowired
    private ToleranceCalibrator calibrator;

    @Autowired
    private BatchReportWriter reportWriter;

    @Autowired(required = false)
    private DataSource dataSource;

    private final Map<String, BatchReport> runs = new ConcurrentHashMap<>();

    /** 已完成的 runId，按完成先后 */
    private final ConcurrentLinkedDeque<String> finishedRuns = new ConcurrentLinkedDeque<>();

    /**
     * 登记一次新的批处理
     *
     * @param inputDir 输入目录，为空时使用配置
     */
    public BatchReport createRun(String inputDir) {
        String dir = inputDir == null || inputDir.isBlank() ? properties.getInputDir() : inputDir;
        String runId = UUID.randomUUID().toString().replace("-", "");
        BatchReport report = new BatchReport(runId, dir);
        runs.put(runId, report);
        return report;
    }

    public BatchReport getReport(String runId) {
        return runs.get(runId);
    }

    /**
     * 异步执行（后台线程），通过 getReport 轮询
     */
    @Async
    public void runAsync(BatchReport report) {
        run(report);
    }

    /**
     * 同步执行
     */
    public BatchReport run(BatchReport report) {
        String runId = report.getRunId();
        Path inputDir = Paths.get(report.getInputDir());
        log.info("[runId: {}] 开始批处理: {}", runId, inputDir.toAbsolutePath());

        try {
            List<Path> files = listFiles(inputDir);
            Map<String, ToleranceCalibrator.Calibration> calibrations = calibrateAll();

            int threads = workerThreads();
            log.info("[runId: {}] 文件 {} 个, 工作线程 {}", runId, files.size(), threads);

            ExecutorService executor = Executors.newFixedThreadPool(threads);
            try {
                List<Future<DocumentOutcome>> futures = new ArrayList<>();
                for (Path file : files) {
                    futures.add(executor.submit(() -> documentProcessor.process(file, calibrations, report)));
                }
                for (Future<DocumentOutcome> future : futures) {
                    try {
                        future.get();
                    } catch (ExecutionException e) {
                        log.error("[runId: {}] 文档任务异常: {}", runId, e.getCause().getMessage(), e.getCause());
                    }
                }
            } finally {
                executor.shutdown();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[runId: {}] 批处理被中断", runId);
        } catch (IOException e) {
            log.error("[runId: {}] 读取输入目录失败: {}", runId, e.getMessage(), e);
        } finally {
            report.markFinished();
        }

        Map<DocumentOutcome.Status, Integer> counts = report.getStatusCounts();
        log.info("[runId: {}] 批处理完成: 成功 {}, 跳过 {}, 失败 {}, 参数 {}, 激活功能 {}, 复核 {}", runId,
                counts.get(DocumentOutcome.Status.SUCCESS), counts.get(DocumentOutcome.Status.SKIPPED),
                counts.get(DocumentOutcome.Status.FAILED), report.getTotalParameters(),
                report.getTotalActiveFunctions(), report.getReviewItems().size());

        try {
            reportWriter.write(report);
        } catch (IOException e) {
            log.error("[runId: {}] 报告写入失败: {}", runId, e.getMessage(), e);
        }
        retire(runId);
        return report;
    }

    /**
     * 记录完成的批处理；超出保留数时移除最早完成的，未完成的批处理始终保留
     */
    private synchronized void retire(String runId) {
        finishedRuns.addLast(runId);
        int limit = Math.max(1, properties.getMaxRetainedRuns());
        while (finishedRuns.size() > limit) {
            String evicted = finishedRuns.pollFirst();
            runs.remove(evicted);
            log.debug("[runId: {}] 超出保留数 {}，从内存移除", evicted, limit);
        }
    }

    /**
     * 输入目录下的常规文件，按文件名排序；不认识的文件也会进入流水线并记入报告
     */
    static List<Path> listFiles(Path inputDir) throws IOException {
        try (Stream<Path> stream = Files.list(inputDir)) {
            return stream.filter(Files::isRegularFile)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private Map<String, ToleranceCalibrator.Calibration> calibrateAll() {
        Map<String, ToleranceCalibrator.Calibration> result = new HashMap<>();
        for (RelayModelProfile profile : modelProfileResolver.getProfiles()) {
            result.put(profile.getModelCode(), calibrator.calibrate(profile));
        }
        return result;
    }

    private int workerThreads() {
        int threads = Math.max(1, properties.getWorkerThreads());
        if (dataSource instanceof HikariDataSource) {
            int poolSize = ((HikariDataSource) dataSource).getMaximumPoolSize();
            if (threads > poolSize) {
                log.warn("工作线程 {} 超过连接池大小 {}，按连接池大小执行", threads, poolSize);
                threads = poolSize;
            }
        }
        return threads;
    }
}
