package com.example.relayserver.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 一次批处理的汇总
 *
 * 工作线程并发写入，所有变更方法在 this 上同步；读取方法返回快照。
 */
public class BatchReport {

    private final String runId;
    private final String inputDir;
    private final Instant startedAt;
    private Instant finishedAt;
    private final List<DocumentOutcome> outcomes = new ArrayList<>();
    private final List<ReviewItem> reviewItems = new ArrayList<>();

    public BatchReport(String runId, String inputDir) {
        this.runId = runId;
        this.inputDir = inputDir;
        this.startedAt = Instant.now();
    }

    public String getRunId() {
        return runId;
    }

    public String getInputDir() {
        return inputDir;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Instant getFinishedAt() {
        return finishedAt;
    }

    public synchronized boolean isFinished() {
        return finishedAt != null;
    }

    public synchronized void markFinished() {
        this.finishedAt = Instant.now();
    }

    public synchronized void addOutcome(DocumentOutcome outcome) {
        outcomes.add(outcome);
    }

    public synchronized void addReviewItem(ReviewItem item) {
        reviewItems.add(item);
    }

    public synchronized void addReviewItems(List<ReviewItem> items) {
        reviewItems.addAll(items);
    }

    public synchronized List<DocumentOutcome> getOutcomes() {
        return Collections.unmodifiableList(new ArrayList<>(outcomes));
    }

    public synchronized List<ReviewItem> getReviewItems() {
        return Collections.unmodifiableList(new ArrayList<>(reviewItems));
    }

    /**
     * 各状态文档数
     */
    public synchronized Map<DocumentOutcome.Status, Integer> getStatusCounts() {
        Map<DocumentOutcome.Status, Integer> counts = new EnumMap<>(DocumentOutcome.Status.class);
        for (DocumentOutcome.Status status : DocumentOutcome.Status.values()) {
            counts.put(status, 0);
        }
        for (DocumentOutcome outcome : outcomes) {
            counts.merge(outcome.getStatus(), 1, Integer::sum);
        }
        return counts;
    }

    public synchronized int getTotalParameters() {
        int total = 0;
        for (DocumentOutcome outcome : outcomes) {
            total += outcome.getParameterCount();
        }
        return total;
    }

    public synchronized int getTotalActiveFunctions() {
        int total = 0;
        for (DocumentOutcome outcome : outcomes) {
            total += outcome.getActiveFunctionCount();
        }
        return total;
    }
}
