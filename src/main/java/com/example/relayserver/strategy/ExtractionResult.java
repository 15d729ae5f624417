package com.example.relayserver.strategy;

import com.example.relayserver.model.ActiveFlagResult;
import com.example.relayserver.model.DetectionMethod;
import com.example.relayserver.model.ParameterLine;
import com.example.relayserver.model.ReviewItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一个文档经检测策略处理后的原始产出：参数行 + 激活功能 + 复核条目
 */
public class ExtractionResult {

    private final DetectionMethod detectionMethod;
    private final List<ParameterLine> lines = new ArrayList<>();
    private final List<ActiveFlagResult> flags = new ArrayList<>();
    private final List<ReviewItem> reviewItems = new ArrayList<>();
    /** 文档内容给出的设备标识，可为空 */
    private String equipmentHint;
    /** 文本导出实际使用的编码；PDF 为空 */
    private String encoding;

    public ExtractionResult(DetectionMethod detectionMethod) {
        this.detectionMethod = detectionMethod;
    }

    public DetectionMethod getDetectionMethod() {
        return detectionMethod;
    }

    public List<ParameterLine> getLines() {
        return Collections.unmodifiableList(lines);
    }

    public void addLines(List<ParameterLine> pageLines) {
        lines.addAll(pageLines);
    }

    public void addLine(ParameterLine line) {
        lines.add(line);
    }

    public List<ActiveFlagResult> getFlags() {
        return Collections.unmodifiableList(flags);
    }

    public void addFlag(ActiveFlagResult flag) {
        if (flag.getDetectionMethod() != detectionMethod) {
            throw new IllegalArgumentException("flag method " + flag.getDetectionMethod()
                    + " does not match strategy " + detectionMethod);
        }
        flags.add(flag);
    }

    public List<ReviewItem> getReviewItems() {
        return Collections.unmodifiableList(reviewItems);
    }

    public void addReviewItem(ReviewItem item) {
        reviewItems.add(item);
    }

    public String getEquipmentHint() {
        return equipmentHint;
    }

    public void setEquipmentHint(String equipmentHint) {
        this.equipmentHint = equipmentHint;
    }

    public String getEncoding() {
        return encoding;
    }

    public void setEncoding(String encoding) {
        this.encoding = encoding;
    }

    public long getActiveFunctionCount() {
        return flags.stream().filter(ActiveFlagResult::isActive).count();
    }
}
