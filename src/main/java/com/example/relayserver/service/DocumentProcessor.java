package com.example.relayserver.service;

import com.example.relayserver.exception.IntegrityMismatchException;
import com.example.relayserver.exception.RelayExtractionException;
import com.example.relayserver.model.ActiveFlagResult;
import com.example.relayserver.model.BatchReport;
import com.example.relayserver.model.DocumentOutcome;
import com.example.relayserver.model.Equipment;
import com.example.relayserver.model.ModelResolution;
import com.example.relayserver.model.NormalizedSetting;
import com.example.relayserver.model.ParameterLine;
import com.example.relayserver.model.RelayModelProfile;
import com.example.relayserver.model.ReviewItem;
import com.example.relayserver.model.ReviewReason;
import com.example.relayserver.model.SourceDocument;
import com.example.relayserver.strategy.DetectionStrategyDispatcher;
import com.example.relayserver.strategy.ExtractionResult;
import com.example.relayserver.strategy.ModelProfileResolver;
import com.example.relayserver.util.checkbox.ToleranceCalibrator;
import com.example.relayserver.util.identity.EquipmentTagResolver;
import com.example.relayserver.util.normalize.MultipartGrouper;
import com.example.relayserver.util.normalize.UnitValueNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 单文档流水线
 *
 * 型号识别 -> 检测策略 -> 设备位号 -> 原子化 / 多段分组 / 激活标记 -> 持久化。
 * 各阶段严格顺序执行；任何失败都转成 DocumentOutcome，不向批处理抛出。
 */
@Slf4j
@Service
public class DocumentProcessor {

    @Autowired
    private SourceDocumentLoader documentLoader;

    @Autowired
    private ModelProfileResolver modelProfileResolver;

    @Autowired
    private DetectionStrategyDispatcher dispatcher;

    @Autowired
    private EquipmentTagResolver equipmentTagResolver;

    @Autowired
    private UnitValueNormalizer normalizer;

    @Autowired
    private MultipartGrouper multipartGrouper;

    @Autowired
    private SettingsPersistenceService persistenceService;

    /**
     * 处理一个文件，结果与复核条目写入 report
     *
     * @param calibrations 本批次各型号的标定结果（modelCode -> 结果）
     */
    public DocumentOutcome process(Path file, Map<String, ToleranceCalibrator.Calibration> calibrations,
                                   BatchReport report) {
        String fileName = file.getFileName().toString();
        String modelCode = null;
        long start = System.currentTimeMillis();

        try {
            SourceDocument document = documentLoader.load(file);

            ModelResolution resolution = modelProfileResolver.resolve(document);
            RelayModelProfile profile = resolution.getProfile();
            modelCode = profile.getModelCode();
            log.info("[{}] 型号 {}（{}）", fileName, modelCode, resolution.getSignal());

            checkCalibration(profile, calibrations.get(modelCode), fileName);

            ExtractionResult extraction = dispatcher.dispatch(document, profile);
            // 未匹配 / 歧义复选框等复核条目与后续成败无关，先记入报告
            report.addReviewItems(extraction.getReviewItems());

            Equipment equipment = equipmentTagResolver.resolve(document, extraction.getEquipmentHint(), modelCode);

            List<NormalizedSetting> settings = buildSettings(extraction, profile, equipment, fileName);
            List<ActiveFlagResult> flags = uniqueFlags(extraction.getFlags(), fileName);
            applyActiveFlags(settings, flags);

            persistenceService.persist(profile, equipment, document, extraction.getEncoding(), settings, flags);

            int activeCount = (int) flags.stream().filter(ActiveFlagResult::isActive).count();
            log.info("[{}] 完成: 设备 {}, 参数 {}, 激活功能 {}/{}, 复核 {}, 耗时 {}ms", fileName, equipment.getTag(),
                    settings.size(), activeCount, flags.size(), extraction.getReviewItems().size(),
                    System.currentTimeMillis() - start);
            return record(report, new DocumentOutcome(fileName, DocumentOutcome.Status.SUCCESS, modelCode,
                    equipment.getTag(), extraction.getDetectionMethod(), settings.size(), activeCount, null));

        } catch (RelayExtractionException e) {
            log.warn("[{}] 跳过: {}", fileName, e.getMessage());
            report.addReviewItem(new ReviewItem(fileName, e.getReason(), e.getMessage()));
            return record(report, DocumentOutcome.skipped(fileName, modelCode, e.getMessage()));

        } catch (IntegrityMismatchException e) {
            log.error("[{}] 写入校验失败，已回滚: {}", fileName, e.getMessage());
            report.addReviewItem(new ReviewItem(fileName, ReviewReason.INTEGRITY_MISMATCH, e.getMessage()));
            return record(report, DocumentOutcome.failed(fileName, modelCode, e.getMessage()));

        } catch (Exception e) {
            log.error("[{}] 处理失败: {}", fileName, e.getMessage(), e);
            String message = e.getClass().getSimpleName() + ": " + e.getMessage();
            report.addReviewItem(new ReviewItem(fileName, ReviewReason.PROCESSING_ERROR, message));
            return record(report, DocumentOutcome.failed(fileName, modelCode, message));
        }
    }

    private static DocumentOutcome record(BatchReport report, DocumentOutcome outcome) {
        report.addOutcome(outcome);
        return outcome;
    }

    private static void checkCalibration(RelayModelProfile profile, ToleranceCalibrator.Calibration calibration,
                                         String fileName) throws RelayExtractionException {
        if (!profile.isRequireCalibration()) {
            return;
        }
        if (calibration == null || !calibration.isCalibrated() || !calibration.isPassed()) {
            String detail = calibration == null || !calibration.isCalibrated()
                    ? "型号 " + profile.getModelCode() + " 未标定"
                    : String.format("型号 %s 标定准确率 %.2f 低于 %.2f", profile.getModelCode(),
                    calibration.getAccuracy(), profile.getMinCalibrationAccuracy());
            throw new RelayExtractionException(ReviewReason.CALIBRATION_FAILED, detail + ": " + fileName);
        }
    }

    /**
     * 参数行 -> NormalizedSetting：排除元数据代码，同一代码只保留第一次出现
     */
    List<NormalizedSetting> buildSettings(ExtractionResult extraction, RelayModelProfile profile,
                                          Equipment equipment, String fileName) {
        UnitValueNormalizer profileNormalizer = normalizer.withUnits(profile.getKnownUnits());
        Set<String> metadata = new HashSet<>(profile.getMetadataCodes());
        Map<String, NormalizedSetting> byCode = new LinkedHashMap<>();

        for (ParameterLine line : extraction.getLines()) {
            if (metadata.contains(line.getCode())) {
                log.debug("[{}] 元数据 {} = {}", fileName, line.getCode(), line.getRawValue());
                continue;
            }
            if (byCode.containsKey(line.getCode())) {
                log.warn("[{}] 参数代码 {} 重复出现（第 {} 页），保留第一次", fileName, line.getCode(), line.getPageIndex() + 1);
                continue;
            }
            NormalizedSetting setting = new NormalizedSetting(line.getCode(), line.getDescription(),
                    profileNormalizer.normalize(line.getRawValue(), line.getDescription()));
            setting.setDetectionMethod(extraction.getDetectionMethod());
            setting.bindLineage(equipment.getTag(), fileName);
            byCode.put(line.getCode(), setting);
        }

        List<NormalizedSetting> settings = new ArrayList<>(byCode.values());
        multipartGrouper.group(settings);
        return settings;
    }

    /**
     * 同一功能代码只保留一个结果：已有激活结果时不被未激活结果覆盖
     */
    private static List<ActiveFlagResult> uniqueFlags(List<ActiveFlagResult> flags, String fileName) {
        Map<String, ActiveFlagResult> byCode = new LinkedHashMap<>();
        for (ActiveFlagResult flag : flags) {
            ActiveFlagResult existing = byCode.get(flag.getFunctionCode());
            if (existing == null) {
                byCode.put(flag.getFunctionCode(), flag);
            } else {
                log.debug("[{}] 功能 {} 重复检测结果", fileName, flag.getFunctionCode());
                if (!existing.isActive() && flag.isActive()) {
                    byCode.put(flag.getFunctionCode(), flag);
                }
            }
        }
        return new ArrayList<>(byCode.values());
    }

    /**
     * 激活结果回写参数：代码相同，或参数属于该分节（"分节.键"）
     */
    static void applyActiveFlags(List<NormalizedSetting> settings, List<ActiveFlagResult> flags) {
        for (ActiveFlagResult flag : flags) {
            if (!flag.isActive() || flag.getParameterCode() == null) {
                continue;
            }
            String code = flag.getParameterCode();
            String sectionPrefix = code + ".";
            for (NormalizedSetting setting : settings) {
                if (setting.getParameterCode().equals(code) || setting.getParameterCode().startsWith(sectionPrefix)) {
                    setting.setActive(true);
                }
            }
        }
    }
}
