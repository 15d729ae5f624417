package com.example.relayserver.util.checkbox;

import com.example.relayserver.model.CheckboxMark;
import com.example.relayserver.model.CorrelationResult;
import com.example.relayserver.model.ParameterLine;
import com.example.relayserver.model.RelayModelProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 关联容差标定
 *
 * 用型号配置里的标注样本重放关联过程，准确率达到 minCalibrationAccuracy 才认为该型号的缩放系数与容差可信。
 * 歧义匹配按错误计。没有样本的型号视为未标定。
 */
public class ToleranceCalibrator {

    private static final Logger log = LoggerFactory.getLogger(ToleranceCalibrator.class);

    public Calibration calibrate(RelayModelProfile profile) {
        List<RelayModelProfile.CalibrationSample> samples = profile.getCalibrationSamples();
        if (samples == null || samples.isEmpty()) {
            log.info("型号 {} 没有标定样本，未标定", profile.getModelCode());
            return new Calibration(profile.getModelCode(), 0, 0, false, Collections.emptyList());
        }

        CheckboxCorrelator correlator = new CheckboxCorrelator(profile);
        int correct = 0;
        List<String> failures = new ArrayList<>();

        for (int i = 0; i < samples.size(); i++) {
            RelayModelProfile.CalibrationSample sample = samples.get(i);

            List<ParameterLine> lines = new ArrayList<>();
            int order = 0;
            for (RelayModelProfile.SampleLine sl : sample.getLines()) {
                lines.add(new ParameterLine(sl.getCode(), "", "", (float) sl.getY(), 0, order++));
            }
            // 零尺寸框：中心即样本坐标
            int cy = (int) Math.round(sample.getCheckboxCenterY());
            CheckboxMark box = new CheckboxMark(0, cy, 0, 0, 1.0, true, 0);

            CorrelationResult result = correlator.correlate(List.of(box), lines, 0);
            String actual = null;
            boolean ambiguous = false;
            if (!result.getMatches().isEmpty()) {
                CorrelationResult.Match match = result.getMatches().get(0);
                actual = match.getLine().getCode();
                ambiguous = match.isAmbiguous();
            }

            if (!ambiguous && sample.getExpectedCode() != null && sample.getExpectedCode().equals(actual)) {
                correct++;
            } else {
                failures.add(String.format("样本 %d: 期望 %s, 实际 %s%s",
                        i, sample.getExpectedCode(), actual, ambiguous ? " (歧义)" : ""));
            }
        }

        double accuracy = correct / (double) samples.size();
        boolean passed = accuracy >= profile.getMinCalibrationAccuracy();
        if (passed) {
            log.info("型号 {} 标定通过: {}/{}", profile.getModelCode(), correct, samples.size());
        } else {
            log.warn("型号 {} 标定未通过: {}/{}, 失败样本 {}", profile.getModelCode(), correct, samples.size(), failures);
        }
        return new Calibration(profile.getModelCode(), samples.size(), correct, passed, failures);
    }

    /**
     * 标定结果
     */
    public static class Calibration {

        private final String modelCode;
        private final int total;
        private final int correct;
        private final boolean passed;
        private final List<String> failures;

        public Calibration(String modelCode, int total, int correct, boolean passed, List<String> failures) {
            this.modelCode = modelCode;
            this.total = total;
            this.correct = correct;
            this.passed = passed;
            this.failures = failures;
        }

        public String getModelCode() {
            return modelCode;
        }

        public int getTotal() {
            return total;
        }

        public int getCorrect() {
            return correct;
        }

        public double getAccuracy() {
            return total == 0 ? 0 : correct / (double) total;
        }

        public boolean isPassed() {
            return passed;
        }

        public boolean isCalibrated() {
            return total > 0;
        }

        public List<String> getFailures() {
            return failures;
        }
    }
}
