package com.example.relayserver.strategy;

import com.example.relayserver.exception.RelayExtractionException;
import com.example.relayserver.model.ActiveFlagResult;
import com.example.relayserver.model.DetectionMethod;
import com.example.relayserver.model.ParameterLine;
import com.example.relayserver.model.RelayModelProfile;
import com.example.relayserver.model.SourceDocument;
import com.example.relayserver.util.parameter.ParameterLineExtractor;
import com.example.relayserver.util.text.TextDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * 标签字段策略（MiCOM P143 一类导出）
 *
 * 功能标签（如 "I>1 Function"）后面跟着取值，可在同一行冒号之后，也可在下一行。
 * 取值不在禁用词表内即为激活。同一功能的多个标签变体中，第一个激活者的序号（1 起）作为 groupIndex。
 */
public class LabeledFieldDetectionStrategy extends AbstractTextDetectionStrategy {

    private static final Logger log = LoggerFactory.getLogger(LabeledFieldDetectionStrategy.class);

    public LabeledFieldDetectionStrategy(List<String> defaultEncodings) {
        super(defaultEncodings);
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.LABELED_FIELD;
    }

    @Override
    public ExtractionResult extract(SourceDocument document, RelayModelProfile profile)
            throws RelayExtractionException, IOException {
        TextDecoder.DecodedText decoded = readText(document, profile, text -> true);
        List<String> textLines = decoded.getLines();

        ExtractionResult result = new ExtractionResult(DetectionMethod.LABELED_FIELD);
        result.setEncoding(decoded.getEncoding());

        List<ParameterLine> lines = new ParameterLineExtractor(profile).extractFromText(textLines);
        result.addLines(lines);

        for (RelayModelProfile.FunctionDefinition function : profile.getFunctions()) {
            ActiveFlagResult flag = evaluate(function, lines, textLines, profile.getDisabledValues());
            if (flag != null) {
                result.addFlag(flag);
            }
        }

        log.info("{} 标签字段策略完成: 参数行 {}, 激活结果 {}, 激活 {}",
                document.getFileName(), lines.size(), result.getFlags().size(), result.getActiveFunctionCount());
        return result;
    }

    /**
     * @return 找不到任何标签时返回 null
     */
    ActiveFlagResult evaluate(RelayModelProfile.FunctionDefinition function, List<ParameterLine> lines,
                              List<String> textLines, List<String> disabledValues) {
        boolean found = false;
        String firstCode = null;
        List<String> labels = function.getLabels();

        for (int i = 0; i < labels.size(); i++) {
            LabelValue lv = findLabelValue(labels.get(i), lines, textLines);
            if (lv == null) {
                continue;
            }
            found = true;
            if (firstCode == null) {
                firstCode = lv.code;
            }
            if (isEnabled(lv.value, disabledValues)) {
                log.debug("功能 {} 标签 '{}' 取值 '{}' -> 激活", function.getCode(), labels.get(i), lv.value);
                return new ActiveFlagResult(function.getCode(), function.getDescription(), true,
                        DetectionMethod.LABELED_FIELD, i + 1, lv.code);
            }
        }

        if (!found) {
            return null;
        }
        return new ActiveFlagResult(function.getCode(), function.getDescription(), false,
                DetectionMethod.LABELED_FIELD, null, firstCode);
    }

    /**
     * 先在已解析的参数行描述中找标签，再在原始文本行中找
     */
    private LabelValue findLabelValue(String label, List<ParameterLine> lines, List<String> textLines) {
        for (ParameterLine line : lines) {
            String desc = stripColon(line.getDescription());
            if (desc.equalsIgnoreCase(label)) {
                return new LabelValue(line.getCode(), line.getRawValue());
            }
        }

        String lowerLabel = label.toLowerCase(Locale.ROOT);
        for (int i = 0; i < textLines.size(); i++) {
            String text = textLines.get(i).trim();
            int idx = text.toLowerCase(Locale.ROOT).indexOf(lowerLabel);
            if (idx < 0) {
                continue;
            }
            String rest = text.substring(idx + label.length()).trim();
            if (rest.startsWith(":") || rest.startsWith("=")) {
                rest = rest.substring(1).trim();
            } else if (!rest.isEmpty()) {
                // 标签只是更长文本的一部分
                continue;
            }
            if (rest.isEmpty()) {
                rest = nextNonBlank(textLines, i + 1);
            }
            return new LabelValue(null, rest);
        }
        return null;
    }

    private static String nextNonBlank(List<String> textLines, int from) {
        for (int j = from; j < textLines.size(); j++) {
            String t = textLines.get(j).trim();
            if (!t.isEmpty()) {
                return t;
            }
        }
        return "";
    }

    private static boolean isEnabled(String value, List<String> disabledValues) {
        if (value == null || value.isBlank()) {
            return false;
        }
        String v = value.trim();
        for (String disabled : disabledValues) {
            if (disabled.equalsIgnoreCase(v)) {
                return false;
            }
        }
        return true;
    }

    private static String stripColon(String s) {
        String t = s == null ? "" : s.trim();
        while (t.endsWith(":") || t.endsWith("=")) {
            t = t.substring(0, t.length() - 1).trim();
        }
        return t;
    }

    private static class LabelValue {
        final String code;
        final String value;

        LabelValue(String code, String value) {
            this.code = code;
            this.value = value;
        }
    }
}
