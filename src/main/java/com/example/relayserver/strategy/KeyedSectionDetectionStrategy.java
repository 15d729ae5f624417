package com.example.relayserver.strategy;

import com.example.relayserver.exception.RelayExtractionException;
import com.example.relayserver.model.ActiveFlagResult;
import com.example.relayserver.model.DetectionMethod;
import com.example.relayserver.model.ParameterLine;
import com.example.relayserver.model.RelayModelProfile;
import com.example.relayserver.model.SourceDocument;
import com.example.relayserver.util.text.KeyedSectionParser;
import com.example.relayserver.util.text.KeyedSections;
import com.example.relayserver.util.text.TextDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 分节键值策略（SEPAM .S40）
 *
 * 功能分节内任一 activite_N=1 即为激活，groupIndex 取最小的激活 N；缺失的键按 0 处理。
 * 未在配置中定义、但名称以 Protection 开头且含编号键的分节也会产出结果，功能代码取去掉前缀后的部分。
 * 每个 key=value 同时作为参数行输出，代码为 "分节.键"。
 */
public class KeyedSectionDetectionStrategy extends AbstractTextDetectionStrategy {

    private static final Logger log = LoggerFactory.getLogger(KeyedSectionDetectionStrategy.class);

    static final String PROTECTION_PREFIX = "Protection";
    private static final String DEFAULT_KEY_PREFIX = "activite_";

    private final KeyedSectionParser parser = new KeyedSectionParser();

    public KeyedSectionDetectionStrategy(List<String> defaultEncodings) {
        super(defaultEncodings);
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.KEYED_SECTION;
    }

    @Override
    public ExtractionResult extract(SourceDocument document, RelayModelProfile profile)
            throws RelayExtractionException, IOException {
        TextDecoder.DecodedText decoded = readText(document, profile, KeyedSectionParser::hasSectionHeader);
        KeyedSections sections = parser.parse(decoded.getLines());

        ExtractionResult result = new ExtractionResult(DetectionMethod.KEYED_SECTION);
        result.setEncoding(decoded.getEncoding());
        result.addLines(toParameterLines(sections));
        result.setEquipmentHint(findIdentification(sections, profile.getIdentificationKeys()));

        for (ActiveFlagResult flag : detect(sections, profile)) {
            result.addFlag(flag);
        }

        log.info("{} 分节策略完成: 分节 {}, 参数 {}, 激活结果 {}, 激活 {}, 标识 {}",
                document.getFileName(), sections.getSections().size(), result.getLines().size(),
                result.getFlags().size(), result.getActiveFunctionCount(), result.getEquipmentHint());
        return result;
    }

    /**
     * 已定义功能 + 未定义的 Protection 分节
     */
    List<ActiveFlagResult> detect(KeyedSections sections, RelayModelProfile profile) {
        List<ActiveFlagResult> flags = new ArrayList<>();
        Set<String> handled = new HashSet<>();

        for (RelayModelProfile.FunctionDefinition function : profile.getFunctions()) {
            if (function.getSection() == null) {
                continue;
            }
            handled.add(function.getSection().toLowerCase(Locale.ROOT));
            String prefix = function.getKeyPrefix() == null ? DEFAULT_KEY_PREFIX : function.getKeyPrefix();
            Integer group = firstActiveGroup(sections.section(function.getSection()), prefix);
            flags.add(new ActiveFlagResult(function.getCode(), function.getDescription(), group != null,
                    DetectionMethod.KEYED_SECTION, group, function.getSection()));
        }

        for (Map.Entry<String, Map<String, String>> entry : sections.getSections().entrySet()) {
            String section = entry.getKey();
            if (!section.startsWith(PROTECTION_PREFIX) || handled.contains(section.toLowerCase(Locale.ROOT))) {
                continue;
            }
            if (!hasGroupKeys(entry.getValue(), DEFAULT_KEY_PREFIX)) {
                continue;
            }
            Integer group = firstActiveGroup(entry.getValue(), DEFAULT_KEY_PREFIX);
            String code = section.substring(PROTECTION_PREFIX.length());
            log.debug("未定义的保护分节 {} -> 功能 {}", section, code);
            flags.add(new ActiveFlagResult(code, section, group != null,
                    DetectionMethod.KEYED_SECTION, group, section));
        }
        return flags;
    }

    /**
     * @return 最小的取值为 1 的编号，没有则为 null
     */
    static Integer firstActiveGroup(Map<String, String> entries, String keyPrefix) {
        Integer first = null;
        String lowerPrefix = keyPrefix.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> e : entries.entrySet()) {
            String key = e.getKey().toLowerCase(Locale.ROOT);
            if (!key.startsWith(lowerPrefix)) {
                continue;
            }
            String suffix = key.substring(lowerPrefix.length());
            if (suffix.isEmpty() || !suffix.chars().allMatch(Character::isDigit)) {
                continue;
            }
            if ("1".equals(e.getValue().trim())) {
                int n = Integer.parseInt(suffix);
                if (first == null || n < first) {
                    first = n;
                }
            }
        }
        return first;
    }

    private static boolean hasGroupKeys(Map<String, String> entries, String keyPrefix) {
        for (String key : entries.keySet()) {
            if (key.toLowerCase(Locale.ROOT).startsWith(keyPrefix)) {
                return true;
            }
        }
        return false;
    }

    private static List<ParameterLine> toParameterLines(KeyedSections sections) {
        List<ParameterLine> lines = new ArrayList<>();
        int order = 0;
        for (Map.Entry<String, Map<String, String>> section : sections.getSections().entrySet()) {
            for (Map.Entry<String, String> e : section.getValue().entrySet()) {
                String code = section.getKey().isEmpty() ? e.getKey() : section.getKey() + "." + e.getKey();
                lines.add(new ParameterLine(code, e.getKey(), e.getValue(), order, 0, order));
                order++;
            }
        }
        return lines;
    }

    private static String findIdentification(KeyedSections sections, List<String> keys) {
        if (keys == null) {
            return null;
        }
        for (String key : keys) {
            String value = sections.findFirst(key);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
