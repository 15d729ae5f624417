package com.example.relayserver.util.identity;

import com.example.relayserver.exception.EquipmentUnresolvedException;
import com.example.relayserver.model.Equipment;
import com.example.relayserver.model.SourceDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 设备位号解析
 *
 * 优先级：文档内容给出的标识（如 SEPAM 的 repere 键） > 文件名正则（按列表顺序，第一个命中者） > 无法确定。
 * 正则有捕获组时取第 1 组，否则取整个匹配。同一输入总是得到同一位号。
 */
public class EquipmentTagResolver {

    private static final Logger log = LoggerFactory.getLogger(EquipmentTagResolver.class);

    public static final String SOURCE_CONTENT = "content";
    public static final String SOURCE_FILENAME = "filename";

    /** 默认文件名约定：型号前缀 + 位号、位号开头、任意位置的位号 */
    public static final List<String> DEFAULT_PATTERNS = List.of(
            "P\\d{3}[A-Z]?[\\s_-]+(\\d{2,3}-[A-Z]{2,3}-[A-Z0-9]+)",
            "^(\\d{2,3}-[A-Z]{2,3}-[A-Z0-9]+)",
            "(\\d{2,3}-[A-Z]{2,3}-\\d{2}[A-Z]?)"
    );

    private final List<Pattern> patterns = new ArrayList<>();

    public EquipmentTagResolver(List<String> regexes) {
        List<String> source = regexes == null || regexes.isEmpty() ? DEFAULT_PATTERNS : regexes;
        for (String regex : source) {
            patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }
    }

    /**
     * @param contentHint 文档内容中的设备标识，可为空
     */
    public Equipment resolve(SourceDocument document, String contentHint, String modelCode)
            throws EquipmentUnresolvedException {
        if (contentHint != null && !contentHint.isBlank()) {
            String tag = normalize(contentHint);
            String fromName = matchFileName(document.getBaseName());
            if (fromName != null && !fromName.equals(tag)) {
                log.info("{} 内容标识 {} 与文件名位号 {} 不一致，以内容为准", document.getFileName(), tag, fromName);
            }
            return new Equipment(tag, modelCode, SOURCE_CONTENT);
        }

        String tag = matchFileName(document.getBaseName());
        if (tag != null) {
            return new Equipment(tag, modelCode, SOURCE_FILENAME);
        }

        log.warn("无法确定设备位号: {}", document.getFileName());
        throw new EquipmentUnresolvedException(document.getFileName());
    }

    /**
     * 文件名正则依次尝试，返回第一个命中的位号
     */
    String matchFileName(String baseName) {
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(baseName);
            if (m.find()) {
                String value = m.groupCount() >= 1 && m.group(1) != null ? m.group(1) : m.group();
                return normalize(value);
            }
        }
        return null;
    }

    private static String normalize(String tag) {
        return tag.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
    }
}
