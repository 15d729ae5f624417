package com.example.relayserver.util.text;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 分节键值文本解析（SEPAM .S40 一类导出）
 *
 * <pre>
 * [Protection50]
 * activite_0=1
 * seuil_0=2.5
 * </pre>
 * 以 ; 或 # 开头的行为注释；分节之前的键值归入空名分节。
 */
public class KeyedSectionParser {

    private static final Logger log = LoggerFactory.getLogger(KeyedSectionParser.class);

    private static final Pattern SECTION_HEADER = Pattern.compile("^\\s*\\[([^\\]]+)]\\s*$", Pattern.MULTILINE);

    /**
     * 文本中是否至少有一个分节头
     */
    public static boolean hasSectionHeader(String text) {
        return text != null && SECTION_HEADER.matcher(text).find();
    }

    public KeyedSections parse(List<String> lines) {
        KeyedSections result = new KeyedSections();
        String current = "";
        int skipped = 0;

        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith(";") || line.startsWith("#")) {
                continue;
            }
            if (line.startsWith("[") && line.endsWith("]")) {
                current = line.substring(1, line.length() - 1).trim();
                result.addSection(current);
                continue;
            }
            int eq = line.indexOf('=');
            if (eq <= 0) {
                skipped++;
                continue;
            }
            String key = line.substring(0, eq).trim();
            String value = line.substring(eq + 1).trim();
            result.put(current, key, value);
        }

        if (skipped > 0) {
            log.debug("跳过 {} 行非键值内容", skipped);
        }
        return result;
    }
}
