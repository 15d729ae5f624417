package com.example.relayserver.util.text;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 分节键值文本（[Section] + key=value）的解析结果
 *
 * 分节与键保持文件中的顺序，查找不区分大小写。
 */
public class KeyedSections {

    private final Map<String, Map<String, String>> sections = new LinkedHashMap<>();

    void put(String section, String key, String value) {
        sections.computeIfAbsent(section, s -> new LinkedHashMap<>()).put(key, value);
    }

    void addSection(String section) {
        sections.computeIfAbsent(section, s -> new LinkedHashMap<>());
    }

    public Map<String, Map<String, String>> getSections() {
        return Collections.unmodifiableMap(sections);
    }

    public boolean isEmpty() {
        return sections.isEmpty();
    }

    /**
     * 分节的键值，不存在时返回空表
     */
    public Map<String, String> section(String name) {
        for (Map.Entry<String, Map<String, String>> e : sections.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) {
                return Collections.unmodifiableMap(e.getValue());
            }
        }
        return Collections.emptyMap();
    }

    public String get(String section, String key) {
        for (Map.Entry<String, String> e : section(section).entrySet()) {
            if (e.getKey().equalsIgnoreCase(key)) {
                return e.getValue();
            }
        }
        return null;
    }

    /**
     * 在所有分节中查找第一个同名键
     */
    public String findFirst(String key) {
        for (Map<String, String> entries : sections.values()) {
            for (Map.Entry<String, String> e : entries.entrySet()) {
                if (e.getKey().equalsIgnoreCase(key)) {
                    return e.getValue();
                }
            }
        }
        return null;
    }
}
