package com.example.relayserver.util.normalize;

import com.example.relayserver.model.MultipartGroup;
import com.example.relayserver.model.NormalizedSetting;
import com.example.relayserver.model.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 多段参数分组
 *
 * 支持的描述格式：
 * <pre>
 *   LED 5 part 1                 -> base=LED 5, part=1
 *   0150: LED 5 PART 1: tU&lt;      -> base=LED 5, part=1, 值=tU&lt;
 *   Input 1 (1/4)                -> base=Input 1, part=1
 * </pre>
 * 组内段序号按观测序号排序后重新编为 1..N，保证连续且唯一。
 */
public class MultipartGrouper {

    private static final Logger log = LoggerFactory.getLogger(MultipartGrouper.class);

    /** 可选的行首数字/十六进制索引，如 "0150:" */
    private static final String INDEX_PREFIX = "(?:[0-9A-F]{2,4}(?:\\.[0-9A-F]{2})?\\s*:\\s*)?";

    private static final Pattern PART_PATTERN = Pattern.compile(
            "^" + INDEX_PREFIX + "(.+?)\\s+part\\s*(\\d+)\\s*(?::\\s*(.*))?$", Pattern.CASE_INSENSITIVE);

    private static final Pattern PAGINATION_PATTERN = Pattern.compile(
            "^" + INDEX_PREFIX + "(.+?)\\s*\\((\\d+)\\s*/\\s*(\\d+)\\)\\s*(?::?\\s*(.*))?$", Pattern.CASE_INSENSITIVE);

    private final UnitValueNormalizer normalizer;

    public MultipartGrouper(UnitValueNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * 描述中的多段标记
     */
    public static class PartMarker {
        public final String base;
        public final int part;
        /** 描述中内嵌的值（"PART 1: tU&lt;" 中的 tU&lt;），可为空 */
        public final String inlineValue;

        PartMarker(String base, int part, String inlineValue) {
            this.base = base;
            this.part = part;
            this.inlineValue = inlineValue;
        }
    }

    /**
     * 解析描述中的多段标记，不是多段参数时返回 null
     */
    public static PartMarker parseMarker(String description) {
        if (description == null) {
            return null;
        }
        String desc = description.trim();
        Matcher m = PART_PATTERN.matcher(desc);
        if (m.matches()) {
            return new PartMarker(m.group(1).trim(), Integer.parseInt(m.group(2)), blankToNull(m.group(3)));
        }
        m = PAGINATION_PATTERN.matcher(desc);
        if (m.matches()) {
            return new PartMarker(m.group(1).trim(), Integer.parseInt(m.group(2)), blankToNull(m.group(4)));
        }
        return null;
    }

    /**
     * 分组并回写每个 setting 的 multipart 字段
     *
     * @param settings 单个文档的全部参数（阅读顺序）
     * @return 多段参数组，按首次出现顺序
     */
    public List<MultipartGroup> group(List<NormalizedSetting> settings) {
        Map<String, List<Entry>> byBase = new LinkedHashMap<>();
        Map<String, String> displayBase = new LinkedHashMap<>();

        int sequence = 0;
        for (NormalizedSetting setting : settings) {
            PartMarker marker = parseMarker(setting.getDescription());
            if (marker == null) {
                continue;
            }
            String key = marker.base.toLowerCase(Locale.ROOT);
            displayBase.putIfAbsent(key, marker.base);
            byBase.computeIfAbsent(key, k -> new ArrayList<>()).add(new Entry(setting, marker, sequence++));

            if (marker.inlineValue != null && setting.getValue().getValueType() == ValueType.EMPTY) {
                setting.setValue(normalizer.normalize(marker.inlineValue, setting.getDescription()));
            }
        }

        List<MultipartGroup> groups = new ArrayList<>();
        for (Map.Entry<String, List<Entry>> e : byBase.entrySet()) {
            String base = displayBase.get(e.getKey());
            List<Entry> entries = e.getValue();
            entries.sort(Comparator.comparingInt((Entry en) -> en.marker.part).thenComparingInt(en -> en.sequence));

            List<NormalizedSetting> ordered = new ArrayList<>();
            int index = 1;
            for (Entry entry : entries) {
                if (entry.marker.part != index) {
                    log.warn("多段参数 '{}' 的段序号 {} 重编为 {}（代码 {}）",
                            base, entry.marker.part, index, entry.setting.getParameterCode());
                }
                entry.setting.assignMultipart(base, index);
                ordered.add(entry.setting);
                index++;
            }
            groups.add(MultipartGroup.of(base, ordered));
        }

        if (!groups.isEmpty()) {
            log.debug("识别多段参数组 {} 个", groups.size());
        }
        return groups;
    }

    private static String blankToNull(String s) {
        if (s == null) {
            return null;
        }
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    private static class Entry {
        final NormalizedSetting setting;
        final PartMarker marker;
        final int sequence;

        Entry(NormalizedSetting setting, PartMarker marker, int sequence) {
            this.setting = setting;
            this.marker = marker;
            this.sequence = sequence;
        }
    }
}
