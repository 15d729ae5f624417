package com.example.relayserver.util.normalize;

import com.example.relayserver.model.NormalizedValue;
import com.example.relayserver.model.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 单元格文本原子化：raw -> (value, unit, type)
 *
 * 按顺序回退，首个命中即返回：
 * <ol>
 *   <li>两字符温度单位（°C / °F）整体保留</li>
 *   <li>已知单位词表，先区分大小写再忽略大小写，长单位优先（kHz 不会被拆成 k + Hz）</li>
 *   <li>通用字母后缀：仅当前缀是带符号小数时才作为单位</li>
 *   <li>纯数字：单位为空</li>
 *   <li>其余一律作为不透明文本，绝不丢弃</li>
 * </ol>
 * 布尔标记（ON/OFF、YES/NO 及多语言变体）在第 1 步之前转换为 1/0，原文保留。
 *
 * 幂等：对已原子化的值再次调用不会继续拆分。
 */
public class UnitValueNormalizer {

    private static final Logger log = LoggerFactory.getLogger(UnitValueNormalizer.class);

    /** 默认已知单位（顺序无关，构造时按长度降序排序） */
    public static final List<String> DEFAULT_UNITS = List.of(
            "MHz", "kHz", "Hz",
            "kA", "mA", "A",
            "kV", "mV", "V",
            "μs", "ms", "s", "min", "h",
            "Ω", "mΩ", "kΩ",
            "MVA", "kVA", "VA",
            "MW", "kW", "W",
            "Mvar", "kvar", "var",
            "°C", "°F", "°",
            "%",
            "km", "m", "cm", "mm",
            "In", "Vn", "Ir", "pu");

    /** 单位别名 -> 标准单位 */
    public static final Map<String, String> DEFAULT_ALIASES;

    static {
        Map<String, String> aliases = new LinkedHashMap<>();
        aliases.put("ohm", "Ω");
        aliases.put("ohms", "Ω");
        aliases.put("mohm", "mΩ");
        aliases.put("kohm", "kΩ");
        aliases.put("deg", "°");
        aliases.put("us", "μs");
        aliases.put("sec", "s");
        DEFAULT_ALIASES = Collections.unmodifiableMap(aliases);
    }

    private static final String DECIMAL = "[+-]?(?:\\d+(?:[.,]\\d+)?|[.,]\\d+)";

    private static final Pattern DEGREE_PATTERN = Pattern.compile("^(" + DECIMAL + ")\\s*(°[CF])$", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBER_PATTERN = Pattern.compile("^" + DECIMAL + "$");
    private static final Pattern SUFFIX_PATTERN = Pattern.compile("^(" + DECIMAL + ")\\s*([A-Za-zΩμ%°]+)$");

    /** 状态类字段：看起来像数字也保留为文本（位掩码、DDB 等） */
    private static final List<Pattern> STATUS_FIELD_PATTERNS = List.of(
            Pattern.compile("status"), Pattern.compile("alarm"), Pattern.compile("opto.*i/p"),
            Pattern.compile("relay.*o/p"), Pattern.compile("flags"), Pattern.compile("\\bddb\\b"),
            Pattern.compile("test\\s+pattern"), Pattern.compile("bit\\s+mask"), Pattern.compile("binary"));

    private final List<String> units;
    private final Map<String, String> aliases;

    public UnitValueNormalizer() {
        this(DEFAULT_UNITS, DEFAULT_ALIASES);
    }

    public UnitValueNormalizer(List<String> knownUnits, Map<String, String> aliases) {
        List<String> sorted = new ArrayList<>();
        for (String unit : knownUnits) {
            sorted.add(canonicalMicro(unit));
        }
        for (String alias : aliases.keySet()) {
            if (!sorted.contains(alias)) {
                sorted.add(alias);
            }
        }
        // 长单位优先
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        this.units = Collections.unmodifiableList(sorted);
        this.aliases = aliases;
    }

    /**
     * 使用型号专用词表创建新实例，别名沿用当前实例
     */
    public UnitValueNormalizer withUnits(List<String> knownUnits) {
        if (knownUnits == null || knownUnits.isEmpty()) {
            return this;
        }
        return new UnitValueNormalizer(knownUnits, aliases);
    }

    public List<String> getUnits() {
        return units;
    }

    /**
     * 原子化一个原始单元格
     */
    public NormalizedValue normalize(String raw) {
        if (raw == null) {
            return NormalizedValue.empty(null);
        }
        String s = canonicalMicro(raw.trim());
        if (s.isEmpty()) {
            return NormalizedValue.empty(raw);
        }

        Boolean bool = BooleanMarkers.parse(s);
        if (bool != null) {
            return NormalizedValue.bool(bool, s);
        }

        // 1. 温度单位整体保留
        Matcher degree = DEGREE_PATTERN.matcher(s);
        if (degree.matches()) {
            String unit = "°" + degree.group(2).substring(1).toUpperCase(Locale.ROOT);
            return NormalizedValue.numeric(parseDecimal(degree.group(1)), unit, s);
        }

        // 2. 已知单位词表
        NormalizedValue known = matchKnownUnit(s, false);
        if (known == null) {
            known = matchKnownUnit(s, true);
        }
        if (known != null) {
            return known;
        }

        // 3. 通用字母后缀
        Matcher suffix = SUFFIX_PATTERN.matcher(s);
        if (suffix.matches()) {
            log.debug("未知单位 '{}' 出现在 '{}'", suffix.group(2), s);
            return NormalizedValue.numeric(parseDecimal(suffix.group(1)), suffix.group(2), s);
        }

        // 4. 纯数字
        if (NUMBER_PATTERN.matcher(s).matches()) {
            return NormalizedValue.numeric(parseDecimal(s), null, s);
        }

        // 5. 不透明文本
        return NormalizedValue.text(s);
    }

    /**
     * 带描述的原子化：状态类字段保持文本
     */
    public NormalizedValue normalize(String raw, String description) {
        NormalizedValue value = normalize(raw);
        if (value.getValueType() == ValueType.NUMERIC && isStatusField(description)) {
            return NormalizedValue.text(raw.trim());
        }
        return value;
    }

    /**
     * 对已原子化的值再次原子化：结果总是原值本身。
     * 仅当重新解析会改变它时记录一条日志（NormalizationNoOp）。
     */
    public NormalizedValue normalize(NormalizedValue value) {
        if (value == null) {
            return NormalizedValue.empty(null);
        }
        NormalizedValue reparsed = normalize(value.render());
        if (!reparsed.equals(value)) {
            log.debug("NormalizationNoOp: 已原子化的值 {} 保持不变（重新解析将得到 {}）", value, reparsed);
        }
        return value;
    }

    public static boolean isStatusField(String description) {
        if (description == null || description.isEmpty()) {
            return false;
        }
        String lower = description.toLowerCase(Locale.ROOT);
        for (Pattern pattern : STATUS_FIELD_PATTERNS) {
            if (pattern.matcher(lower).find()) {
                return true;
            }
        }
        return false;
    }

    private NormalizedValue matchKnownUnit(String s, boolean ignoreCase) {
        String haystack = ignoreCase ? s.toLowerCase(Locale.ROOT) : s;
        for (String unit : units) {
            String needle = ignoreCase ? unit.toLowerCase(Locale.ROOT) : unit;
            if (!haystack.endsWith(needle)) {
                continue;
            }
            String prefix = s.substring(0, s.length() - unit.length()).trim();
            if (!NUMBER_PATTERN.matcher(prefix).matches()) {
                continue;
            }
            return NormalizedValue.numeric(parseDecimal(prefix), canonicalUnit(unit), s);
        }
        return null;
    }

    private String canonicalUnit(String unit) {
        String alias = aliases.get(unit.toLowerCase(Locale.ROOT));
        return alias != null ? alias : unit;
    }

    /**
     * 小数逗号视为小数点
     */
    static BigDecimal parseDecimal(String text) {
        String s = text.replace(',', '.');
        if (s.startsWith("+")) {
            s = s.substring(1);
        }
        if (s.startsWith(".")) {
            s = "0" + s;
        } else if (s.startsWith("-.")) {
            s = "-0" + s.substring(1);
        }
        return new BigDecimal(s);
    }

    /**
     * 微符号 U+00B5 统一为希腊字母 μ
     */
    private static String canonicalMicro(String s) {
        return s.replace('µ', 'μ');
    }
}
