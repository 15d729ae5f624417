package com.example.relayserver.util.normalize;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 布尔文本标记（多语言）
 */
public final class BooleanMarkers {

    private static final Map<String, Boolean> MARKERS = new HashMap<>();

    static {
        put(true, "on", "yes", "true", "sim", "oui", "ja", "enabled", "enable");
        put(false, "off", "no", "false", "não", "nao", "non", "nein", "disabled", "disable");
    }

    private BooleanMarkers() {
    }

    private static void put(boolean value, String... markers) {
        for (String marker : markers) {
            MARKERS.put(marker, value);
        }
    }

    /**
     * @return true / false；不是布尔标记时返回 null
     */
    public static Boolean parse(String text) {
        if (text == null) {
            return null;
        }
        return MARKERS.get(text.trim().toLowerCase(Locale.ROOT));
    }

    public static boolean isMarker(String text) {
        return parse(text) != null;
    }
}
