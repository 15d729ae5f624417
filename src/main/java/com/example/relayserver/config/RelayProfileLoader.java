package com.example.relayserver.config;

import com.example.relayserver.model.RelayModelProfile;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 型号配置加载
 *
 * 每个型号从 RelayModelProfile 的默认值开始，JSON 中出现的字段覆盖默认值，未出现的保持不变。
 * 外部文件中与内置同名（modelCode）的型号在内置配置基础上再覆盖一次；新的型号直接追加。
 *
 * JSON 格式：
 * <pre>
 * {
 *   "profiles": [
 *     { "modelCode": "MICON_P922", "detectionMethod": "CHECKBOX", "renderDpi": 300, ... }
 *   ]
 * }
 * </pre>
 */
public class RelayProfileLoader {

    private static final Logger log = LoggerFactory.getLogger(RelayProfileLoader.class);

    public static final String DEFAULT_RESOURCE = "relay-profiles.json";

    private final ObjectMapper mapper;

    public RelayProfileLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * 加载内置配置，并用外部文件覆盖
     *
     * @param externalLocation 外部文件路径，可为空
     */
    public List<RelayModelProfile> load(String externalLocation) {
        Map<String, RelayModelProfile> profiles = new LinkedHashMap<>();

        try (InputStream in = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                log.warn("classpath 中未找到 {}", DEFAULT_RESOURCE);
            } else {
                merge(profiles, mapper.readTree(in), DEFAULT_RESOURCE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("读取内置型号配置失败: " + DEFAULT_RESOURCE, e);
        }

        if (externalLocation != null && !externalLocation.isBlank()) {
            File file = new File(externalLocation);
            if (!file.isFile()) {
                throw new IllegalStateException("型号配置文件不存在: " + file.getAbsolutePath());
            }
            try {
                merge(profiles, mapper.readTree(file), file.getAbsolutePath());
            } catch (IOException e) {
                throw new UncheckedIOException("读取型号配置失败: " + file.getAbsolutePath(), e);
            }
        }

        log.info("已加载型号配置 {} 个: {}", profiles.size(), profiles.keySet());
        return new ArrayList<>(profiles.values());
    }

    /**
     * 解析一份 JSON，逐个型号覆盖到 profiles
     */
    public void merge(Map<String, RelayModelProfile> profiles, JsonNode root, String source) throws IOException {
        JsonNode array = root.has("profiles") ? root.get("profiles") : root;
        if (!array.isArray()) {
            throw new IllegalStateException("型号配置格式错误（需要 profiles 数组）: " + source);
        }

        for (JsonNode node : array) {
            String modelCode = node.path("modelCode").asText(null);
            if (modelCode == null || modelCode.isBlank()) {
                throw new IllegalStateException("型号配置缺少 modelCode: " + source);
            }

            RelayModelProfile profile = profiles.get(modelCode);
            boolean overriding = profile != null;
            if (profile == null) {
                profile = new RelayModelProfile();
            }
            mapper.readerForUpdating(profile).readValue(node);

            if (profile.getDetectionMethod() == null) {
                throw new IllegalStateException("型号 " + modelCode + " 缺少 detectionMethod: " + source);
            }
            profiles.put(modelCode, profile);
            log.debug("{} 型号 {}（{}）来自 {}", overriding ? "覆盖" : "加载", modelCode,
                    profile.getDetectionMethod(), source);
        }
    }
}
