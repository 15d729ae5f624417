package com.example.relayserver.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * relay.extractor.* 配置
 */
@Data
@ConfigurationProperties(prefix = "relay.extractor")
public class ExtractorProperties {

    /** 待处理文件目录 */
    private String inputDir = "inputs";

    /** 批处理报告输出目录 */
    private String reportDir = "outputs/reports";

    /** 并发处理的文档数，不超过数据库连接池大小 */
    private int workerThreads = 4;

    /** 文本导出文件的候选编码（型号未指定时使用） */
    private List<String> encodings = new ArrayList<>(List.of("UTF-8", "windows-1252", "ISO-8859-1"));

    /** 已知单位词表，为空时使用内置词表 */
    private List<String> units = new ArrayList<>();

    /** 单位别名，为空时使用内置别名 */
    private Map<String, String> unitAliases = new LinkedHashMap<>();

    /** 设备位号文件名正则，按顺序尝试，为空时使用内置约定 */
    private List<String> tagPatterns = new ArrayList<>();

    /** 外部型号配置文件路径，为空时只用 classpath:relay-profiles.json */
    private String profilesLocation;

    /** 内存中保留的已完成批处理数，超出后最早完成的先移除（报告文件不受影响） */
    private int maxRetainedRuns = 50;

    /** 启动时执行一次批处理 */
    private boolean runOnStartup = false;

    /** 歧义复选框的处理方式 */
    private AmbiguousPolicy ambiguousPolicy = AmbiguousPolicy.EXCLUDE;

    public enum AmbiguousPolicy {
        /** 排除并转人工复核 */
        EXCLUDE,
        /** 采纳较早的行，同时转人工复核 */
        INCLUDE
    }
}
