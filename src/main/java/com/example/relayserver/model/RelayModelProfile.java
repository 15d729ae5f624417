package com.example.relayserver.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 继电器型号配置
 *
 * 选择激活功能检测策略，并携带该策略所需的全部标定参数。
 * 由 relay-profiles.json 加载，运行期间只读。
 *
 * 设计原则：
 * 1. 阈值、容差、缩放系数都是配置，不是常量
 * 2. 每个字段都有开箱即用的默认值，JSON 只需覆盖差异部分
 */
@Data
public class RelayModelProfile {

    /** 型号代码，如 MICON_P922 */
    private String modelCode;

    private String manufacturer;

    private DetectionMethod detectionMethod;

    // ========== 型号识别信号 ==========

    /** 内容特征（正则），最可信 */
    private List<String> contentSignatures = new ArrayList<>();

    /** 该型号导出文件的扩展名（含点，如 .S40） */
    private List<String> extensions = new ArrayList<>();

    /** 文件名特征（正则），最不可信，必须有扩展名佐证 */
    private List<String> filenamePatterns = new ArrayList<>();

    // ========== 文本解析 ==========

    /** 行首参数代码格式 */
    private String codePattern = "[0-9A-F]{4}|[0-9A-F]{2}\\.[0-9A-F]{2}";

    /** 按顺序尝试的字符编码 */
    private List<String> encodings = new ArrayList<>();

    /** 描述继电器自身而非整定值的代码（序列号、软件版本等） */
    private List<String> metadataCodes = new ArrayList<>();

    /** 型号专用单位词表，为空时使用全局词表 */
    private List<String> knownUnits = new ArrayList<>();

    /** 栏带聚类间隙（pt） */
    private double columnBandGap = 60.0;

    /** 同一基线合并容差（pt） */
    private double lineMergeTolerance = 2.0;

    /** 续行允许的最大垂直间距（pt） */
    private double continuationGap = 14.0;

    // ========== 复选框检测 ==========

    private int renderDpi = 300;

    /** 像素坐标 -> 文本层坐标的缩放系数，为空时取 72 / renderDpi */
    private Double coordinateScale;

    private int checkboxMinSizePx = 10;

    private int checkboxMaxSizePx = 40;

    /** 宽高比允许偏离 1 的幅度 */
    private double aspectTolerance = 0.3;

    /** 边框像素占外周长的最小比例 */
    private double borderCoverage = 0.75;

    /** 二值化阈值（灰度 < 该值视为深色） */
    private int darkThreshold = 128;

    /** 标记判定阈值：内部深色像素占比 > 该值即为已勾选 */
    private double densityThreshold = 0.316;

    /** 平均饱和度上限 [0, 1]，超过视为彩色图标 */
    private double maxSaturation = 0.16;

    private int interiorShrinkPx = 3;

    private int dedupDistancePx = 4;

    private int textMaskPaddingPx = 1;

    // ========== 位置关联 ==========

    /** 复选框与参数行的最大垂直距离（pt） */
    private double correlationTolerance = 15.0;

    /** 两个候选行距离差小于该值视为歧义（pt） */
    private double ambiguityMargin = 0.25;

    /** 子行复选框（如 LED 分配的 tI>、tI>>）距父参数行的最大下方距离（pt），0 表示不做子行关联 */
    private double subLineWindow = 0;

    /** 子行复选框距父参数行的最小下方距离（pt） */
    private double subLineMinOffset = 5.0;

    /** 标注样本，用于在批处理前验证容差 */
    private List<CalibrationSample> calibrationSamples = new ArrayList<>();

    private double minCalibrationAccuracy = 1.0;

    /** 为 true 时，未通过标定的型号文档一律转人工复核 */
    private boolean requireCalibration = false;

    // ========== 文本策略 ==========

    private List<FunctionDefinition> functions = new ArrayList<>();

    /** LABELED_FIELD 策略中表示"未启用"的取值 */
    private List<String> disabledValues = new ArrayList<>(List.of("disabled", "none", "off", "not used", "-", "no"));

    /** KEYED_SECTION 中设备标识所在的键（如 repere） */
    private List<String> identificationKeys = new ArrayList<>(List.of("repere"));

    /**
     * 实际使用的缩放系数
     */
    public double effectiveCoordinateScale() {
        if (coordinateScale != null && coordinateScale > 0) {
            return coordinateScale;
        }
        return 72.0 / renderDpi;
    }

    /**
     * 保护功能定义
     */
    @Data
    public static class FunctionDefinition {

        /** ANSI 功能代码，如 50/51 */
        private String code;

        private String description;

        /** LABELED_FIELD：同一功能的多个标签变体（如 I>1 Function, I>2 Function） */
        private List<String> labels = new ArrayList<>();

        /** KEYED_SECTION：功能所在分节 */
        private String section;

        /** KEYED_SECTION：编号布尔键前缀 */
        private String keyPrefix = "activite_";

        /** CHECKBOX：归属该功能的参数代码 */
        private List<String> parameterCodes = new ArrayList<>();
    }

    /**
     * 容差标定样本：一页上的参数行位置 + 一个已知正确归属的复选框
     */
    @Data
    public static class CalibrationSample {

        /** 参数行：代码 -> 垂直位置（pt） */
        private List<SampleLine> lines = new ArrayList<>();

        /** 复选框中心 Y（像素） */
        private double checkboxCenterY;

        private String expectedCode;
    }

    @Data
    public static class SampleLine {
        private String code;
        private double y;
    }
}
