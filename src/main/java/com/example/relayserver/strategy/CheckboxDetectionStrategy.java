package com.example.relayserver.strategy;

import com.example.relayserver.exception.RelayExtractionException;
import com.example.relayserver.model.ActiveFlagResult;
import com.example.relayserver.model.CheckboxMark;
import com.example.relayserver.model.CorrelationResult;
import com.example.relayserver.model.DetectionMethod;
import com.example.relayserver.model.ParameterLine;
import com.example.relayserver.model.RelayModelProfile;
import com.example.relayserver.model.ReviewItem;
import com.example.relayserver.model.ReviewReason;
import com.example.relayserver.model.SourceDocument;
import com.example.relayserver.model.TextRun;
import com.example.relayserver.util.checkbox.CheckboxCorrelator;
import com.example.relayserver.util.checkbox.CheckboxDetector;
import com.example.relayserver.util.parameter.ParameterLineExtractor;
import com.example.relayserver.util.pdf.PdfPageRenderer;
import com.example.relayserver.util.pdf.PdfTextRunExtractor;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 复选框策略（MiCOM / Easergy 渲染页）
 *
 * 逐页：文本层 -> 参数行；页面渲染 -> 复选框；位置关联 -> 每个匹配行（含子行复选框的父行）一个激活结果。
 * 没有参数行的页面直接跳过，不渲染。
 */
public class CheckboxDetectionStrategy implements DetectionStrategy {

    private static final Logger log = LoggerFactory.getLogger(CheckboxDetectionStrategy.class);

    private static final double LABEL_SEARCH_LEFT = 30;
    private static final double LABEL_SEARCH_RIGHT = 60;
    private static final double LABEL_SEARCH_VERTICAL = 5;
    private static final Set<String> LABEL_NOISE = Set.of(":", ",", "-", "(", ")");

    /** 是否采纳歧义匹配；默认不采纳 */
    private final boolean includeAmbiguous;

    public CheckboxDetectionStrategy(boolean includeAmbiguous) {
        this.includeAmbiguous = includeAmbiguous;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.CHECKBOX;
    }

    @Override
    public ExtractionResult extract(SourceDocument document, RelayModelProfile profile)
            throws RelayExtractionException, IOException {
        if (!document.isPdf()) {
            throw new RelayExtractionException(ReviewReason.PROCESSING_ERROR,
                    "复选框策略只处理 PDF: " + document.getFileName());
        }

        ExtractionResult result = new ExtractionResult(DetectionMethod.CHECKBOX);
        ParameterLineExtractor lineExtractor = new ParameterLineExtractor(profile);
        CheckboxDetector detector = new CheckboxDetector(profile);
        CheckboxCorrelator correlator = new CheckboxCorrelator(profile);

        try (PDDocument pdf = Loader.loadPDF(document.getPath().toFile())) {
            List<List<TextRun>> pages = PdfTextRunExtractor.extractPages(pdf);
            PdfPageRenderer renderer = new PdfPageRenderer(pdf, profile.getRenderDpi());

            for (int pageIndex = 0; pageIndex < pages.size(); pageIndex++) {
                List<TextRun> runs = pages.get(pageIndex);
                List<ParameterLine> lines = lineExtractor.extract(runs, pageIndex);
                if (lines.isEmpty()) {
                    log.debug("{} 第 {} 页无参数行，跳过", document.getFileName(), pageIndex + 1);
                    continue;
                }

                BufferedImage image = renderer.render(pageIndex);
                List<CheckboxMark> boxes = detector.detect(image, runs, pageIndex);
                if (boxes.isEmpty()) {
                    result.addLines(lines);
                    continue;
                }

                CorrelationResult correlation = correlator.correlate(boxes, lines, pageIndex);
                collect(document, correlation, boxes, lines, runs, profile.effectiveCoordinateScale(), result);
            }
        }

        log.info("{} 复选框策略完成: 参数行 {}, 激活结果 {}, 激活 {}",
                document.getFileName(), result.getLines().size(), result.getFlags().size(),
                result.getActiveFunctionCount());
        return result;
    }

    /**
     * 一页的关联结果 -> 参数行与激活结果
     *
     * 参数行自身的复选框或其子行上任一复选框勾选，即为激活；
     * 勾选的子行标签（如 tI>, tI>>）按字母序以逗号拼接，作为该参数行的值。
     *
     * @param scale 像素 -> 文本层坐标的缩放系数
     */
    void collect(SourceDocument document, CorrelationResult correlation, List<CheckboxMark> boxes,
                 List<ParameterLine> lines, List<TextRun> runs, double scale, ExtractionResult result) {
        int page = correlation.getPageIndex() + 1;

        if (correlation.getMatches().isEmpty() && correlation.getChildCount() == 0) {
            // 有框有行却一个都没关联上，多半是缩放系数或容差错了
            result.addReviewItem(new ReviewItem(document.getFileName(), ReviewReason.ZERO_CORRELATION,
                    String.format("第 %d 页复选框 %d 个、参数行 %d 行，无任何关联", page, boxes.size(), lines.size())));
            log.warn("{} 第 {} 页关联数为 0（复选框 {}, 参数行 {}）", document.getFileName(), page, boxes.size(), lines.size());
        }

        Map<ParameterLine, CorrelationResult.Match> own = new IdentityHashMap<>();
        for (CorrelationResult.Match match : correlation.getMatches()) {
            if (match.isAmbiguous()) {
                result.addReviewItem(new ReviewItem(document.getFileName(), ReviewReason.AMBIGUOUS_CHECKBOX,
                        String.format("第 %d 页复选框 y=%d 归属 %s 存疑", page, match.getCheckbox().getY(),
                                match.getLine().getCode())));
                if (!includeAmbiguous) {
                    continue;
                }
            }
            own.put(match.getLine(), match);
        }

        for (ParameterLine line : lines) {
            CorrelationResult.Match match = own.get(line);
            List<CheckboxMark> children = correlation.getChildren(line);
            if (match == null && children.isEmpty()) {
                result.addLine(line);
                continue;
            }

            boolean active = match != null && match.getCheckbox().isMarked();
            List<String> labels = new ArrayList<>();
            for (CheckboxMark child : children) {
                if (!child.isMarked()) {
                    continue;
                }
                active = true;
                String label = labelNear(child, runs, scale);
                if (!label.isEmpty()) {
                    labels.add(label);
                }
            }

            ParameterLine emitted = line;
            if (!labels.isEmpty()) {
                Collections.sort(labels);
                emitted = line.withRawValue(String.join(", ", labels));
                log.debug("{} 第 {} 页 {} 子行勾选: {}", document.getFileName(), page, line.getCode(), labels);
            }
            result.addLine(emitted);
            result.addFlag(new ActiveFlagResult(line.getCode(), line.getDescription(), active,
                    DetectionMethod.CHECKBOX, null, line.getCode()));
        }

        for (CheckboxMark box : correlation.getUnmatched()) {
            result.addReviewItem(new ReviewItem(document.getFileName(), ReviewReason.UNMATCHED_CHECKBOX,
                    String.format("第 %d 页复选框 [%d, %d] 未匹配参数行", page, box.getX(), box.getY())));
        }
    }

    /**
     * 复选框附近的标签文字：左 30pt、右 60pt、上下 5pt 范围内，优先取含 ">" 的最长单词，否则取最长单词
     */
    static String labelNear(CheckboxMark box, List<TextRun> runs, double scale) {
        double left = box.getX() * scale - LABEL_SEARCH_LEFT;
        double right = (box.getX() + box.getWidth()) * scale + LABEL_SEARCH_RIGHT;
        double top = box.getY() * scale - LABEL_SEARCH_VERTICAL;
        double bottom = (box.getY() + box.getHeight()) * scale + LABEL_SEARCH_VERTICAL;

        String best = "";
        boolean bestHasArrow = false;
        for (TextRun run : runs) {
            String text = run.getText().trim();
            if (text.isEmpty() || LABEL_NOISE.contains(text)) {
                continue;
            }
            if (run.getRight() < left || run.getX() > right || run.getBottom() < top || run.getTop() > bottom) {
                continue;
            }
            boolean hasArrow = text.contains(">");
            if ((hasArrow && !bestHasArrow) || (hasArrow == bestHasArrow && text.length() > best.length())) {
                best = text;
                bestHasArrow = hasArrow;
            }
        }
        return best;
    }
}
