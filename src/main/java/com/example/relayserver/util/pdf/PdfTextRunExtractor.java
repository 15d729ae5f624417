package com.example.relayserver.util.pdf;

import com.example.relayserver.model.TextRun;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * PDF 文本层提取器
 * 按页提取每个单词片段的内容和边界框（DirAdj 坐标，原点左上角，单位 pt）
 */
public class PdfTextRunExtractor extends PDFTextStripper {

    private int currentPageIndex = -1;
    private final List<List<TextRun>> pages = new ArrayList<>();

    public PdfTextRunExtractor() throws IOException {
        super();
        setSortByPosition(true);
    }

    /**
     * 提取整份文档的文本片段
     *
     * @param document PDF 文档
     * @return 每页一个列表（页序与文档一致，空白页为空列表）
     */
    public static List<List<TextRun>> extractPages(PDDocument document) throws IOException {
        PdfTextRunExtractor extractor = new PdfTextRunExtractor();
        extractor.setStartPage(1);
        extractor.setEndPage(document.getNumberOfPages());
        // 只需要回调，输出丢弃
        extractor.writeText(document, new StringWriter());

        // 尾部空白页不会触发 startPage 之后的 writeString，这里补齐
        while (extractor.pages.size() < document.getNumberOfPages()) {
            extractor.pages.add(new ArrayList<>());
        }
        return extractor.pages;
    }

    /**
     * 首页纯文本，用于型号内容嗅探
     */
    public static String extractFirstPageText(PDDocument document) throws IOException {
        if (document.getNumberOfPages() == 0) {
            return "";
        }
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setStartPage(1);
        stripper.setEndPage(1);
        return stripper.getText(document);
    }

    /**
     * 重写页面处理方法，记录当前页索引
     */
    @Override
    protected void startPage(PDPage page) throws IOException {
        currentPageIndex++;
        while (pages.size() <= currentPageIndex) {
            pages.add(new ArrayList<>());
        }
        super.startPage(page);
    }

    /**
     * 重写文本写入方法，按空白字符把一段文本拆成单词片段，坐标使用边界框
     *
     * PDFBox 传入的是整段文本（如 "0104: Overcurrent I>"），参数代码必须成为独立片段才能参与栏带聚类。
     */
    @Override
    protected void writeString(String string, List<TextPosition> textPositions) throws IOException {
        if (textPositions == null || textPositions.isEmpty() || string == null || string.trim().isEmpty()) {
            return;
        }

        List<TextPosition> word = new ArrayList<>();
        for (TextPosition tp : textPositions) {
            String unicode = tp.getUnicode();
            if (unicode == null || unicode.isBlank()) {
                addWord(word);
                word = new ArrayList<>();
            } else {
                word.add(tp);
            }
        }
        addWord(word);
    }

    private void addWord(List<TextPosition> word) {
        if (word.isEmpty()) {
            return;
        }

        StringBuilder text = new StringBuilder();
        float minX = Float.MAX_VALUE;
        float minTop = Float.MAX_VALUE;
        float maxX = -Float.MAX_VALUE;
        float maxBottom = -Float.MAX_VALUE;

        for (TextPosition tp : word) {
            text.append(tp.getUnicode());
            float x = tp.getXDirAdj();
            // YDirAdj 是基线位置（自顶向下），字形顶部 = 基线 - 高度
            float baseline = tp.getYDirAdj();
            float height = tp.getHeightDir();

            minX = Math.min(minX, x);
            maxX = Math.max(maxX, x + tp.getWidthDirAdj());
            minTop = Math.min(minTop, baseline - height);
            maxBottom = Math.max(maxBottom, baseline);
        }

        pages.get(currentPageIndex).add(new TextRun(text.toString(), minX, minTop,
                maxX - minX, maxBottom - minTop, currentPageIndex));
    }
}
