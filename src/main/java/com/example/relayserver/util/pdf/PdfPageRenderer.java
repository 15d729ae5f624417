package com.example.relayserver.util.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * PDF 页面渲染为栅格图
 * 注意：PDFRenderer 不是线程安全的，一个实例只在一个文档的处理线程内使用
 */
public class PdfPageRenderer {

    private static final Logger log = LoggerFactory.getLogger(PdfPageRenderer.class);

    private final PDFRenderer renderer;
    private final int dpi;

    public PdfPageRenderer(PDDocument document, int dpi) {
        this.renderer = new PDFRenderer(document);
        this.dpi = dpi;
    }

    /**
     * 渲染单个页面
     *
     * @param pageIndex 页面索引（0-based）
     * @return RGB 图像
     */
    public BufferedImage render(int pageIndex) throws IOException {
        long start = System.currentTimeMillis();
        BufferedImage image = renderer.renderImageWithDPI(pageIndex, dpi, ImageType.RGB);
        log.debug("页面 {} 渲染完成: {}x{} @ {} DPI, 耗时={}ms",
                pageIndex, image.getWidth(), image.getHeight(), dpi, System.currentTimeMillis() - start);
        return image;
    }

    public int getDpi() {
        return dpi;
    }
}
