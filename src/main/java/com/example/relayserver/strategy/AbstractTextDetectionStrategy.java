package com.example.relayserver.strategy;

import com.example.relayserver.exception.EncodingUnresolvedException;
import com.example.relayserver.model.RelayModelProfile;
import com.example.relayserver.model.SourceDocument;
import com.example.relayserver.util.text.TextDecoder;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;
import java.nio.file.Files;
import java.util.List;
import java.util.function.Predicate;

/**
 * 文本类策略的公共部分：把 PDF 文本层或文本导出文件读成行
 */
public abstract class AbstractTextDetectionStrategy implements DetectionStrategy {

    private final List<String> defaultEncodings;

    protected AbstractTextDetectionStrategy(List<String> defaultEncodings) {
        this.defaultEncodings = defaultEncodings;
    }

    /**
     * 读取文档全部文本行
     *
     * @param structureCheck 文本文件解码结果的结构条件；PDF 不适用
     */
    protected TextDecoder.DecodedText readText(SourceDocument document, RelayModelProfile profile,
                                               Predicate<String> structureCheck)
            throws IOException, EncodingUnresolvedException {
        if (document.isPdf()) {
            try (PDDocument pdf = Loader.loadPDF(document.getPath().toFile())) {
                PDFTextStripper stripper = new PDFTextStripper();
                stripper.setSortByPosition(true);
                return new TextDecoder.DecodedText(stripper.getText(pdf), null);
            }
        }

        List<String> encodings = profile.getEncodings() == null || profile.getEncodings().isEmpty()
                ? defaultEncodings
                : profile.getEncodings();
        byte[] bytes = Files.readAllBytes(document.getPath());
        return new TextDecoder(encodings).decode(bytes, document.getFileName(), structureCheck);
    }
}
