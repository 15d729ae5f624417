package com.example.relayserver.service;

import com.example.relayserver.model.SourceDocument;
import com.example.relayserver.util.pdf.PdfTextRunExtractor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * 读取输入文件元信息：校验和、页数、用于型号嗅探的内容采样
 */
@Slf4j
@Component
public class SourceDocumentLoader {

    /** 文本文件采样长度（字节） */
    static final int SAMPLE_BYTES = 8192;

    public SourceDocument load(Path path) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        String checksum = sha256(bytes);
        String extension = SourceDocument.extensionOf(path.getFileName().toString());

        if (".PDF".equals(extension)) {
            try (PDDocument pdf = Loader.loadPDF(bytes)) {
                String sample = PdfTextRunExtractor.extractFirstPageText(pdf);
                log.debug("加载 PDF: {}, 页数={}, 首页文本 {} 字符", path.getFileName(), pdf.getNumberOfPages(), sample.length());
                return new SourceDocument(path, checksum, bytes.length, pdf.getNumberOfPages(), sample, null);
            }
        }

        // 仅用于嗅探：ISO-8859-1 逐字节映射，不会失败；真正的解码由策略按候选编码完成
        byte[] head = bytes.length > SAMPLE_BYTES ? Arrays.copyOf(bytes, SAMPLE_BYTES) : bytes;
        String sample = new String(head, StandardCharsets.ISO_8859_1);
        return new SourceDocument(path, checksum, bytes.length, 1, sample, null);
    }

    static String sha256(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 不可用", e);
        }
    }
}
