package com.example.relayserver.model;

import java.nio.file.Path;
import java.util.Locale;

/**
 * 一个输入文件，创建后不可变
 */
public class SourceDocument {

    private final Path path;
    private final String fileName;
    private final String extension;
    private final String checksum;
    private final long size;
    private final int pageCount;
    /** 内容采样（PDF 首页文本或文本文件开头），用于型号嗅探 */
    private final String contentSample;
    /** 文本文件实际解码所用编码；PDF 为 null */
    private final String encoding;

    public SourceDocument(Path path, String checksum, long size, int pageCount, String contentSample, String encoding) {
        this.path = path;
        this.fileName = path.getFileName().toString();
        this.extension = extensionOf(fileName);
        this.checksum = checksum;
        this.size = size;
        this.pageCount = pageCount;
        this.contentSample = contentSample == null ? "" : contentSample;
        this.encoding = encoding;
    }

    public static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot).toUpperCase(Locale.ROOT);
    }

    public Path getPath() {
        return path;
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 大写扩展名（含点），无扩展名时为空串
     */
    public String getExtension() {
        return extension;
    }

    /**
     * 去掉扩展名的文件名
     */
    public String getBaseName() {
        return extension.isEmpty() ? fileName : fileName.substring(0, fileName.length() - extension.length());
    }

    public String getChecksum() {
        return checksum;
    }

    public long getSize() {
        return size;
    }

    public int getPageCount() {
        return pageCount;
    }

    public String getContentSample() {
        return contentSample;
    }

    public String getEncoding() {
        return encoding;
    }

    public boolean isPdf() {
        return ".PDF".equals(extension);
    }

    @Override
    public String toString() {
        return "SourceDocument{" + fileName + ", pages=" + pageCount + ", encoding=" + encoding + "}";
    }
}
