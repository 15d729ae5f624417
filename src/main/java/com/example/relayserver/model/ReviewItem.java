package com.example.relayserver.model;

/**
 * 人工复核条目
 */
public class ReviewItem {

    private final String fileName;
    private final ReviewReason reason;
    private final String detail;

    public ReviewItem(String fileName, ReviewReason reason, String detail) {
        this.fileName = fileName;
        this.reason = reason;
        this.detail = detail;
    }

    public String getFileName() {
        return fileName;
    }

    public ReviewReason getReason() {
        return reason;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return "ReviewItem{" + fileName + ", " + reason + ", " + detail + "}";
    }
}
