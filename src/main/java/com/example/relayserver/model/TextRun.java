package com.example.relayserver.model;

/**
 * 文本层中的一段连续文字
 *
 * 坐标系与 PDFBox TextPosition 的 DirAdj 坐标一致：原点在页面左上角，Y 轴向下，单位 pt。
 * 纯文本导出时 x 恒为 0，top 为行号。
 */
public class TextRun {

    private final String text;
    private final float x;
    private final float top;
    private final float width;
    private final float height;
    private final int pageIndex;

    public TextRun(String text, float x, float top, float width, float height, int pageIndex) {
        this.text = text;
        this.x = x;
        this.top = top;
        this.width = width;
        this.height = height;
        this.pageIndex = pageIndex;
    }

    public String getText() {
        return text;
    }

    public float getX() {
        return x;
    }

    public float getTop() {
        return top;
    }

    public float getWidth() {
        return width;
    }

    public float getHeight() {
        return height;
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public float getRight() {
        return x + width;
    }

    public float getBottom() {
        return top + height;
    }

    /**
     * 垂直中心线
     */
    public float getCenterY() {
        return top + height / 2f;
    }

    @Override
    public String toString() {
        return String.format("TextRun{page=%d, text='%s', xy=[%.2f, %.2f], size=[%.2f, %.2f]}",
                pageIndex, text, x, top, width, height);
    }
}
