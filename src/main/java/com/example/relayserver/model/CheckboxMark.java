package com.example.relayserver.model;

/**
 * 页面渲染图中检测到的一个复选框（像素坐标，原点左上角）
 */
public class CheckboxMark {

    private final int x;
    private final int y;
    private final int width;
    private final int height;
    /** 内部深色像素占比 [0, 1] */
    private final double density;
    private final boolean marked;
    private final int pageIndex;

    public CheckboxMark(int x, int y, int width, int height, double density, boolean marked, int pageIndex) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.density = density;
        this.marked = marked;
        this.pageIndex = pageIndex;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public double getDensity() {
        return density;
    }

    public boolean isMarked() {
        return marked;
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public double getCenterX() {
        return x + width / 2.0;
    }

    public double getCenterY() {
        return y + height / 2.0;
    }

    @Override
    public String toString() {
        return String.format("CheckboxMark{page=%d, xy=[%d, %d], size=%dx%d, density=%.3f, marked=%s}",
                pageIndex, x, y, width, height, density, marked);
    }
}
