package com.example.relayserver.util.checkbox;

import com.example.relayserver.model.CheckboxMark;
import com.example.relayserver.model.RelayModelProfile;
import com.example.relayserver.model.TextRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 复选框检测器
 *
 * <h3>流程</h3>
 * <ol>
 *   <li>先用文本层边界框把文字区域涂白：字母的闭合笔画（O、D、0 等）是误检的主要来源</li>
 *   <li>灰度二值化后做 8 连通域标记，取尺寸、宽高比、边框覆盖率都符合的近似正方形</li>
 *   <li>拒绝彩色区域（图标），复选框是黑白的</li>
 *   <li>内缩边框后计算内部深色像素占比，超过阈值即为已勾选</li>
 *   <li>去重：嵌套 / 重叠的候选保留面积较大者</li>
 * </ol>
 * 所有阈值来自 RelayModelProfile，不同厂商模板的复选框尺寸和渲染分辨率不同。
 * 一个复选框都没有的页面是正常的"纯文本页"。
 */
public class CheckboxDetector {

    private static final Logger log = LoggerFactory.getLogger(CheckboxDetector.class);

    private final RelayModelProfile profile;

    public CheckboxDetector(RelayModelProfile profile) {
        this.profile = profile;
    }

    /**
     * 检测一页中的复选框
     *
     * @param image     页面渲染图
     * @param textRuns  同一页的文本片段（文本层坐标），用于遮罩
     * @param pageIndex 页索引
     * @return 去重后的复选框，按 Y、X 排序
     */
    public List<CheckboxMark> detect(BufferedImage image, List<TextRun> textRuns, int pageIndex) {
        int width = image.getWidth();
        int height = image.getHeight();

        int[] gray = new int[width * height];
        float[] saturation = new float[width * height];
        readPixels(image, gray, saturation);

        boolean[] dark = new boolean[width * height];
        for (int i = 0; i < gray.length; i++) {
            dark[i] = gray[i] < profile.getDarkThreshold();
        }

        int maskedRuns = maskText(dark, width, height, textRuns);

        List<CheckboxMark> candidates = findCandidates(dark, saturation, width, height, pageIndex);
        List<CheckboxMark> result = deduplicate(candidates);

        if (result.isEmpty()) {
            log.debug("页面 {} 未检测到复选框，视为纯文本页（遮罩文本 {} 段）", pageIndex, maskedRuns);
        } else {
            long marked = result.stream().filter(CheckboxMark::isMarked).count();
            log.debug("页面 {} 检测到复选框 {} 个（已勾选 {}），遮罩文本 {} 段",
                    pageIndex, result.size(), marked, maskedRuns);
        }
        return result;
    }

    private static void readPixels(BufferedImage image, int[] gray, float[] saturation) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] rgb = image.getRGB(0, 0, width, height, null, 0, width);
        for (int i = 0; i < rgb.length; i++) {
            int r = (rgb[i] >> 16) & 0xFF;
            int g = (rgb[i] >> 8) & 0xFF;
            int b = rgb[i] & 0xFF;
            gray[i] = (r * 299 + g * 587 + b * 114) / 1000;
            int max = Math.max(r, Math.max(g, b));
            int min = Math.min(r, Math.min(g, b));
            saturation[i] = max == 0 ? 0f : (max - min) / (float) max;
        }
    }

    /**
     * 将文本片段边界框（pt）换算成像素后涂白
     *
     * @return 遮罩的片段数
     */
    private int maskText(boolean[] dark, int width, int height, List<TextRun> textRuns) {
        if (textRuns == null) {
            return 0;
        }
        double pxPerPt = 1.0 / profile.effectiveCoordinateScale();
        int pad = profile.getTextMaskPaddingPx();
        int count = 0;
        for (TextRun run : textRuns) {
            int x0 = clamp((int) Math.floor(run.getX() * pxPerPt) - pad, 0, width);
            int y0 = clamp((int) Math.floor(run.getTop() * pxPerPt) - pad, 0, height);
            int x1 = clamp((int) Math.ceil(run.getRight() * pxPerPt) + pad, 0, width);
            int y1 = clamp((int) Math.ceil(run.getBottom() * pxPerPt) + pad, 0, height);
            if (x1 <= x0 || y1 <= y0) {
                continue;
            }
            for (int y = y0; y < y1; y++) {
                int row = y * width;
                for (int x = x0; x < x1; x++) {
                    dark[row + x] = false;
                }
            }
            count++;
        }
        return count;
    }

    /**
     * 8 连通域标记 + 几何 / 颜色 / 密度过滤
     */
    private List<CheckboxMark> findCandidates(boolean[] dark, float[] saturation, int width, int height, int pageIndex) {
        List<CheckboxMark> candidates = new ArrayList<>();
        boolean[] visited = new boolean[dark.length];
        int[] stack = new int[1024];

        for (int start = 0; start < dark.length; start++) {
            if (!dark[start] || visited[start]) {
                continue;
            }

            // 迭代 DFS，记录边界框
            int minX = Integer.MAX_VALUE, minY = Integer.MAX_VALUE;
            int maxX = Integer.MIN_VALUE, maxY = Integer.MIN_VALUE;
            int top = 0;
            stack[top++] = start;
            visited[start] = true;
            while (top > 0) {
                int p = stack[--top];
                int px = p % width;
                int py = p / width;
                minX = Math.min(minX, px);
                maxX = Math.max(maxX, px);
                minY = Math.min(minY, py);
                maxY = Math.max(maxY, py);

                for (int dy = -1; dy <= 1; dy++) {
                    int ny = py + dy;
                    if (ny < 0 || ny >= height) continue;
                    for (int dx = -1; dx <= 1; dx++) {
                        int nx = px + dx;
                        if (nx < 0 || nx >= width || (dx == 0 && dy == 0)) continue;
                        int n = ny * width + nx;
                        if (dark[n] && !visited[n]) {
                            visited[n] = true;
                            if (top == stack.length) {
                                int[] grown = new int[stack.length * 2];
                                System.arraycopy(stack, 0, grown, 0, stack.length);
                                stack = grown;
                            }
                            stack[top++] = n;
                        }
                    }
                }
            }

            int w = maxX - minX + 1;
            int h = maxY - minY + 1;
            CheckboxMark mark = evaluate(dark, saturation, width, minX, minY, w, h, pageIndex);
            if (mark != null) {
                candidates.add(mark);
            }
        }
        return candidates;
    }

    /**
     * 判断一个连通域是否是复选框
     *
     * @return 复选框，不符合时返回 null
     */
    private CheckboxMark evaluate(boolean[] dark, float[] saturation, int width,
                                  int x, int y, int w, int h, int pageIndex) {
        // 尺寸
        if (w < profile.getCheckboxMinSizePx() || w > profile.getCheckboxMaxSizePx()
                || h < profile.getCheckboxMinSizePx() || h > profile.getCheckboxMaxSizePx()) {
            return null;
        }

        // 近似正方形
        double aspect = w / (double) h;
        if (Math.abs(aspect - 1.0) > profile.getAspectTolerance()) {
            return null;
        }

        // 闭合边框
        if (borderCoverage(dark, width, x, y, w, h) < profile.getBorderCoverage()) {
            return null;
        }

        // 彩色图标
        double satSum = 0;
        for (int yy = y; yy < y + h; yy++) {
            for (int xx = x; xx < x + w; xx++) {
                satSum += saturation[yy * width + xx];
            }
        }
        if (satSum / (w * h) > profile.getMaxSaturation()) {
            log.trace("拒绝彩色区域: [{}, {}] {}x{}", x, y, w, h);
            return null;
        }

        // 内部密度
        int shrink = profile.getInteriorShrinkPx();
        int ix0 = x + shrink;
        int iy0 = y + shrink;
        int iw = w - 2 * shrink;
        int ih = h - 2 * shrink;
        if (iw <= 0 || ih <= 0) {
            return null;
        }
        int darkCount = 0;
        for (int yy = iy0; yy < iy0 + ih; yy++) {
            for (int xx = ix0; xx < ix0 + iw; xx++) {
                if (dark[yy * width + xx]) {
                    darkCount++;
                }
            }
        }
        double density = darkCount / (double) (iw * ih);
        boolean marked = density > profile.getDensityThreshold();

        return new CheckboxMark(x, y, w, h, density, marked, pageIndex);
    }

    /**
     * 边界框四条边上深色像素的覆盖率（每条边允许 1 像素内偏）
     */
    private static double borderCoverage(boolean[] dark, int width, int x, int y, int w, int h) {
        int covered = 0;
        int total = 0;
        int right = x + w - 1;
        int bottom = y + h - 1;
        for (int xx = x; xx <= right; xx++) {
            total += 2;
            if (dark[y * width + xx] || (h > 2 && dark[(y + 1) * width + xx])) covered++;
            if (dark[bottom * width + xx] || (h > 2 && dark[(bottom - 1) * width + xx])) covered++;
        }
        for (int yy = y; yy <= bottom; yy++) {
            total += 2;
            if (dark[yy * width + x] || (w > 2 && dark[yy * width + x + 1])) covered++;
            if (dark[yy * width + right] || (w > 2 && dark[yy * width + right - 1])) covered++;
        }
        return total == 0 ? 0 : covered / (double) total;
    }

    /**
     * 去重：按面积降序，中心落在已保留框内或距离过近的丢弃
     */
    private List<CheckboxMark> deduplicate(List<CheckboxMark> candidates) {
        List<CheckboxMark> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingInt((CheckboxMark m) -> m.getWidth() * m.getHeight()).reversed());

        int dist = profile.getDedupDistancePx();
        List<CheckboxMark> kept = new ArrayList<>();
        for (CheckboxMark mark : sorted) {
            boolean duplicate = false;
            for (CheckboxMark k : kept) {
                boolean near = Math.abs(k.getCenterX() - mark.getCenterX()) <= dist
                        && Math.abs(k.getCenterY() - mark.getCenterY()) <= dist;
                boolean inside = mark.getCenterX() >= k.getX() && mark.getCenterX() <= k.getX() + k.getWidth()
                        && mark.getCenterY() >= k.getY() && mark.getCenterY() <= k.getY() + k.getHeight();
                if (near || inside) {
                    duplicate = true;
                    break;
                }
            }
            if (!duplicate) {
                kept.add(mark);
            }
        }

        kept.sort(Comparator.comparingInt(CheckboxMark::getY).thenComparingInt(CheckboxMark::getX));
        return kept;
    }

    private static int clamp(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
