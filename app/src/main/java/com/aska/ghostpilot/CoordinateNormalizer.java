package com.aska.ghostpilot;

import java.awt.Point;

/**
 * 坐标转换器
 *
 * 职责：
 * 1. 判断模型给出的坐标是否为 0-1000 归一化坐标
 * 2. 归一化坐标 → 屏幕像素坐标
 *
 * 每个实例绑定一组屏幕尺寸，尺寸变化时创建新实例。
 */
public class CoordinateNormalizer {

    // 大于该尺寸的屏幕，0-1000 范围内的坐标一律视为归一化
    private static final int LARGE_SCREEN_THRESHOLD = 1200;

    // 小屏幕上，坐标落在屏幕 90% 以内才视为归一化
    private static final double SMALL_SCREEN_RATIO = 0.9;

    private final int screenWidth;
    private final int screenHeight;

    public CoordinateNormalizer(int screenWidth, int screenHeight) {
        this.screenWidth = screenWidth > 0 ? screenWidth : Config.DEFAULT_SCREEN_WIDTH;
        this.screenHeight = screenHeight > 0 ? screenHeight : Config.DEFAULT_SCREEN_HEIGHT;
    }

    public int getScreenWidth() {
        return screenWidth;
    }

    public int getScreenHeight() {
        return screenHeight;
    }

    /**
     * 启发式判断坐标是否为归一化坐标
     *
     * 任一分量超出 0-1000 时一定是像素坐标；屏幕宽或高超过 1200 时，
     * 0-1000 范围内的坐标视为归一化；小屏幕上只有 x 或 y 落在屏幕 90% 以内才视为归一化。
     */
    public boolean isNormalized(int x, int y) {
        if (!inNormalizedRange(x, y)) {
            return false;
        }
        if (screenWidth > LARGE_SCREEN_THRESHOLD || screenHeight > LARGE_SCREEN_THRESHOLD) {
            return true;
        }
        return x < (int) (screenWidth * SMALL_SCREEN_RATIO) || y < (int) (screenHeight * SMALL_SCREEN_RATIO);
    }

    /**
     * 归一化坐标 → 像素坐标，结果限制在屏幕范围内
     */
    public Point toPixel(int x, int y) {
        int px = (int) (x * screenWidth / (double) Config.NORMALIZED_MAX);
        int py = (int) (y * screenHeight / (double) Config.NORMALIZED_MAX);
        return new Point(clamp(px, screenWidth), clamp(py, screenHeight));
    }

    /**
     * 按指定坐标系把模型坐标解析为像素坐标
     */
    public Point resolve(int x, int y, CoordinateSystem system) {
        switch (system == null ? CoordinateSystem.AUTO : system) {
            case PIXEL:
                return new Point(x, y);
            case NORMALIZED:
                return inNormalizedRange(x, y) ? toPixel(x, y) : new Point(x, y);
            case AUTO:
            default:
                return isNormalized(x, y) ? toPixel(x, y) : new Point(x, y);
        }
    }

    private static boolean inNormalizedRange(int x, int y) {
        return x >= 0 && x <= Config.NORMALIZED_MAX && y >= 0 && y <= Config.NORMALIZED_MAX;
    }

    private static int clamp(int value, int max) {
        return Math.max(0, Math.min(value, max));
    }
}
