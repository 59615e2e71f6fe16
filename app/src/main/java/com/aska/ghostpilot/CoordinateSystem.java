package com.aska.ghostpilot;

/**
 * 模型输出坐标的解释方式
 */
public enum CoordinateSystem {
    /** 按启发式规则判断是否为 0-1000 归一化坐标 */
    AUTO,
    /** 所有 0-1000 范围内的坐标都按归一化处理 */
    NORMALIZED,
    /** 坐标已是像素值，直接使用 */
    PIXEL;

    public static CoordinateSystem fromString(String value) {
        if (value == null) return AUTO;
        switch (value.trim().toLowerCase()) {
            case "normalized":
            case "relative":
                return NORMALIZED;
            case "pixel":
            case "absolute":
                return PIXEL;
            default:
                return AUTO;
        }
    }
}
