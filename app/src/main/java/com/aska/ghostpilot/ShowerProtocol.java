package com.aska.ghostpilot;

/**
 * Shower 文本协议
 *
 * 每条命令是一行不含换行的文本，参数以空格分隔。
 * 服务端的回复同样是单行文本，二进制帧是 H.264 视频流。
 */
public final class ShowerProtocol {

    // ========== 上行命令 ==========
    public static final String CREATE_DISPLAY = "CREATE_DISPLAY";
    public static final String DESTROY_DISPLAY = "DESTROY_DISPLAY";
    public static final String SCREENSHOT = "SCREENSHOT";
    public static final String TAP = "TAP";
    public static final String SWIPE = "SWIPE";
    public static final String KEY = "KEY";
    public static final String LAUNCH_APP = "LAUNCH_APP";
    public static final String TOUCH_DOWN = "TOUCH_DOWN";
    public static final String TOUCH_MOVE = "TOUCH_MOVE";
    public static final String TOUCH_UP = "TOUCH_UP";

    // ========== 下行消息前缀 ==========
    public static final String DISPLAY_CREATED = "DISPLAY_CREATED ";
    public static final String DISPLAY_SIZE = "DISPLAY_SIZE ";
    public static final String SCREENSHOT_DATA = "SCREENSHOT_DATA ";
    public static final String SCREENSHOT_ERROR = "SCREENSHOT_ERROR";

    // ========== 按键码 ==========
    public static final int KEYCODE_HOME = 3;
    public static final int KEYCODE_BACK = 4;

    // 正常关闭
    public static final int CLOSE_NORMAL = 1000;

    private ShowerProtocol() {}

    public static String createDisplay(int width, int height, int dpi, Integer bitrateKbps) {
        StringBuilder sb = new StringBuilder(CREATE_DISPLAY)
            .append(' ').append(width)
            .append(' ').append(height)
            .append(' ').append(dpi);
        if (bitrateKbps != null) {
            sb.append(' ').append(bitrateKbps);
        }
        return sb.toString();
    }

    public static String tap(int x, int y) {
        return TAP + " " + x + " " + y;
    }

    public static String swipe(int x1, int y1, int x2, int y2, long durationMs) {
        return SWIPE + " " + x1 + " " + y1 + " " + x2 + " " + y2 + " " + durationMs;
    }

    public static String key(int keyCode) {
        return KEY + " " + keyCode;
    }

    public static String launchApp(String packageName) {
        return LAUNCH_APP + " " + packageName;
    }

    public static String touch(String phase, int x, int y) {
        return phase + " " + x + " " + y;
    }
}
