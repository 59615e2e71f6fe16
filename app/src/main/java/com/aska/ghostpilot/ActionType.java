package com.aska.ghostpilot;

/**
 * 动作类型及其同义词
 *
 * 第一个名称是规范名，用于重新生成动作字符串。
 */
public enum ActionType {
    LAUNCH("launch", "open_app", "open", "launch_app"),
    TAP("tap", "click"),
    TYPE("type", "input", "type_name"),
    SWIPE("swipe", "scroll"),
    BACK("back"),
    HOME("home"),
    DOUBLE_TAP("double_tap", "doubletap"),
    LONG_PRESS("long_press", "longpress"),
    WAIT("wait"),
    TAKE_OVER("take_over", "takeover"),
    NOTE("note"),
    CALL_API("call_api", "callapi"),
    INTERACT("interact"),
    FINISH("finish", "done"),
    UNKNOWN("unknown");

    private final String[] names;

    ActionType(String... names) {
        this.names = names;
    }

    /**
     * 规范名
     */
    public String canonicalName() {
        return names[0];
    }

    /**
     * 不区分大小写匹配动作名，空格和连字符视同下划线（"Double Tap" → DOUBLE_TAP）
     */
    public static ActionType fromString(String name) {
        if (name == null) return UNKNOWN;
        String key = name.trim();
        if (key.length() >= 2 && (key.startsWith("\"") && key.endsWith("\"")
                || key.startsWith("'") && key.endsWith("'"))) {
            key = key.substring(1, key.length() - 1).trim();
        }
        key = key.toLowerCase().replace(' ', '_').replace('-', '_');

        for (ActionType type : values()) {
            if (type == UNKNOWN) continue;
            for (String candidate : type.names) {
                if (candidate.equals(key)) {
                    return type;
                }
            }
        }
        return UNKNOWN;
    }
}
