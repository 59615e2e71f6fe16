package com.aska.ghostpilot;

/**
 * 解析结果：要么是一个完整的动作，要么是一条失败原因
 */
public final class ParseResult {

    private final Action action;
    private final String error;
    private final String raw;

    private ParseResult(Action action, String error, String raw) {
        this.action = action;
        this.error = error;
        this.raw = raw;
    }

    public static ParseResult success(Action action, String raw) {
        return new ParseResult(action, null, raw);
    }

    public static ParseResult failure(String error, String raw) {
        return new ParseResult(null, error, raw);
    }

    public boolean isSuccess() {
        return action != null;
    }

    /**
     * 解析成功时的动作，失败时为 null
     */
    public Action getAction() {
        return action;
    }

    /**
     * 失败原因，成功时为 null
     */
    public String getError() {
        return error;
    }

    public String getRaw() {
        return raw;
    }

    @Override
    public String toString() {
        return isSuccess()
            ? "ParseResult{action=" + action.toCommandString() + "}"
            : "ParseResult{error=" + error + ", raw=" + raw + "}";
    }
}
