package com.aska.ghostpilot;

import java.util.Arrays;
import java.util.Objects;

/**
 * 解析后的动作
 *
 * 每种动作是一个不可变的嵌套类，字段全部为 final。
 * sensitive 为 true 且 message 非空的动作在执行前需要用户确认。
 */
public abstract class Action {

    public final ActionType type;
    public final boolean sensitive;
    public final String message;  // 确认提示，可为空

    protected Action(ActionType type, boolean sensitive, String message) {
        this.type = type;
        this.sensitive = sensitive;
        this.message = message;
    }

    /**
     * 是否需要用户确认
     */
    public boolean requiresConfirmation() {
        return sensitive && message != null && !message.trim().isEmpty();
    }

    /**
     * 生成规范格式的动作字符串，可被 {@link ActionParser} 重新解析
     */
    public abstract String toCommandString();

    /**
     * 参与相等比较的字段
     */
    protected abstract Object[] payload();

    /**
     * 规范格式的 do(...) 字符串，附带 sensitive/message 参数
     */
    protected String doCall(String... params) {
        StringBuilder sb = new StringBuilder("do(").append(type.canonicalName());
        for (String param : params) {
            sb.append(", ").append(param);
        }
        if (sensitive) {
            sb.append(", sensitive=true");
            if (message != null) {
                sb.append(", message=").append(quote(message));
            }
        }
        return sb.append(')').toString();
    }

    static String quote(String value) {
        String text = value == null ? "" : value;
        return text.indexOf('"') >= 0 && text.indexOf('\'') < 0
            ? "'" + text + "'"
            : "\"" + text + "\"";
    }

    static String point(int x, int y) {
        return "[" + x + "," + y + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Action other = (Action) o;
        return sensitive == other.sensitive
            && Objects.equals(message, other.message)
            && Arrays.equals(payload(), other.payload());
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(type, sensitive, message) + Arrays.hashCode(payload());
    }

    @Override
    public String toString() {
        return toCommandString();
    }

    // ========== 设备动作 ==========

    public static final class Launch extends Action {
        public final String app;

        public Launch(String app) {
            this(app, false, null);
        }

        public Launch(String app, boolean sensitive, String message) {
            super(ActionType.LAUNCH, sensitive, message);
            this.app = app;
        }

        @Override
        public String toCommandString() {
            return doCall("app=" + quote(app));
        }

        @Override
        protected Object[] payload() {
            return new Object[]{app};
        }
    }

    public static final class Tap extends Action {
        public final int x;
        public final int y;

        public Tap(int x, int y) {
            this(x, y, false, null);
        }

        public Tap(int x, int y, boolean sensitive, String message) {
            super(ActionType.TAP, sensitive, message);
            this.x = x;
            this.y = y;
        }

        @Override
        public String toCommandString() {
            return doCall("element=" + point(x, y));
        }

        @Override
        protected Object[] payload() {
            return new Object[]{x, y};
        }
    }

    public static final class DoubleTap extends Action {
        public final int x;
        public final int y;

        public DoubleTap(int x, int y) {
            this(x, y, false, null);
        }

        public DoubleTap(int x, int y, boolean sensitive, String message) {
            super(ActionType.DOUBLE_TAP, sensitive, message);
            this.x = x;
            this.y = y;
        }

        @Override
        public String toCommandString() {
            return doCall("element=" + point(x, y));
        }

        @Override
        protected Object[] payload() {
            return new Object[]{x, y};
        }
    }

    public static final class LongPress extends Action {
        public final int x;
        public final int y;

        public LongPress(int x, int y) {
            this(x, y, false, null);
        }

        public LongPress(int x, int y, boolean sensitive, String message) {
            super(ActionType.LONG_PRESS, sensitive, message);
            this.x = x;
            this.y = y;
        }

        @Override
        public String toCommandString() {
            return doCall("element=" + point(x, y));
        }

        @Override
        protected Object[] payload() {
            return new Object[]{x, y};
        }
    }

    public static final class Type extends Action {
        public final String text;

        public Type(String text) {
            this(text, false, null);
        }

        public Type(String text, boolean sensitive, String message) {
            super(ActionType.TYPE, sensitive, message);
            this.text = text == null ? "" : text;
        }

        @Override
        public String toCommandString() {
            return doCall("text=" + quote(text));
        }

        @Override
        protected Object[] payload() {
            return new Object[]{text};
        }
    }

    public static final class Swipe extends Action {
        public final int x1;
        public final int y1;
        public final int x2;
        public final int y2;
        public final int durationMs;

        public Swipe(int x1, int y1, int x2, int y2) {
            this(x1, y1, x2, y2, Config.DEFAULT_SWIPE_DURATION_MS);
        }

        public Swipe(int x1, int y1, int x2, int y2, int durationMs) {
            this(x1, y1, x2, y2, durationMs, false, null);
        }

        public Swipe(int x1, int y1, int x2, int y2, int durationMs, boolean sensitive, String message) {
            super(ActionType.SWIPE, sensitive, message);
            this.x1 = x1;
            this.y1 = y1;
            this.x2 = x2;
            this.y2 = y2;
            this.durationMs = durationMs > 0 ? durationMs : Config.DEFAULT_SWIPE_DURATION_MS;
        }

        @Override
        public String toCommandString() {
            return doCall("start=" + point(x1, y1), "end=" + point(x2, y2), "duration=" + durationMs);
        }

        @Override
        protected Object[] payload() {
            return new Object[]{x1, y1, x2, y2, durationMs};
        }
    }

    public static final class Back extends Action {
        public Back() {
            this(false, null);
        }

        public Back(boolean sensitive, String message) {
            super(ActionType.BACK, sensitive, message);
        }

        @Override
        public String toCommandString() {
            return doCall();
        }

        @Override
        protected Object[] payload() {
            return new Object[0];
        }
    }

    public static final class Home extends Action {
        public Home() {
            this(false, null);
        }

        public Home(boolean sensitive, String message) {
            super(ActionType.HOME, sensitive, message);
        }

        @Override
        public String toCommandString() {
            return doCall();
        }

        @Override
        protected Object[] payload() {
            return new Object[0];
        }
    }

    public static final class Wait extends Action {
        public final long durationMs;

        public Wait(long durationMs) {
            super(ActionType.WAIT, false, null);
            this.durationMs = Math.max(0L, durationMs);
        }

        @Override
        public String toCommandString() {
            String duration = durationMs % 1000 == 0
                ? (durationMs / 1000) + " seconds"
                : durationMs + " ms";
            return doCall("duration=" + quote(duration));
        }

        @Override
        protected Object[] payload() {
            return new Object[]{durationMs};
        }
    }

    // ========== 流程控制 ==========

    /**
     * 把控制权交给用户（登录、验证码等场景）
     */
    public static final class TakeOver extends Action {
        public final String prompt;

        public TakeOver(String prompt) {
            super(ActionType.TAKE_OVER, false, null);
            this.prompt = prompt == null ? "" : prompt;
        }

        @Override
        public String toCommandString() {
            return doCall("message=" + quote(prompt));
        }

        @Override
        protected Object[] payload() {
            return new Object[]{prompt};
        }
    }

    public static final class Finish extends Action {
        public final String result;

        public Finish(String result) {
            super(ActionType.FINISH, false, null);
            this.result = result == null ? "" : result;
        }

        @Override
        public String toCommandString() {
            return "finish(" + quote(result) + ")";
        }

        @Override
        protected Object[] payload() {
            return new Object[]{result};
        }
    }

    // ========== 无操作动作（兼容模型词汇） ==========

    public static final class Note extends Action {
        public final String text;

        public Note(String text) {
            super(ActionType.NOTE, false, null);
            this.text = text == null ? "" : text;
        }

        @Override
        public String toCommandString() {
            return doCall("message=" + quote(text));
        }

        @Override
        protected Object[] payload() {
            return new Object[]{text};
        }
    }

    public static final class CallApi extends Action {
        public final String body;

        public CallApi(String body) {
            super(ActionType.CALL_API, false, null);
            this.body = body == null ? "" : body;
        }

        @Override
        public String toCommandString() {
            return doCall("message=" + quote(body));
        }

        @Override
        protected Object[] payload() {
            return new Object[]{body};
        }
    }

    public static final class Interact extends Action {
        public final String text;

        public Interact(String text) {
            super(ActionType.INTERACT, false, null);
            this.text = text == null ? "" : text;
        }

        @Override
        public String toCommandString() {
            return doCall("message=" + quote(text));
        }

        @Override
        protected Object[] payload() {
            return new Object[]{text};
        }
    }

    /**
     * 无法识别的动作名，保留原始文本，由执行器决定如何处理
     */
    public static final class Unknown extends Action {
        public final String name;
        public final String raw;

        public Unknown(String name, String raw) {
            super(ActionType.UNKNOWN, false, null);
            this.name = name == null ? "" : name;
            this.raw = raw == null ? "" : raw;
        }

        @Override
        public String toCommandString() {
            return raw;
        }

        @Override
        protected Object[] payload() {
            return new Object[]{name, raw};
        }
    }
}
