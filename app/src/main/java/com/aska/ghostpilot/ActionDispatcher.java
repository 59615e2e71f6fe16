package com.aska.ghostpilot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Point;
import java.util.function.BooleanSupplier;

/**
 * 动作执行器
 *
 * 职责：
 * 1. 把 {@link Action} 路由到 Shower 虚拟屏或本地 shell
 * 2. 坐标转换（归一化 → 像素）
 * 3. 敏感操作确认、用户接管、可取消的等待
 * 4. 组合动作：双击 = 两次点击，长按 = 原地滑动
 *
 * 任何异常都被转换为失败结果，调用方总能拿到一个完整的 {@link ActionResult}。
 */
public class ActionDispatcher {

    private static final String TAG = Config.LOG_TAG + ".Dispatcher";
    private static final Logger log = LoggerFactory.getLogger(TAG);

    private static final String DEFAULT_TAKEOVER_PROMPT = "Please complete the operation, then continue";

    public enum DispatchState {
        IDLE,
        EXECUTING,
        SUCCEEDED,
        FAILED,
        AWAITING_CONFIRMATION,
        AWAITING_TAKEOVER
    }

    /**
     * 敏感操作确认，返回 true 表示用户同意
     */
    public interface ConfirmationCallback {
        boolean confirm(String message);
    }

    /**
     * 通知用户接管设备
     */
    public interface TakeoverCallback {
        void onTakeover(String message);
    }

    public interface StateListener {
        void onStateChanged(DispatchState state);
    }

    private final ShellExecutor shell;
    private final RemoteControlChannel channel;
    private final BooleanSupplier cancelled;
    private final ConfirmationCallback confirmation;
    private final TakeoverCallback takeover;
    private final StateListener stateListener;

    private final long waitTickMs;
    private final long takeoverTickMs;
    private final long takeoverCeilingMs;
    private final long typePreDelayMs;
    private final long typePostDelayMs;
    private final long doubleTapGapMs;
    private final int longPressDurationMs;
    private final boolean unknownActionsFatal;

    private volatile DispatchState state = DispatchState.IDLE;

    private ActionDispatcher(Builder builder) {
        this.shell = builder.shell;
        this.channel = builder.channel;
        this.cancelled = builder.cancelled;
        this.confirmation = builder.confirmation;
        this.takeover = builder.takeover;
        this.stateListener = builder.stateListener;
        this.waitTickMs = builder.waitTickMs;
        this.takeoverTickMs = builder.takeoverTickMs;
        this.takeoverCeilingMs = builder.takeoverCeilingMs;
        this.typePreDelayMs = builder.typePreDelayMs;
        this.typePostDelayMs = builder.typePostDelayMs;
        this.doubleTapGapMs = builder.doubleTapGapMs;
        this.longPressDurationMs = builder.longPressDurationMs;
        this.unknownActionsFatal = builder.unknownActionsFatal;
    }

    public static Builder builder(ShellExecutor shell) {
        return new Builder(shell);
    }

    public DispatchState getState() {
        return state;
    }

    /**
     * 执行一个动作
     */
    public ActionResult execute(Action action, DisplayContext context) {
        if (action == null) {
            return ActionResult.failed("No action");
        }
        DisplayContext ctx = context != null
            ? context
            : DisplayContext.local(Config.DEFAULT_SCREEN_WIDTH, Config.DEFAULT_SCREEN_HEIGHT, CoordinateSystem.AUTO);

        log.info("Executing {} on {}", action.toCommandString(), ctx);
        transition(DispatchState.EXECUTING);

        ActionResult result;
        try {
            result = dispatch(action, ctx);
        } catch (RuntimeException e) {
            log.error("Action failed: {}", action.toCommandString(), e);
            result = ActionResult.failed("Action failed: " + e.getMessage());
        }

        transition(result.success ? DispatchState.SUCCEEDED : DispatchState.FAILED);
        if (!result.success) {
            log.warn("Action {} -> {}", action.type, result);
        }
        transition(DispatchState.IDLE);
        return result;
    }

    private ActionResult dispatch(Action action, DisplayContext ctx) {
        if (action instanceof Action.Finish) {
            return ActionResult.finish(((Action.Finish) action).result);
        }
        if (action instanceof Action.Unknown) {
            String message = "Unknown action: " + ((Action.Unknown) action).name;
            return unknownActionsFatal ? ActionResult.fatal(message) : ActionResult.failed(message);
        }

        // ========== 敏感操作确认 ==========
        boolean confirmed = false;
        if (action.requiresConfirmation()) {
            transition(DispatchState.AWAITING_CONFIRMATION);
            if (confirmation == null) {
                log.warn("No confirmation handler, declining sensitive action: {}", action.message);
            }
            boolean accepted = confirmation != null && confirmation.confirm(action.message);
            if (!accepted) {
                return ActionResult.denied("User cancelled sensitive operation");
            }
            transition(DispatchState.EXECUTING);
            confirmed = true;
        }

        ActionResult result = perform(action, ctx);
        return confirmed ? result.confirmed() : result;
    }

    private ActionResult perform(Action action, DisplayContext ctx) {
        boolean remote = ctx.isRemoteAvailable() && channel != null && channel.isConnected();
        CoordinateNormalizer normalizer = new CoordinateNormalizer(ctx.getScreenWidth(), ctx.getScreenHeight());
        CoordinateSystem system = ctx.getCoordinateSystem();

        switch (action.type) {
            case LAUNCH:
                return launch(((Action.Launch) action).app, remote);

            case TAP: {
                Action.Tap tap = (Action.Tap) action;
                if (!validPoint(tap.x, tap.y)) return ActionResult.failed("Invalid tap coordinates");
                Point p = normalizer.resolve(tap.x, tap.y, system);
                return check(tapAt(p, remote), "Tap failed");
            }

            case DOUBLE_TAP: {
                Action.DoubleTap tap = (Action.DoubleTap) action;
                if (!validPoint(tap.x, tap.y)) return ActionResult.failed("Invalid tap coordinates");
                Point p = normalizer.resolve(tap.x, tap.y, system);
                if (!tapAt(p, remote)) return ActionResult.failed("Double tap failed");
                if (!pause(doubleTapGapMs)) return ActionResult.cancelled("Interrupted");
                return check(tapAt(p, remote), "Double tap failed");
            }

            case LONG_PRESS: {
                Action.LongPress press = (Action.LongPress) action;
                if (!validPoint(press.x, press.y)) return ActionResult.failed("Invalid long press coordinates");
                Point p = normalizer.resolve(press.x, press.y, system);
                return check(swipe(p, p, longPressDurationMs, remote), "Long press failed");
            }

            case SWIPE: {
                Action.Swipe swipe = (Action.Swipe) action;
                if (!validPoint(swipe.x1, swipe.y1) || !validPoint(swipe.x2, swipe.y2)) {
                    return ActionResult.failed("Missing swipe coordinates");
                }
                Point from = normalizer.resolve(swipe.x1, swipe.y1, system);
                Point to = normalizer.resolve(swipe.x2, swipe.y2, system);
                return check(swipe(from, to, swipe.durationMs, remote), "Swipe failed");
            }

            case TYPE:
                return type(((Action.Type) action).text);

            case BACK:
                return check(key(ShowerProtocol.KEYCODE_BACK, remote), "Back failed");

            case HOME:
                return check(key(ShowerProtocol.KEYCODE_HOME, remote), "Home failed");

            case WAIT:
                return sleepCancellable(((Action.Wait) action).durationMs, waitTickMs);

            case TAKE_OVER:
                return takeOver(((Action.TakeOver) action).prompt);

            case NOTE:
            case CALL_API:
                return ActionResult.ok();

            case INTERACT:
                return ActionResult.ok("User interaction required");

            default:
                return ActionResult.failed("Unsupported action: " + action.type);
        }
    }

    // ========== 基本操作 ==========

    private boolean tapAt(Point p, boolean remote) {
        return remote ? channel.tap(p.x, p.y) : shell.tap(p.x, p.y);
    }

    private boolean swipe(Point from, Point to, int durationMs, boolean remote) {
        return remote
            ? channel.swipe(from.x, from.y, to.x, to.y, durationMs)
            : shell.swipe(from.x, from.y, to.x, to.y, durationMs);
    }

    private boolean key(int keyCode, boolean remote) {
        return remote ? channel.key(keyCode) : shell.keyEvent(keyCode);
    }

    private ActionResult launch(String app, boolean remote) {
        if (app == null || app.trim().isEmpty()) {
            return ActionResult.failed("No app name specified");
        }
        String packageName = AppPackages.resolve(app);
        if (packageName == null) {
            return ActionResult.failed("App not found: " + app);
        }
        boolean ok = remote ? channel.launchApp(packageName) : shell.launchApp(packageName);
        return check(ok, "Failed to launch " + packageName);
    }

    /**
     * 文本总是通过本地输入法注入，前后各等待一段时间让焦点稳定
     */
    private ActionResult type(String text) {
        if (text == null || text.isEmpty()) {
            return ActionResult.ok();
        }
        if (!pause(typePreDelayMs)) return ActionResult.cancelled("Interrupted");
        boolean ok = shell.inputText(text);
        if (!pause(typePostDelayMs)) return ActionResult.cancelled("Interrupted");
        return check(ok, "Failed to type text");
    }

    private ActionResult takeOver(String prompt) {
        if (isCancelled()) {
            return ActionResult.cancelled("Task stopped");
        }
        transition(DispatchState.AWAITING_TAKEOVER);
        String message = prompt == null || prompt.trim().isEmpty() ? DEFAULT_TAKEOVER_PROMPT : prompt;
        if (takeover != null) {
            takeover.onTakeover(message);
        } else {
            log.warn("No takeover handler: {}", message);
        }
        return sleepCancellable(takeoverCeilingMs, takeoverTickMs);
    }

    /**
     * 分段睡眠，每段检查一次取消标志
     */
    private ActionResult sleepCancellable(long totalMs, long tickMs) {
        long tick = tickMs > 0 ? tickMs : Config.WAIT_TICK_MS;
        long elapsed = 0;
        while (elapsed < totalMs) {
            if (isCancelled()) {
                log.info("Cancelled after {}ms of {}ms", elapsed, totalMs);
                return ActionResult.cancelled("Task stopped");
            }
            long step = Math.min(tick, totalMs - elapsed);
            if (!pause(step)) {
                return ActionResult.cancelled("Interrupted");
            }
            elapsed += step;
        }
        return ActionResult.ok();
    }

    private boolean pause(long ms) {
        if (ms <= 0) return true;
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private boolean isCancelled() {
        return cancelled != null && cancelled.getAsBoolean();
    }

    private static boolean validPoint(int x, int y) {
        return x >= 0 && y >= 0;
    }

    private static ActionResult check(boolean ok, String failure) {
        return ok ? ActionResult.ok() : ActionResult.failed(failure);
    }

    private void transition(DispatchState next) {
        state = next;
        if (stateListener != null) {
            stateListener.onStateChanged(next);
        }
    }

    // ========== Builder ==========

    public static class Builder {
        private final ShellExecutor shell;
        private RemoteControlChannel channel;
        private BooleanSupplier cancelled;
        private ConfirmationCallback confirmation;
        private TakeoverCallback takeover;
        private StateListener stateListener;

        private long waitTickMs = Config.WAIT_TICK_MS;
        private long takeoverTickMs = Config.TAKEOVER_TICK_MS;
        private long takeoverCeilingMs = Config.TAKEOVER_CEILING_MS;
        private long typePreDelayMs = Config.TYPE_PRE_DELAY_MS;
        private long typePostDelayMs = Config.TYPE_POST_DELAY_MS;
        private long doubleTapGapMs = Config.DOUBLE_TAP_GAP_MS;
        private int longPressDurationMs = Config.LONG_PRESS_DURATION_MS;
        private boolean unknownActionsFatal = false;

        private Builder(ShellExecutor shell) {
            if (shell == null) {
                throw new IllegalArgumentException("shell executor is required");
            }
            this.shell = shell;
        }

        public Builder remoteChannel(RemoteControlChannel channel) {
            this.channel = channel;
            return this;
        }

        public Builder cancellation(BooleanSupplier cancelled) {
            this.cancelled = cancelled;
            return this;
        }

        public Builder confirmation(ConfirmationCallback confirmation) {
            this.confirmation = confirmation;
            return this;
        }

        public Builder takeover(TakeoverCallback takeover) {
            this.takeover = takeover;
            return this;
        }

        public Builder stateListener(StateListener stateListener) {
            this.stateListener = stateListener;
            return this;
        }

        public Builder waitTick(long ms) {
            this.waitTickMs = ms;
            return this;
        }

        public Builder takeoverTiming(long tickMs, long ceilingMs) {
            this.takeoverTickMs = tickMs;
            this.takeoverCeilingMs = ceilingMs;
            return this;
        }

        public Builder typeDelays(long preMs, long postMs) {
            this.typePreDelayMs = preMs;
            this.typePostDelayMs = postMs;
            return this;
        }

        public Builder doubleTapGap(long ms) {
            this.doubleTapGapMs = ms;
            return this;
        }

        public Builder longPressDuration(int ms) {
            this.longPressDurationMs = ms;
            return this;
        }

        public Builder unknownActionsFatal(boolean fatal) {
            this.unknownActionsFatal = fatal;
            return this;
        }

        public ActionDispatcher build() {
            return new ActionDispatcher(this);
        }
    }
}
