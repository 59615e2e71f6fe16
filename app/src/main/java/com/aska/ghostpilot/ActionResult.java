package com.aska.ghostpilot;

/**
 * 单个动作的执行结果
 */
public final class ActionResult {

    public enum Outcome {
        SUCCEEDED,
        FAILED,
        CANCELLED,  // 任务被停止
        DENIED      // 用户拒绝了敏感操作
    }

    public final boolean success;
    public final boolean shouldFinish;
    public final String message;
    public final boolean requiresConfirmation;
    public final Outcome outcome;

    private ActionResult(boolean success, boolean shouldFinish, String message,
                         boolean requiresConfirmation, Outcome outcome) {
        this.success = success;
        this.shouldFinish = shouldFinish;
        this.message = message;
        this.requiresConfirmation = requiresConfirmation;
        this.outcome = outcome;
    }

    public static ActionResult ok() {
        return ok(null);
    }

    public static ActionResult ok(String message) {
        return new ActionResult(true, false, message, false, Outcome.SUCCEEDED);
    }

    /**
     * 任务完成
     */
    public static ActionResult finish(String message) {
        return new ActionResult(true, true, message, false, Outcome.SUCCEEDED);
    }

    /**
     * 本步失败，任务可以继续
     */
    public static ActionResult failed(String message) {
        return new ActionResult(false, false, message, false, Outcome.FAILED);
    }

    /**
     * 失败且任务应当结束
     */
    public static ActionResult fatal(String message) {
        return new ActionResult(false, true, message, false, Outcome.FAILED);
    }

    public static ActionResult cancelled(String message) {
        return new ActionResult(false, true, message, false, Outcome.CANCELLED);
    }

    public static ActionResult denied(String message) {
        return new ActionResult(false, true, message, true, Outcome.DENIED);
    }

    /**
     * 标记该动作经过了用户确认
     */
    ActionResult confirmed() {
        return new ActionResult(success, shouldFinish, message, true, outcome);
    }

    @Override
    public String toString() {
        return "ActionResult{" + outcome + ", shouldFinish=" + shouldFinish
            + (message != null ? ", message=" + message : "") + "}";
    }
}
