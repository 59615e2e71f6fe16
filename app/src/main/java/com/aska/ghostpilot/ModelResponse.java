package com.aska.ghostpilot;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 模型一次回复：思考过程 + 动作字符串
 */
public final class ModelResponse {

    private static final Pattern THINK = Pattern.compile("<think>(.*?)</think>", Pattern.DOTALL);
    private static final Pattern ANSWER = Pattern.compile("<(answer|action)>(.*?)</\\1>", Pattern.DOTALL);
    private static final Pattern CALL = Pattern.compile("(?<![\\w])(do|finish)\\(");

    public final String thinking;
    public final String action;
    public final String content;
    public final boolean success;
    public final String error;

    private ModelResponse(String thinking, String action, String content, boolean success, String error) {
        this.thinking = thinking;
        this.action = action;
        this.content = content;
        this.success = success;
        this.error = error;
    }

    public static ModelResponse failure(String error) {
        return new ModelResponse(null, null, null, false, error);
    }

    /**
     * 从回复正文中提取思考过程和动作
     *
     * 动作优先取 &lt;answer&gt; 或 &lt;action&gt; 标签；没有标签时取最后一个 do( 或 finish( 开始的文本。
     */
    public static ModelResponse fromContent(String content) {
        String text = content == null ? "" : content;

        String thinking = null;
        Matcher think = THINK.matcher(text);
        if (think.find()) {
            thinking = think.group(1).trim();
        }

        String action = null;
        Matcher answer = ANSWER.matcher(text);
        if (answer.find()) {
            action = answer.group(2).trim();
        } else {
            String rest = think.reset().replaceAll("");
            Matcher call = CALL.matcher(rest);
            int last = -1;
            while (call.find()) {
                last = call.start();
            }
            if (last >= 0) {
                action = rest.substring(last).trim();
                if (thinking == null && last > 0) {
                    thinking = rest.substring(0, last).trim();
                }
            }
        }

        return new ModelResponse(thinking, action, text, true, null);
    }

    @Override
    public String toString() {
        return success
            ? "ModelResponse{action=" + action + "}"
            : "ModelResponse{error=" + error + "}";
    }
}
