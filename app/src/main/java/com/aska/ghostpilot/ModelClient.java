package com.aska.ghostpilot;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okhttp3.logging.HttpLoggingInterceptor;
import okio.ByteString;

/**
 * 模型客户端（OpenAI 兼容的 chat/completions 接口）
 *
 * 每一步发送任务描述、当前截图和最近的动作，返回模型给出的下一步动作。
 */
public class ModelClient {

    private static final String TAG = Config.LOG_TAG + ".Model";
    private static final Logger log = LoggerFactory.getLogger(TAG);

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    // 请求中携带的历史动作数
    private static final int HISTORY_SIZE = 5;

    static final String SYSTEM_PROMPT = String.join("\n",
        "你是一个手机自动化助手。用户会给你一个任务和当前屏幕截图，你需要分析屏幕内容并决定下一步操作。",
        "坐标使用 0-1000 的相对坐标。",
        "可用的操作:",
        "- do(launch, app=\"应用名\") - 启动应用",
        "- do(tap, element=[x,y]) - 点击",
        "- do(double_tap, element=[x,y]) - 双击",
        "- do(long_press, element=[x,y]) - 长按",
        "- do(type, text=\"文本\") - 输入文本",
        "- do(swipe, start=[x1,y1], end=[x2,y2], duration=300) - 滑动",
        "- do(back) - 返回",
        "- do(home) - 回到桌面",
        "- do(wait, duration=\"2 seconds\") - 等待",
        "- do(take_over, message=\"原因\") - 需要用户接管（登录、验证码）",
        "- finish(\"结果\") - 任务完成",
        "涉及支付、删除等敏感操作时加上 sensitive=true, message=\"确认提示\"。",
        "请按以下格式回复:",
        "<think>你的思考过程</think>",
        "<answer>你要执行的操作</answer>");

    private final OkHttpClient client;
    private final String baseUrl;
    private final String apiKey;
    private final String model;

    public ModelClient(AgentSettings settings) {
        this(settings.base_url, settings.api_key, settings.model_name);
    }

    public ModelClient(String baseUrl, String apiKey, String model) {
        this.baseUrl = trimSlash(baseUrl == null || baseUrl.trim().isEmpty() ? Config.DEFAULT_MODEL_BASE_URL : baseUrl);
        this.apiKey = apiKey == null ? "" : apiKey;
        this.model = model == null || model.trim().isEmpty() ? Config.DEFAULT_MODEL_NAME : model;

        OkHttpClient.Builder builder = new OkHttpClient.Builder()
            .connectTimeout(Config.MODEL_TIMEOUT_SECONDS, TimeUnit.SECONDS)
            .readTimeout(Config.MODEL_TIMEOUT_SECONDS * 2, TimeUnit.SECONDS)
            .writeTimeout(Config.MODEL_TIMEOUT_SECONDS, TimeUnit.SECONDS);

        if (Config.DEBUG_MODE) {
            HttpLoggingInterceptor logging = new HttpLoggingInterceptor(log::debug);
            logging.setLevel(HttpLoggingInterceptor.Level.BASIC);
            builder.addInterceptor(logging);
        }

        this.client = builder.build();
    }

    /**
     * 请求下一步动作
     *
     * @param screenshotPng 当前截图（PNG）
     * @param stepNumber 当前步数，从 1 开始
     * @param previousActions 已执行的动作字符串
     */
    public ModelResponse sendStep(String task, byte[] screenshotPng, int stepNumber, List<String> previousActions) {
        if (apiKey.trim().isEmpty()) {
            log.error("No API key configured");
            return ModelResponse.failure("No API key configured");
        }
        if (screenshotPng == null || screenshotPng.length == 0) {
            return ModelResponse.failure("No screenshot");
        }

        String body;
        try {
            body = buildRequestBody(task, screenshotPng, stepNumber, previousActions).toString();
        } catch (JSONException e) {
            log.error("Failed to build request", e);
            return ModelResponse.failure("Failed to build request: " + e.getMessage());
        }

        Request request = new Request.Builder()
            .url(baseUrl + "/chat/completions")
            .addHeader("Authorization", "Bearer " + apiKey)
            .post(RequestBody.create(body, JSON))
            .build();

        log.info("Step {}: sending request to {}/chat/completions", stepNumber, baseUrl);

        try (Response response = client.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody != null ? responseBody.string() : null;

            if (Config.DEBUG_MODE) {
                log.debug("Response {}: {}", response.code(), text == null ? null
                    : text.substring(0, Math.min(500, text.length())));
            }

            if (!response.isSuccessful()) {
                log.warn("Model request failed: {}", response.code());
                return ModelResponse.failure("API request failed: " + response.code() + " - " + text);
            }
            return parseResponse(text);

        } catch (IOException e) {
            log.error("Model request failed", e);
            return ModelResponse.failure("API request error: " + e.getMessage());
        }
    }

    JSONObject buildRequestBody(String task, byte[] screenshotPng, int stepNumber, List<String> previousActions) {
        JSONArray messages = new JSONArray();

        messages.put(new JSONObject()
            .put("role", "system")
            .put("content", SYSTEM_PROMPT));

        StringBuilder prompt = new StringBuilder();
        prompt.append("任务: ").append(task).append('\n');
        prompt.append("当前步骤: ").append(stepNumber).append('\n');
        if (previousActions != null && !previousActions.isEmpty()) {
            List<String> recent = previousActions.subList(
                Math.max(0, previousActions.size() - HISTORY_SIZE), previousActions.size());
            prompt.append("之前的操作: ").append(String.join(", ", recent)).append('\n');
        }
        prompt.append("\n请分析当前屏幕并决定下一步操作。");

        JSONArray userContent = new JSONArray()
            .put(new JSONObject()
                .put("type", "text")
                .put("text", prompt.toString()))
            .put(new JSONObject()
                .put("type", "image_url")
                .put("image_url", new JSONObject()
                    .put("url", "data:image/png;base64," + ByteString.of(screenshotPng).base64())));

        messages.put(new JSONObject()
            .put("role", "user")
            .put("content", userContent));

        return new JSONObject()
            .put("model", model)
            .put("messages", messages)
            .put("max_tokens", Config.MODEL_MAX_TOKENS);
    }

    static ModelResponse parseResponse(String body) {
        if (body == null || body.trim().isEmpty()) {
            return ModelResponse.failure("Empty response");
        }
        try {
            JSONObject json = new JSONObject(body);
            JSONArray choices = json.optJSONArray("choices");
            JSONObject first = choices != null ? choices.optJSONObject(0) : null;
            JSONObject message = first != null ? first.optJSONObject("message") : null;
            if (message == null) {
                return ModelResponse.failure("No choices in response");
            }
            return ModelResponse.fromContent(message.optString("content", ""));
        } catch (JSONException e) {
            log.error("Failed to parse response", e);
            return ModelResponse.failure("Failed to parse response: " + e.getMessage());
        }
    }

    public String getModel() {
        return model;
    }

    /**
     * 释放资源
     */
    public void release() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }

    private static String trimSlash(String url) {
        String u = url.trim();
        while (u.endsWith("/")) {
            u = u.substring(0, u.length() - 1);
        }
        return u;
    }
}
