package com.aska.ghostpilot;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * JSON 工具类
 * 使用 Gson 进行配置和任务记录的序列化
 */
public class JsonUtils {

    private static final Gson gson = new GsonBuilder()
        .serializeNulls()
        .create();

    private static final Gson prettyGson = new GsonBuilder()
        .serializeNulls()
        .setPrettyPrinting()
        .create();

    /**
     * 将对象转换为 JSON 字符串
     */
    public static String toJson(Object obj) {
        return gson.toJson(obj);
    }

    /**
     * 格式化输出，用于任务报告
     */
    public static String toPrettyJson(Object obj) {
        return prettyGson.toJson(obj);
    }

    /**
     * 将 JSON 字符串转换为对象
     *
     * @throws JsonParseException 格式错误
     */
    public static <T> T fromJson(String json, Class<T> clazz) {
        return gson.fromJson(json, clazz);
    }

    private JsonUtils() {}
}
