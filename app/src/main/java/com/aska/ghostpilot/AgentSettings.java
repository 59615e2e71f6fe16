package com.aska.ghostpilot;

import com.google.gson.JsonParseException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 运行配置
 *
 * 从 JSON 文件读取（字段名与文件中的键一致），缺失的键保留默认值。
 * 本类只读取配置，不负责编辑或保存。
 */
public class AgentSettings {

    private static final Logger log = LoggerFactory.getLogger(Config.LOG_TAG + ".Settings");

    // ========== 模型 ==========
    public String base_url = Config.DEFAULT_MODEL_BASE_URL;
    public String api_key = "";
    public String model_name = Config.DEFAULT_MODEL_NAME;

    // ========== Shower 虚拟屏 ==========
    public boolean shower_enabled = true;
    public String shower_host = Config.SHOWER_HOST;
    public int shower_port = Config.SHOWER_PORT;
    public Integer bitrate_kbps;  // 为空时由 Shower 自行决定

    // ========== 屏幕 ==========
    public int screen_width = Config.DEFAULT_SCREEN_WIDTH;
    public int screen_height = Config.DEFAULT_SCREEN_HEIGHT;
    public int dpi = Config.DEFAULT_DPI;
    public String coordinate_system = "auto";  // "auto", "normalized", "pixel"

    // ========== 任务 ==========
    public int max_steps = Config.MAX_STEPS;
    public String shell_prefix = "sh -c";  // 主机上可用 "adb shell"
    public String screenshot_path = "/data/local/tmp/ghostpilot_screen.png";
    public boolean debug = false;

    public AgentSettings() {}

    /**
     * 读取配置文件，文件不存在时返回默认配置
     *
     * @throws IOException 文件无法读取或内容不是合法 JSON
     */
    public static AgentSettings load(Path file) throws IOException {
        if (file == null || !Files.exists(file)) {
            log.info("Settings file not found, using defaults: {}", file);
            return new AgentSettings();
        }

        String json = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        AgentSettings settings;
        try {
            settings = JsonUtils.fromJson(json, AgentSettings.class);
        } catch (JsonParseException e) {
            throw new IOException("Malformed settings file: " + file, e);
        }
        if (settings == null) {
            return new AgentSettings();
        }
        settings.sanitize();
        log.info("Loaded settings from {}: model={}, shower={}:{} (enabled={})",
            file, settings.model_name, settings.shower_host, settings.shower_port, settings.shower_enabled);
        return settings;
    }

    /**
     * 修正明显不合法的值
     */
    void sanitize() {
        if (base_url == null || base_url.trim().isEmpty()) base_url = Config.DEFAULT_MODEL_BASE_URL;
        if (model_name == null || model_name.trim().isEmpty()) model_name = Config.DEFAULT_MODEL_NAME;
        if (api_key == null) api_key = "";
        if (shower_host == null || shower_host.trim().isEmpty()) shower_host = Config.SHOWER_HOST;
        if (shower_port <= 0 || shower_port > 65535) shower_port = Config.SHOWER_PORT;
        if (screen_width <= 0) screen_width = Config.DEFAULT_SCREEN_WIDTH;
        if (screen_height <= 0) screen_height = Config.DEFAULT_SCREEN_HEIGHT;
        if (dpi <= 0) dpi = Config.DEFAULT_DPI;
        if (max_steps <= 0) max_steps = Config.MAX_STEPS;
        if (bitrate_kbps != null && bitrate_kbps <= 0) bitrate_kbps = null;
        if (shell_prefix == null || shell_prefix.trim().isEmpty()) shell_prefix = "sh -c";
        if (screenshot_path == null || screenshot_path.trim().isEmpty()) {
            screenshot_path = "/data/local/tmp/ghostpilot_screen.png";
        }
    }

    public CoordinateSystem coordinateSystem() {
        return CoordinateSystem.fromString(coordinate_system);
    }

    public String showerUrl() {
        return "ws://" + shower_host + ":" + shower_port;
    }

    /**
     * 用于日志输出，隐藏 api_key
     */
    @Override
    public String toString() {
        String masked = api_key == null || api_key.isEmpty() ? "" : "****";
        return "AgentSettings{base_url=" + base_url + ", model_name=" + model_name
            + ", api_key=" + masked + ", shower=" + showerUrl() + " (enabled=" + shower_enabled + ")"
            + ", screen=" + screen_width + "x" + screen_height + "@" + dpi
            + ", coordinate_system=" + coordinate_system + ", max_steps=" + max_steps + "}";
    }
}
