package com.aska.ghostpilot;

/**
 * GhostPilot 配置常量
 *
 * 包含 Shower 连接配置、超时、动作节奏、解码缓冲上限等常量。
 * 可在运行时修改的部分见 {@link AgentSettings}。
 */
public class Config {

    // ========== Shower 服务配置 ==========

    /**
     * Shower 服务默认地址（本机）
     */
    public static final String SHOWER_HOST = "127.0.0.1";

    /**
     * Shower 服务默认端口
     */
    public static final int SHOWER_PORT = 8986;

    /**
     * 连接等待上限（毫秒）
     */
    public static final long CONNECT_TIMEOUT_MS = 5 * 1000L;

    /**
     * WebSocket 读写超时（毫秒）
     */
    public static final long SOCKET_IO_TIMEOUT_MS = 5 * 1000L;

    /**
     * 远程截图等待上限（毫秒）
     */
    public static final long SCREENSHOT_TIMEOUT_MS = 3 * 1000L;

    /**
     * 远程截图失败后的重试间隔（毫秒）
     */
    public static final long SCREENSHOT_RETRY_DELAY_MS = 500L;

    /**
     * 远程截图尝试次数
     */
    public static final int SCREENSHOT_ATTEMPTS = 2;

    // ========== 动作节奏 ==========

    /**
     * wait 动作的检查粒度（毫秒）
     */
    public static final long WAIT_TICK_MS = 100L;

    /**
     * take_over 动作的检查粒度（毫秒）
     */
    public static final long TAKEOVER_TICK_MS = 200L;

    /**
     * take_over 动作的最长等待（毫秒）
     */
    public static final long TAKEOVER_CEILING_MS = 30 * 1000L;

    /**
     * 输入文本前的等待（毫秒），让输入框获得焦点
     */
    public static final long TYPE_PRE_DELAY_MS = 500L;

    /**
     * 输入文本后的等待（毫秒）
     */
    public static final long TYPE_POST_DELAY_MS = 300L;

    /**
     * 双击两次点击之间的间隔（毫秒）
     */
    public static final long DOUBLE_TAP_GAP_MS = 100L;

    /**
     * 长按持续时间（毫秒）
     */
    public static final int LONG_PRESS_DURATION_MS = 1000;

    /**
     * 默认滑动持续时间（毫秒）
     */
    public static final int DEFAULT_SWIPE_DURATION_MS = 300;

    // ========== 坐标配置 ==========

    /**
     * 归一化坐标上限
     */
    public static final int NORMALIZED_MAX = 1000;

    /**
     * 默认屏幕尺寸（未获取到真实尺寸时使用）
     */
    public static final int DEFAULT_SCREEN_WIDTH = 1080;
    public static final int DEFAULT_SCREEN_HEIGHT = 2400;
    public static final int DEFAULT_DPI = 440;

    // ========== 视频解码配置 ==========

    /**
     * 解码器未就绪时最多缓存的视频分片数
     */
    public static final int MAX_PENDING_FRAMES = 100;

    /**
     * 连续解码失败超过该次数时升级为错误日志
     */
    public static final int DECODE_FAILURE_ALERT_THRESHOLD = 5;

    // ========== 任务配置 ==========

    /**
     * 单个任务最多执行的步数
     */
    public static final int MAX_STEPS = 30;

    /**
     * 步与步之间的间隔（毫秒）
     */
    public static final long STEP_DELAY_MS = 500L;

    /**
     * 本地命令执行超时（秒）
     */
    public static final long SHELL_TIMEOUT_SECONDS = 30L;

    // ========== 模型配置 ==========

    public static final String DEFAULT_MODEL_BASE_URL = "https://open.bigmodel.cn/api/paas/v4";
    public static final String DEFAULT_MODEL_NAME = "autoglm-phone";
    public static final int MODEL_MAX_TOKENS = 1024;
    public static final long MODEL_TIMEOUT_SECONDS = 60L;

    // ========== 调试配置 ==========

    /**
     * 是否启用详细日志
     */
    public static boolean DEBUG_MODE = false;

    /**
     * 日志标签前缀
     */
    public static final String LOG_TAG = "GhostPilot";

    /**
     * 默认配置文件名
     */
    public static final String SETTINGS_FILE = "ghostpilot.json";

    private Config() {}
}
