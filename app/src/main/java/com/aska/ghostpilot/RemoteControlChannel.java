package com.aska.ghostpilot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.logging.HttpLoggingInterceptor;
import okio.ByteString;

/**
 * Shower 虚拟屏控制通道
 *
 * 职责：
 * 1. 维护到 Shower 服务的 WebSocket 连接（同一时间最多一次连接尝试）
 * 2. 发送 CREATE_DISPLAY / TAP / SWIPE / KEY 等单行文本命令
 * 3. 截图请求与 SCREENSHOT_DATA 回复的配对，超时后迟到的回复被丢弃
 * 4. 把二进制视频帧转交给 {@link VideoListener}
 *
 * 未连接时所有命令立即返回 false，不排队。
 */
public class RemoteControlChannel {

    private static final String TAG = Config.LOG_TAG + ".Shower";
    private static final Logger log = LoggerFactory.getLogger(TAG);

    public enum ConnectionState {
        DISCONNECTED,
        CONNECTING,
        CONNECTED
    }

    /**
     * 视频帧回调，在 OkHttp 的读线程上调用
     */
    public interface VideoListener {
        void onVideoChunk(byte[] chunk);
    }

    private final OkHttpClient client;
    private final String url;
    private final long connectTimeoutMs;

    private final Object lock = new Object();

    // ========== 以下字段由 lock 保护 ==========
    private WebSocket webSocket;
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private CompletableFuture<Boolean> connecting;
    private Integer displayId;
    private int videoWidth;
    private int videoHeight;
    private CompletableFuture<byte[]> pendingScreenshot;
    // 已发出但尚未收到回复的 SCREENSHOT 数，回复按发送顺序到达
    private int outstandingScreenshots;

    // 截图请求串行化
    private final Semaphore screenshotPermit = new Semaphore(1, true);

    private volatile VideoListener videoListener;

    public RemoteControlChannel() {
        this(showerUrl(Config.SHOWER_HOST, Config.SHOWER_PORT), Config.CONNECT_TIMEOUT_MS);
    }

    public static RemoteControlChannel forHost(String host, int port) {
        return new RemoteControlChannel(showerUrl(host, port), Config.CONNECT_TIMEOUT_MS);
    }

    static String showerUrl(String host, int port) {
        return "ws://" + host + ":" + port;
    }

    public RemoteControlChannel(String url, long connectTimeoutMs) {
        this.url = url;
        this.connectTimeoutMs = connectTimeoutMs > 0 ? connectTimeoutMs : Config.CONNECT_TIMEOUT_MS;

        OkHttpClient.Builder builder = new OkHttpClient.Builder()
            .connectTimeout(this.connectTimeoutMs, TimeUnit.MILLISECONDS)
            .readTimeout(Config.SOCKET_IO_TIMEOUT_MS, TimeUnit.MILLISECONDS)
            .writeTimeout(Config.SOCKET_IO_TIMEOUT_MS, TimeUnit.MILLISECONDS);

        if (Config.DEBUG_MODE) {
            HttpLoggingInterceptor logging = new HttpLoggingInterceptor(log::debug);
            logging.setLevel(HttpLoggingInterceptor.Level.HEADERS);
            builder.addInterceptor(logging);
        }

        this.client = builder.build();
    }

    // ========== 连接 ==========

    /**
     * 确保已连接；正在连接时等待同一次尝试的结果
     *
     * @return 是否已连接
     */
    public boolean ensureConnected() {
        CompletableFuture<Boolean> attempt;
        synchronized (lock) {
            if (state == ConnectionState.CONNECTED && webSocket != null) {
                return true;
            }
            if (state == ConnectionState.CONNECTING && connecting != null) {
                attempt = connecting;
            } else {
                log.info("Connecting to Shower: {}", url);
                attempt = new CompletableFuture<>();
                connecting = attempt;
                state = ConnectionState.CONNECTING;
                Request request = new Request.Builder().url(url).build();
                webSocket = client.newWebSocket(request, new ShowerListener());
            }
        }

        try {
            return attempt.get(connectTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Connection to {} timed out after {}ms", url, connectTimeoutMs);
            abandonAttempt(attempt);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            log.error("Connection attempt failed", e);
            return false;
        }
    }

    private void abandonAttempt(CompletableFuture<Boolean> attempt) {
        WebSocket stale = null;
        synchronized (lock) {
            if (connecting == attempt && state == ConnectionState.CONNECTING) {
                stale = webSocket;
                webSocket = null;
                connecting = null;
                state = ConnectionState.DISCONNECTED;
            }
        }
        if (stale != null) {
            stale.cancel();
        }
        attempt.complete(false);
    }

    // ========== 命令 ==========

    /**
     * 发送一条文本命令，未连接时立即返回 false
     */
    public boolean send(String command) {
        WebSocket ws;
        synchronized (lock) {
            if (state != ConnectionState.CONNECTED || webSocket == null) {
                log.warn("Cannot send, not connected: {}", command);
                return false;
            }
            ws = webSocket;
        }
        if (Config.DEBUG_MODE) {
            log.debug("Sending: {}", command);
        }
        return ws.send(command);
    }

    /**
     * 连接并创建虚拟屏
     */
    public boolean ensureDisplay(int width, int height, int dpi, Integer bitrateKbps) {
        if (!ensureConnected()) {
            return false;
        }
        String command = ShowerProtocol.createDisplay(width, height, dpi, bitrateKbps);
        log.info("Creating virtual display: {}", command);
        return send(command);
    }

    public boolean tap(int x, int y) {
        return send(ShowerProtocol.tap(x, y));
    }

    public boolean swipe(int x1, int y1, int x2, int y2, long durationMs) {
        return send(ShowerProtocol.swipe(x1, y1, x2, y2, durationMs));
    }

    public boolean key(int keyCode) {
        return send(ShowerProtocol.key(keyCode));
    }

    public boolean launchApp(String packageName) {
        return send(ShowerProtocol.launchApp(packageName));
    }

    public boolean touchDown(int x, int y) {
        return send(ShowerProtocol.touch(ShowerProtocol.TOUCH_DOWN, x, y));
    }

    public boolean touchMove(int x, int y) {
        return send(ShowerProtocol.touch(ShowerProtocol.TOUCH_MOVE, x, y));
    }

    public boolean touchUp(int x, int y) {
        return send(ShowerProtocol.touch(ShowerProtocol.TOUCH_UP, x, y));
    }

    // ========== 截图 ==========

    /**
     * 请求一张截图
     *
     * 同一时间只有一个请求在等待回复，后来的请求排队等待，排队时间也计入超时。
     *
     * @return PNG 数据，超时、出错或未连接时返回 null
     */
    public byte[] requestScreenshot(long timeoutMs) {
        if (!ensureConnected()) {
            log.warn("Not connected, cannot take screenshot");
            return null;
        }

        long deadline = System.currentTimeMillis() + timeoutMs;
        try {
            if (!screenshotPermit.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Screenshot request still pending, giving up after {}ms", timeoutMs);
                return null;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }

        CompletableFuture<byte[]> slot = new CompletableFuture<>();
        try {
            synchronized (lock) {
                pendingScreenshot = slot;
                outstandingScreenshots++;
            }

            if (!send(ShowerProtocol.SCREENSHOT)) {
                synchronized (lock) {
                    if (outstandingScreenshots > 0) outstandingScreenshots--;
                }
                clearSlot(slot);
                return null;
            }

            long remaining = Math.max(1L, deadline - System.currentTimeMillis());
            return slot.get(remaining, TimeUnit.MILLISECONDS);

        } catch (TimeoutException e) {
            log.warn("Screenshot timed out after {}ms", timeoutMs);
            clearSlot(slot);
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            clearSlot(slot);
            return null;
        } catch (ExecutionException e) {
            log.error("Screenshot request failed", e);
            clearSlot(slot);
            return null;
        } finally {
            screenshotPermit.release();
        }
    }

    /**
     * 只清除自己安装的截图槽位；超时请求的回复仍计入未回复数，到达时丢弃
     */
    private void clearSlot(CompletableFuture<byte[]> slot) {
        synchronized (lock) {
            if (pendingScreenshot != slot) {
                return;
            }
            pendingScreenshot = null;
        }
        slot.complete(null);
    }

    /**
     * 只有最后一个发出的请求的回复才交给当前槽位，更早的回复属于已超时的请求
     */
    private void deliverScreenshot(byte[] data) {
        CompletableFuture<byte[]> slot;
        synchronized (lock) {
            if (outstandingScreenshots > 0) {
                outstandingScreenshots--;
            }
            if (outstandingScreenshots > 0) {
                log.debug("Dropping late screenshot response, {} still outstanding", outstandingScreenshots);
                return;
            }
            slot = pendingScreenshot;
            pendingScreenshot = null;
        }
        if (slot == null) {
            log.debug("Screenshot response with no pending request, dropped");
            return;
        }
        slot.complete(data);
    }

    // ========== 收到的消息 ==========

    void handleTextMessage(String text) {
        try {
            if (text.startsWith(ShowerProtocol.DISPLAY_CREATED)) {
                String value = text.substring(ShowerProtocol.DISPLAY_CREATED.length()).trim();
                Integer id = parseIntOrNull(value);
                synchronized (lock) {
                    displayId = id;
                }
                log.info("Virtual display created: {}", id);

            } else if (text.startsWith(ShowerProtocol.DISPLAY_SIZE)) {
                String[] parts = text.substring(ShowerProtocol.DISPLAY_SIZE.length()).trim().split("\\s+");
                Integer w = parts.length >= 2 ? parseIntOrNull(parts[0]) : null;
                Integer h = parts.length >= 2 ? parseIntOrNull(parts[1]) : null;
                if (w == null || h == null) {
                    log.warn("Malformed display size: {}", text);
                    return;
                }
                synchronized (lock) {
                    videoWidth = w;
                    videoHeight = h;
                }
                log.info("Display size: {}x{}", w, h);

            } else if (text.startsWith(ShowerProtocol.SCREENSHOT_DATA)) {
                String base64 = text.substring(ShowerProtocol.SCREENSHOT_DATA.length()).trim();
                ByteString decoded = ByteString.decodeBase64(base64);
                if (decoded == null) {
                    log.error("Failed to decode screenshot data ({} chars)", base64.length());
                }
                deliverScreenshot(decoded != null ? decoded.toByteArray() : null);

            } else if (text.startsWith(ShowerProtocol.SCREENSHOT_ERROR)) {
                log.error("Screenshot error: {}", text);
                deliverScreenshot(null);

            } else {
                log.debug("[Server] {}", text);
            }
        } catch (RuntimeException e) {
            log.error("Failed to handle message: {}", text, e);
        }
    }

    private static Integer parseIntOrNull(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private class ShowerListener extends WebSocketListener {

        @Override
        public void onOpen(WebSocket ws, Response response) {
            CompletableFuture<Boolean> attempt;
            synchronized (lock) {
                if (ws != webSocket) {
                    ws.close(ShowerProtocol.CLOSE_NORMAL, "Superseded");
                    return;
                }
                state = ConnectionState.CONNECTED;
                outstandingScreenshots = 0;
                attempt = connecting;
                connecting = null;
            }
            log.info("Connected to Shower: {}", url);
            if (attempt != null) {
                attempt.complete(true);
            }
        }

        @Override
        public void onMessage(WebSocket ws, String text) {
            if (Config.DEBUG_MODE) {
                log.debug("Received: {}", text.length() > 100 ? text.substring(0, 100) : text);
            }
            handleTextMessage(text);
        }

        @Override
        public void onMessage(WebSocket ws, ByteString bytes) {
            VideoListener listener = videoListener;
            if (listener == null) {
                return;
            }
            try {
                listener.onVideoChunk(bytes.toByteArray());
            } catch (RuntimeException e) {
                log.error("Video listener failed", e);
            }
        }

        @Override
        public void onClosing(WebSocket ws, int code, String reason) {
            log.info("Shower closing: {} - {}", code, reason);
            ws.close(code, reason);
        }

        @Override
        public void onClosed(WebSocket ws, int code, String reason) {
            log.info("Shower closed: {} - {}", code, reason);
            handleDisconnect(ws);
        }

        @Override
        public void onFailure(WebSocket ws, Throwable t, Response response) {
            log.error("Shower connection error: {}", t.getMessage());
            handleDisconnect(ws);
        }
    }

    private void handleDisconnect(WebSocket ws) {
        CompletableFuture<Boolean> attempt;
        CompletableFuture<byte[]> slot;
        synchronized (lock) {
            if (ws != webSocket) {
                return;
            }
            webSocket = null;
            state = ConnectionState.DISCONNECTED;
            attempt = connecting;
            connecting = null;
            slot = pendingScreenshot;
            pendingScreenshot = null;
            outstandingScreenshots = 0;
        }
        if (attempt != null) attempt.complete(false);
        if (slot != null) slot.complete(null);
    }

    // ========== 关闭 ==========

    /**
     * 销毁虚拟屏并断开连接，不会抛出异常
     */
    public void shutdown() {
        log.info("Shutting down Shower channel");
        try {
            if (isConnected()) {
                send(ShowerProtocol.DESTROY_DISPLAY);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to destroy display", e);
        }

        WebSocket ws;
        CompletableFuture<Boolean> attempt;
        CompletableFuture<byte[]> slot;
        synchronized (lock) {
            ws = webSocket;
            webSocket = null;
            state = ConnectionState.DISCONNECTED;
            attempt = connecting;
            connecting = null;
            slot = pendingScreenshot;
            pendingScreenshot = null;
            outstandingScreenshots = 0;
            displayId = null;
            videoWidth = 0;
            videoHeight = 0;
        }
        if (attempt != null) attempt.complete(false);
        if (slot != null) slot.complete(null);

        if (ws != null) {
            try {
                ws.close(ShowerProtocol.CLOSE_NORMAL, "Client shutdown");
            } catch (RuntimeException e) {
                log.warn("Error while closing Shower socket", e);
            }
        }
    }

    /**
     * 释放资源，之后不能再使用
     */
    public void release() {
        shutdown();
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }

    // ========== 状态 ==========

    public void setVideoListener(VideoListener listener) {
        this.videoListener = listener;
    }

    public ConnectionState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public boolean isConnected() {
        return getState() == ConnectionState.CONNECTED;
    }

    public Integer getDisplayId() {
        synchronized (lock) {
            return displayId;
        }
    }

    public int getVideoWidth() {
        synchronized (lock) {
            return videoWidth;
        }
    }

    public int getVideoHeight() {
        synchronized (lock) {
            return videoHeight;
        }
    }

    public String getUrl() {
        return url;
    }
}
