package com.aska.ghostpilot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import javax.imageio.ImageIO;

/**
 * H.264 视频流解码生命周期
 *
 * 职责：
 * 1. 从视频流中捕获 SPS/PPS，捕获后一直保留（detach 和解码错误都不清除）
 * 2. 解码器就绪前缓存视频分片（按分片计数，最多 {@link Config#MAX_PENDING_FRAMES} 个，参数集不计入）
 * 3. SPS、PPS、渲染目标齐全时创建解码器并按顺序送入缓存的分片
 * 4. 解码出错时释放解码器，下一个分片到达时自动重建
 * 5. 从渲染目标截取当前画面并编码为 PNG
 *
 * 真正的解码器和渲染目标由宿主平台通过 {@link DecoderFactory}、{@link RenderSurface} 提供。
 * 所有状态由同一把锁保护，视频读线程和控制线程可以并发调用。
 */
public class VideoStreamDecoder implements RemoteControlChannel.VideoListener {

    private static final String TAG = Config.LOG_TAG + ".Video";
    private static final Logger log = LoggerFactory.getLogger(TAG);

    /**
     * 解码器报告的错误
     */
    public static class DecoderException extends Exception {
        public DecoderException(String message) {
            super(message);
        }

        public DecoderException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * 渲染目标
     */
    public interface RenderSurface {
        /**
         * 读取最近一次渲染的画面；没有画面时可以一直不完成，调用方负责超时
         */
        CompletableFuture<BufferedImage> copyFrame();
    }

    /**
     * 平台解码器实例
     */
    public interface VideoDecoder {
        /**
         * 提交一个起始码格式的分片
         */
        void queue(byte[] annexB, long presentationTimeUs) throws DecoderException;

        /**
         * 把所有已解码的输出渲染到目标上
         *
         * @return 渲染的帧数
         */
        int drain() throws DecoderException;

        void release();
    }

    public interface DecoderFactory {
        /**
         * 用 SPS/PPS（起始码格式）和尺寸创建解码器
         */
        VideoDecoder create(byte[] sps, byte[] pps, int width, int height, RenderSurface surface)
            throws DecoderException;
    }

    private final DecoderFactory factory;
    private final int maxPendingFrames;
    private final Object lock = new Object();

    // ========== 以下字段由 lock 保护 ==========
    private byte[] csd0;  // SPS
    private byte[] csd1;  // PPS
    private VideoDecoder decoder;
    private final Deque<byte[]> pendingFrames = new ArrayDeque<>();
    private RenderSurface surface;
    private int width;
    private int height;
    private int consecutiveFailures;
    private long droppedFrames;

    public VideoStreamDecoder(DecoderFactory factory) {
        this(factory, Config.MAX_PENDING_FRAMES);
    }

    public VideoStreamDecoder(DecoderFactory factory, int maxPendingFrames) {
        this.factory = factory;
        this.maxPendingFrames = maxPendingFrames > 0 ? maxPendingFrames : Config.MAX_PENDING_FRAMES;
    }

    // ========== 渲染目标 ==========

    /**
     * 绑定渲染目标
     *
     * 释放旧的解码器并清空缓存，保留已捕获的 SPS/PPS；
     * 参数集已齐全时立即创建新解码器。
     */
    public boolean attach(RenderSurface target, int targetWidth, int targetHeight) {
        if (target == null || targetWidth <= 0 || targetHeight <= 0) {
            log.warn("Invalid attach target: surface={}, size={}x{}", target, targetWidth, targetHeight);
            return false;
        }

        synchronized (lock) {
            releaseDecoder();
            pendingFrames.clear();
            surface = target;
            width = targetWidth;
            height = targetHeight;
            consecutiveFailures = 0;
            log.info("Attached surface {}x{} (sps={}, pps={})", targetWidth, targetHeight, csd0 != null, csd1 != null);
            maybeCreateDecoder();
        }
        return true;
    }

    /**
     * 解除渲染目标，SPS/PPS 保留
     */
    public void detach() {
        synchronized (lock) {
            releaseDecoder();
            pendingFrames.clear();
            surface = null;
            width = 0;
            height = 0;
            log.info("Detached surface");
        }
    }

    /**
     * 进程退出时调用，清除所有状态（包括 SPS/PPS）
     */
    public void close() {
        synchronized (lock) {
            detach();
            csd0 = null;
            csd1 = null;
        }
    }

    // ========== 视频流 ==========

    @Override
    public void onVideoChunk(byte[] chunk) {
        onChunk(chunk);
    }

    /**
     * 处理一个视频分片
     */
    public void onChunk(byte[] raw) {
        if (raw == null || raw.length == 0) {
            return;
        }
        byte[] chunk = NalUnits.maybeConvertFraming(raw);

        synchronized (lock) {
            if (decoder != null) {
                submit(chunk);
                return;
            }

            // 解码器未就绪：捕获参数集，分片的其余部分整体进入缓存
            ByteArrayOutputStream rest = new ByteArrayOutputStream(chunk.length);
            for (byte[] unit : NalUnits.split(chunk)) {
                int type = NalUnits.findNalUnitType(unit);
                if (type == NalUnits.TYPE_SPS) {
                    if (csd0 == null) {
                        csd0 = unit;
                        log.info("Captured SPS ({} bytes)", unit.length);
                    }
                } else if (type == NalUnits.TYPE_PPS) {
                    if (csd1 == null) {
                        csd1 = unit;
                        log.info("Captured PPS ({} bytes)", unit.length);
                    }
                } else {
                    rest.write(unit, 0, unit.length);
                }
            }
            if (rest.size() > 0) {
                buffer(rest.toByteArray());
            }

            maybeCreateDecoder();
        }
    }

    private void buffer(byte[] chunk) {
        if (surface == null) {
            droppedFrames++;
            return;
        }
        if (pendingFrames.size() >= maxPendingFrames) {
            droppedFrames++;
            if (Config.DEBUG_MODE) {
                log.debug("Pending buffer full ({}), dropping chunk", maxPendingFrames);
            }
            return;
        }
        pendingFrames.addLast(chunk);
    }

    /**
     * 条件齐全时创建解码器并送入缓存的分片，调用方持有 lock
     */
    private void maybeCreateDecoder() {
        if (decoder != null || surface == null || csd0 == null || csd1 == null || width <= 0 || height <= 0) {
            return;
        }

        try {
            decoder = factory.create(
                NalUnits.maybeConvertFraming(csd0), NalUnits.maybeConvertFraming(csd1), width, height, surface);
        } catch (DecoderException | RuntimeException e) {
            decoder = null;
            recordFailure("Failed to create decoder", e);
            return;
        }

        log.info("Decoder created {}x{}, feeding {} buffered chunks", width, height, pendingFrames.size());
        while (decoder != null && !pendingFrames.isEmpty()) {
            submit(pendingFrames.pollFirst());
        }
        pendingFrames.clear();
    }

    /**
     * 提交分片并渲染输出；出错时释放解码器并清空缓存，参数集保留，调用方持有 lock
     */
    private void submit(byte[] chunk) {
        try {
            decoder.queue(chunk, System.nanoTime() / 1000);
            decoder.drain();
            consecutiveFailures = 0;
        } catch (DecoderException | RuntimeException e) {
            recordFailure("Decode failed, decoder will be recreated", e);
            releaseDecoder();
            pendingFrames.clear();
        }
    }

    private void recordFailure(String message, Exception e) {
        consecutiveFailures++;
        if (consecutiveFailures >= Config.DECODE_FAILURE_ALERT_THRESHOLD) {
            log.error("{} ({} consecutive failures)", message, consecutiveFailures, e);
        } else {
            log.warn("{}: {}", message, e.toString());
        }
    }

    private void releaseDecoder() {
        if (decoder == null) {
            return;
        }
        try {
            decoder.release();
        } catch (RuntimeException e) {
            log.warn("Error releasing decoder", e);
        }
        decoder = null;
    }

    // ========== 截图 ==========

    /**
     * 截取渲染目标上的当前画面
     *
     * @return PNG 数据，未绑定目标、超时或编码失败时返回 null
     */
    public byte[] captureFrame(long timeoutMs) {
        RenderSurface target;
        synchronized (lock) {
            target = surface;
        }
        if (target == null) {
            log.warn("No surface attached, cannot capture frame");
            return null;
        }

        try {
            BufferedImage image = target.copyFrame().get(timeoutMs, TimeUnit.MILLISECONDS);
            if (image == null) {
                return null;
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            if (!ImageIO.write(image, "png", out)) {
                log.error("No PNG writer available");
                return null;
            }
            return out.toByteArray();
        } catch (TimeoutException e) {
            log.warn("Frame capture timed out after {}ms", timeoutMs);
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (ExecutionException | IOException e) {
            log.error("Frame capture failed", e);
            return null;
        }
    }

    // ========== 状态 ==========

    public boolean isAttached() {
        synchronized (lock) {
            return surface != null;
        }
    }

    public boolean hasDecoder() {
        synchronized (lock) {
            return decoder != null;
        }
    }

    public boolean hasParameterSets() {
        synchronized (lock) {
            return csd0 != null && csd1 != null;
        }
    }

    public int getPendingFrameCount() {
        synchronized (lock) {
            return pendingFrames.size();
        }
    }

    public long getDroppedFrameCount() {
        synchronized (lock) {
            return droppedFrames;
        }
    }
}
