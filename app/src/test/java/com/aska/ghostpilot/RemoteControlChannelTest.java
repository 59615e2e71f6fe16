package com.aska.ghostpilot;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;
import java.util.function.BooleanSupplier;

import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okio.ByteString;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RemoteControlChannelTest {

    private static final byte[] PNG_A = {(byte) 0x89, 'P', 'N', 'G', 1};
    private static final byte[] PNG_B = {(byte) 0x89, 'P', 'N', 'G', 2};

    private MockWebServer server;
    private ShowerServer shower;
    private RemoteControlChannel channel;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        shower = new ShowerServer();
        server.enqueue(new MockResponse().withWebSocketUpgrade(shower));
        channel = new RemoteControlChannel("ws://" + server.getHostName() + ":" + server.getPort(), 2000L);
    }

    @AfterEach
    void tearDown() throws Exception {
        channel.release();
        server.shutdown();
    }

    @Test
    void createsDisplayAndSendsCommands() throws Exception {
        assertTrue(channel.ensureDisplay(1080, 2400, 440, 4000));
        assertTrue(channel.isConnected());
        assertEquals("CREATE_DISPLAY 1080 2400 440 4000", shower.next());

        assertTrue(channel.tap(10, 20));
        assertTrue(channel.swipe(1, 2, 3, 4, 300));
        assertTrue(channel.key(ShowerProtocol.KEYCODE_BACK));
        assertTrue(channel.launchApp("com.tencent.mm"));
        assertEquals("TAP 10 20", shower.next());
        assertEquals("SWIPE 1 2 3 4 300", shower.next());
        assertEquals("KEY 4", shower.next());
        assertEquals("LAUNCH_APP com.tencent.mm", shower.next());
    }

    @Test
    void commandsFailFastWhenNotConnected() {
        assertFalse(channel.tap(1, 2));
        assertEquals(RemoteControlChannel.ConnectionState.DISCONNECTED, channel.getState());
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void unreachableServerFailsToConnect() {
        RemoteControlChannel offline = new RemoteControlChannel("ws://127.0.0.1:1", 1000L);
        try {
            assertFalse(offline.ensureConnected());
            assertFalse(offline.isConnected());
            assertNull(offline.requestScreenshot(200));
        } finally {
            offline.release();
        }
    }

    @Test
    void concurrentCallersShareOneAttempt() throws Exception {
        int callers = 4;
        CountDownLatch start = new CountDownLatch(1);
        List<Boolean> results = Collections.synchronizedList(new ArrayList<>());
        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            Thread t = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                results.add(channel.ensureConnected());
            });
            threads.add(t);
            t.start();
        }
        start.countDown();
        for (Thread t : threads) {
            t.join(5000);
        }

        assertEquals(callers, results.size());
        assertTrue(results.stream().allMatch(Boolean::booleanValue));
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void tracksDisplayIdAndSize() throws Exception {
        assertTrue(channel.ensureConnected());
        WebSocket ws = shower.opened.get(2, TimeUnit.SECONDS);
        ws.send("DISPLAY_CREATED 7");
        ws.send("DISPLAY_SIZE 1080 2400");

        awaitTrue(() -> channel.getVideoHeight() == 2400);
        assertEquals(Integer.valueOf(7), channel.getDisplayId());
        assertEquals(1080, channel.getVideoWidth());
    }

    @Test
    void ignoresUnknownAndMalformedLines() {
        channel.handleTextMessage("HELLO from server");
        channel.handleTextMessage("DISPLAY_SIZE wide tall");
        channel.handleTextMessage("DISPLAY_CREATED x");
        assertEquals(0, channel.getVideoWidth());
        assertNull(channel.getDisplayId());
    }

    @Test
    void screenshotIsDecoded() {
        shower.onText = (ws, text) -> {
            if (ShowerProtocol.SCREENSHOT.equals(text)) {
                ws.send("SCREENSHOT_DATA " + ByteString.of(PNG_A).base64());
            }
        };
        assertArrayEquals(PNG_A, channel.requestScreenshot(2000));
    }

    @Test
    void screenshotErrorReturnsNull() {
        shower.onText = (ws, text) -> {
            if (ShowerProtocol.SCREENSHOT.equals(text)) {
                ws.send("SCREENSHOT_ERROR capture failed");
            }
        };
        assertNull(channel.requestScreenshot(2000));
    }

    @Test
    void lateReplyIsNotMistakenForNextScreenshot() {
        AtomicInteger requests = new AtomicInteger();
        shower.onText = (ws, text) -> {
            if (!ShowerProtocol.SCREENSHOT.equals(text)) return;
            if (requests.incrementAndGet() == 2) {
                // 第一次请求的回复迟到，紧跟着第二次请求的回复
                ws.send("SCREENSHOT_DATA " + ByteString.of(PNG_A).base64());
                ws.send("SCREENSHOT_DATA " + ByteString.of(PNG_B).base64());
            }
        };

        assertNull(channel.requestScreenshot(300));
        assertArrayEquals(PNG_B, channel.requestScreenshot(2000));
    }

    @Test
    void slowRepliesNeverReachALaterRequest() {
        ScheduledExecutorService slow = Executors.newSingleThreadScheduledExecutor();
        AtomicInteger requests = new AtomicInteger();
        shower.onText = (ws, text) -> {
            if (!ShowerProtocol.SCREENSHOT.equals(text)) return;
            byte n = (byte) requests.incrementAndGet();
            byte[] tagged = {(byte) 0x89, 'P', 'N', 'G', n};
            slow.schedule(() -> ws.send("SCREENSHOT_DATA " + ByteString.of(tagged).base64()),
                400, TimeUnit.MILLISECONDS);
        };
        try {
            assertNull(channel.requestScreenshot(300));
            assertNull(channel.requestScreenshot(300));
            byte[] third = channel.requestScreenshot(2000);
            assertArrayEquals(new byte[]{(byte) 0x89, 'P', 'N', 'G', 3}, third);
        } finally {
            slow.shutdownNow();
        }
    }

    @Test
    void screenshotErrorCountsAsReply() {
        shower.onText = (ws, text) -> {
            if (ShowerProtocol.SCREENSHOT.equals(text)) {
                ws.send("SCREENSHOT_ERROR busy");
            }
        };
        assertNull(channel.requestScreenshot(2000));

        shower.onText = (ws, text) -> {
            if (ShowerProtocol.SCREENSHOT.equals(text)) {
                ws.send("SCREENSHOT_DATA " + ByteString.of(PNG_A).base64());
            }
        };
        assertArrayEquals(PNG_A, channel.requestScreenshot(2000));
    }

    @Test
    void forHostBuildsWebSocketUrl() {
        RemoteControlChannel local = RemoteControlChannel.forHost("127.0.0.1", 8986);
        try {
            assertEquals("ws://127.0.0.1:8986", local.getUrl());
        } finally {
            local.release();
        }
        assertEquals("ws://" + server.getHostName() + ":" + server.getPort(), channel.getUrl());
    }

    @Test
    void serverCloseCompletesPendingScreenshot() {
        shower.onText = (ws, text) -> {
            if (ShowerProtocol.SCREENSHOT.equals(text)) {
                ws.close(1000, "bye");
            }
        };

        long start = System.nanoTime();
        assertNull(channel.requestScreenshot(5000));
        assertTrue((System.nanoTime() - start) / 1_000_000 < 4000);
        awaitTrue(() -> !channel.isConnected());
    }

    @Test
    void forwardsVideoFrames() throws Exception {
        BlockingQueue<byte[]> chunks = new LinkedBlockingQueue<>();
        channel.setVideoListener(chunks::add);
        assertTrue(channel.ensureConnected());

        shower.opened.get(2, TimeUnit.SECONDS).send(ByteString.of((byte) 0, (byte) 0, (byte) 1, (byte) 0x65));

        byte[] chunk = chunks.poll(2, TimeUnit.SECONDS);
        assertArrayEquals(new byte[]{0, 0, 1, 0x65}, chunk);
    }

    @Test
    void shutdownDestroysDisplayAndCloses() throws Exception {
        assertTrue(channel.ensureConnected());
        shower.opened.get(2, TimeUnit.SECONDS).send("DISPLAY_CREATED 3");
        awaitTrue(() -> channel.getDisplayId() != null);

        channel.shutdown();

        assertEquals(RemoteControlChannel.ConnectionState.DISCONNECTED, channel.getState());
        assertNull(channel.getDisplayId());
        assertEquals("DESTROY_DISPLAY", shower.next());
        assertEquals("CLOSE 1000", shower.next());
    }

    @Test
    void shutdownWithoutConnectionIsSafe() {
        channel.shutdown();
        channel.shutdown();
        assertFalse(channel.isConnected());
    }

    private static void awaitTrue(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + 3000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("condition not met in time");
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError(e);
            }
        }
    }

    /**
     * 服务端：记录收到的文本，按需回复
     */
    static class ShowerServer extends WebSocketListener {
        final BlockingQueue<String> received = new LinkedBlockingQueue<>();
        final CompletableFuture<WebSocket> opened = new CompletableFuture<>();
        volatile BiConsumer<WebSocket, String> onText;

        @Override
        public void onOpen(WebSocket ws, Response response) {
            opened.complete(ws);
        }

        @Override
        public void onMessage(WebSocket ws, String text) {
            received.add(text);
            BiConsumer<WebSocket, String> handler = onText;
            if (handler != null) {
                handler.accept(ws, text);
            }
        }

        @Override
        public void onClosing(WebSocket ws, int code, String reason) {
            received.add("CLOSE " + code);
            ws.close(1000, null);
        }

        String next() throws InterruptedException {
            String text = received.poll(2, TimeUnit.SECONDS);
            if (text == null) {
                throw new AssertionError("no message from client");
            }
            return text;
        }
    }
}
