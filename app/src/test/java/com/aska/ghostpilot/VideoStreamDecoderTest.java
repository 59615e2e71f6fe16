package com.aska.ghostpilot;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import javax.imageio.ImageIO;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VideoStreamDecoderTest {

    private static final byte[] SPS = {0, 0, 0, 1, 0x67, 0x42, 0x1f};
    private static final byte[] SPS_OTHER = {0, 0, 0, 1, 0x67, 0x4d, 0x28};
    private static final byte[] PPS = {0, 0, 0, 1, 0x68, (byte) 0xCE, 0x3C};
    private static final byte[] IDR = {0, 0, 0, 1, 0x65, (byte) 0x88, 0x11};
    private static final byte[] P1 = {0, 0, 0, 1, 0x41, (byte) 0x9A, 0x22};
    private static final byte[] P2 = {0, 0, 0, 1, 0x41, (byte) 0x9B, 0x33};

    private final FakeFactory factory = new FakeFactory();
    private final FakeSurface surface = new FakeSurface();

    @Test
    void chunksBeforeAttachAreDroppedButParameterSetsAreKept() {
        VideoStreamDecoder video = new VideoStreamDecoder(factory);
        video.onChunk(SPS);
        video.onChunk(PPS);
        video.onChunk(IDR);

        assertTrue(video.hasParameterSets());
        assertFalse(video.hasDecoder());
        assertEquals(0, video.getPendingFrameCount());
        assertEquals(1, video.getDroppedFrameCount());

        assertTrue(video.attach(surface, 1080, 2400));
        assertTrue(video.hasDecoder());
        assertEquals(1, factory.decoders.size());
        assertArrayEquals(SPS, factory.lastSps);
        assertArrayEquals(PPS, factory.lastPps);
        assertEquals(1080, factory.lastWidth);
        assertTrue(factory.decoders.get(0).queued.isEmpty());
    }

    @Test
    void buffersUntilParameterSetsArriveThenFeedsInOrder() {
        VideoStreamDecoder video = new VideoStreamDecoder(factory);
        video.attach(surface, 720, 1280);
        video.onChunk(IDR);
        video.onChunk(P1);
        assertEquals(2, video.getPendingFrameCount());
        assertFalse(video.hasDecoder());

        video.onChunk(SPS);
        assertFalse(video.hasDecoder());
        video.onChunk(PPS);

        assertTrue(video.hasDecoder());
        assertEquals(0, video.getPendingFrameCount());
        List<byte[]> queued = factory.decoders.get(0).queued;
        assertEquals(2, queued.size());
        assertArrayEquals(IDR, queued.get(0));
        assertArrayEquals(P1, queued.get(1));
    }

    @Test
    void combinedChunkStartsDecoder() {
        VideoStreamDecoder video = new VideoStreamDecoder(factory);
        video.attach(surface, 720, 1280);
        video.onVideoChunk(concat(SPS, PPS, IDR));

        assertTrue(video.hasDecoder());
        assertArrayEquals(SPS, factory.lastSps);
        assertArrayEquals(PPS, factory.lastPps);
        assertEquals(1, factory.decoders.get(0).queued.size());
        assertArrayEquals(IDR, factory.decoders.get(0).queued.get(0));
    }

    @Test
    void lengthPrefixedChunksAreConverted() {
        VideoStreamDecoder video = new VideoStreamDecoder(factory);
        video.attach(surface, 720, 1280);
        video.onChunk(new byte[]{0, 0, 0, 3, 0x67, 0x42, 0x1f});
        video.onChunk(new byte[]{0, 0, 0, 3, 0x68, (byte) 0xCE, 0x3C});
        video.onChunk(new byte[]{0, 0, 0, 3, 0x41, (byte) 0x9A, 0x22});

        assertArrayEquals(SPS, factory.lastSps);
        assertArrayEquals(PPS, factory.lastPps);
        assertArrayEquals(P1, factory.decoders.get(0).queued.get(0));
    }

    @Test
    void firstParameterSetWins() {
        VideoStreamDecoder video = new VideoStreamDecoder(factory);
        video.onChunk(SPS);
        video.onChunk(SPS_OTHER);
        video.onChunk(PPS);
        video.attach(surface, 720, 1280);
        assertArrayEquals(SPS, factory.lastSps);
    }

    @Test
    void pendingBufferIsCapped() {
        VideoStreamDecoder video = new VideoStreamDecoder(factory, 3);
        video.attach(surface, 720, 1280);
        for (int i = 0; i < 5; i++) {
            video.onChunk(P1);
        }
        assertEquals(3, video.getPendingFrameCount());
        assertEquals(2, video.getDroppedFrameCount());
    }

    @Test
    void pendingBufferCountsChunksNotUnits() {
        VideoStreamDecoder video = new VideoStreamDecoder(factory, 2);
        video.attach(surface, 720, 1280);
        video.onChunk(concat(IDR, P1));
        video.onChunk(concat(SPS, P2, P1));
        assertEquals(2, video.getPendingFrameCount());
        assertEquals(0, video.getDroppedFrameCount());

        video.onChunk(PPS);
        List<byte[]> queued = factory.decoders.get(0).queued;
        assertEquals(2, queued.size());
        assertArrayEquals(concat(IDR, P1), queued.get(0));
        assertArrayEquals(concat(P2, P1), queued.get(1));
    }

    @Test
    void decodeErrorRecreatesDecoderOnNextChunk() {
        VideoStreamDecoder video = new VideoStreamDecoder(factory);
        video.attach(surface, 720, 1280);
        video.onChunk(SPS);
        video.onChunk(PPS);
        FakeDecoder first = factory.decoders.get(0);

        first.failNext = true;
        video.onChunk(P1);
        assertTrue(first.released);
        assertFalse(video.hasDecoder());
        assertTrue(video.hasParameterSets());

        video.onChunk(P2);
        assertTrue(video.hasDecoder());
        assertEquals(2, factory.decoders.size());
        FakeDecoder second = factory.decoders.get(1);
        assertEquals(1, second.queued.size());
        assertArrayEquals(P2, second.queued.get(0));
    }

    @Test
    void factoryFailureIsRetried() {
        VideoStreamDecoder video = new VideoStreamDecoder(factory);
        video.attach(surface, 720, 1280);
        factory.failNext = true;
        video.onChunk(concat(SPS, PPS));
        assertFalse(video.hasDecoder());

        video.onChunk(P1);
        assertTrue(video.hasDecoder());
        assertArrayEquals(P1, factory.decoders.get(0).queued.get(0));
    }

    @Test
    void parameterSetsSurviveDetachButNotClose() {
        VideoStreamDecoder video = new VideoStreamDecoder(factory);
        video.attach(surface, 720, 1280);
        video.onChunk(concat(SPS, PPS));
        FakeDecoder first = factory.decoders.get(0);

        video.detach();
        assertTrue(first.released);
        assertFalse(video.isAttached());
        assertTrue(video.hasParameterSets());

        video.attach(surface, 1080, 2400);
        assertTrue(video.hasDecoder());
        assertEquals(1080, factory.lastWidth);

        video.close();
        assertFalse(video.hasDecoder());
        assertFalse(video.hasParameterSets());
    }

    @Test
    void attachRejectsInvalidTargets() {
        VideoStreamDecoder video = new VideoStreamDecoder(factory);
        assertFalse(video.attach(null, 720, 1280));
        assertFalse(video.attach(surface, 0, 1280));
        assertFalse(video.isAttached());
    }

    @Test
    void captureFrameEncodesPng() throws Exception {
        VideoStreamDecoder video = new VideoStreamDecoder(factory);
        assertNull(video.captureFrame(100));

        surface.frame = CompletableFuture.completedFuture(new BufferedImage(4, 2, BufferedImage.TYPE_INT_RGB));
        video.attach(surface, 4, 2);

        byte[] png = video.captureFrame(1000);
        assertNotNull(png);
        assertEquals((byte) 0x89, png[0]);
        assertEquals((byte) 'P', png[1]);
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(png));
        assertEquals(4, decoded.getWidth());
        assertEquals(2, decoded.getHeight());
    }

    @Test
    void captureFrameTimesOut() {
        VideoStreamDecoder video = new VideoStreamDecoder(factory);
        surface.frame = new CompletableFuture<>();
        video.attach(surface, 4, 2);
        assertNull(video.captureFrame(50));
    }

    private static byte[] concat(byte[]... parts) {
        int total = 0;
        for (byte[] p : parts) total += p.length;
        byte[] out = new byte[total];
        int offset = 0;
        for (byte[] p : parts) {
            System.arraycopy(p, 0, out, offset, p.length);
            offset += p.length;
        }
        return out;
    }

    // ========== 测试替身 ==========

    static class FakeSurface implements VideoStreamDecoder.RenderSurface {
        CompletableFuture<BufferedImage> frame = new CompletableFuture<>();

        @Override
        public CompletableFuture<BufferedImage> copyFrame() {
            return frame;
        }
    }

    static class FakeDecoder implements VideoStreamDecoder.VideoDecoder {
        final List<byte[]> queued = new ArrayList<>();
        boolean failNext;
        boolean released;

        @Override
        public void queue(byte[] annexB, long presentationTimeUs) throws VideoStreamDecoder.DecoderException {
            if (failNext) {
                failNext = false;
                throw new VideoStreamDecoder.DecoderException("codec error");
            }
            queued.add(annexB);
        }

        @Override
        public int drain() {
            return 1;
        }

        @Override
        public void release() {
            released = true;
        }
    }

    static class FakeFactory implements VideoStreamDecoder.DecoderFactory {
        final List<FakeDecoder> decoders = new ArrayList<>();
        boolean failNext;
        byte[] lastSps;
        byte[] lastPps;
        int lastWidth;

        @Override
        public VideoStreamDecoder.VideoDecoder create(byte[] sps, byte[] pps, int width, int height,
                                                      VideoStreamDecoder.RenderSurface surface)
                throws VideoStreamDecoder.DecoderException {
            if (failNext) {
                failNext = false;
                throw new VideoStreamDecoder.DecoderException("no codec");
            }
            lastSps = sps;
            lastPps = pps;
            lastWidth = width;
            FakeDecoder decoder = new FakeDecoder();
            decoders.add(decoder);
            return decoder;
        }
    }
}
