package com.aska.ghostpilot;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * H.264 NAL 单元工具
 *
 * 职责：
 * 1. 识别起始码（00 00 01 / 00 00 00 01）
 * 2. 读取 NAL 类型（7 = SPS，8 = PPS）
 * 3. 长度前缀（AVCC）→ 起始码（Annex-B）转换
 */
public final class NalUnits {

    public static final int TYPE_SPS = 7;
    public static final int TYPE_PPS = 8;

    private static final byte[] START_CODE = {0, 0, 0, 1};

    private NalUnits() {}

    /**
     * 是否以起始码开头
     */
    public static boolean startsWithStartCode(byte[] data) {
        if (data == null || data.length < 3) return false;
        if (data[0] == 0 && data[1] == 0 && data[2] == 1) return true;
        return data.length >= 4 && data[0] == 0 && data[1] == 0 && data[2] == 0 && data[3] == 1;
    }

    /**
     * 第一个起始码之后的 NAL 类型（低 5 位），找不到起始码时返回 -1
     */
    public static int findNalUnitType(byte[] data) {
        if (data == null) return -1;
        for (int i = 0; i + 3 < data.length; i++) {
            if (data[i] == 0 && data[i + 1] == 0 && data[i + 2] == 1) {
                return data[i + 3] & 0x1F;
            }
        }
        return -1;
    }

    /**
     * 长度前缀格式转换为起始码格式
     *
     * 已经以起始码开头时原样返回（重复调用不会改变结果）；
     * 长度字段不合法时也原样返回，交给解码器处理。
     */
    public static byte[] maybeConvertFraming(byte[] data) {
        if (data == null || data.length < 4 || startsWithStartCode(data)) {
            return data;
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length + 16);
        int offset = 0;
        while (offset + 4 <= data.length) {
            int length = ((data[offset] & 0xFF) << 24)
                | ((data[offset + 1] & 0xFF) << 16)
                | ((data[offset + 2] & 0xFF) << 8)
                | (data[offset + 3] & 0xFF);
            offset += 4;
            if (length <= 0 || length > data.length - offset) {
                return data;
            }
            out.write(START_CODE, 0, START_CODE.length);
            out.write(data, offset, length);
            offset += length;
        }
        // 剩余不足一个长度字段的字节
        if (offset != data.length) {
            return data;
        }

        byte[] converted = out.toByteArray();
        return converted.length == 0 ? data : converted;
    }

    /**
     * 按起始码切分，每个单元保留自己的起始码；没有起始码时整体作为一个单元
     */
    public static List<byte[]> split(byte[] data) {
        List<Integer> starts = new ArrayList<>();
        for (int i = 0; i + 2 < data.length; i++) {
            if (data[i] == 0 && data[i + 1] == 0 && data[i + 2] == 1) {
                starts.add(i > 0 && data[i - 1] == 0 ? i - 1 : i);
                i += 2;
            }
        }

        List<byte[]> units = new ArrayList<>();
        if (starts.isEmpty() || starts.get(0) != 0) {
            // 起始码之前的字节无法归属，整体交给调用方
            units.add(data);
            return units;
        }
        for (int k = 0; k < starts.size(); k++) {
            int from = starts.get(k);
            int to = k + 1 < starts.size() ? starts.get(k + 1) : data.length;
            units.add(Arrays.copyOfRange(data, from, to));
        }
        return units;
    }
}
