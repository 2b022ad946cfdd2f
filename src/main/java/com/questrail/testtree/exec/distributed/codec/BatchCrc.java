package com.questrail.testtree.exec.distributed.codec;

import java.util.Arrays;

/**
 * BatchCrc
 * -----------------------------------------------------------------------------
 * CRC-16/ARC over a frame body, appended as two bytes (big-endian).
 *
 * <p>TCP already detects transmission errors; the CRC guards against a worker
 * that dies while writing and a coordinator reading a spliced or stale
 * frame.</p>
 */
final class BatchCrc
{
    /*
     * CRC-16/ARC (reflected algorithm)
     *   • Polynomial (normal): 0x8005, reflected 0xA001
     *   • INIT: 0x0000, XOROUT: 0x0000
     *   • Input/output reflected
     */
    private static final int REFLECTED_POLY = 0xA001;
    private static final int INIT = 0x0000;

    private BatchCrc() {}

    static byte[] append(byte[] body)
    {
        final int crc = compute(body, 0, body.length);
        final byte[] out = Arrays.copyOf(body, body.length + 2);
        out[out.length - 2] = (byte) ((crc >>> 8) & 0xFF);
        out[out.length - 1] = (byte) (crc & 0xFF);
        return out;
    }

    /**
     * Validates and removes the trailing CRC.
     *
     * @throws BatchCodecException if the frame is too short or the CRC does not match
     */
    static byte[] verifyAndStrip(byte[] frame)
    {
        if (frame == null || frame.length < 3) {
            throw new BatchCodecException("frame too short for kind byte and CRC");
        }
        final int len = frame.length;
        final int transmitted = ((frame[len - 2] & 0xFF) << 8) | (frame[len - 1] & 0xFF);
        final int computed = compute(frame, 0, len - 2);
        if (transmitted != computed) {
            throw new BatchCodecException(String.format(
                    "CRC mismatch: transmitted=0x%04X computed=0x%04X", transmitted, computed));
        }
        return Arrays.copyOf(frame, len - 2);
    }

    static int compute(byte[] data, int off, int len)
    {
        int crc = INIT;
        for (int i = off; i < off + len; i++) {
            crc ^= (data[i] & 0xFF);
            for (int b = 0; b < 8; b++) {
                crc = (crc & 0x0001) != 0 ? (crc >>> 1) ^ REFLECTED_POLY : crc >>> 1;
            }
            crc &= 0xFFFF;
        }
        return crc;
    }
}
