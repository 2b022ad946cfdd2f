package com.questrail.testtree.exec.distributed.codec;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BatchCrcTest
 * -----------------------------------------------------------------------------
 * CRC-16/ARC: polynomial 0x8005 (reflected 0xA001), init 0x0000, reflected
 * input/output, XOROUT 0x0000, appended big-endian.
 */
final class BatchCrcTest
{
    @Test
    void matchesStandardCheckValue()
    {
        byte[] check = "123456789".getBytes(StandardCharsets.US_ASCII);
        assertEquals(0xBB3D, BatchCrc.compute(check, 0, check.length));
    }

    @Test
    void appendThenVerifyReturnsBody()
    {
        byte[] body = { (byte) 0xF1, 0x00, 0x00, 0x00, 0x02 };
        byte[] framed = BatchCrc.append(body);

        assertEquals(body.length + 2, framed.length);
        assertArrayEquals(body, BatchCrc.verifyAndStrip(framed));
    }

    @Test
    void flippedBitIsDetected()
    {
        byte[] framed = BatchCrc.append(new byte[] { (byte) 0xF3, 0x00, 0x00, 0x00, 0x01 });
        framed[2] ^= 0x10;

        BatchCodecException e = assertThrows(BatchCodecException.class, () -> BatchCrc.verifyAndStrip(framed));
        assertTrue(e.getMessage().startsWith("CRC mismatch"));
    }

    @Test
    void tooShortFrameIsRejected()
    {
        assertThrows(BatchCodecException.class, () -> BatchCrc.verifyAndStrip(new byte[] { 0x01, 0x02 }));
    }
}
