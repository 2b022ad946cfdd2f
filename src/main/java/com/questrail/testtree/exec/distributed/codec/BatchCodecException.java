package com.questrail.testtree.exec.distributed.codec;

/**
 * Indicates that a frame could not be decoded.
 *
 * This typically reflects:
 * <ul>
 *   <li>Unknown frame kind or outcome tag</li>
 *   <li>Truncated payload</li>
 *   <li>CRC mismatch</li>
 * </ul>
 */
public final class BatchCodecException extends RuntimeException
{
    public BatchCodecException(String message) {
        super(message);
    }

    public BatchCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
