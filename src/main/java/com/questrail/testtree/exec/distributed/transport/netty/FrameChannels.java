package com.questrail.testtree.exec.distributed.transport.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;

import java.util.concurrent.TimeUnit;

/**
 * Pipeline setup shared by both ends of the worker link: a 4-byte big-endian
 * length prefix in front of every frame.
 */
final class FrameChannels
{
    static final int LENGTH_FIELD_BYTES = 4;
    static final int MAX_FRAME_BYTES = 64 * 1024 * 1024;

    private FrameChannels() {}

    static void addFraming(ChannelPipeline p)
    {
        p.addLast(new LengthFieldBasedFrameDecoder(
                MAX_FRAME_BYTES, 0, LENGTH_FIELD_BYTES, 0, LENGTH_FIELD_BYTES));
        p.addLast(new LengthFieldPrepender(LENGTH_FIELD_BYTES));
    }

    /** Copies the readable bytes out of a buffer (Netty containment rule). */
    static byte[] copy(ByteBuf buf)
    {
        byte[] bytes = new byte[buf.readableBytes()];
        buf.getBytes(buf.readerIndex(), bytes);
        return bytes;
    }

    /** No quiet period: the link carries no traffic once either side stops. */
    static void shutdown(EventLoopGroup group)
    {
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
    }
}
