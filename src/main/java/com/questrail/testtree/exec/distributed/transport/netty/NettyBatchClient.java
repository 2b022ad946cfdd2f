package com.questrail.testtree.exec.distributed.transport.netty;

import com.questrail.testtree.exec.distributed.transport.BatchClient;
import com.questrail.testtree.exec.distributed.transport.TransportException;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Netty-backed implementation of the {@link BatchClient} port.
 *
 * <p>Same containment rule as {@link NettyBatchServer}: inbound frames are
 * copied out of their buffers before they reach the consumer.</p>
 */
public final class NettyBatchClient implements BatchClient
{
    private static final int CONNECT_TIMEOUT_MILLIS = 10_000;

    private final EventLoopGroup group = new NioEventLoopGroup(1);

    private volatile Channel channel;

    @Override
    public void connect(InetSocketAddress coordinator, Consumer<byte[]> inbound)
    {
        Objects.requireNonNull(coordinator, "coordinator");
        Objects.requireNonNull(inbound, "inbound");
        if (channel != null) {
            throw new IllegalStateException("already connected");
        }

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        FrameChannels.addFraming(ch.pipeline());
                        ch.pipeline().addLast(new SimpleChannelInboundHandler<ByteBuf>() {
                            @Override
                            protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame)
                            {
                                inbound.accept(FrameChannels.copy(frame));
                            }
                        });
                    }
                });

        ChannelFuture connected = bootstrap.connect(coordinator).awaitUninterruptibly();
        if (!connected.isSuccess()) {
            FrameChannels.shutdown(group);
            throw new TransportException("cannot connect to coordinator at " + coordinator, connected.cause());
        }
        channel = connected.channel();
    }

    @Override
    public void send(byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");
        Channel ch = channel;
        if (ch == null) {
            throw new IllegalStateException("not connected");
        }
        ChannelFuture written = ch.writeAndFlush(Unpooled.wrappedBuffer(frame)).awaitUninterruptibly();
        if (!written.isSuccess()) {
            throw new TransportException("cannot write frame to coordinator", written.cause());
        }
    }

    @Override
    public void close()
    {
        Channel ch = channel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        FrameChannels.shutdown(group);
    }
}
