package com.questrail.testtree.exec.distributed.transport.netty;

import com.questrail.testtree.exec.distributed.transport.BatchServer;
import com.questrail.testtree.exec.distributed.transport.BatchServerListener;
import com.questrail.testtree.exec.distributed.transport.TransportException;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.GlobalEventExecutor;

import java.net.InetSocketAddress;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * NettyBatchServer
 * =============================================================================
 * Netty-backed implementation of the {@link BatchServer} port.
 *
 * <h2>Architectural role</h2>
 * A pure transport adapter: it splits the stream into frames and forwards
 * their bytes. It never decodes a frame.
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, {@code ByteBuf}) do not
 * escape this package. Inbound frames are copied into {@code byte[]} and every
 * reference-counted buffer is released here.
 *
 * <h2>Threading</h2>
 * A single event loop serves the acceptor and every connection, so listener
 * callbacks are serialized across all connections.
 */
public final class NettyBatchServer implements BatchServer
{
    private final InetSocketAddress bindAddress;

    private final EventLoopGroup group;
    private final ChannelGroup connections;
    private final Map<Integer, Channel> byId = new ConcurrentHashMap<>();
    private final AtomicInteger connectionIds = new AtomicInteger();

    private volatile BatchServerListener listener;
    private volatile Channel serverChannel;

    /**
     * @param bindAddress local address; port 0 picks an ephemeral port
     */
    public NettyBatchServer(InetSocketAddress bindAddress)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.group = new NioEventLoopGroup(1);
        this.connections = new DefaultChannelGroup("testtree-workers", GlobalEventExecutor.INSTANCE);
    }

    /** A server on an ephemeral loopback port. */
    public static NettyBatchServer loopback()
    {
        return new NettyBatchServer(new InetSocketAddress("127.0.0.1", 0));
    }

    @Override
    public void setListener(BatchServerListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public InetSocketAddress start()
    {
        if (listener == null) {
            throw new IllegalStateException("BatchServerListener must be set before start()");
        }

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(group)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        FrameChannels.addFraming(ch.pipeline());
                        ch.pipeline().addLast(new ConnectionHandler(connectionIds.incrementAndGet()));
                    }
                });

        ChannelFuture bound = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!bound.isSuccess()) {
            FrameChannels.shutdown(group);
            throw new TransportException("cannot bind coordinator to " + bindAddress, bound.cause());
        }
        serverChannel = bound.channel();
        return (InetSocketAddress) serverChannel.localAddress();
    }

    @Override
    public void send(int connection, byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");
        Channel ch = byId.get(connection);
        if (ch != null && ch.isActive()) {
            ch.writeAndFlush(Unpooled.wrappedBuffer(frame));
        }
    }

    @Override
    public void broadcast(byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");
        connections.writeAndFlush(Unpooled.wrappedBuffer(frame));
    }

    @Override
    public void stop()
    {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        connections.close().awaitUninterruptibly();
        FrameChannels.shutdown(group);
    }

    /**
     * ConnectionHandler
     * -------------------------------------------------------------------------
     * One per accepted connection; forwards whole frames to the listener.
     */
    private final class ConnectionHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        private final int connection;
        private boolean reportedDown;

        ConnectionHandler(int connection)
        {
            this.connection = connection;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            connections.add(ctx.channel());
            byId.put(connection, ctx.channel());
            listener.onConnected(connection);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame)
        {
            listener.onFrame(connection, FrameChannels.copy(frame));
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            down(null);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            down(cause);
            ctx.close();
        }

        private void down(Throwable cause)
        {
            if (!reportedDown) {
                reportedDown = true;
                byId.remove(connection);
                listener.onDisconnected(connection, cause);
            }
        }
    }
}
