package com.questrail.mdoc.transport.l2cap.netty;

import com.questrail.mdoc.transport.l2cap.L2capChannel;
import com.questrail.mdoc.transport.l2cap.L2capChannelListener;
import com.questrail.mdoc.transport.l2cap.L2capConnector;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * NettyL2capConnector
 * =============================================================================
 * {@link L2capConnector} that emulates connection-oriented BLE channels with
 * TCP. The PSM becomes the port; the device id is resolved to a host.
 *
 * <p>Used by host-side test rigs and by deployments that tunnel the reader
 * link over IP.</p>
 *
 * <h2>Netty containment rule</h2>
 * Netty types never leave this package. Inbound frames are copied into
 * {@code byte[]} and every reference-counted buffer is released here.
 *
 * <h2>Framing</h2>
 * <pre>
 *   length (4 bytes, BE) | message
 * </pre>
 */
public final class NettyL2capConnector implements L2capConnector
{
    /** Upper bound on a single inbound message. */
    public static final int MAX_MESSAGE_SIZE = 16 * 1024 * 1024;

    private static final int LENGTH_FIELD_SIZE = 4;

    private final Function<String, String> hostResolver;
    private final EventLoopGroup group;

    /**
     * Connector that treats the device id as a host name or address.
     */
    public NettyL2capConnector()
    {
        this(Function.identity());
    }

    public NettyL2capConnector(Function<String, String> hostResolver)
    {
        this.hostResolver = Objects.requireNonNull(hostResolver, "hostResolver");
        this.group = new NioEventLoopGroup(1);
    }

    @Override
    public boolean isSupported()
    {
        return !group.isShuttingDown();
    }

    @Override
    public void connect(String deviceId, int psm, L2capChannelListener listener)
    {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(listener, "listener");

        InetSocketAddress remote = new InetSocketAddress(hostResolver.apply(deviceId), psm);
        ChannelAdapter adapter = new ChannelAdapter(listener);

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new LengthFieldBasedFrameDecoder(
                                MAX_MESSAGE_SIZE, 0, LENGTH_FIELD_SIZE, 0, LENGTH_FIELD_SIZE));
                        p.addLast(new LengthFieldPrepender(LENGTH_FIELD_SIZE));
                        p.addLast(adapter);
                    }
                });

        bootstrap.connect(remote).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                listener.onConnected(new NettyL2capChannel(future.channel(), adapter));
            }
            else {
                adapter.suppressClose();
                listener.onConnectFailed(future.cause());
            }
        });
    }

    /**
     * Closes all channels and stops the event loop.
     */
    public void shutdown()
    {
        group.shutdownGracefully();
    }

    /**
     * A failed write closes the channel and is reported as its close cause.
     */
    static final class NettyL2capChannel implements L2capChannel
    {
        private final Channel channel;
        private final ChannelAdapter adapter;

        NettyL2capChannel(Channel channel, ChannelAdapter adapter)
        {
            this.channel = channel;
            this.adapter = adapter;
        }

        @Override
        public void send(byte[] message)
        {
            Objects.requireNonNull(message, "message");
            channel.writeAndFlush(Unpooled.wrappedBuffer(message)).addListener((ChannelFutureListener) future -> {
                if (!future.isSuccess()) {
                    adapter.writeFailed(future.cause());
                    future.channel().close();
                }
            });
        }

        @Override
        public void close()
        {
            channel.close();
        }
    }

    /**
     * ChannelAdapter
     * -------------------------------------------------------------------------
     * Forwards de-framed messages and the channel's end of life to the port
     * listener. {@code onClosed} is delivered at most once.
     */
    static final class ChannelAdapter extends SimpleChannelInboundHandler<ByteBuf>
    {
        private final L2capChannelListener listener;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        ChannelAdapter(L2capChannelListener listener)
        {
            this.listener = listener;
        }

        void suppressClose()
        {
            closed.set(true);
        }

        void writeFailed(Throwable cause)
        {
            if (closed.compareAndSet(false, true)) {
                listener.onClosed(cause);
            }
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame)
        {
            byte[] bytes = new byte[frame.readableBytes()];
            frame.getBytes(frame.readerIndex(), bytes);
            listener.onMessage(bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            if (closed.compareAndSet(false, true)) {
                listener.onClosed(null);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            if (closed.compareAndSet(false, true)) {
                listener.onClosed(cause);
            }
            ctx.close();
        }
    }
}
