package com.questrail.mdoc.transport.l2cap.netty;

import com.questrail.mdoc.transport.l2cap.L2capChannel;
import com.questrail.mdoc.transport.l2cap.L2capChannelListener;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOutboundHandlerAdapter;
import io.netty.channel.ChannelPromise;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.util.ReferenceCountUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyL2capConnectorTest
 * -----------------------------------------------------------------------------
 * Runs the connector against a loopback echo server that speaks the same
 * length-prefixed framing.
 */
class NettyL2capConnectorTest {

    private EventLoopGroup serverGroup;
    private Channel serverChannel;
    private NettyL2capConnector connector;

    @BeforeEach
    void setUp() throws InterruptedException {
        serverGroup = new NioEventLoopGroup(1);
        serverChannel = new ServerBootstrap()
                .group(serverGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(
                                new LengthFieldBasedFrameDecoder(1 << 20, 0, 4, 0, 4),
                                new LengthFieldPrepender(4),
                                new SimpleChannelInboundHandler<ByteBuf>() {
                                    @Override
                                    protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg) {
                                        if (msg.readableBytes() == 1 && msg.getByte(msg.readerIndex()) == 'q') {
                                            ctx.close();
                                            return;
                                        }
                                        ctx.writeAndFlush(msg.retain());
                                    }
                                });
                    }
                })
                .bind("127.0.0.1", 0)
                .sync()
                .channel();

        connector = new NettyL2capConnector(deviceId -> "127.0.0.1");
    }

    @AfterEach
    void tearDown() {
        connector.shutdown();
        serverChannel.close();
        serverGroup.shutdownGracefully();
    }

    private int port() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    @Test
    void wholeMessagesRoundTripThroughEchoServer() throws Exception {
        QueueingListener listener = new QueueingListener();

        connector.connect("reader-1", port(), listener);
        L2capChannel channel = listener.connected.get(5, TimeUnit.SECONDS);

        byte[] large = new byte[70_000];
        for (int i = 0; i < large.length; i++) {
            large[i] = (byte) i;
        }
        channel.send(new byte[] { 1, 2, 3 });
        channel.send(large);

        assertArrayEquals(new byte[] { 1, 2, 3 }, listener.messages.poll(5, TimeUnit.SECONDS));
        assertArrayEquals(large, listener.messages.poll(5, TimeUnit.SECONDS));

        channel.close();
        assertEquals(QueueingListener.ORDERLY, listener.closed.get(5, TimeUnit.SECONDS));
    }

    @Test
    void peerCloseIsReportedOnce() throws Exception {
        QueueingListener listener = new QueueingListener();

        connector.connect("reader-1", port(), listener);
        L2capChannel channel = listener.connected.get(5, TimeUnit.SECONDS);
        channel.send(new byte[] { 'q' });

        assertEquals(QueueingListener.ORDERLY, listener.closed.get(5, TimeUnit.SECONDS));
        channel.close();
        assertEquals(1, listener.closeCount);
    }

    @Test
    void refusedConnectionReportsFailure() throws Exception {
        int unused = port();
        serverChannel.close().sync();
        QueueingListener listener = new QueueingListener();

        connector.connect("reader-1", unused, listener);

        assertNotNull(listener.failed.get(5, TimeUnit.SECONDS));
        assertFalse(listener.closed.isDone());
    }

    @Test
    void failedWriteClosesChannelWithCause() {
        QueueingListener listener = new QueueingListener();
        NettyL2capConnector.ChannelAdapter adapter = new NettyL2capConnector.ChannelAdapter(listener);
        EmbeddedChannel embedded = new EmbeddedChannel(new ChannelOutboundHandlerAdapter() {
            @Override
            public void write(ChannelHandlerContext ctx, Object msg, ChannelPromise promise) {
                ReferenceCountUtil.release(msg);
                promise.setFailure(new IOException("link reset"));
            }
        }, adapter);
        L2capChannel channel = new NettyL2capConnector.NettyL2capChannel(embedded, adapter);

        channel.send(new byte[] { 1, 2, 3 });
        embedded.runPendingTasks();

        Throwable cause = listener.closed.getNow(null);
        assertInstanceOf(IOException.class, cause);
        assertEquals(1, listener.closeCount);
        assertFalse(embedded.isOpen());
    }

    @Test
    void unsupportedAfterShutdown() {
        assertTrue(connector.isSupported());
        connector.shutdown();
        assertFalse(connector.isSupported());
    }

    private static final class QueueingListener implements L2capChannelListener {
        static final Throwable ORDERLY = new Throwable("orderly");

        final CompletableFuture<L2capChannel> connected = new CompletableFuture<>();
        final CompletableFuture<Throwable> failed = new CompletableFuture<>();
        final CompletableFuture<Throwable> closed = new CompletableFuture<>();
        final BlockingQueue<byte[]> messages = new LinkedBlockingQueue<>();
        volatile int closeCount;

        @Override
        public void onConnected(L2capChannel channel) {
            connected.complete(channel);
        }

        @Override
        public void onConnectFailed(Throwable cause) {
            failed.complete(cause);
        }

        @Override
        public void onMessage(byte[] message) {
            messages.add(message);
        }

        @Override
        public void onClosed(Throwable cause) {
            closeCount++;
            closed.complete(cause == null ? ORDERLY : cause);
        }
    }
}
