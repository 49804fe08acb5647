package com.wangbin.hoststats.core.socket;

import com.wangbin.hoststats.config.StatsProperties;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollDomainSocketChannel;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.unix.DomainSocketAddress;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * 基于 Netty epoll 的 Unix 域套接字传输
 */
@Slf4j
@Component
public class UnixSocketTransport implements SocketTransport, DisposableBean {

    private final StatsProperties.SocketConfig config;
    private EventLoopGroup workerGroup;

    public UnixSocketTransport(StatsProperties properties) {
        this.config = properties.getSocket();
    }

    @Override
    public SocketConnection open(Path socketPath) throws IOException {
        if (!Epoll.isAvailable()) {
            throw new IOException("当前平台不支持Unix域套接字", Epoll.unavailabilityCause());
        }

        FrameHandler handler = new FrameHandler(socketPath);
        Bootstrap bootstrap = new Bootstrap()
                .group(workerGroup())
                .channel(EpollDomainSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, config.getConnectTimeoutMs())
                .handler(new ChannelInitializer<EpollDomainSocketChannel>() {
                    @Override
                    protected void initChannel(EpollDomainSocketChannel ch) {
                        FrameCodec.install(ch.pipeline(), config.getMaxFrameLength());
                        ch.pipeline().addLast("frameHandler", handler);
                    }
                });

        ChannelFuture future = bootstrap.connect(new DomainSocketAddress(socketPath.toFile()));
        future.awaitUninterruptibly();
        if (!future.isSuccess()) {
            throw new IOException("连接套接字失败: " + socketPath, future.cause());
        }

        log.debug("套接字连接建立成功: {}", socketPath);
        return new NettySocketConnection(future.channel(), handler, config.getReadTimeoutMs());
    }

    private synchronized EventLoopGroup workerGroup() {
        if (workerGroup == null) {
            workerGroup = new EpollEventLoopGroup(1);
        }
        return workerGroup;
    }

    @Override
    public synchronized void destroy() {
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
    }

    /**
     * 单个请求的连接
     */
    private static class NettySocketConnection implements SocketConnection {

        private final Channel channel;
        private final FrameHandler handler;
        private final long readTimeoutMs;

        NettySocketConnection(Channel channel, FrameHandler handler, long readTimeoutMs) {
            this.channel = channel;
            this.handler = handler;
            this.readTimeoutMs = readTimeoutMs;
        }

        @Override
        public void send(byte[] data) throws IOException {
            ChannelFuture future = channel.writeAndFlush(data).awaitUninterruptibly();
            if (!future.isSuccess()) {
                throw new IOException("套接字发送失败: " + handler.socketPath, future.cause());
            }
        }

        @Override
        public byte[] receive() throws IOException {
            byte[] data;
            try {
                data = handler.receive(readTimeoutMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("等待套接字响应时被中断", e);
            }
            if (data == null) {
                throw new IOException("等待套接字响应超时: " + handler.socketPath);
            }
            if (data == FrameHandler.CLOSED) {
                throw new IOException("套接字在响应前关闭: " + handler.socketPath, handler.failure);
            }
            return data;
        }

        @Override
        public void close() {
            if (channel.isOpen()) {
                channel.close().awaitUninterruptibly();
                log.debug("套接字连接关闭: {}", handler.socketPath);
            }
        }
    }

    /**
     * 帧处理器，把收到的帧放入队列
     */
    private static class FrameHandler extends ChannelInboundHandlerAdapter {

        // 连接关闭标记
        static final byte[] CLOSED = new byte[0];

        private final Path socketPath;
        private final BlockingQueue<byte[]> receiveQueue = new LinkedBlockingQueue<>();
        private volatile Throwable failure;

        FrameHandler(Path socketPath) {
            this.socketPath = socketPath;
        }

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg) {
            if (msg instanceof byte[] data) {
                log.debug("收到套接字数据: {} bytes", data.length);
                receiveQueue.offer(data);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            receiveQueue.offer(CLOSED);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.error("套接字连接异常: {}", socketPath, cause);
            failure = cause;
            ctx.close();
        }

        byte[] receive(long timeoutMs) throws InterruptedException {
            if (timeoutMs <= 0) {
                return receiveQueue.take();
            }
            return receiveQueue.poll(timeoutMs, TimeUnit.MILLISECONDS);
        }
    }
}
