package com.questrail.shepherd.transport.netty;

import com.questrail.shepherd.internal.exec.SerialExecutor;
import com.questrail.shepherd.transport.StreamBinder;
import com.questrail.shepherd.transport.StreamConnection;
import com.questrail.shepherd.transport.StreamConnectionListener;
import com.questrail.shepherd.transport.StreamConnector;
import com.questrail.shepherd.transport.StreamServer;

import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollDomainSocketChannel;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerDomainSocketChannel;
import io.netty.channel.kqueue.KQueue;
import io.netty.channel.kqueue.KQueueDomainSocketChannel;
import io.netty.channel.kqueue.KQueueEventLoopGroup;
import io.netty.channel.kqueue.KQueueServerDomainSocketChannel;
import io.netty.channel.unix.DomainSocketAddress;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * NettyDomainSocketTransport
 * =============================================================================
 * Netty-backed implementation of the {@link StreamConnector} and
 * {@link StreamBinder} ports over Unix domain sockets.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT decode
 * frames, interpret messages or schedule protocol timers of its own.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound chunks are copied into {@code byte[]}
 * and every reference-counted buffer is released here.
 *
 * <h2>Threading</h2>
 * The transport runs exactly one event-loop thread. Every connection, every
 * listener callback and every task submitted through {@link #serialExecutor()}
 * or {@link #callbackScheduler()} runs on it, which is what gives the session
 * manager its lock-free serial callback context.
 *
 * <h2>Native transport selection</h2>
 * Epoll on Linux, KQueue on macOS. There is no NIO fallback: JDK NIO cannot
 * drive Netty domain-socket channels on Java 17.
 */
public final class NettyDomainSocketTransport implements StreamConnector, StreamBinder, AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(NettyDomainSocketTransport.class);

    private final EventLoopGroup group;
    private final EventLoop loop;
    private final Class<? extends Channel> channelType;
    private final Class<? extends ServerChannel> serverChannelType;
    private final SerialExecutor serialExecutor;

    private NettyDomainSocketTransport(EventLoopGroup group,
                                       Class<? extends Channel> channelType,
                                       Class<? extends ServerChannel> serverChannelType)
    {
        this.group = group;
        this.loop = group.next();
        this.channelType = channelType;
        this.serverChannelType = serverChannelType;
        this.serialExecutor = new EventLoopSerialExecutor(loop);
    }

    /**
     * Create a transport with its own single event-loop thread.
     *
     * @param threadName prefix for the daemon event-loop thread
     * @throws IllegalStateException if neither epoll nor kqueue is usable
     */
    public static NettyDomainSocketTransport create(String threadName)
    {
        Objects.requireNonNull(threadName, "threadName");
        DefaultThreadFactory threads = new DefaultThreadFactory(threadName, true);

        if (Epoll.isAvailable()) {
            return new NettyDomainSocketTransport(
                    new EpollEventLoopGroup(1, threads),
                    EpollDomainSocketChannel.class,
                    EpollServerDomainSocketChannel.class);
        }
        if (KQueue.isAvailable()) {
            return new NettyDomainSocketTransport(
                    new KQueueEventLoopGroup(1, threads),
                    KQueueDomainSocketChannel.class,
                    KQueueServerDomainSocketChannel.class);
        }
        throw new IllegalStateException("No native Unix domain socket transport available", Epoll.unavailabilityCause());
    }

    /**
     * The serial callback context shared by every connection of this transport.
     */
    public SerialExecutor serialExecutor()
    {
        return serialExecutor;
    }

    /**
     * Scheduler whose tasks run on the same thread as connection callbacks.
     */
    public ScheduledExecutorService callbackScheduler()
    {
        return loop;
    }

    @Override
    public CompletableFuture<StreamConnection> connect(Path socketPath, StreamConnectionListener listener)
    {
        Objects.requireNonNull(socketPath, "socketPath");
        Objects.requireNonNull(listener, "listener");

        CompletableFuture<StreamConnection> result = new CompletableFuture<>();
        ConnectionHandler handler = new ConnectionHandler(listener);
        ChannelFuture f = new Bootstrap()
                .group(loop)
                .channel(channelType)
                .handler(handler)
                .connect(new DomainSocketAddress(socketPath.toFile()));

        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                result.complete(handler.connection(future.channel()));
            }
            else {
                result.completeExceptionally(new IOException(
                        "connect to " + socketPath + " failed", future.cause()));
            }
        });
        return result;
    }

    @Override
    public CompletableFuture<Boolean> probe(Path socketPath, Duration timeout)
    {
        Objects.requireNonNull(socketPath, "socketPath");
        Objects.requireNonNull(timeout, "timeout");

        CompletableFuture<Boolean> result = new CompletableFuture<>();
        final ChannelFuture f;
        try {
            f = new Bootstrap()
                    .group(loop)
                    .channel(channelType)
                    .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.max(1, timeout.toMillis()))
                    .handler(new ChannelInboundHandlerAdapter())
                    .connect(new DomainSocketAddress(socketPath.toFile()));
        }
        catch (RuntimeException e) {
            log.debug("probe of {} could not start: {}", socketPath, e.toString());
            result.complete(false);
            return result;
        }

        io.netty.util.concurrent.ScheduledFuture<?> timer = loop.schedule(() -> {
            if (result.complete(false)) {
                f.channel().close();
            }
        }, timeout.toNanos(), TimeUnit.NANOSECONDS);

        f.addListener((ChannelFutureListener) future -> {
            timer.cancel(false);
            if (future.isSuccess()) {
                future.channel().close();
                result.complete(true);
            }
            else {
                result.complete(false);
            }
        });
        return result;
    }

    @Override
    public StreamServer bind(Path socketPath, Supplier<? extends StreamConnectionListener> listeners) throws IOException
    {
        Objects.requireNonNull(socketPath, "socketPath");
        Objects.requireNonNull(listeners, "listeners");

        ChannelFuture f = new ServerBootstrap()
                .group(loop, loop)
                .channel(serverChannelType)
                .childHandler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch)
                    {
                        ch.pipeline().addLast(new ConnectionHandler(listeners.get()));
                    }
                })
                .bind(new DomainSocketAddress(socketPath.toFile()));

        f.awaitUninterruptibly();
        if (!f.isSuccess()) {
            throw new IOException("bind to " + socketPath + " failed", f.cause());
        }

        log.debug("listening on {}", socketPath);
        return new NettyStreamServer(socketPath, f.channel());
    }

    /**
     * Shut down the event loop. Open connections are closed.
     */
    @Override
    public void close()
    {
        io.netty.util.concurrent.Future<?> done = group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        if (!loop.inEventLoop()) {
            done.awaitUninterruptibly(5, TimeUnit.SECONDS);
        }
    }

    // -------------------------------------------------------------------------

    private static final class EventLoopSerialExecutor implements SerialExecutor
    {
        private final EventLoop loop;

        private EventLoopSerialExecutor(EventLoop loop)
        {
            this.loop = loop;
        }

        @Override
        public void execute(Runnable task)
        {
            loop.execute(task);
        }

        @Override
        public boolean inSerialContext()
        {
            return loop.inEventLoop();
        }
    }

    private static final class NettyStreamConnection implements StreamConnection
    {
        private final Channel channel;

        private NettyStreamConnection(Channel channel)
        {
            this.channel = channel;
        }

        @Override
        public void send(byte[] bytes)
        {
            Objects.requireNonNull(bytes, "bytes");
            ByteBuf buf = Unpooled.wrappedBuffer(bytes);
            // Always queue, so writes from any thread keep their call order.
            channel.eventLoop().execute(() -> {
                if (channel.isActive()) {
                    channel.writeAndFlush(buf);
                }
                else {
                    ReferenceCountUtil.release(buf);
                }
            });
        }

        @Override
        public void close()
        {
            channel.close();
        }

        @Override
        public boolean isOpen()
        {
            return channel.isActive();
        }

        @Override
        public String toString()
        {
            return "NettyStreamConnection[" + channel.id().asShortText() + ']';
        }
    }

    private static final class NettyStreamServer implements StreamServer
    {
        private final Path socketPath;
        private final Channel channel;

        private NettyStreamServer(Path socketPath, Channel channel)
        {
            this.socketPath = socketPath;
            this.channel = channel;
        }

        @Override
        public Path socketPath()
        {
            return socketPath;
        }

        @Override
        public void close()
        {
            channel.close().awaitUninterruptibly(2, TimeUnit.SECONDS);
        }
    }

    /**
     * ConnectionHandler
     * -------------------------------------------------------------------------
     * Bridges one channel's lifecycle and inbound bytes to a port listener.
     */
    private static final class ConnectionHandler extends ChannelInboundHandlerAdapter
    {
        private final StreamConnectionListener listener;
        private NettyStreamConnection connection;
        private Throwable cause;
        private boolean closed;

        private ConnectionHandler(StreamConnectionListener listener)
        {
            this.listener = Objects.requireNonNull(listener, "listener");
        }

        private NettyStreamConnection connection(Channel channel)
        {
            if (connection == null) {
                connection = new NettyStreamConnection(channel);
            }
            return connection;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            listener.onOpen(connection(ctx.channel()));
            ctx.fireChannelActive();
        }

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg)
        {
            try {
                if (msg instanceof ByteBuf) {
                    ByteBuf in = (ByteBuf) msg;
                    byte[] bytes = new byte[in.readableBytes()];
                    in.getBytes(in.readerIndex(), bytes);
                    listener.onBytes(connection(ctx.channel()), bytes);
                }
            }
            finally {
                ReferenceCountUtil.release(msg);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.debug("connection {} failed: {}", ctx.channel().id().asShortText(), cause.toString());
            if (this.cause == null) {
                this.cause = cause;
            }
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            if (!closed) {
                closed = true;
                listener.onClosed(connection(ctx.channel()), cause);
            }
            ctx.fireChannelInactive();
        }
    }
}
