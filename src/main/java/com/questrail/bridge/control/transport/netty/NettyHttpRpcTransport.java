package com.questrail.bridge.control.transport.netty;

import com.questrail.bridge.control.transport.RpcTransport;
import com.questrail.bridge.control.transport.RpcTransportException;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollDomainSocketChannel;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.channel.unix.DomainSocketAddress;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * NettyHttpRpcTransport
 * =============================================================================
 * Netty-backed implementation of the {@link RpcTransport} port, speaking
 * HTTP/1.1 POST to the daemon's XML-RPC endpoint.
 *
 * <p>Two endpoint forms are accepted:</p>
 * <ul>
 *   <li>{@code http://host[:port]/path}: TCP on the NIO event loop; the
 *       request goes to {@code path}.</li>
 *   <li>{@code unix:///path/to/socket}: the daemon's local socket, through
 *       Netty's native epoll domain-socket channel (Linux only); the request
 *       goes to {@code /RPC2}.</li>
 * </ul>
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It does not encode
 * or decode XML-RPC and does not retry.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Response bodies are copied into
 * {@code byte[]} and every reference-counted buffer is released here.
 *
 * <h2>Connection handling</h2>
 * One keep-alive connection is reused across calls and at most one call is in
 * flight. After a timeout or any failure the connection is closed, so the next
 * call starts on a fresh socket and never reads a stale reply.
 */
public final class NettyHttpRpcTransport implements RpcTransport
{
    private static final Logger log = LoggerFactory.getLogger(NettyHttpRpcTransport.class);

    static final String DOMAIN_SOCKET_REQUEST_PATH = "/RPC2";

    private final URI endpoint;
    private final SocketAddress remoteAddress;
    private final String hostHeader;
    private final String requestPath;
    private final String authorization;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private Channel channel;
    private volatile CompletableFuture<FullHttpResponse> pending;
    private volatile boolean closed;

    public NettyHttpRpcTransport(URI endpoint)
    {
        this(endpoint, null, null);
    }

    /**
     * @param endpoint {@code http://host:port/path} or {@code unix:///socket/path}
     * @param username basic-auth user, or {@code null}
     * @param password basic-auth password, or {@code null}
     * @throws IllegalArgumentException for any other scheme, a missing host or socket path
     * @throws IllegalStateException    for a {@code unix://} endpoint where native epoll is unavailable
     */
    public NettyHttpRpcTransport(URI endpoint, String username, String password)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        String scheme = endpoint.getScheme();
        if ("http".equalsIgnoreCase(scheme)) {
            if (endpoint.getHost() == null) {
                throw new IllegalArgumentException("Endpoint has no host: " + endpoint);
            }
            int port = endpoint.getPort() > 0 ? endpoint.getPort() : 80;
            this.remoteAddress = InetSocketAddress.createUnresolved(endpoint.getHost(), port);
            this.hostHeader = endpoint.getHost() + ":" + port;
            this.requestPath = endpoint.getRawPath() == null || endpoint.getRawPath().isEmpty()
                    ? "/"
                    : endpoint.getRawPath();
            this.group = new NioEventLoopGroup(1);
            this.bootstrap = new Bootstrap()
                    .group(group)
                    .channel(NioSocketChannel.class)
                    .option(ChannelOption.TCP_NODELAY, true);
        } else if ("unix".equalsIgnoreCase(scheme)) {
            if (endpoint.getPath() == null || endpoint.getPath().isEmpty()) {
                throw new IllegalArgumentException("Endpoint has no socket path: " + endpoint);
            }
            if (!Epoll.isAvailable()) {
                throw new IllegalStateException(
                        "Native epoll transport unavailable for " + endpoint, Epoll.unavailabilityCause());
            }
            this.remoteAddress = new DomainSocketAddress(endpoint.getPath());
            this.hostHeader = "localhost";
            this.requestPath = DOMAIN_SOCKET_REQUEST_PATH;
            this.group = new EpollEventLoopGroup(1);
            this.bootstrap = new Bootstrap()
                    .group(group)
                    .channel(EpollDomainSocketChannel.class);
        } else {
            throw new IllegalArgumentException("Only http:// and unix:// endpoints are supported: " + endpoint);
        }
        this.authorization = (username == null || username.isEmpty())
                ? null
                : "Basic " + Base64.getEncoder().encodeToString(
                        (username + ":" + (password == null ? "" : password)).getBytes(StandardCharsets.UTF_8));

        bootstrap.handler(new ChannelInitializer<Channel>() {
            @Override
            protected void initChannel(Channel ch)
            {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new HttpClientCodec());
                p.addLast(new HttpObjectAggregator(16 * 1024 * 1024));
                p.addLast(new ResponseHandler());
            }
        });
    }

    public URI endpoint()
    {
        return endpoint;
    }

    @Override
    public synchronized byte[] call(byte[] body, Duration timeout) throws RpcTransportException
    {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(timeout, "timeout");
        if (closed) {
            throw new RpcTransportException("Transport closed", false);
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        Channel ch = connect(timeout);

        CompletableFuture<FullHttpResponse> future = new CompletableFuture<>();
        pending = future;
        ch.writeAndFlush(buildRequest(body)).addListener(f -> {
            if (!f.isSuccess()) {
                future.completeExceptionally(f.cause());
            }
        });

        FullHttpResponse response;
        try {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            response = future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            dropConnection();
            throw new RpcTransportException("No reply from " + endpoint + " within " + timeout.toMillis() + " ms", true);
        } catch (ExecutionException e) {
            dropConnection();
            throw new RpcTransportException("Request to " + endpoint + " failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            dropConnection();
            throw new RpcTransportException("Interrupted waiting for " + endpoint, e);
        } finally {
            pending = null;
        }

        try {
            if (!HttpResponseStatus.OK.equals(response.status())) {
                dropConnection();
                throw new RpcTransportException("HTTP " + response.status() + " from " + endpoint, false);
            }
            if (!HttpUtil.isKeepAlive(response)) {
                dropConnection();
            }

            ByteBuf content = response.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);
            return bytes;
        } finally {
            response.release();
        }
    }

    private Channel connect(Duration timeout) throws RpcTransportException
    {
        Channel ch = channel;
        if (ch != null && ch.isActive()) {
            return ch;
        }

        ChannelFuture f = bootstrap.connect(remoteAddress);
        boolean done = f.awaitUninterruptibly(Math.max(1L, timeout.toMillis()), TimeUnit.MILLISECONDS);
        if (!done) {
            f.cancel(false);
            f.channel().close();
            throw new RpcTransportException("Connect to " + endpoint + " timed out", true);
        }
        if (!f.isSuccess()) {
            throw new RpcTransportException("Cannot connect to " + endpoint, f.cause());
        }

        channel = f.channel();
        log.debug("Connected to {}", endpoint);
        return channel;
    }

    private FullHttpRequest buildRequest(byte[] body)
    {
        FullHttpRequest req = new DefaultFullHttpRequest(
                HttpVersion.HTTP_1_1, HttpMethod.POST, requestPath, Unpooled.wrappedBuffer(body));
        req.headers()
                .set(HttpHeaderNames.HOST, hostHeader)
                .set(HttpHeaderNames.CONTENT_TYPE, "text/xml")
                .set(HttpHeaderNames.CONTENT_LENGTH, body.length)
                .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
        if (authorization != null) {
            req.headers().set(HttpHeaderNames.AUTHORIZATION, authorization);
        }
        return req;
    }

    private void dropConnection()
    {
        Channel ch = channel;
        channel = null;
        if (ch != null) {
            ch.close();
        }
    }

    @Override
    public synchronized void close()
    {
        if (closed) {
            return;
        }
        closed = true;
        dropConnection();
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

    /**
     * ResponseHandler
     * -------------------------------------------------------------------------
     * Hands the aggregated response to the waiting caller. A response nobody
     * is waiting for is released and dropped.
     */
    private final class ResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse>
    {
        ResponseHandler()
        {
            super(false);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse response)
        {
            CompletableFuture<FullHttpResponse> f = pending;
            if (f == null || !f.complete(response)) {
                response.release();
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            CompletableFuture<FullHttpResponse> f = pending;
            if (f != null) {
                f.completeExceptionally(new RpcTransportException("Connection closed by " + endpoint, false));
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            CompletableFuture<FullHttpResponse> f = pending;
            if (f != null) {
                f.completeExceptionally(cause);
            }
            ctx.close();
        }
    }
}
