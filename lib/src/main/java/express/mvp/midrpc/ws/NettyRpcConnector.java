package express.mvp.midrpc.ws;

import express.mvp.midrpc.ClientException;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import io.netty.util.concurrent.DefaultThreadFactory;
import java.net.URI;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;
import javax.net.ssl.SSLException;

/**
 * Opens WebSocket connections with Netty.
 *
 * <p>All connections share one single-threaded event loop, which is released by {@link #close()}.
 */
public final class NettyRpcConnector implements RpcConnector {

    private static final Logger LOGGER = Logger.getLogger(NettyRpcConnector.class.getName());

    private static final int MAX_FRAME_BYTES = 64 * 1024 * 1024;

    private final EventLoopGroup group =
            new NioEventLoopGroup(1, new DefaultThreadFactory("midrpc-ws-io", true));

    @Override
    public RpcConnection open(URI endpoint, WebSocketConfig config) {
        String host = endpoint.getHost();
        int port = endpoint.getPort();
        SslContext ssl = "wss".equals(endpoint.getScheme()) ? sslContext(config) : null;

        NettyRpcConnection connection =
                new NettyRpcConnection(
                        WebSocketClientHandshakerFactory.newHandshaker(
                                endpoint,
                                WebSocketVersion.V13,
                                null,
                                false,
                                new DefaultHttpHeaders(),
                                MAX_FRAME_BYTES));

        Bootstrap bootstrap =
                new Bootstrap()
                        .group(group)
                        .channel(NioSocketChannel.class)
                        .option(
                                ChannelOption.CONNECT_TIMEOUT_MILLIS,
                                (int) Math.min(Integer.MAX_VALUE, config.getConnectTimeout().toMillis()))
                        .handler(
                                new ChannelInitializer<SocketChannel>() {
                                    @Override
                                    protected void initChannel(SocketChannel ch) {
                                        ChannelPipeline p = ch.pipeline();
                                        if (ssl != null) {
                                            p.addLast(ssl.newHandler(ch.alloc(), host, port));
                                        }
                                        p.addLast(new HttpClientCodec());
                                        p.addLast(new HttpObjectAggregator(8192));
                                        p.addLast(new WebSocketFrameAggregator(MAX_FRAME_BYTES));
                                        p.addLast(connection);
                                    }
                                });

        long timeoutMillis = config.getConnectTimeout().toMillis();
        ChannelFuture connected = bootstrap.connect(host, port);
        Channel channel = connected.channel();
        try {
            if (!connected.await(timeoutMillis, TimeUnit.MILLISECONDS)) {
                channel.close();
                throw new ClientException("timed out connecting to " + host + ":" + port);
            }
            if (!connected.isSuccess()) {
                throw new ClientException(
                        "cannot connect to " + host + ":" + port + ": "
                                + connected.cause().getMessage(),
                        connected.cause());
            }
            ChannelFuture upgraded = connection.handshakeFuture();
            if (!upgraded.await(timeoutMillis, TimeUnit.MILLISECONDS)) {
                channel.close();
                throw new ClientException("timed out upgrading " + endpoint + " to WebSocket");
            }
            if (!upgraded.isSuccess()) {
                channel.close();
                throw new ClientException(
                        "WebSocket upgrade failed: " + upgraded.cause().getMessage(),
                        upgraded.cause());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            channel.close();
            throw new ClientException("interrupted while connecting to " + endpoint, e);
        }
        LOGGER.fine("WebSocket connected to " + endpoint);
        return connection;
    }

    private static SslContext sslContext(WebSocketConfig config) {
        try {
            SslContextBuilder builder = SslContextBuilder.forClient();
            if (config.isInsecureSkipVerify()) {
                builder.trustManager(InsecureTrustManagerFactory.INSTANCE);
            }
            return builder.build();
        } catch (SSLException e) {
            throw new ClientException("cannot initialise TLS: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }
}
