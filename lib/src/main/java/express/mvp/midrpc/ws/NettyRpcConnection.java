package express.mvp.midrpc.ws;

import express.mvp.midrpc.ClientException;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.util.concurrent.Future;
import java.nio.channels.ClosedChannelException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Netty pipeline handler that is also the {@link RpcConnection} for its channel.
 *
 * <p>Frames that arrive before {@link #start} are queued and served by {@link #receive}; {@link
 * #start} hands the remainder to the listener in arrival order.
 */
final class NettyRpcConnection extends SimpleChannelInboundHandler<Object>
        implements RpcConnection {

    private static final Logger LOGGER = Logger.getLogger(NettyRpcConnection.class.getName());

    private final WebSocketClientHandshaker handshaker;
    private final Object lock = new Object();
    private final Deque<String> inbox = new ArrayDeque<>();

    private ChannelPromise handshakeFuture;
    private volatile Channel channel;

    // guarded by lock
    private RpcConnectionListener listener;
    private Throwable closedCause;
    private boolean closedDelivered;

    NettyRpcConnection(WebSocketClientHandshaker handshaker) {
        this.handshaker = handshaker;
    }

    ChannelFuture handshakeFuture() {
        return handshakeFuture;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        handshakeFuture = ctx.newPromise();
        channel = ctx.channel();
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        handshaker.handshake(ctx.channel());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        if (!handshakeFuture.isDone()) {
            handshakeFuture.tryFailure(new ClosedChannelException());
        }
        closed(new ClientException("connection closed by peer"));
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        if (!handshaker.isHandshakeComplete()) {
            try {
                handshaker.finishHandshake(ctx.channel(), (FullHttpResponse) msg);
                handshakeFuture.trySuccess();
            } catch (RuntimeException e) {
                handshakeFuture.tryFailure(e);
            }
            return;
        }
        if (msg instanceof FullHttpResponse response) {
            throw new IllegalStateException(
                    "unexpected HTTP response after upgrade: " + response.status());
        }
        WebSocketFrame frame = (WebSocketFrame) msg;
        if (frame instanceof TextWebSocketFrame text) {
            text(text.text());
        } else if (frame instanceof PongWebSocketFrame) {
            pong();
        } else if (frame instanceof CloseWebSocketFrame close) {
            closed(new ClientException(
                    "server closed the connection: " + close.statusCode() + " " + close.reasonText()));
            ctx.channel().close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (!handshakeFuture.isDone()) {
            handshakeFuture.tryFailure(cause);
        }
        closed(cause);
        ctx.close();
    }

    @Override
    public void send(String text) {
        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            throw new ClientException("connection is closed");
        }
        ch.writeAndFlush(new TextWebSocketFrame(text)).addListener(this::onWriteComplete);
    }

    @Override
    public String receive(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (lock) {
            while (true) {
                if (listener != null) {
                    throw new IllegalStateException("receive() after start()");
                }
                String next = inbox.poll();
                if (next != null) {
                    return next;
                }
                if (closedCause != null) {
                    throw new ClientException(
                            "connection closed during handshake: " + closedCause.getMessage(),
                            closedCause);
                }
                long left = deadline - System.nanoTime();
                if (left <= 0) {
                    throw new ClientException("timed out waiting for handshake response");
                }
                try {
                    TimeUnit.NANOSECONDS.timedWait(lock, left);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ClientException("interrupted during handshake", e);
                }
            }
        }
    }

    @Override
    public void start(RpcConnectionListener l) {
        synchronized (lock) {
            if (listener != null) {
                throw new IllegalStateException("already started");
            }
            listener = l;
            String queued;
            while ((queued = inbox.poll()) != null) {
                l.onText(queued);
            }
            if (closedCause != null && !closedDelivered) {
                closedDelivered = true;
                l.onClosed(closedCause);
            }
        }
    }

    @Override
    public void ping() {
        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            throw new ClientException("connection is closed");
        }
        ch.writeAndFlush(new PingWebSocketFrame()).addListener(this::onWriteComplete);
    }

    @Override
    public void close() {
        Channel ch = channel;
        if (ch == null) {
            return;
        }
        if (ch.isActive()) {
            ch.writeAndFlush(new CloseWebSocketFrame()).addListener(ChannelFutureListener.CLOSE);
        } else {
            ch.close();
        }
    }

    private void onWriteComplete(Future<? super Void> f) {
        if (!f.isSuccess()) {
            closed(f.cause() != null ? f.cause() : new ClosedChannelException());
            Channel ch = channel;
            if (ch != null) {
                ch.close();
            }
        }
    }

    private void text(String text) {
        synchronized (lock) {
            if (listener == null) {
                inbox.add(text);
                lock.notifyAll();
                return;
            }
            listener.onText(text);
        }
    }

    private void pong() {
        synchronized (lock) {
            if (listener != null) {
                listener.onPong();
            }
        }
    }

    private void closed(Throwable cause) {
        synchronized (lock) {
            if (closedCause != null) {
                return;
            }
            closedCause = cause;
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("WebSocket channel closed: " + cause);
            }
            if (listener != null) {
                closedDelivered = true;
                listener.onClosed(cause);
            } else {
                lock.notifyAll();
            }
        }
    }
}
