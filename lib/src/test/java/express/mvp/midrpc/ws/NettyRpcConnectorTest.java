package express.mvp.midrpc.ws;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.midrpc.ClientException;
import express.mvp.midrpc.error.SocketRetryClassifier;
import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("NettyRpcConnector")
class NettyRpcConnectorTest {

    private static int closedPort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            return socket.getLocalPort();
        }
    }

    @Test
    @DisplayName("a refused dial fails with an error the socket classifier retries")
    void refusedDialIsTransient() throws IOException {
        WebSocketConfig config =
                WebSocketConfig.builder()
                        .host("127.0.0.1")
                        .username("admin")
                        .apiKey("1-secret")
                        .tls(false)
                        .connectTimeout(Duration.ofSeconds(5))
                        .fallback(new WebSocketClientTest.FakeFallback("25.04.0"))
                        .build();
        URI endpoint = URI.create("ws://127.0.0.1:" + closedPort() + WebSocketClient.API_PATH);

        NettyRpcConnector connector = new NettyRpcConnector();
        try {
            ClientException e =
                    assertThrows(ClientException.class, () -> connector.open(endpoint, config));
            assertTrue(new SocketRetryClassifier().isRetriable(e), e.getMessage());
        } finally {
            connector.close();
        }
    }
}
