package com.trueform.client.transport;

import com.trueform.common.config.TrueNasSettings;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Dials the TrueNAS WebSocket API with OkHttp.
 */
@Slf4j
public class OkHttpTransportDialer implements TransportDialer {

    public static final String API_PATH = "/api/current";
    private static final Duration PING_INTERVAL = Duration.ofSeconds(30);

    private final HttpUrl url;
    private final OkHttpClient client;

    /**
     * @param url       WebSocket endpoint; {@code ws}/{@code wss} and {@code http}/{@code https} are accepted
     * @param verifySsl whether the server certificate is checked
     * @param timeout   connect, handshake and write timeout
     */
    public OkHttpTransportDialer(String url, boolean verifySsl, Duration timeout) {
        this.url = parse(url);
        this.client = buildClient(verifySsl, timeout);
    }

    /**
     * Dialer for {@code wss://<host>/api/current}.
     */
    public static OkHttpTransportDialer forSettings(TrueNasSettings settings) {
        return new OkHttpTransportDialer("wss://" + settings.getHost() + API_PATH,
                settings.isVerifySsl(), settings.effectiveTimeout());
    }

    private static HttpUrl parse(String url) {
        // OkHttp's HttpUrl only knows http(s); WebSocket requests accept both spellings
        String normalized = url;
        if (url.regionMatches(true, 0, "ws:", 0, 3)) {
            normalized = "http:" + url.substring(3);
        } else if (url.regionMatches(true, 0, "wss:", 0, 4)) {
            normalized = "https:" + url.substring(4);
        }
        HttpUrl parsed = HttpUrl.parse(normalized);
        if (parsed == null) {
            throw new IllegalArgumentException("invalid endpoint URL: " + url);
        }
        return parsed;
    }

    private static OkHttpClient buildClient(boolean verifySsl, Duration timeout) {
        OkHttpClient.Builder builder = new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .writeTimeout(timeout)
                .readTimeout(Duration.ZERO) // idle reads are bounded by pings
                .pingInterval(PING_INTERVAL);
        if (!verifySsl) {
            try {
                InsecureTls.apply(builder);
            } catch (GeneralSecurityException e) {
                throw new IllegalStateException("TLS setup failed", e);
            }
            log.warn("TLS certificate verification is disabled; the server certificate will not be checked");
        }
        return builder.build();
    }

    @Override
    public Transport dial(Duration timeout) throws IOException, InterruptedException {
        OkHttpTransport transport = new OkHttpTransport();
        WebSocket socket = client.newWebSocket(new Request.Builder().url(url).build(), transport.listener());
        transport.attach(socket);

        if (!transport.awaitOpen(timeout)) {
            socket.cancel();
            throw new IOException("WebSocket handshake timeout after " + timeout.toMillis() + "ms");
        }
        Throwable failure = transport.openFailure();
        if (failure != null) {
            throw failure instanceof IOException io ? io : new IOException(failure.getMessage(), failure);
        }
        log.debug("WebSocket open to {}", target());
        return transport;
    }

    @Override
    public String target() {
        return url.host() + (url.port() == HttpUrl.defaultPort(url.scheme()) ? "" : ":" + url.port());
    }

    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }

    /**
     * An OkHttp WebSocket adapted to the pull-based {@link Transport} contract.
     */
    static final class OkHttpTransport extends QueuedTransport {

        private final CountDownLatch openLatch = new CountDownLatch(1);
        private final AtomicReference<Throwable> openFailure = new AtomicReference<>();
        private volatile WebSocket socket;

        void attach(WebSocket socket) {
            this.socket = socket;
        }

        boolean awaitOpen(Duration timeout) throws InterruptedException {
            return openLatch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
        }

        Throwable openFailure() {
            return openFailure.get();
        }

        @Override
        public void send(String text) throws IOException {
            WebSocket ws = socket;
            if (ws == null || isClosed() || !ws.send(text)) {
                throw new IOException("WebSocket is closed");
            }
        }

        @Override
        protected void doClose() {
            WebSocket ws = socket;
            if (ws != null) {
                ws.close(Frame.NORMAL_CLOSURE, "done");
            }
        }

        WebSocketListener listener() {
            return new WebSocketListener() {
                @Override
                public void onOpen(WebSocket ws, Response response) {
                    openLatch.countDown();
                }

                @Override
                public void onMessage(WebSocket ws, String text) {
                    enqueue(Frame.text(text));
                }

                @Override
                public void onMessage(WebSocket ws, ByteString bytes) {
                    enqueue(Frame.text(bytes.utf8()));
                }

                @Override
                public void onClosing(WebSocket ws, int code, String reason) {
                    ws.close(Frame.replyCloseCode(code), null);
                    enqueue(Frame.closed(code, reason));
                }

                @Override
                public void onClosed(WebSocket ws, int code, String reason) {
                    enqueue(Frame.closed(code, reason));
                }

                @Override
                public void onFailure(WebSocket ws, Throwable t, Response response) {
                    if (openLatch.getCount() > 0) {
                        openFailure.compareAndSet(null, t);
                        openLatch.countDown();
                        return;
                    }
                    enqueue(Frame.failed(t));
                }
            };
        }
    }
}
