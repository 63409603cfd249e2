package in.tickvault.infrastructure.provider;

import in.tickvault.domain.model.ProviderRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.net.http.WebSocketHandshakeException;
import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link LiveStream} over java.net.http WebSocket.
 *
 * Flow control: one message is requested from the socket at a time and the
 * next request is only issued after the consumer has taken the previous one
 * out of the queue, so the queue never holds more than a handful of frames.
 */
public class WebSocketLiveStream implements LiveStream, WebSocket.Listener {
    private static final Logger log = LoggerFactory.getLogger(WebSocketLiveStream.class);

    private static final int QUEUE_CAPACITY = 16;

    /**
     * Turns one complete text message into zero or more records.
     */
    @FunctionalInterface
    public interface Decoder {
        List<ProviderRecord> decode(String payload, Instant receivedAt);
    }

    private enum FrameKind { TEXT, KEEPALIVE, CLOSED }

    private record Frame(FrameKind kind, String payload, Instant receivedAt) {}

    private final String provider;
    private final String symbol;
    private final Decoder decoder;
    private final Clock clock;

    private final BlockingQueue<Frame> frames = new ArrayBlockingQueue<>(QUEUE_CAPACITY);
    private final Deque<ProviderRecord> pending = new ArrayDeque<>();
    private final StringBuilder messageBuffer = new StringBuilder();

    private volatile WebSocket webSocket;
    private volatile String terminalReason;

    WebSocketLiveStream(String provider, String symbol, Decoder decoder, Clock clock) {
        this.provider = provider;
        this.symbol = symbol;
        this.decoder = decoder;
        this.clock = clock;
    }

    /**
     * Open the socket and send the initial messages (auth, subscribe) in order.
     */
    public static WebSocketLiveStream connect(HttpClient httpClient, URI uri,
                                              String provider, String symbol,
                                              Decoder decoder, List<String> initialMessages,
                                              Duration connectTimeout, Clock clock) {
        WebSocketLiveStream stream = new WebSocketLiveStream(provider, symbol, decoder, clock);
        log.info("[{}:{}] Connecting live stream {}", provider, symbol, uri.getHost());

        try {
            WebSocket ws = httpClient.newWebSocketBuilder()
                .connectTimeout(connectTimeout)
                .buildAsync(uri, stream)
                .get(connectTimeout.toMillis() + 1000, TimeUnit.MILLISECONDS);
            stream.webSocket = ws;

            for (String message : initialMessages) {
                ws.sendText(message, true).get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            return stream;

        } catch (ExecutionException e) {
            stream.abort();
            Throwable cause = e.getCause();
            if (cause instanceof WebSocketHandshakeException handshake && handshake.getResponse() != null) {
                int status = handshake.getResponse().statusCode();
                if (status == 401 || status == 403) {
                    throw new ProviderAuthenticationException(provider, symbol,
                        "WebSocket handshake rejected - HTTP " + status, cause);
                }
                if (status == 429) {
                    throw new RateLimitedException(provider, symbol, Duration.ofSeconds(1));
                }
                throw new TransientProviderException(provider, symbol,
                    "WebSocket handshake failed - HTTP " + status, cause);
            }
            throw new TransientProviderException(provider, symbol,
                "WebSocket connect failed: " + (cause != null ? cause.getMessage() : e.getMessage()), e);
        } catch (TimeoutException e) {
            stream.abort();
            throw new TransientProviderException(provider, symbol,
                "WebSocket connect timed out after " + connectTimeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            stream.abort();
            Thread.currentThread().interrupt();
            throw new CancellationException("[" + provider + ":" + symbol + "] Connect interrupted");
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // CONSUMER SIDE
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public ProviderRecord poll(Duration timeout) throws InterruptedException {
        ProviderRecord buffered = pending.pollFirst();
        if (buffered != null) {
            return buffered;
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            if (frames.isEmpty() && terminalReason != null) {
                throw new TransientProviderException(provider, symbol, "Stream closed: " + terminalReason);
            }

            long remaining = deadline - System.nanoTime();
            Frame frame = frames.poll(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
            if (frame == null) {
                if (terminalReason != null) {
                    throw new TransientProviderException(provider, symbol, "Stream closed: " + terminalReason);
                }
                return null;
            }

            switch (frame.kind()) {
                case CLOSED -> throw new TransientProviderException(provider, symbol,
                    "Stream closed: " + frame.payload());
                case KEEPALIVE -> {
                    requestNext();
                    return ProviderRecord.keepalive(provider, frame.receivedAt(), null);
                }
                case TEXT -> {
                    requestNext();
                    List<ProviderRecord> records = decode(frame);
                    if (!records.isEmpty()) {
                        pending.addAll(records.subList(1, records.size()));
                        return records.get(0);
                    }
                    if (System.nanoTime() >= deadline) {
                        return null;
                    }
                }
            }
        }
    }

    @Override
    public boolean isOpen() {
        return terminalReason == null && webSocket != null;
    }

    @Override
    public void close() {
        if (terminalReason == null) {
            terminalReason = "closed by client";
        }
        frames.offer(new Frame(FrameKind.CLOSED, terminalReason, clock.instant()));

        WebSocket ws = webSocket;
        if (ws != null && !ws.isOutputClosed()) {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "client close")
                .orTimeout(2, TimeUnit.SECONDS)
                .whenComplete((ignored, error) -> ws.abort());
        }
    }

    private List<ProviderRecord> decode(Frame frame) {
        try {
            return decoder.decode(frame.payload(), frame.receivedAt());
        } catch (ProviderException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MalformedPayloadException(provider, symbol, frame.payload(), e);
        }
    }

    private void requestNext() {
        WebSocket ws = webSocket;
        if (ws != null && terminalReason == null) {
            ws.request(1);
        }
    }

    private void abort() {
        terminalReason = "aborted";
        WebSocket ws = webSocket;
        if (ws != null) {
            ws.abort();
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // LISTENER SIDE (HttpClient threads)
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public void onOpen(WebSocket ws) {
        log.info("[{}:{}] WebSocket open", provider, symbol);
        this.webSocket = ws;
        ws.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
        messageBuffer.append(data);
        if (!last) {
            ws.request(1);
            return null;
        }
        String message = messageBuffer.toString();
        messageBuffer.setLength(0);
        enqueue(new Frame(FrameKind.TEXT, message, clock.instant()));
        return null;
    }

    @Override
    public CompletionStage<?> onPing(WebSocket ws, ByteBuffer message) {
        enqueue(new Frame(FrameKind.KEEPALIVE, null, clock.instant()));
        return null;
    }

    @Override
    public CompletionStage<?> onPong(WebSocket ws, ByteBuffer message) {
        enqueue(new Frame(FrameKind.KEEPALIVE, null, clock.instant()));
        return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
        log.info("[{}:{}] WebSocket closed by provider: {} - {}", provider, symbol, statusCode, reason);
        terminal("remote close " + statusCode + (reason == null || reason.isEmpty() ? "" : " " + reason));
        return null;
    }

    @Override
    public void onError(WebSocket ws, Throwable error) {
        log.warn("[{}:{}] WebSocket error: {}", provider, symbol, error.getMessage());
        terminal("error " + error.getMessage());
    }

    private void enqueue(Frame frame) {
        if (!frames.offer(frame)) {
            log.error("[{}:{}] Frame queue overflow, closing stream", provider, symbol);
            terminal("frame queue overflow");
            WebSocket ws = webSocket;
            if (ws != null) {
                ws.abort();
            }
        }
    }

    private void terminal(String reason) {
        if (terminalReason == null) {
            terminalReason = reason;
        }
        frames.offer(new Frame(FrameKind.CLOSED, reason, clock.instant()));
    }
}
