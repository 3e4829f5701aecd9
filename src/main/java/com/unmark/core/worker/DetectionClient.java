package com.unmark.core.worker;

import com.unmark.core.image.GrayImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntConsumer;

/**
 * Сторона вызывающего на границе контекстов. Каждый запрос — маленькая машина
 * состояний PENDING → RESOLVED | REJECTED | TIMED_OUT; в карте ожидания лежат
 * только PENDING, запись удаляется при любом терминальном переходе.
 * Поздний ответ на уже снятый (например, по таймауту) id отбрасывается.
 */
public final class DetectionClient implements DetectionChannel.Endpoint, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DetectionClient.class);

    public enum State { PENDING, RESOLVED, REJECTED, TIMED_OUT }

    private final DetectionChannel channel;
    private final Duration timeout;
    private final Map<String, Pending> pending = new ConcurrentHashMap<>();
    private final ScheduledExecutorService timers = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "unmark-detect-timeouts");
        t.setDaemon(true);
        return t;
    });

    public DetectionClient(DetectionChannel channel, Duration timeout) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0: " + timeout);
        }
        channel.start(this);
    }

    /** Array-путь. source и template передаются во владение worker'у. */
    public CompletableFuture<DetectResult> detectArray(GrayImage source, GrayImage template,
                                                       double scaleToFull, IntConsumer onProgress) {
        return submit(new DetectArrayRequest(newId(), source, template, scaleToFull), onProgress);
    }

    /** Raster-путь: worker декодирует сам (нужен OpenCV). */
    public CompletableFuture<DetectResult> detectRaster(byte[] image, byte[] template, IntConsumer onProgress) {
        return submit(new DetectRasterRequest(newId(), image, template), onProgress);
    }

    public CompletableFuture<DetectResult> submit(DetectRequest request, IntConsumer onProgress) {
        Objects.requireNonNull(request, "request");
        Pending p = new Pending(request.id(), onProgress);
        if (pending.putIfAbsent(request.id(), p) != null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Request id already pending: " + request.id()));
        }
        try {
            p.timer = timers.schedule(() -> timeOut(p), timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException ex) {
            finish(p, State.REJECTED, null, new DetectionException("Detection client closed", ex));
            return p.future;
        }
        try {
            channel.post(request);
            log.debug("Client: posted {} id={}", request.kind().wireName(), request.id());
        } catch (RuntimeException ex) {
            finish(p, State.REJECTED, null, new DetectionException("Worker unavailable", ex));
        }
        return p.future;
    }

    @Override
    public void onResponse(DetectResponse response) {
        if (response == null || response.id() == null) return;
        Pending p = pending.get(response.id());
        if (p == null) {
            log.debug("Client: discarding response for unknown or expired id={}", response.id());
            return;
        }
        if (response.ok()) {
            finish(p, State.RESOLVED, new DetectResult(response.match(), response.scaleToFull()), null);
        } else {
            String msg = response.error() != null ? response.error() : "Worker error";
            finish(p, State.REJECTED, null, new DetectionException(msg));
        }
    }

    @Override
    public void onCrash(Throwable cause) {
        log.error("Client: worker crashed, rejecting {} pending request(s)", pending.size());
        for (Pending p : pending.values()) {
            finish(p, State.REJECTED, null, new DetectionException("Worker crashed", cause));
        }
    }

    @Override
    public void onProgress(String id, int percent) {
        Pending p = pending.get(id);
        if (p != null && p.onProgress != null) p.onProgress.accept(percent);
    }

    private void timeOut(Pending p) {
        if (finish(p, State.TIMED_OUT, null,
                new DetectionTimeoutException("Worker timeout after " + timeout.toMillis() + " ms (id=" + p.id + ")"))) {
            log.warn("Client: request {} timed out", p.id);
        }
    }

    /** Единственная точка терминального перехода; true, если переход совершил этот вызов. */
    private boolean finish(Pending p, State to, DetectResult result, Throwable error) {
        if (!p.state.compareAndSet(State.PENDING, to)) return false;
        pending.remove(p.id, p);
        ScheduledFuture<?> t = p.timer;
        if (t != null) t.cancel(false);
        if (error == null) {
            p.future.complete(result);
        } else {
            p.future.completeExceptionally(error);
        }
        return true;
    }

    public int pendingCount() {
        return pending.size();
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }

    @Override
    public void close() {
        try {
            channel.close();
        } finally {
            timers.shutdownNow();
            for (Pending p : pending.values()) {
                finish(p, State.REJECTED, null, new DetectionException("Detection client closed"));
            }
        }
    }

    private static final class Pending {
        final String id;
        final IntConsumer onProgress;
        final CompletableFuture<DetectResult> future = new CompletableFuture<>();
        final AtomicReference<State> state = new AtomicReference<>(State.PENDING);
        volatile ScheduledFuture<?> timer;

        Pending(String id, IntConsumer onProgress) {
            this.id = id;
            this.onProgress = onProgress;
        }
    }
}
