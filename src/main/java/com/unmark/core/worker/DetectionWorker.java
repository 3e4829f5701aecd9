package com.unmark.core.worker;

import com.unmark.core.image.OpenCvImages;
import com.unmark.core.image.WorkingCopy;
import com.unmark.core.match.ArrayTemplateScaler;
import com.unmark.core.match.Match;
import com.unmark.core.match.OpenCvTemplateScaler;
import com.unmark.core.match.SearchYield;
import com.unmark.core.match.WatermarkSearcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Отдельный контекст исполнения для поиска: один daemon-поток разбирает очередь
 * запросов и на каждый отдаёт ровно один ответ. Поиск внутри однопоточный,
 * уступает управление через {@link SearchYield} после каждой строки и масштаба.
 */
public final class DetectionWorker implements DetectionChannel {
    private static final Logger log = LoggerFactory.getLogger(DetectionWorker.class);

    private final BlockingQueue<DetectRequest> queue = new LinkedBlockingQueue<>();
    private final ExecutorService exec = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "unmark-detect-worker");
        t.setDaemon(true);
        return t;
    });

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final WatermarkSearcher searcher;
    private final int workingMaxWidth;
    private volatile Future<?> workerFuture;

    public DetectionWorker(WatermarkSearcher searcher, int workingMaxWidth) {
        this.searcher = Objects.requireNonNull(searcher, "searcher");
        if (workingMaxWidth <= 0) throw new IllegalArgumentException("workingMaxWidth must be > 0");
        this.workingMaxWidth = workingMaxWidth;
    }

    /** Запустить обработчик очереди. Повторный вызов, если уже запущен, игнорируется. */
    @Override
    public synchronized void start(Endpoint endpoint) {
        Objects.requireNonNull(endpoint, "endpoint");
        if (running.get()) return;
        running.set(true);
        workerFuture = exec.submit(() -> workerLoop(endpoint));
        log.info("Worker: started");
    }

    @Override
    public void post(DetectRequest request) {
        Objects.requireNonNull(request, "request");
        if (!running.get()) {
            throw new IllegalStateException("Worker is not running");
        }
        queue.add(request);
    }

    private void workerLoop(Endpoint endpoint) {
        while (running.get()) {
            DetectRequest req;
            try {
                req = queue.poll(250, TimeUnit.MILLISECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            }
            if (req == null) continue;

            DetectResponse resp;
            long t0 = System.nanoTime();
            try {
                resp = handle(req, endpoint);
            } catch (CancellationException ce) {
                // остановка во время поиска: ответа не будет, клиент отклонит запрос сам
                log.info("Worker: request {} cancelled by shutdown", req.id());
                break;
            } catch (Exception ex) {
                log.warn("Worker: request {} ({}) failed: {}", req.id(), req.kind().wireName(), ex.toString());
                resp = DetectResponse.failure(req.id(), ex.getMessage() != null ? ex.getMessage() : ex.toString());
            } catch (Error err) {
                log.error("Worker: crashed on request {}", req.id(), err);
                running.set(false);
                endpoint.onCrash(err);
                break;
            }
            log.debug("Worker: request {} done in {} ms", req.id(), (System.nanoTime() - t0) / 1_000_000);
            try {
                endpoint.onResponse(resp);
            } catch (RuntimeException ex) {
                log.warn("Worker: endpoint failed on response {}: {}", resp.id(), ex.toString());
            }
        }
        log.info("Worker: exited");
    }

    private DetectResponse handle(DetectRequest req, Endpoint endpoint) {
        SearchYield yield = yieldFor(req.id(), endpoint);
        if (req instanceof DetectArrayRequest a) {
            Optional<Match> m = searcher.search(a.source(), new ArrayTemplateScaler(a.template()), yield);
            return DetectResponse.success(a.id(), m.orElse(null), a.scaleToFull());
        }
        if (req instanceof DetectRasterRequest r) {
            // бросает UnsupportedEnvironmentException без OpenCV → ответ ok=false
            OpenCvImages.ensureLoaded();
            WorkingCopy wc = OpenCvImages.workingCopy(r.image(), workingMaxWidth);
            try (OpenCvTemplateScaler tpl = OpenCvTemplateScaler.decode(r.template())) {
                Optional<Match> m = searcher.search(wc.gray(), tpl, yield);
                return DetectResponse.success(r.id(), m.orElse(null), wc.scaleToFull());
            }
        }
        throw new IllegalArgumentException("Unsupported request kind: " + req.kind());
    }

    /** Уступка: отдать квант планировщику, сообщить прогресс, прерваться при остановке. */
    private SearchYield yieldFor(String id, Endpoint endpoint) {
        int[] last = {-1};
        return percent -> {
            if (!running.get() || Thread.currentThread().isInterrupted()) {
                throw new CancellationException("worker stopped");
            }
            if (percent != last[0]) {
                last[0] = percent;
                try {
                    endpoint.onProgress(id, percent);
                } catch (RuntimeException ex) {
                    // прогресс не влияет на результат
                    log.debug("Worker: progress listener failed: {}", ex.toString());
                }
            }
            Thread.yield();
        };
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public synchronized void close() {
        running.set(false);
        if (workerFuture != null) workerFuture.cancel(true);
        exec.shutdownNow();
        queue.clear();
    }
}
