package com.unmark.core.pipeline;

import com.unmark.core.image.ImageCodec;
import com.unmark.core.image.RgbaImage;
import com.unmark.core.image.WorkingCopy;
import com.unmark.core.inpaint.Region;
import com.unmark.core.inpaint.RegionInpainter;
import com.unmark.core.match.Match;
import com.unmark.core.worker.DetectResult;
import com.unmark.core.worker.DetectionClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Полный цикл над одним изображением: декодирование → рабочая копия → поиск в worker'е
 * (сначала array-путь, при ошибке raster-путь) → перевод прямоугольника в полное
 * разрешение → заливка → PNG.
 * <p>
 * Неудачный поиск не трогает полноразмерный буфер.
 */
public final class WatermarkRemover implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WatermarkRemover.class);

    static final String NO_MATCH_MESSAGE =
            "Could not detect the watermark. Make sure the marked area is visible.";
    static final String FAILED_MESSAGE = "Failed to process the image. Try another one.";

    private final DetectionClient client;
    private final RegionInpainter inpainter;
    private final TemplateImage template;
    private final int workingMaxWidth;
    private final int margin;

    public WatermarkRemover(DetectionClient client, RegionInpainter inpainter, TemplateImage template,
                            int workingMaxWidth, int margin) {
        this.client = Objects.requireNonNull(client, "client");
        this.inpainter = Objects.requireNonNull(inpainter, "inpainter");
        this.template = Objects.requireNonNull(template, "template");
        if (workingMaxWidth <= 0) throw new IllegalArgumentException("workingMaxWidth must be > 0");
        this.workingMaxWidth = workingMaxWidth;
        this.margin = Math.max(0, margin);
    }

    public RemovalResult process(byte[] encoded) {
        return process(encoded, StatusListener.NONE);
    }

    public RemovalResult process(byte[] encoded, StatusListener listener) {
        Objects.requireNonNull(listener, "listener");
        listener.onStatus("Loading image…");
        RgbaImage full;
        try {
            full = ImageCodec.decode(encoded);
        } catch (IOException e) {
            log.warn("Remove: decode failed: {}", e.getMessage());
            return RemovalResult.failed(FAILED_MESSAGE);
        }

        listener.onStatus("Searching watermark…");
        DetectResult det;
        try {
            det = detect(full, encoded, listener);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return RemovalResult.failed("Interrupted");
        } catch (ExecutionException e) {
            log.warn("Remove: detection failed on both paths: {}", e.getCause().toString());
            return RemovalResult.failed(FAILED_MESSAGE);
        }
        if (!det.found()) {
            return RemovalResult.noMatch(NO_MATCH_MESSAGE);
        }

        Match m = det.match();
        Region region = Region.fromMatch(m, det.scaleToFull(), margin, full.width(), full.height());
        listener.onStatus("Removing watermark…");
        inpainter.inpaint(full, region);
        try {
            byte[] png = ImageCodec.encodePng(full);
            listener.onStatus("Done");
            log.info("Remove: {} -> region=({}, {}, {}, {})", m, region.x(), region.y(), region.w(), region.h());
            return RemovalResult.done(m, region, png);
        } catch (IOException e) {
            log.warn("Remove: encode failed: {}", e.getMessage());
            return RemovalResult.failed(FAILED_MESSAGE);
        }
    }

    /** Array-путь не требует растеризации; raster-путь — запасной. */
    private DetectResult detect(RgbaImage full, byte[] encoded, StatusListener listener)
            throws InterruptedException, ExecutionException {
        WorkingCopy wc = WorkingCopy.of(full, workingMaxWidth);
        // массивы уходят worker'у, себе ничего не оставляем
        CompletableFuture<DetectResult> arrayCall = client.detectArray(
                wc.gray(), template.gray().copy(), wc.scaleToFull(), listener::onProgress);
        try {
            return arrayCall.get();
        } catch (ExecutionException e) {
            log.warn("Remove: array path failed, falling back to raster path: {}", e.getCause().toString());
        }
        return client.detectRaster(encoded, template.encoded(), listener::onProgress).get();
    }

    @Override
    public void close() {
        client.close();
    }
}
