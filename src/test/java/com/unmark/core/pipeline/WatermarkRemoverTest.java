package com.unmark.core.pipeline;

import com.unmark.core.TestImages;
import com.unmark.core.image.ImageCodec;
import com.unmark.core.image.RgbaImage;
import com.unmark.core.inpaint.Region;
import com.unmark.core.inpaint.RegionInpainter;
import com.unmark.core.match.Match;
import com.unmark.core.match.SearchParams;
import com.unmark.core.match.WatermarkSearcher;
import com.unmark.core.worker.*;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;

import static org.junit.jupiter.api.Assertions.*;

class WatermarkRemoverTest {

    private static TemplateImage template() throws Exception {
        return TemplateImage.fromBytes(TestImages.png(TestImages.template()));
    }

    private static WatermarkRemover realRemover() throws Exception {
        DetectionWorker worker = new DetectionWorker(new WatermarkSearcher(SearchParams.defaults()), 720);
        DetectionClient client = new DetectionClient(worker, Duration.ofSeconds(30));
        return new WatermarkRemover(client, new RegionInpainter(), template(), 720, 2);
    }

    /** Канал, отвечающий синхронно внутри post. */
    private static final class ScriptedChannel implements DetectionChannel {
        final List<DetectRequest> posted = new CopyOnWriteArrayList<>();
        final BiConsumer<DetectRequest, Endpoint> script;
        Endpoint endpoint;

        ScriptedChannel(BiConsumer<DetectRequest, Endpoint> script) {
            this.script = script;
        }

        @Override
        public void start(Endpoint endpoint) {
            this.endpoint = endpoint;
        }

        @Override
        public void post(DetectRequest request) {
            posted.add(request);
            script.accept(request, endpoint);
        }

        @Override
        public void close() {
            // нечего освобождать
        }
    }

    private static WatermarkRemover scripted(ScriptedChannel ch) throws Exception {
        return new WatermarkRemover(new DetectionClient(ch, Duration.ofSeconds(5)),
                new RegionInpainter(), template(), 720, 2);
    }

    @Test
    void removesMarkEndToEnd() throws Exception {
        byte[] input = TestImages.png(TestImages.marked(300, 200, 96, 40));
        List<String> statuses = new ArrayList<>();

        RemovalResult r;
        try (WatermarkRemover remover = realRemover()) {
            r = remover.process(input, new StatusListener() {
                @Override
                public void onStatus(String status) {
                    statuses.add(status);
                }
            });
        }

        assertTrue(r.isDone(), r.message());
        assertEquals(new Region(94, 38, 44, 24), r.region());
        assertEquals(List.of("Loading image…", "Searching watermark…", "Removing watermark…", "Done"), statuses);

        RgbaImage out = ImageCodec.decode(r.png());
        for (int y = 0; y < out.height(); y++) {
            for (int x = 0; x < out.width(); x++) {
                assertEquals(TestImages.BG, out.channel(x, y, 0), "R at " + x + "," + y);
                assertEquals(TestImages.BG, out.channel(x, y, 1));
                assertEquals(TestImages.BG, out.channel(x, y, 2));
                assertEquals(255, out.channel(x, y, 3));
            }
        }
    }

    @Test
    void grayPngKeepsPixelsOutsideRegion() throws Exception {
        RgbaImage src = TestImages.marked(300, 200, 96, 40);
        TestImages.grayNoise(src, 200, 120, 100, 80, 21L); // текстура вдали от метки
        TestImages.fill(src, 10, 150, 30, 20, 77);
        byte[] input = TestImages.grayPng(src, false);

        RemovalResult r;
        try (WatermarkRemover remover = realRemover()) {
            r = remover.process(input);
        }

        assertTrue(r.isDone(), r.message());
        Region reg = r.region();
        assertEquals(new Region(94, 38, 44, 24), reg);
        RgbaImage out = ImageCodec.decode(r.png());
        for (int y = 0; y < out.height(); y++) {
            for (int x = 0; x < out.width(); x++) {
                boolean frame = x >= reg.x() - 1 && x <= reg.x() + reg.w() + 1
                        && y >= reg.y() - 1 && y <= reg.y() + reg.h() + 1;
                if (frame) continue;
                assertEquals(src.channel(x, y, 0), out.channel(x, y, 0), "R at " + x + "," + y);
                assertEquals(src.channel(x, y, 2), out.channel(x, y, 2), "B at " + x + "," + y);
            }
        }
    }

    @Test
    void noMarkLeavesImageAlone() throws Exception {
        byte[] input = TestImages.png(TestImages.uniform(200, 120, 180));
        try (WatermarkRemover remover = realRemover()) {
            RemovalResult r = remover.process(input);
            assertEquals(RemovalResult.Status.NO_MATCH, r.status());
            assertEquals(WatermarkRemover.NO_MATCH_MESSAGE, r.message());
            assertNull(r.png());
        }
    }

    @Test
    void undecodableInputFails() throws Exception {
        try (WatermarkRemover remover = realRemover()) {
            RemovalResult r = remover.process("definitely not a png".getBytes());
            assertEquals(RemovalResult.Status.FAILED, r.status());
            assertEquals(WatermarkRemover.FAILED_MESSAGE, r.message());
        }
    }

    @Test
    void fallsBackToRasterWhenArrayPathFails() throws Exception {
        ScriptedChannel ch = new ScriptedChannel((req, ep) -> {
            if (req instanceof DetectArrayRequest) {
                ep.onResponse(DetectResponse.failure(req.id(), "array path broken"));
            } else {
                ep.onResponse(DetectResponse.success(req.id(), new Match(96, 40, 40, 20, 0.97), 1.0));
            }
        });
        byte[] input = TestImages.png(TestImages.marked(300, 200, 96, 40));

        try (WatermarkRemover remover = scripted(ch)) {
            RemovalResult r = remover.process(input);
            assertTrue(r.isDone());
            assertEquals(new Region(94, 38, 44, 24), r.region());
        }
        assertEquals(2, ch.posted.size());
        assertEquals(DetectKind.DETECT_ARRAY, ch.posted.get(0).kind());
        assertEquals(DetectKind.DETECT_RASTER, ch.posted.get(1).kind());
        assertArrayEquals(input, ((DetectRasterRequest) ch.posted.get(1)).image());
    }

    @Test
    void bothPathsFailingGivesFailedResult() throws Exception {
        ScriptedChannel ch = new ScriptedChannel((req, ep) ->
                ep.onResponse(DetectResponse.failure(req.id(), "nope")));
        try (WatermarkRemover remover = scripted(ch)) {
            RemovalResult r = remover.process(TestImages.png(TestImages.uniform(50, 50, 10)));
            assertEquals(RemovalResult.Status.FAILED, r.status());
        }
    }

    @Test
    void workingCopyCoordinatesAreMappedToFullSize() throws Exception {
        List<Double> sentScale = new ArrayList<>();
        ScriptedChannel ch = new ScriptedChannel((req, ep) -> {
            DetectArrayRequest a = (DetectArrayRequest) req;
            sentScale.add(a.scaleToFull());
            assertEquals(720, a.source().width());
            ep.onResponse(DetectResponse.success(a.id(), new Match(10, 10, 20, 10, 0.95), a.scaleToFull()));
        });
        byte[] input = TestImages.png(TestImages.uniform(1440, 400, 120));

        try (WatermarkRemover remover = scripted(ch)) {
            RemovalResult r = remover.process(input);
            assertTrue(r.isDone());
            assertEquals(new Region(18, 18, 44, 24), r.region());
        }
        assertEquals(List.of(2.0), sentScale);
    }

    @Test
    void templateIsCopiedForEveryRequest() throws Exception {
        TemplateImage tpl = template();
        ScriptedChannel ch = new ScriptedChannel((req, ep) -> {
            DetectArrayRequest a = (DetectArrayRequest) req;
            assertNotSame(tpl.gray(), a.template());
            ep.onResponse(DetectResponse.success(a.id(), null, 1.0));
        });
        try (WatermarkRemover remover = new WatermarkRemover(new DetectionClient(ch, Duration.ofSeconds(5)),
                new RegionInpainter(), tpl, 720, 2)) {
            assertEquals(RemovalResult.Status.NO_MATCH, remover.process(TestImages.png(TestImages.uniform(60, 40, 5))).status());
        }
    }
}
