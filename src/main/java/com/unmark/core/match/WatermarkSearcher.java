package com.unmark.core.match;

import com.unmark.core.image.GrayImage;
import com.unmark.core.image.Grayscale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Многомасштабный поиск метки неизвестного размера и полярности.
 * <p>
 * Проход 1 сканирует ожидаемую область (по умолчанию полоса 5%..55% по высоте),
 * проход 2 — весь кадр и только если проход 1 ничего убедительного не нашёл.
 * На каждой позиции дешёвый MAD отсекает явные промахи, выжившие уточняются
 * композитной оценкой madWeight*MAD + (1-madWeight)*NCC; обе полярности, берём максимум.
 * <p>
 * Однопоточный и без общего состояния между вызовами: один экземпляр можно
 * вызывать из синхронного кода и из worker'а одинаково.
 */
public final class WatermarkSearcher {
    private static final Logger log = LoggerFactory.getLogger(WatermarkSearcher.class);

    private static final int PASSES = 2;

    private final SearchParams params;

    public WatermarkSearcher(SearchParams params) {
        this.params = Objects.requireNonNull(params, "params");
    }

    public Optional<Match> search(GrayImage source, TemplateScaler template) {
        return search(source, template, SearchYield.NONE);
    }

    public Optional<Match> search(GrayImage source, TemplateScaler template, SearchYield yield) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(yield, "yield");
        final int W = source.width(), H = source.height();
        SearchParams.Focus f = params.focus();

        // проход 1: ожидаемое место метки
        Window focusWindow = new Window(
                (int) Math.floor(W * f.x0()), W - f.rightInsetPx(),
                (int) Math.floor(H * f.y0()), (int) Math.floor(H * f.y1()));
        Match best = runPass(1, source, template, focusWindow, params.focused(), null, yield);
        log.debug("Search: pass1 best={}", best);

        // проход 2: весь кадр, шаг крупнее, пороги мягче
        if (best == null || best.score() < params.fallbackBelow()) {
            best = runPass(2, source, template, new Window(0, W, 0, H), params.fallback(), best, yield);
            log.debug("Search: pass2 best={}", best);
        }

        if (best != null && best.score() > params.accept()) {
            log.info("Search: match {} in {}x{}", best, W, H);
            return Optional.of(best);
        }
        log.info("Search: no match in {}x{} (best score={})", W, H,
                best == null ? "n/a" : String.format("%.4f", best.score()));
        return Optional.empty();
    }

    private Match runPass(int pass, GrayImage src, TemplateScaler template, Window win,
                          SearchParams.Pass p, Match best, SearchYield yield) {
        final int W = src.width(), H = src.height();
        final List<Double> scales = params.scales();
        final int n = scales.size();
        final int minSide = params.minTemplateSide();

        for (int si = 0; si < n; si++) {
            double s = scales.get(si);
            int w = Math.max(minSide, (int) Math.round(template.nativeWidth() * s));
            int h = Math.max(minSide, (int) Math.round(template.nativeHeight() * s));
            if (w >= W || h >= H) {
                yield.pause(progress(pass, si + 1, n, 0));
                continue;
            }
            GrayImage dark = template.scale(w, h);
            GrayImage light = Grayscale.invert(dark);

            int yLast = win.y1 - h;
            int xLast = win.x1 - w;
            int rows = yLast >= win.y0 ? (yLast - win.y0) / p.stride() + 1 : 0;
            int row = 0;
            int gated = 0;
            for (int y = win.y0; y <= yLast; y += p.stride()) {
                for (int x = win.x0; x <= xLast; x += p.stride()) {
                    double quick = Similarity.mad(src, x, y, dark, p.quickStep(), p.quickAbort());
                    if (quick < p.gate()) {
                        quick = Math.max(quick, Similarity.mad(src, x, y, light, p.quickStep(), p.quickAbort()));
                    }
                    if (quick < p.gate()) continue;
                    gated++;
                    double refine = Math.max(
                            composite(src, x, y, dark, p.refineAbort()),
                            composite(src, x, y, light, p.refineAbort()));
                    // строго больше: при равенстве остаётся найденный раньше
                    if (best == null || refine > best.score()) {
                        best = new Match(x, y, w, h, refine);
                    }
                }
                yield.pause(progress(pass, si, n, ++row / (double) Math.max(1, rows)));
            }
            if (log.isDebugEnabled()) {
                log.debug("Search: pass{} scale={} tpl={}x{} rows={} gated={}", pass, s, w, h, rows, gated);
            }
            yield.pause(progress(pass, si + 1, n, 0));
        }
        return best;
    }

    private double composite(GrayImage src, int x, int y, GrayImage tpl, double refineAbort) {
        double mad = Similarity.mad(src, x, y, tpl, params.refineMadStep(), refineAbort);
        double ncc = Similarity.ncc(src, x, y, tpl, params.refineNccStep());
        return params.madWeight() * mad + (1.0 - params.madWeight()) * ncc;
    }

    private static int progress(int pass, int scaleIndex, int scales, double rowFraction) {
        double done = (pass - 1) * scales + scaleIndex + rowFraction;
        return (int) Math.min(100, Math.floor(100.0 * done / (PASSES * scales)));
    }

    /** Диапазон левых верхних углов: x0..x1-w, y0..y1-h включительно. */
    private record Window(int x0, int x1, int y0, int y1) {}
}
