package com.unmark.core.match;

import java.util.List;
import java.util.Objects;

/**
 * Параметры поиска. Все пороги, шаги и масштабы подобраны эмпирически;
 * значения по умолчанию — в {@link #defaults()}, переопределяются из application.yaml.
 */
public record SearchParams(
        List<Double> scales,      // по возрастанию, доли родного размера шаблона
        int minTemplateSide,      // минимальная сторона масштабированного шаблона, px
        Focus focus,              // область первого прохода
        Pass focused,             // проход 1: ожидаемое место метки
        Pass fallback,            // проход 2: весь кадр
        double fallbackBelow,     // проход 2 запускается, если лучший результат прохода 1 ниже
        int refineMadStep,        // шаг MAD при уточнении
        int refineNccStep,        // шаг NCC при уточнении
        double madWeight,         // вес MAD в композитной оценке, NCC получает 1 - madWeight
        double accept             // итоговый порог: score строго больше
) {

    /** Область прохода 1 в долях рабочего изображения; справа отступ в пикселях. */
    public record Focus(double x0, int rightInsetPx, double y0, double y1) {}

    /**
     * Двухступенчатый фильтр прохода: дешёвый MAD (quickStep, ранний выход ниже quickAbort)
     * отсекает позиции ниже gate, выжившие уточняются композитной оценкой.
     */
    public record Pass(int stride, int quickStep, double quickAbort, double gate, double refineAbort) {
        public Pass {
            if (stride <= 0 || quickStep <= 0) {
                throw new IllegalArgumentException("stride/quickStep must be > 0");
            }
        }
    }

    public SearchParams {
        Objects.requireNonNull(scales, "scales");
        Objects.requireNonNull(focus, "focus");
        Objects.requireNonNull(focused, "focused");
        Objects.requireNonNull(fallback, "fallback");
        if (scales.isEmpty()) throw new IllegalArgumentException("scales must not be empty");
        for (int i = 1; i < scales.size(); i++) {
            if (scales.get(i) <= scales.get(i - 1)) {
                throw new IllegalArgumentException("scales must be ascending: " + scales);
            }
        }
        if (minTemplateSide <= 0) {
            throw new IllegalArgumentException("minTemplateSide must be > 0: " + minTemplateSide);
        }
        if (refineMadStep <= 0 || refineNccStep <= 0) {
            throw new IllegalArgumentException("refine steps must be > 0");
        }
        scales = List.copyOf(scales);
    }

    public static SearchParams defaults() {
        return new SearchParams(
                List.of(0.4, 0.5, 0.6, 0.75, 0.9, 1.0, 1.1, 1.25, 1.4, 1.6, 1.8),
                6,
                new Focus(0.02, 4, 0.05, 0.55),
                new Pass(3, 3, 0.82, 0.84, 0.88),
                new Pass(4, 3, 0.80, 0.82, 0.86),
                0.88,
                1,
                2,
                0.5,
                0.87);
    }

    public SearchParams withAccept(double newAccept) {
        return new SearchParams(scales, minTemplateSide, focus, focused, fallback,
                fallbackBelow, refineMadStep, refineNccStep, madWeight, newAccept);
    }
}
