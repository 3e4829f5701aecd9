package com.unmark.core.match;

/**
 * Кандидат на метку: левый верхний угол и размер прямоугольника в координатах
 * того серого буфера, где он найден, плюс оценка сходства 0..1.
 */
public record Match(int x, int y, int w, int h, double score) {

    public Match {
        if (w <= 0 || h <= 0) {
            throw new IllegalArgumentException("Invalid match size: " + w + "x" + h);
        }
    }

    @Override
    public String toString() {
        return String.format("Match[x=%d, y=%d, w=%d, h=%d, score=%.4f]", x, y, w, h, score);
    }
}
