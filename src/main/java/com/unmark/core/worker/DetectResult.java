package com.unmark.core.worker;

import com.unmark.core.match.Match;

import java.util.Optional;

/** Успешный результат запроса. Отсутствие метки — нормальный исход, не ошибка. */
public record DetectResult(Match match, double scaleToFull) {

    public Optional<Match> bestMatch() {
        return Optional.ofNullable(match);
    }

    public boolean found() {
        return match != null;
    }
}
