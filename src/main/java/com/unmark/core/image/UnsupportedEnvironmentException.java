package com.unmark.core.image;

/** Нет нужной возможности растеризации (нативный OpenCV не загрузился). Восстановимо через array-путь. */
public class UnsupportedEnvironmentException extends RuntimeException {
    public UnsupportedEnvironmentException(String message) {
        super(message);
    }
}
