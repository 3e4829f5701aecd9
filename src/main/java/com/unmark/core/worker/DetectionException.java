package com.unmark.core.worker;

/** Запрос отклонён: worker вернул ошибку, упал или недоступен. */
public class DetectionException extends RuntimeException {
    public DetectionException(String message) {
        super(message);
    }

    public DetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
