package com.unmark.core.worker;

/** Ответ не пришёл за отведённое время; запрос снят с ожидания. */
public class DetectionTimeoutException extends DetectionException {
    public DetectionTimeoutException(String message) {
        super(message);
    }
}
