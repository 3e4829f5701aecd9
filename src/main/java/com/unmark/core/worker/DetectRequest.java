package com.unmark.core.worker;

/** Запрос на поиск метки; id непрозрачен и коррелирует запрос с единственным ответом. */
public interface DetectRequest {

    String id();

    DetectKind kind();
}
