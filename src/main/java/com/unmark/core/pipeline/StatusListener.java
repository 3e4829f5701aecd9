package com.unmark.core.pipeline;

/** Статус и прогресс обработки для UI/CLI. Вызывается с рабочих потоков. */
public interface StatusListener {

    StatusListener NONE = new StatusListener() {};

    default void onStatus(String status) {}

    /** Прогресс поиска 0..100. */
    default void onProgress(int percent) {}
}
