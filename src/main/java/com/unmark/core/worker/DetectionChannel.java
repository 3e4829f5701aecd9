package com.unmark.core.worker;

/**
 * Граница отдельного контекста исполнения: запросы уходят через {@link #post},
 * ответы приходят в {@link Endpoint} на потоке контекста.
 */
public interface DetectionChannel extends AutoCloseable {

    /** Получатель сообщений из контекста. Реализация должна быть потокобезопасной. */
    interface Endpoint {
        void onResponse(DetectResponse response);

        /** Контекст завершился аварийно; ответов больше не будет. */
        void onCrash(Throwable cause);

        default void onProgress(String id, int percent) {}
    }

    void start(Endpoint endpoint);

    void post(DetectRequest request);

    @Override
    void close();
}
