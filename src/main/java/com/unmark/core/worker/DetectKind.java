package com.unmark.core.worker;

/** Вид запроса к worker'у; wireName — имя на границе контекстов. */
public enum DetectKind {
    /** Worker сам декодирует изображение и шаблон (нужен OpenCV). */
    DETECT_RASTER("detect-raster"),
    /** Готовые серые массивы источника и шаблона, без растеризации. */
    DETECT_ARRAY("detect-array");

    private final String wireName;

    DetectKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
