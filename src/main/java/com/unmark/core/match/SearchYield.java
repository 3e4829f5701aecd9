package com.unmark.core.match;

/**
 * Точка кооперативной уступки: поиск вызывает её после каждой просканированной строки
 * и после каждого масштаба. Хост может отдать управление, обновить прогресс или
 * прервать поиск исключением. На результат поиска не влияет.
 */
@FunctionalInterface
public interface SearchYield {

    /** Без уступок: поиск идёт до конца. */
    SearchYield NONE = percent -> {};

    /** @param percent грубый прогресс поиска 0..100 */
    void pause(int percent);
}
