package com.unmark.core.inpaint;

import com.unmark.core.match.Match;

/** Прямоугольник в координатах полноразмерного изображения. */
public record Region(int x, int y, int w, int h) {

    public boolean isEmpty() {
        return w <= 0 || h <= 0;
    }

    /**
     * Переводит совпадение из рабочей копии в полное разрешение и добавляет поле margin
     * с каждой стороны: x,y сдвигаются на -margin (не меньше 0), w,h растут на 2*margin
     * (не больше размеров изображения).
     */
    public static Region fromMatch(Match m, double scaleToFull, int margin, int fullWidth, int fullHeight) {
        int x = Math.max(0, (int) Math.round(m.x() * scaleToFull) - margin);
        int y = Math.max(0, (int) Math.round(m.y() * scaleToFull) - margin);
        int w = Math.min(fullWidth, (int) Math.round(m.w() * scaleToFull) + 2 * margin);
        int h = Math.min(fullHeight, (int) Math.round(m.h() * scaleToFull) + 2 * margin);
        return new Region(x, y, w, h);
    }
}
