package com.unmark.core.match;

import com.unmark.core.image.GrayImage;

/** Источник шаблона в родном разрешении, умеющий выдать серый шаблон нужного размера. */
public interface TemplateScaler {

    int nativeWidth();

    int nativeHeight();

    /** Серый шаблон размера width x height. Вызывающий не должен его модифицировать. */
    GrayImage scale(int width, int height);
}
