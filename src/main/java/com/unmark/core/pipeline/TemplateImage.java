package com.unmark.core.pipeline;

import com.unmark.core.image.GrayImage;
import com.unmark.core.image.Grayscale;
import com.unmark.core.image.ImageCodec;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Эталон метки в родном разрешении: закодированные байты (для raster-пути)
 * и серый буфер (для array-пути).
 */
public record TemplateImage(byte[] encoded, GrayImage gray) {

    public static final String CLASSPATH_PREFIX = "classpath:";

    public TemplateImage {
        Objects.requireNonNull(encoded, "encoded");
        Objects.requireNonNull(gray, "gray");
    }

    public static TemplateImage fromBytes(byte[] encoded) throws IOException {
        return new TemplateImage(encoded, Grayscale.toGray(ImageCodec.decode(encoded)));
    }

    /** location: путь к файлу или "classpath:/templates/..." */
    public static TemplateImage load(String location) throws IOException {
        Objects.requireNonNull(location, "location");
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String res = location.substring(CLASSPATH_PREFIX.length());
            try (InputStream in = TemplateImage.class.getResourceAsStream(res)) {
                if (in == null) throw new IOException("Template resource not found: " + res);
                return fromBytes(in.readAllBytes());
            }
        }
        Path p = Path.of(location);
        if (!Files.isRegularFile(p)) throw new IOException("Template file not found: " + p.toAbsolutePath());
        return fromBytes(Files.readAllBytes(p));
    }

    public int width() {
        return gray.width();
    }

    public int height() {
        return gray.height();
    }
}
