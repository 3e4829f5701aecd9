package com.unmark.ui;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/** Мелочи про файлы изображений для UI и CLI. */
public final class ImageFiles {

    private static final Set<String> EXTENSIONS = Set.of("png", "jpg", "jpeg", "bmp", "gif", "wbmp");

    private ImageFiles() {
        // no-op
    }

    /** По расширению: то, что умеет читать ImageIO. */
    public static boolean isImageFile(Path p) {
        if (p == null || p.getFileName() == null) return false;
        String ext = extension(p.getFileName().toString());
        return ext != null && EXTENSIONS.contains(ext.toLowerCase(Locale.ROOT));
    }

    /** "photo.jpg" + "-unwatermarked" → "photo-unwatermarked.png". Результат всегда PNG. */
    public static String outputName(String fileName, String suffix) {
        String base = baseNoExt(fileName == null || fileName.isBlank() ? "image" : fileName);
        return base + (suffix == null ? "" : suffix) + ".png";
    }

    static String baseNoExt(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    static String extension(String name) {
        int dot = name.lastIndexOf('.');
        return (dot > 0 && dot < name.length() - 1) ? name.substring(dot + 1) : null;
    }
}
