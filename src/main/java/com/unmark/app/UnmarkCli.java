package com.unmark.app;

import com.unmark.core.pipeline.RemovalResult;
import com.unmark.core.pipeline.WatermarkRemover;
import com.unmark.ui.ImageFiles;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Пакетный режим без UI:
 * {@code --in=<файл|каталог> --out=<каталог> [--template=<png>]}.
 */
public final class UnmarkCli {

    public static void main(String[] args) throws Exception {
        Map<String, String> a = parseArgs(args);
        Path in = Path.of(req(a, "in"));
        Path outDir = Path.of(a.getOrDefault("out", "unwatermarked"));
        Config cfg = Config.load();
        String template = a.getOrDefault("template", cfg.template().path());

        List<Path> files = listImages(in);
        if (files.isEmpty()) {
            System.err.println("No images found in " + in);
            System.exit(2);
        }
        Files.createDirectories(outDir);
        int ok = 0, miss = 0, err = 0;
        try (WatermarkRemover remover = Components.remover(cfg, template)) {
            for (Path f : files) {
                try {
                    RemovalResult r = remover.process(Files.readAllBytes(f));
                    switch (r.status()) {
                        case DONE -> {
                            Path out = outDir.resolve(ImageFiles.outputName(f.getFileName().toString(), cfg.output().suffix()));
                            Files.write(out, r.png());
                            System.out.println("OK   " + out + "  " + r.match());
                            ok++;
                        }
                        case NO_MATCH -> {
                            System.out.println("MISS " + f);
                            miss++;
                        }
                        case FAILED -> {
                            System.err.println("ERR  " + f + " :: " + r.message());
                            err++;
                        }
                    }
                } catch (IOException ex) {
                    System.err.println("ERR  " + f + " :: " + ex.getMessage());
                    err++;
                }
            }
        }
        System.out.printf("Done. cleaned=%d missed=%d failed=%d%n", ok, miss, err);
        if (err > 0) System.exit(1);
    }

    static List<Path> listImages(Path in) throws IOException {
        if (Files.isRegularFile(in)) return List.of(in);
        if (!Files.isDirectory(in)) throw new IllegalArgumentException("input not found: " + in);
        try (Stream<Path> s = Files.list(in)) {
            return s.filter(Files::isRegularFile)
                    .filter(ImageFiles::isImageFile)
                    .sorted()
                    .toList();
        }
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> m = new HashMap<>();
        for (String s : args) {
            int i = s.indexOf('=');
            if (i > 0) m.put(s.substring(0, i).replaceFirst("^--", ""), s.substring(i + 1));
        }
        return m;
    }

    static String req(Map<String, String> a, String k) {
        String v = a.get(k);
        if (v == null || v.isBlank()) throw new IllegalArgumentException("missing --" + k);
        return v;
    }
}
