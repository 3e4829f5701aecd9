package com.unmark.app;

import com.unmark.core.match.SearchParams;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;


public record Config(SearchParams search, WorkingConf working, WorkerConf worker,
                     InpaintConf inpaint, TemplateConf template, OutputConf output) {
    public record WorkingConf(int maxWidth) {}
    public record WorkerConf(long timeoutMs) {}
    public record InpaintConf(int margin, int stripWidth, int stripRowPad) {}
    public record TemplateConf(String path) {}
    public record OutputConf(String suffix) {}

    public static final String DEFAULT_TEMPLATE = "classpath:/templates/watermark.png";

    public static Config load() {
        try (InputStream in = Config.class.getResourceAsStream("/application.yaml")) {
            if (in == null) {
                throw new IllegalStateException("application.yaml not found on classpath");
            }
            Map<String, Object> root = new Yaml().load(in);
            return parse(root == null ? Map.of() : root);
        } catch (Exception e) {
            throw new RuntimeException("Failed to load application.yaml", e);
        }
    }

    /** Разбор дерева YAML; отсутствующие ключи берут значения по умолчанию, -Dunmark.* приоритетнее YAML. */
    static Config parse(Map<String, Object> root) {
        SearchParams d = SearchParams.defaults();
        Map<String, Object> s   = section(root, "search");
        Map<String, Object> fc  = section(s, "focus");
        Map<String, Object> p1  = section(s, "focused");
        Map<String, Object> p2  = section(s, "fallback");
        Map<String, Object> wk  = section(root, "working");
        Map<String, Object> wr  = section(root, "worker");
        Map<String, Object> inp = section(root, "inpaint");
        Map<String, Object> tp  = section(root, "template");
        Map<String, Object> out = section(root, "output");

        SearchParams search = new SearchParams(
                scales(s.get("scales"), d.scales()),
                intOr(s, "minTemplateSide", d.minTemplateSide()),
                new SearchParams.Focus(
                        dblOr(fc, "x0", d.focus().x0()),
                        intOr(fc, "rightInsetPx", d.focus().rightInsetPx()),
                        dblOr(fc, "y0", d.focus().y0()),
                        dblOr(fc, "y1", d.focus().y1())),
                pass(p1, d.focused()),
                pass(p2, d.fallback()),
                dblOr(s, "fallbackBelow", d.fallbackBelow()),
                intOr(s, "refineMadStep", d.refineMadStep()),
                intOr(s, "refineNccStep", d.refineNccStep()),
                dblOr(s, "madWeight", d.madWeight()),
                dblOr(s, "accept", d.accept()));

        int maxWidth = Integer.getInteger("unmark.workingMaxWidth", intOr(wk, "maxWidth", 720));
        long timeoutMs = Long.getLong("unmark.timeoutMs", longOr(wr, "timeoutMs", 30_000L));
        String templatePath = System.getProperty("unmark.template",
                (String) tp.getOrDefault("path", DEFAULT_TEMPLATE));

        return new Config(
                search,
                new WorkingConf(maxWidth),
                new WorkerConf(timeoutMs),
                new InpaintConf(intOr(inp, "margin", 2), intOr(inp, "stripWidth", 6), intOr(inp, "stripRowPad", 2)),
                new TemplateConf(templatePath),
                new OutputConf((String) out.getOrDefault("suffix", "-unwatermarked")));
    }

    private static SearchParams.Pass pass(Map<String, Object> m, SearchParams.Pass d) {
        return new SearchParams.Pass(
                intOr(m, "stride", d.stride()),
                intOr(m, "quickStep", d.quickStep()),
                dblOr(m, "quickAbort", d.quickAbort()),
                dblOr(m, "gate", d.gate()),
                dblOr(m, "refineAbort", d.refineAbort()));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> m, String key) {
        Object v = m.get(key);
        return v instanceof Map ? (Map<String, Object>) v : Map.of();
    }

    private static List<Double> scales(Object v, List<Double> def) {
        if (!(v instanceof List<?> list) || list.isEmpty()) return def;
        List<Double> out = new ArrayList<>(list.size());
        for (Object o : list) out.add(((Number) o).doubleValue());
        return out;
    }

    private static int intOr(Map<String, Object> m, String key, int def) {
        return m.get(key) != null ? ((Number) m.get(key)).intValue() : def;
    }

    private static long longOr(Map<String, Object> m, String key, long def) {
        return m.get(key) != null ? ((Number) m.get(key)).longValue() : def;
    }

    private static double dblOr(Map<String, Object> m, String key, double def) {
        return m.get(key) != null ? ((Number) m.get(key)).doubleValue() : def;
    }
}
