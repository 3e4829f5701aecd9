package com.unmark.app;

import com.unmark.core.inpaint.RegionInpainter;
import com.unmark.core.match.WatermarkSearcher;
import com.unmark.core.pipeline.TemplateImage;
import com.unmark.core.pipeline.WatermarkRemover;
import com.unmark.core.worker.DetectionClient;
import com.unmark.core.worker.DetectionWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;

/** Сборка конвейера из конфигурации: worker + клиент + инпейнтер + шаблон. */
public final class Components {
    private static final Logger log = LoggerFactory.getLogger(Components.class);

    private Components() {}

    public static WatermarkRemover remover(Config cfg) throws IOException {
        return remover(cfg, cfg.template().path());
    }

    public static WatermarkRemover remover(Config cfg, String templateLocation) throws IOException {
        TemplateImage template = TemplateImage.load(templateLocation);
        log.info("Template: {} ({}x{})", templateLocation, template.width(), template.height());
        DetectionWorker worker = new DetectionWorker(new WatermarkSearcher(cfg.search()), cfg.working().maxWidth());
        DetectionClient client = new DetectionClient(worker, Duration.ofMillis(cfg.worker().timeoutMs()));
        Config.InpaintConf ic = cfg.inpaint();
        return new WatermarkRemover(client, new RegionInpainter(ic.stripWidth(), ic.stripRowPad()),
                template, cfg.working().maxWidth(), ic.margin());
    }
}
