package com.unmark.app;

import com.unmark.ui.MainController;
import javafx.application.Application;
import javafx.application.Platform;
import javafx.scene.Scene;
import javafx.stage.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// JavaFX Application (main)
public class Boot extends Application {
    private static final Logger log = LoggerFactory.getLogger(Boot.class);

    @Override
    public void start(Stage stage) {
        Config cfg = Config.load();
        log.info("Template: {} workingMaxWidth={} timeoutMs={}",
                cfg.template().path(), cfg.working().maxWidth(), cfg.worker().timeoutMs());
        MainController root = new MainController(cfg);
        stage.setOnCloseRequest(e -> {
            log.info("Shutting down...");
            try {
                // остановить фоновые задачи UI и worker
                root.shutdown();
            } catch (RuntimeException ex) {
                log.warn("Shutdown failed: {}", ex.toString());
            }
            Platform.exit();
        });
        stage.setTitle("Unmark - watermark remover");
        stage.setScene(new Scene(root.getRoot(), 900, 650));
        stage.show();
    }

    public static void main(String[] args) {
        launch(args);
    }
}
