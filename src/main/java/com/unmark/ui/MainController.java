package com.unmark.ui;

import com.unmark.app.Components;
import com.unmark.app.Config;
import com.unmark.core.pipeline.RemovalResult;
import com.unmark.core.pipeline.StatusListener;
import com.unmark.core.pipeline.WatermarkRemover;
import javafx.animation.Animation;
import javafx.animation.KeyFrame;
import javafx.animation.Timeline;
import javafx.application.Platform;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.control.Button;
import javafx.scene.control.Label;
import javafx.scene.control.ProgressBar;
import javafx.scene.control.ToggleButton;
import javafx.scene.image.Image;
import javafx.scene.image.ImageView;
import javafx.scene.input.DragEvent;
import javafx.scene.input.Dragboard;
import javafx.scene.input.TransferMode;
import javafx.scene.layout.*;
import javafx.stage.FileChooser;
import javafx.stage.Window;
import javafx.util.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

// одна сцена: выбор/перетаскивание картинки → удаление метки → сравнение → сохранение
public class MainController {
    private static final Logger log = LoggerFactory.getLogger(MainController.class);

    private final BorderPane root = new BorderPane();
    private final ExecutorService exec = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "unmark-ui-task");
        t.setDaemon(true);
        return t;
    });
    private final Config cfg;
    private WatermarkRemover remover;

    private final ImageView view = new ImageView();
    private final Label placeholder = new Label("Drop an image here or press \"Open…\"");
    private final Label status = new Label();
    private final Label error = new Label();
    private final ProgressBar progress = new ProgressBar(0);
    private final Button openBtn = new Button("Open…");
    private final Button processBtn = new Button("Remove watermark");
    private final ToggleButton originalBtn = new ToggleButton("Show original");
    private final Button saveBtn = new Button("Save…");
    private Timeline busyDots;

    private Path sourcePath;
    private byte[] sourceBytes;
    private Image originalImage;
    private Image processedImage;
    private byte[] processedPng;

    public MainController(Config cfg) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        HBox toolbar = new HBox(8, openBtn, processBtn, originalBtn, saveBtn);
        toolbar.setPadding(new Insets(10));
        toolbar.setAlignment(Pos.CENTER_LEFT);

        view.setPreserveRatio(true);
        view.setSmooth(true);
        StackPane dropZone = new StackPane(placeholder, view);
        dropZone.setPadding(new Insets(10));
        dropZone.setStyle("-fx-border-color: #9aa; -fx-border-style: dashed; -fx-border-width: 2;");
        view.fitWidthProperty().bind(dropZone.widthProperty().subtract(24));
        view.fitHeightProperty().bind(dropZone.heightProperty().subtract(24));
        dropZone.setOnDragOver(this::onDragOver);
        dropZone.setOnDragDropped(this::onDragDropped);

        progress.setMaxWidth(Double.MAX_VALUE);
        progress.setVisible(false);
        error.setStyle("-fx-text-fill: #c0392b;");
        VBox bottom = new VBox(4, progress, status, error);
        bottom.setPadding(new Insets(10));

        root.setTop(toolbar);
        root.setCenter(dropZone);
        root.setBottom(bottom);

        openBtn.setOnAction(e -> chooseFile(root.getScene() == null ? null : root.getScene().getWindow()));
        processBtn.setOnAction(e -> process());
        originalBtn.setOnAction(e -> showCurrent());
        saveBtn.setOnAction(e -> save(root.getScene() == null ? null : root.getScene().getWindow()));
        refreshButtons(false);
    }

    public Pane getRoot() {
        return root;
    }

    private void onDragOver(DragEvent e) {
        if (e.getDragboard().hasFiles()) {
            e.acceptTransferModes(TransferMode.COPY);
        }
        e.consume();
    }

    private void onDragDropped(DragEvent e) {
        Dragboard db = e.getDragboard();
        boolean done = false;
        if (db.hasFiles() && !db.getFiles().isEmpty()) {
            File f = db.getFiles().get(0);
            if (ImageFiles.isImageFile(f.toPath())) {
                load(f.toPath());
                done = true;
            } else {
                error.setText("Please drop an image file.");
            }
        }
        e.setDropCompleted(done);
        e.consume();
    }

    private void chooseFile(Window owner) {
        FileChooser fc = new FileChooser();
        fc.setTitle("Open image");
        fc.getExtensionFilters().add(new FileChooser.ExtensionFilter("Images", "*.png", "*.jpg", "*.jpeg", "*.bmp", "*.gif"));
        File f = fc.showOpenDialog(owner);
        if (f == null) return;
        if (!ImageFiles.isImageFile(f.toPath())) {
            error.setText("Please select an image file.");
            return;
        }
        load(f.toPath());
    }

    private void load(Path p) {
        try {
            sourceBytes = Files.readAllBytes(p);
            sourcePath = p;
            originalImage = new Image(new ByteArrayInputStream(sourceBytes));
            processedImage = null;
            processedPng = null;
            originalBtn.setSelected(false);
            error.setText("");
            status.setText(p.getFileName().toString());
            showCurrent();
            refreshButtons(false);
        } catch (IOException ex) {
            log.warn("UI: cannot read {}: {}", p, ex.toString());
            error.setText("Cannot read " + p.getFileName() + ": " + ex.getMessage());
        }
    }

    private void process() {
        if (sourceBytes == null) return;
        final byte[] input = sourceBytes;
        processedImage = null;
        processedPng = null;
        error.setText("");
        progress.setProgress(0);
        progress.setVisible(true);
        refreshButtons(true);
        startBusy();
        exec.submit(() -> {
            RemovalResult r;
            try {
                r = remover().process(input, new StatusListener() {
                    @Override
                    public void onStatus(String s) {
                        Platform.runLater(() -> status.setText(s));
                    }

                    @Override
                    public void onProgress(int percent) {
                        Platform.runLater(() -> progress.setProgress(percent / 100.0));
                    }
                });
            } catch (Exception ex) {
                log.error("UI: processing failed", ex);
                r = new RemovalResult(RemovalResult.Status.FAILED, null, null, null,
                        "Failed to process the image. Try another one.");
            }
            final RemovalResult res = r;
            Platform.runLater(() -> onProcessed(res));
        });
    }

    private void onProcessed(RemovalResult r) {
        stopBusy();
        progress.setVisible(false);
        if (r.isDone()) {
            processedPng = r.png();
            processedImage = new Image(new ByteArrayInputStream(processedPng));
            originalBtn.setSelected(false);
            status.setText("Done");
        } else {
            error.setText(r.message());
            status.setText("");
        }
        showCurrent();
        refreshButtons(false);
    }

    private void showCurrent() {
        boolean original = originalBtn.isSelected() || processedImage == null;
        view.setImage(original ? originalImage : processedImage);
        placeholder.setVisible(view.getImage() == null);
    }

    private void save(Window owner) {
        if (processedPng == null) return;
        FileChooser fc = new FileChooser();
        fc.setTitle("Save image");
        String name = ImageFiles.outputName(sourcePath == null ? null : sourcePath.getFileName().toString(),
                cfg.output().suffix());
        fc.setInitialFileName(name);
        if (sourcePath != null && sourcePath.getParent() != null) {
            fc.setInitialDirectory(sourcePath.getParent().toFile());
        }
        File f = fc.showSaveDialog(owner);
        if (f == null) return;
        try {
            Files.write(f.toPath(), processedPng);
            status.setText("Saved " + f.getName());
        } catch (IOException ex) {
            log.warn("UI: save failed {}: {}", f, ex.toString());
            error.setText("Save failed: " + ex.getMessage());
        }
    }

    private void refreshButtons(boolean busy) {
        openBtn.setDisable(busy);
        processBtn.setDisable(busy || sourceBytes == null);
        originalBtn.setDisable(busy || processedImage == null);
        saveBtn.setDisable(busy || processedPng == null);
    }

    // анимированные точки в статусе, пока идёт обработка
    private void startBusy() {
        stopBusy();
        final int[] n = {0};
        busyDots = new Timeline(new KeyFrame(Duration.millis(400), e -> {
            String base = status.getText().replaceAll("\\.*$", "");
            n[0] = (n[0] + 1) % 4;
            status.setText(base + ".".repeat(n[0]));
        }));
        busyDots.setCycleCount(Animation.INDEFINITE);
        busyDots.play();
    }

    private void stopBusy() {
        if (busyDots != null) {
            busyDots.stop();
            busyDots = null;
        }
    }

    private synchronized WatermarkRemover remover() throws IOException {
        if (remover == null) remover = Components.remover(cfg);
        return remover;
    }

    public void shutdown() {
        stopBusy();
        exec.shutdownNow();
        synchronized (this) {
            if (remover != null) remover.close();
        }
    }
}
