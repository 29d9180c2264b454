package com.ttennebkram.rgbviewer;

import javafx.application.Application;
import javafx.application.Platform;
import javafx.geometry.Insets;
import javafx.scene.Scene;
import javafx.scene.control.*;
import javafx.scene.input.KeyCode;
import javafx.scene.input.KeyCodeCombination;
import javafx.scene.input.KeyCombination;
import javafx.scene.layout.*;
import javafx.stage.FileChooser;
import javafx.stage.Stage;

import com.ttennebkram.rgbviewer.fx.ChannelBarChart;
import com.ttennebkram.rgbviewer.fx.ImagePane;
import com.ttennebkram.rgbviewer.image.ImageCatalog;
import com.ttennebkram.rgbviewer.image.OpenCvImageLoader;
import com.ttennebkram.rgbviewer.report.AnalysisReportSerializer;
import com.ttennebkram.rgbviewer.session.AnalyzedImage;
import com.ttennebkram.rgbviewer.session.ViewerSession;
import com.ttennebkram.rgbviewer.session.ViewerState;
import com.ttennebkram.rgbviewer.session.ViewerTaskRunner;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.prefs.Preferences;

/**
 * Main JavaFX Application class: the image on the left, the channel chart on the right,
 * buttons underneath. All loading and analysis runs on a {@link ViewerTaskRunner} worker.
 */
public class RgbViewerApp extends Application {

    private static final String LAST_OPEN_DIR_KEY = "lastOpenDir";
    private static final String LAST_EXPORT_DIR_KEY = "lastExportDir";

    private Stage primaryStage;
    private Preferences prefs;
    private ViewerOptions options;

    private ViewerSession session;
    private ViewerTaskRunner taskRunner;

    // Only touched on the JavaFX Application Thread
    private ViewerState state;

    private ImagePane imagePane;
    private Label imageInfoLabel;
    private ChannelBarChart chart;
    private Button nextImageButton;
    private Button loadImageButton;
    private Button refreshButton;
    private MenuItem openItem;

    public static void main(String[] args) {
        launch(args);
    }

    @Override
    public void start(Stage primaryStage) {
        try {
            options = ViewerOptions.parse(getParameters().getRaw());
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            ViewerOptions.printHelp();
            Platform.exit();
            return;
        }
        this.primaryStage = primaryStage;
        prefs = Preferences.userNodeForPackage(RgbViewerApp.class);

        session = new ViewerSession(new OpenCvImageLoader());
        taskRunner = new ViewerTaskRunner(Platform::runLater);

        ImageCatalog catalog;
        try {
            catalog = ImageCatalog.scan(options.imagesDir);
        } catch (IOException e) {
            System.err.println("Cannot read images folder " + options.imagesDir + ": " + e.getMessage());
            catalog = ImageCatalog.empty(options.imagesDir);
        }
        state = ViewerState.initial(catalog);

        BorderPane root = new BorderPane();
        root.setTop(createMenuBar());
        root.setCenter(createContent());

        Scene scene = new Scene(root, options.windowWidth, options.windowHeight);
        primaryStage.setTitle("RGB Brightness Viewer");
        primaryStage.setScene(scene);
        primaryStage.setMinWidth(ViewerOptions.MIN_WIDTH);
        primaryStage.setMinHeight(ViewerOptions.MIN_HEIGHT);
        primaryStage.centerOnScreen();
        primaryStage.setOnCloseRequest(event -> shutdown());
        primaryStage.show();

        System.out.println("RGB Brightness Viewer started");
        System.out.println("OpenCV version: " + org.opencv.core.Core.VERSION);
        System.out.println("Images folder: " + catalog.getDirectory().toAbsolutePath()
            + " (" + catalog.size() + " images)");

        if (options.startFile != null && !options.startFile.toFile().exists()) {
            System.err.println("Image file not found: " + options.startFile);
        }
        Path startFile = options.startFile;
        ViewerState initial = state;
        runTask(() -> session.start(initial, startFile), "Load Error");
    }

    @Override
    public void stop() {
        shutdown();
    }

    private void shutdown() {
        if (taskRunner != null) {
            taskRunner.shutdown();
        }
        if (state != null) {
            ViewerSession.releaseReplaced(state, null);
            state = null;
        }
    }

    // ========================= LAYOUT =========================

    private MenuBar createMenuBar() {
        MenuBar menuBar = new MenuBar();

        Menu fileMenu = new Menu("File");

        openItem = new MenuItem("Open Image...");
        openItem.setAccelerator(new KeyCodeCombination(KeyCode.O, KeyCombination.SHORTCUT_DOWN));
        openItem.setOnAction(e -> loadCustomImage());

        MenuItem exportItem = new MenuItem("Export Analysis...");
        exportItem.setAccelerator(new KeyCodeCombination(KeyCode.E, KeyCombination.SHORTCUT_DOWN));
        exportItem.setOnAction(e -> exportAnalysis());

        MenuItem quitItem = new MenuItem("Quit");
        quitItem.setAccelerator(new KeyCodeCombination(KeyCode.Q, KeyCombination.SHORTCUT_DOWN));
        quitItem.setOnAction(e -> {
            shutdown();
            Platform.exit();
        });

        fileMenu.getItems().addAll(openItem, exportItem, new SeparatorMenuItem(), quitItem);
        menuBar.getMenus().add(fileMenu);
        return menuBar;
    }

    private Pane createContent() {
        // Image section
        imagePane = new ImagePane();
        imageInfoLabel = new Label("Loading...");
        VBox imageBox = new VBox(5, imagePane, imageInfoLabel);
        VBox.setVgrow(imagePane, Priority.ALWAYS);
        TitledPane imageSection = new TitledPane("Image", imageBox);
        imageSection.setCollapsible(false);
        imageSection.setMaxHeight(Double.MAX_VALUE);

        // Chart section
        chart = new ChannelBarChart();
        TitledPane chartSection = new TitledPane("RGB Histogram", chart.getNode());
        chartSection.setCollapsible(false);
        chartSection.setMaxHeight(Double.MAX_VALUE);

        GridPane grid = new GridPane();
        grid.setHgap(10);
        ColumnConstraints half = new ColumnConstraints();
        half.setPercentWidth(50);
        half.setHgrow(Priority.ALWAYS);
        grid.getColumnConstraints().addAll(half, half);
        RowConstraints fill = new RowConstraints();
        fill.setVgrow(Priority.ALWAYS);
        grid.getRowConstraints().add(fill);
        grid.add(imageSection, 0, 0);
        grid.add(chartSection, 1, 0);

        // Buttons
        nextImageButton = new Button("Next Image");
        nextImageButton.setOnAction(e -> switchImage());
        loadImageButton = new Button("Load Your Own Image...");
        loadImageButton.setOnAction(e -> loadCustomImage());
        refreshButton = new Button("Refresh Display");
        refreshButton.setOnAction(e -> updateDisplay());

        Region spacer = new Region();
        HBox.setHgrow(spacer, Priority.ALWAYS);
        HBox buttons = new HBox(10, nextImageButton, loadImageButton, spacer, refreshButton);
        buttons.setPadding(new Insets(10, 0, 0, 0));

        VBox content = new VBox(grid, buttons);
        VBox.setVgrow(grid, Priority.ALWAYS);
        content.setPadding(new Insets(10));
        return content;
    }

    // ========================= ACTIONS =========================

    private void switchImage() {
        if (taskRunner.isBusy()) {
            return;
        }
        if (state.getCatalog().isEmpty()) {
            showWarning("Warning", "No images available in folder '" + state.getCatalog().getDirectory() + "'");
            return;
        }
        ViewerState current = state;
        runTask(() -> session.next(current), "Load Error");
    }

    private void loadCustomImage() {
        if (taskRunner.isBusy()) {
            return;
        }
        FileChooser fileChooser = new FileChooser();
        fileChooser.setTitle("Choose an Image");
        fileChooser.getExtensionFilters().addAll(
            new FileChooser.ExtensionFilter("Images", "*.png", "*.jpg", "*.jpeg", "*.bmp", "*.gif"),
            new FileChooser.ExtensionFilter("All Files", "*.*")
        );
        String lastDir = prefs.get(LAST_OPEN_DIR_KEY, null);
        if (lastDir != null && new File(lastDir).isDirectory()) {
            fileChooser.setInitialDirectory(new File(lastDir));
        }

        File file = fileChooser.showOpenDialog(primaryStage);
        if (file == null) {
            return;
        }
        if (file.getParentFile() != null) {
            prefs.put(LAST_OPEN_DIR_KEY, file.getParentFile().getAbsolutePath());
        }

        ViewerState current = state;
        Path path = file.toPath();
        runTask(() -> session.openCustom(current, path), "Load Error");
    }

    private void exportAnalysis() {
        AnalyzedImage current = state.getCurrent();
        if (current == null) {
            showWarning("Nothing to Export", "No image is loaded.");
            return;
        }

        FileChooser fileChooser = new FileChooser();
        fileChooser.setTitle("Export Analysis");
        fileChooser.getExtensionFilters().add(new FileChooser.ExtensionFilter("JSON Files", "*.json"));
        fileChooser.setInitialFileName(stripExtension(current.image.getName()) + "-rgb.json");
        String lastDir = prefs.get(LAST_EXPORT_DIR_KEY, null);
        if (lastDir != null && new File(lastDir).isDirectory()) {
            fileChooser.setInitialDirectory(new File(lastDir));
        }

        File file = fileChooser.showSaveDialog(primaryStage);
        if (file == null) {
            return;
        }
        try {
            AnalysisReportSerializer.save(file.toPath(), current.image, current.counts);
            if (file.getParentFile() != null) {
                prefs.put(LAST_EXPORT_DIR_KEY, file.getParentFile().getAbsolutePath());
            }
            System.out.println("Exported analysis: " + file.getAbsolutePath());
        } catch (IOException e) {
            e.printStackTrace();
            showError("Export Error", "Failed to export analysis: " + e.getMessage());
        }
    }

    /**
     * Run a load on the worker. Every load control stays disabled until the result
     * arrives, so each task starts from the state the previous one produced.
     * On failure the current state is kept and an error dialog is shown.
     */
    private void runTask(Callable<ViewerState> task, String errorTitle) {
        setLoadControlsDisabled(true);
        taskRunner.submit(task,
            newState -> {
                setLoadControlsDisabled(taskRunner.isBusy());
                applyState(newState);
            },
            e -> {
                setLoadControlsDisabled(taskRunner.isBusy());
                System.err.println("Failed to load image: " + e.getMessage());
                if (!(e instanceof IOException)) {
                    e.printStackTrace();
                }
                showError(errorTitle, "Could not load image: " + e.getMessage());
                updateDisplay();
            });
    }

    private void setLoadControlsDisabled(boolean disabled) {
        nextImageButton.setDisable(disabled);
        loadImageButton.setDisable(disabled);
        openItem.setDisable(disabled);
    }

    private void applyState(ViewerState newState) {
        if (state == null) {
            // Window closed while the task ran
            ViewerSession.releaseReplaced(newState, null);
            return;
        }
        ViewerState previous = state;
        state = newState;
        updateDisplay();
        ViewerSession.releaseReplaced(previous, newState);
    }

    /**
     * Redraw the image and chart from the current state.
     */
    private void updateDisplay() {
        if (state == null) {
            return;
        }
        AnalyzedImage current = state.getCurrent();
        if (current != null) {
            imagePane.setImage(current.image.mat);
            imageInfoLabel.setText(current.image.describe());
            primaryStage.setTitle("RGB Brightness Viewer - " + current.image.getName());
        } else {
            imagePane.setImage(null);
            imageInfoLabel.setText("No image loaded");
        }
        chart.update(state.getCounts());
    }

    private static String stripExtension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    // ========================= DIALOGS =========================

    private void showError(String title, String message) {
        Alert alert = new Alert(Alert.AlertType.ERROR);
        alert.setTitle(title);
        alert.setHeaderText(null);
        alert.setContentText(message);
        alert.showAndWait();
    }

    private void showWarning(String title, String message) {
        Alert alert = new Alert(Alert.AlertType.WARNING);
        alert.setTitle(title);
        alert.setHeaderText(null);
        alert.setContentText(message);
        alert.showAndWait();
    }
}
