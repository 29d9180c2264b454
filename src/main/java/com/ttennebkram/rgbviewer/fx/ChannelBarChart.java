package com.ttennebkram.rgbviewer.fx;

import com.ttennebkram.rgbviewer.analysis.Channel;
import com.ttennebkram.rgbviewer.analysis.ChannelCounts;
import javafx.geometry.Pos;
import javafx.scene.chart.BarChart;
import javafx.scene.chart.CategoryAxis;
import javafx.scene.chart.NumberAxis;
import javafx.scene.chart.XYChart;
import javafx.scene.control.Label;
import javafx.scene.layout.StackPane;
import javafx.scene.paint.Color;
import javafx.scene.text.TextAlignment;

import java.util.EnumMap;
import java.util.Map;

/**
 * Three-bar chart of bright-sample percentages, one bar per channel, y axis fixed at 0-100%.
 * Each bar carries a label with the percentage and the raw count.
 * Must be created and updated on the JavaFX Application Thread.
 */
public class ChannelBarChart {

    private static final double LABEL_ABOVE_OFFSET = 22;

    private final BarChart<String, Number> chart;
    private final Map<Channel, XYChart.Data<String, Number>> dataByChannel = new EnumMap<>(Channel.class);
    private final Map<Channel, Label> labels = new EnumMap<>(Channel.class);

    public ChannelBarChart() {
        CategoryAxis xAxis = new CategoryAxis();
        xAxis.setLabel("Channel");

        NumberAxis yAxis = new NumberAxis(0, 100, 10);
        yAxis.setAutoRanging(false);
        yAxis.setLabel("Pixels above threshold (%)");

        chart = new BarChart<>(xAxis, yAxis);
        chart.setTitle("RGB Channel Brightness");
        chart.setLegendVisible(false);
        chart.setAnimated(false);
        chart.setVerticalGridLinesVisible(false);
        chart.setCategoryGap(40);

        XYChart.Series<String, Number> series = new XYChart.Series<>();
        for (Channel channel : Channel.values()) {
            XYChart.Data<String, Number> data = new XYChart.Data<>(channel.getDisplayName(), 0);

            // Supplying our own node lets the label live inside the bar
            Label label = new Label();
            label.setTextAlignment(TextAlignment.CENTER);
            label.setStyle("-fx-font-size: 11px; -fx-font-weight: bold;");
            StackPane bar = new StackPane(label);
            bar.setStyle("-fx-background-color: " + channel.getCssColor() + ";");
            data.setNode(bar);

            dataByChannel.put(channel, data);
            labels.put(channel, label);
            series.getData().add(data);
        }
        chart.getData().add(series);
        update(ChannelCounts.EMPTY);
    }

    public BarChart<String, Number> getNode() {
        return chart;
    }

    /**
     * Show new counts.
     */
    public void update(ChannelCounts counts) {
        ChannelChartData chartData = ChannelChartData.of(counts);
        for (ChannelChartData.Bar bar : chartData.getBars()) {
            dataByChannel.get(bar.channel).setYValue(bar.percentage);

            Label label = labels.get(bar.channel);
            label.setText(bar.getLabel());
            if (bar.isLabelInside()) {
                StackPane.setAlignment(label, Pos.CENTER);
                label.setTranslateY(0);
                label.setTextFill(Color.WHITE);
            } else {
                // Short bar: put the label just above it
                StackPane.setAlignment(label, Pos.TOP_CENTER);
                label.setTranslateY(-LABEL_ABOVE_OFFSET - label.getFont().getSize());
                label.setTextFill(Color.BLACK);
            }
        }
    }
}
