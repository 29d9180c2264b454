package com.ttennebkram.rgbviewer.fx;

import com.ttennebkram.rgbviewer.analysis.Channel;
import com.ttennebkram.rgbviewer.analysis.ChannelCounts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Bar values and labels for the channel chart, computed without touching the JavaFX toolkit.
 */
public final class ChannelChartData {

    /** Bars shorter than this (in percent) get their label above the bar instead of inside. */
    public static final double INSIDE_LABEL_MIN_PERCENT = 10.0;

    /**
     * One bar of the chart.
     */
    public static final class Bar {
        public final Channel channel;
        public final long count;
        public final double percentage;

        Bar(Channel channel, long count, double percentage) {
            this.channel = channel;
            this.count = count;
            this.percentage = percentage;
        }

        /** Two-line label, e.g. "25.0%\n(1)". */
        public String getLabel() {
            return String.format(Locale.ROOT, "%.1f%%\n(%d)", percentage, count);
        }

        public boolean isLabelInside() {
            return percentage >= INSIDE_LABEL_MIN_PERCENT;
        }
    }

    private final List<Bar> bars;

    private ChannelChartData(List<Bar> bars) {
        this.bars = Collections.unmodifiableList(bars);
    }

    public static ChannelChartData of(ChannelCounts counts) {
        List<Bar> bars = new ArrayList<>();
        for (Channel channel : Channel.values()) {
            bars.add(new Bar(channel, counts.get(channel), counts.percentage(channel)));
        }
        return new ChannelChartData(bars);
    }

    public List<Bar> getBars() {
        return bars;
    }

    public Bar get(Channel channel) {
        return bars.get(channel.ordinal());
    }
}
