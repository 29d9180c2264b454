package com.ttennebkram.rgbviewer.fx;

import com.ttennebkram.rgbviewer.analysis.Channel;
import com.ttennebkram.rgbviewer.analysis.ChannelCounts;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChannelChartDataTest {

    @Test
    void barsInRedGreenBlueOrder() {
        ChannelChartData data = ChannelChartData.of(new ChannelCounts(1, 2, 3, 4));
        assertEquals(3, data.getBars().size());
        assertEquals(Channel.RED, data.getBars().get(0).channel);
        assertEquals(Channel.GREEN, data.getBars().get(1).channel);
        assertEquals(Channel.BLUE, data.getBars().get(2).channel);
    }

    @Test
    void labelShowsPercentageAndCount() {
        ChannelChartData data = ChannelChartData.of(new ChannelCounts(1, 3, 0, 4));
        assertEquals("25.0%\n(1)", data.get(Channel.RED).getLabel());
        assertEquals("75.0%\n(3)", data.get(Channel.GREEN).getLabel());
        assertEquals("0.0%\n(0)", data.get(Channel.BLUE).getLabel());
    }

    @Test
    void labelRoundsToOneDecimal() {
        ChannelChartData data = ChannelChartData.of(new ChannelCounts(1, 2, 0, 3));
        assertEquals("33.3%\n(1)", data.get(Channel.RED).getLabel());
        assertEquals("66.7%\n(2)", data.get(Channel.GREEN).getLabel());
    }

    @Test
    void shortBarsLabelledAbove() {
        ChannelChartData data = ChannelChartData.of(new ChannelCounts(9, 10, 100, 100));
        assertFalse(data.get(Channel.RED).isLabelInside());
        assertTrue(data.get(Channel.GREEN).isLabelInside());
        assertTrue(data.get(Channel.BLUE).isLabelInside());
    }

    @Test
    void emptyCounts_allZeroPercent() {
        ChannelChartData data = ChannelChartData.of(ChannelCounts.EMPTY);
        for (ChannelChartData.Bar bar : data.getBars()) {
            assertEquals(0.0, bar.percentage);
            assertEquals(0, bar.count);
        }
    }
}
