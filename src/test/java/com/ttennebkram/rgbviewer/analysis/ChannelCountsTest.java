package com.ttennebkram.rgbviewer.analysis;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChannelCountsTest {

    @Test
    void percentage_oneOfFour() {
        assertEquals(25.0, ChannelCounts.percentage(1, 4), 1e-9);
    }

    @Test
    void percentage_zeroTotalIsZero() {
        assertEquals(0.0, ChannelCounts.percentage(0, 0));
        for (Channel channel : Channel.values()) {
            assertEquals(0.0, ChannelCounts.EMPTY.percentage(channel));
        }
    }

    @Test
    void countAboveTotal_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new ChannelCounts(5, 0, 0, 4));
        assertThrows(IllegalArgumentException.class, () -> new ChannelCounts(0, -1, 0, 4));
    }

    @Test
    void getByChannel() {
        ChannelCounts counts = new ChannelCounts(1, 2, 3, 10);
        assertEquals(1, counts.get(Channel.RED));
        assertEquals(2, counts.get(Channel.GREEN));
        assertEquals(3, counts.get(Channel.BLUE));
        assertEquals(30.0, counts.percentage(Channel.BLUE), 1e-9);
    }

    @Test
    void valueEquality() {
        assertEquals(new ChannelCounts(1, 2, 3, 10), new ChannelCounts(1, 2, 3, 10));
        assertEquals(new ChannelCounts(1, 2, 3, 10).hashCode(), new ChannelCounts(1, 2, 3, 10).hashCode());
        assertNotEquals(new ChannelCounts(1, 2, 3, 10), new ChannelCounts(1, 2, 3, 11));
    }
}
