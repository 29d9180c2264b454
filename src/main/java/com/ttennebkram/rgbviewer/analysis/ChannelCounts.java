package com.ttennebkram.rgbviewer.analysis;

/**
 * Per-channel count of bright samples plus the pixel count they were taken from.
 * Immutable.
 */
public final class ChannelCounts {

    /** Result for an absent image. */
    public static final ChannelCounts EMPTY = new ChannelCounts(0, 0, 0, 0);

    private final long red;
    private final long green;
    private final long blue;
    private final long totalPixels;

    public ChannelCounts(long red, long green, long blue, long totalPixels) {
        if (totalPixels < 0) {
            throw new IllegalArgumentException("totalPixels must be >= 0: " + totalPixels);
        }
        checkRange("red", red, totalPixels);
        checkRange("green", green, totalPixels);
        checkRange("blue", blue, totalPixels);
        this.red = red;
        this.green = green;
        this.blue = blue;
        this.totalPixels = totalPixels;
    }

    private static void checkRange(String name, long value, long totalPixels) {
        if (value < 0 || value > totalPixels) {
            throw new IllegalArgumentException(
                name + " count " + value + " outside [0, " + totalPixels + "]");
        }
    }

    public long getRed() {
        return red;
    }

    public long getGreen() {
        return green;
    }

    public long getBlue() {
        return blue;
    }

    public long getTotalPixels() {
        return totalPixels;
    }

    public long get(Channel channel) {
        switch (channel) {
            case RED: return red;
            case GREEN: return green;
            default: return blue;
        }
    }

    /**
     * Share of bright samples for a channel as a percentage, 0 when there are no pixels.
     */
    public double percentage(Channel channel) {
        return percentage(get(channel), totalPixels);
    }

    public static double percentage(long count, long totalPixels) {
        return totalPixels > 0 ? (double) count / totalPixels * 100.0 : 0.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChannelCounts)) return false;
        ChannelCounts other = (ChannelCounts) o;
        return red == other.red && green == other.green
            && blue == other.blue && totalPixels == other.totalPixels;
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(red);
        result = 31 * result + Long.hashCode(green);
        result = 31 * result + Long.hashCode(blue);
        result = 31 * result + Long.hashCode(totalPixels);
        return result;
    }

    @Override
    public String toString() {
        return "ChannelCounts{red=" + red + ", green=" + green + ", blue=" + blue
            + ", totalPixels=" + totalPixels + "}";
    }
}
