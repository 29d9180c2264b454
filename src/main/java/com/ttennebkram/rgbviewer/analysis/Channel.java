package com.ttennebkram.rgbviewer.analysis;

/**
 * Color channels reported by the brightness tally, in display order.
 */
public enum Channel {
    RED("Red", "rgba(255, 0, 0, 0.7)"),
    GREEN("Green", "rgba(0, 128, 0, 0.7)"),
    BLUE("Blue", "rgba(0, 0, 255, 0.7)");

    private final String displayName;
    private final String cssColor;

    Channel(String displayName, String cssColor) {
        this.displayName = displayName;
        this.cssColor = cssColor;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** JavaFX CSS bar fill for this channel. */
    public String getCssColor() {
        return cssColor;
    }
}
