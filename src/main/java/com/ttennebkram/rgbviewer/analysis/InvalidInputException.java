package com.ttennebkram.rgbviewer.analysis;

/**
 * Thrown when a pixel buffer does not have a shape the analyzer understands.
 * Indicates a caller bug, so it is unchecked and not recovered internally.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }
}
