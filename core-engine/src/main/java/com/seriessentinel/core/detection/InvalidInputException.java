package com.seriessentinel.core.detection;

/**
 * The caller supplied a series or parameter the pipeline cannot work with.
 *
 * <p>
 * The message is meant for the caller and describes what was wrong. Requests
 * failing this way must not be retried unchanged.
 * </p>
 *
 * @since 1.0.0
 */
public class InvalidInputException extends DetectionException {

    private static final long serialVersionUID = 1L;

    public InvalidInputException(String message) {
        super(message);
    }
}
