package com.seriessentinel.core.detection;

/**
 * Base type for failures raised by the detection pipeline.
 *
 * @since 1.0.0
 */
public class DetectionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DetectionException(String message) {
        super(message);
    }

    public DetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
