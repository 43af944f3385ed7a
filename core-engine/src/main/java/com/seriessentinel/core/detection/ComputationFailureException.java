package com.seriessentinel.core.detection;

/**
 * Unexpected internal failure while scoring a series.
 *
 * <p>
 * The cause may carry request data, so callers outside the engine should log
 * it and report only {@link #getMessage()}.
 * </p>
 *
 * @since 1.0.0
 */
public class ComputationFailureException extends DetectionException {

    private static final long serialVersionUID = 1L;

    public ComputationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
