package focalplane.sim.utilities;

import java.io.IOException;

/**
 * Thrown when a serialized calibration document cannot be turned back into a model: malformed JSON, a missing
 * field, a wrong array length or an unknown term key.
 *
 * @since 1.1
 */
public class CalibrationFormatException extends IOException {

    /**
     * @param message the detail message
     */
    public CalibrationFormatException(String message) {
        super(message);
    }

    /**
     * @param message the detail message
     * @param cause the underlying parse failure
     */
    public CalibrationFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
