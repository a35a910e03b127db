package org.calista.neuro.ai.learn.nn;

import java.io.IOException;

/** Model bytes are not a network this codec wrote, or do not fit the expected shape. */
public class ModelFormatException extends IOException {

    public ModelFormatException(String message) {
        super(message);
    }

    public ModelFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
