package bstree.io;

import java.io.IOException;

/**
 * Thrown when a tree file is truncated or does not match the expected
 * key/value types.
 */
public class DataFormatException extends IOException {

    public DataFormatException(String message) {
        super(message);
    }

    public DataFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
