package org.carball.litepilot.pool;

import java.sql.SQLException;

/**
 * Unchecked carrier for a {@link SQLException} that has to cross a future or a non-throwing API.
 */
public class DatabaseAccessException extends RuntimeException {

    public DatabaseAccessException(String message, SQLException cause) {
        super(message, cause);
    }

    public DatabaseAccessException(String message, Throwable cause) {
        super(message, cause);
    }

    public DatabaseAccessException(String message) {
        super(message);
    }

    /**
     * Returns {@code failure} itself when it is already unchecked, otherwise wraps it.
     */
    public static RuntimeException from(Throwable failure) {
        if (failure instanceof RuntimeException runtime) {
            return runtime;
        }
        return new DatabaseAccessException(failure.getMessage(), failure);
    }
}
