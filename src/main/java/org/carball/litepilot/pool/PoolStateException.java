package org.carball.litepilot.pool;

/**
 * The pool was used before {@code init()} or after {@code destroy()}.
 */
public class PoolStateException extends IllegalStateException {

    public PoolStateException(String message) {
        super(message);
    }
}
