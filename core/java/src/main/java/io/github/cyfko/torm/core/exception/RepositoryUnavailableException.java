package io.github.cyfko.torm.core.exception;

/**
 * Exception raised by a document repository or its backing store when it cannot serve a request.
 * <p>
 * The model facade propagates it unchanged and never retries: retries, timeouts and
 * reconnection belong to the store's transport.
 * </p>
 *
 * <pre>{@code
 * try {
 *     users.create(Map.of("name", "Alice"));
 * } catch (RepositoryUnavailableException e) {
 *     // backing store down, nothing was written
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class RepositoryUnavailableException extends RuntimeException {

    /**
     * Creates an exception with an explanatory message.
     *
     * @param message the description of the failure
     */
    public RepositoryUnavailableException(String message) {
        super(message);
    }

    /**
     * Creates an exception with an explanatory message and the transport error that caused it.
     *
     * @param message the description of the failure
     * @param cause   the original cause
     */
    public RepositoryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
