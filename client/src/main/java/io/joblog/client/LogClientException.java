package io.joblog.client;

/**
 * Non-2xx answer from the log server.
 */
public final class LogClientException extends RuntimeException {

    private final int status;

    public LogClientException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int status() {
        return status;
    }
}
