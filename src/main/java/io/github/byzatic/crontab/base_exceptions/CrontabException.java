package io.github.byzatic.crontab.base_exceptions;

/**
 * Root of all failures raised while parsing or evaluating a crontab schedule.
 */
public class CrontabException extends RuntimeException {
    public CrontabException(String message) {
        super(message);
    }

    public CrontabException(Throwable cause) {
        super(cause);
    }

    public CrontabException(String message, Throwable cause) {
        super(message, cause);
    }

    public CrontabException(Throwable cause, String message) {
        super(message, cause);
    }
}
