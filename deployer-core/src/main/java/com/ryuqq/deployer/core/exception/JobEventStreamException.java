package com.ryuqq.deployer.core.exception;

/**
 * The job event source closed or failed.
 *
 * <p>{@link #isClosed()} distinguishes an orderly close from a transport error.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public class JobEventStreamException extends DeployerException {

    private final boolean closed;

    private JobEventStreamException(String message, Throwable cause, boolean closed) {
        super(message, cause);
        this.closed = closed;
    }

    /**
     * The stream was closed before the caller stopped reading.
     *
     * @param appId app whose stream closed
     * @return exception for an orderly close
     */
    public static JobEventStreamException closed(String appId) {
        return new JobEventStreamException("Job event stream closed for app " + appId, null, true);
    }

    /**
     * The stream failed with a transport error.
     *
     * @param appId app whose stream failed
     * @param cause underlying error
     * @return exception wrapping the cause
     */
    public static JobEventStreamException failed(String appId, Throwable cause) {
        return new JobEventStreamException("Job event stream failed for app " + appId, cause, false);
    }

    public boolean isClosed() {
        return closed;
    }
}
