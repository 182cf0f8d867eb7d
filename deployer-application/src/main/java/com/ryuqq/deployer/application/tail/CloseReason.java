package com.ryuqq.deployer.application.tail;

/**
 * Why a live tail session ended.
 *
 * <p>None of these is retried internally. The caller resumes with
 * {@code sinceId = session.cursor()}.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public enum CloseReason {

    /**
     * The sink stopped accepting writes.
     */
    SUBSCRIBER_GONE,

    /**
     * The wake-up channel closed cleanly.
     */
    CHANNEL_CLOSED,

    /**
     * The wake-up channel failed, never became ready, or delivered a malformed payload.
     */
    CHANNEL_FAILED,

    /**
     * Reading the deployment event log failed.
     */
    FETCH_FAILED,

    /**
     * The sink threw while writing an event or keep-alive.
     */
    SINK_FAILED,

    /**
     * The tailing thread was interrupted.
     */
    INTERRUPTED
}
