package com.ryuqq.deployer.core.spi;

import com.ryuqq.deployer.core.model.Formation;

/**
 * Controller SPI consumed by the strategy engine.
 *
 * <p>The controller owns formations (desired instance counts per release) and relays the
 * scheduler's job lifecycle events. The deployer never schedules processes itself: it writes
 * formations and waits for the scheduler to report the resulting job events.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Formation read by (app, release)</li>
 *   <li>Formation write with full-overwrite semantics</li>
 *   <li>Per-app job event stream (at-least-once, unordered, may contain duplicates)</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Full overwrite: {@code putFormation} replaces the whole process mapping, never merges</li>
 *   <li>Thread-safe: distinct apps may deploy concurrently</li>
 *   <li>Failures surface as {@link com.ryuqq.deployer.core.exception.ControllerException}</li>
 * </ul>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public interface Controller {

    /**
     * Reads the formation of one release.
     *
     * @param appId the app
     * @param releaseId the release
     * @return the current formation
     * @throws com.ryuqq.deployer.core.exception.NotFoundException if the release has no formation
     * @throws com.ryuqq.deployer.core.exception.ControllerException on I/O failure
     */
    Formation getFormation(String appId, String releaseId);

    /**
     * Overwrites the formation of one release.
     *
     * <p>The given process mapping becomes the complete desired state of the release.
     * Types missing from the mapping are scaled to zero.</p>
     *
     * @param formation the complete formation to write
     * @throws IllegalArgumentException if formation is null
     * @throws com.ryuqq.deployer.core.exception.ControllerException on I/O failure
     */
    void putFormation(Formation formation);

    /**
     * Opens the app's job event stream.
     *
     * <p>{@code sinceId = 0} delivers only events emitted after the stream opens.
     * A positive value resumes after that position of the controller's event history.</p>
     *
     * @param appId the app
     * @param sinceId resume position, 0 for live only
     * @return an open stream; the caller must close it
     * @throws IllegalArgumentException if sinceId is negative
     * @throws com.ryuqq.deployer.core.exception.ControllerException if the stream cannot be opened
     */
    JobEventStream streamJobEvents(String appId, long sinceId);
}
