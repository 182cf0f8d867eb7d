package com.ryuqq.deployer.core.exception;

/**
 * A live tail could not be established.
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public class LiveTailException extends DeployerException {

    public LiveTailException(String message, Throwable cause) {
        super(message, cause);
    }
}
