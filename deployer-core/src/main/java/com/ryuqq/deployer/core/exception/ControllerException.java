package com.ryuqq.deployer.core.exception;

/**
 * Formation read/write or job event stream setup failed at the controller.
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public class ControllerException extends DeployerException {

    public ControllerException(String message) {
        super(message);
    }

    public ControllerException(String message, Throwable cause) {
        super(message, cause);
    }
}
