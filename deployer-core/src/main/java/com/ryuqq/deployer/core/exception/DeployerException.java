package com.ryuqq.deployer.core.exception;

/**
 * Base class of every failure raised by the deployer core and its SPI adapters.
 *
 * <p>All deployer exceptions are unchecked. Argument and state violations keep using
 * {@link IllegalArgumentException} and {@link IllegalStateException}.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public class DeployerException extends RuntimeException {

    public DeployerException(String message) {
        super(message);
    }

    public DeployerException(String message, Throwable cause) {
        super(message, cause);
    }
}
