package com.ryuqq.deployer.core.exception;

import com.ryuqq.deployer.core.outcome.UnmetReason;
import com.ryuqq.deployer.core.outcome.Unmatched;

/**
 * A deployment step could not be confirmed.
 *
 * <p>Carries the {@link Unmatched} outcome of the failed wait. A scheduler-reported crash is
 * terminal ("new code failed to start"); stream closure and cancellation are infrastructure
 * failures.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public class DeploymentFailedException extends DeployerException {

    private final String deploymentId;
    private final Unmatched outcome;

    public DeploymentFailedException(String deploymentId, Unmatched outcome) {
        super(buildMessage(deploymentId, outcome), outcome.cause());
        this.deploymentId = deploymentId;
        this.outcome = outcome;
    }

    private static String buildMessage(String deploymentId, Unmatched outcome) {
        StringBuilder message = new StringBuilder()
            .append("Deployment ").append(deploymentId)
            .append(" failed: ").append(outcome.reason())
            .append(", unmet ").append(outcome.remaining());
        if (outcome.trigger() != null) {
            message.append(", observed ").append(outcome.trigger());
        }
        return message.toString();
    }

    public String getDeploymentId() {
        return deploymentId;
    }

    public Unmatched getOutcome() {
        return outcome;
    }

    public UnmetReason getReason() {
        return outcome.reason();
    }

    /**
     * @return true when the failure was a crash reported by the scheduler
     */
    public boolean isTerminal() {
        return outcome.reason() == UnmetReason.CRASHED;
    }
}
