package com.ryuqq.deployer.adapter.runner;

import com.ryuqq.deployer.core.exception.DeployerException;

/**
 * 배포가 maxDeploymentTimeMs 안에 끝나지 않아 취소된 경우.
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public class DeploymentTimeoutException extends DeployerException {

    private final String deploymentId;

    public DeploymentTimeoutException(String deploymentId, long maxDeploymentTimeMs) {
        super("Deployment " + deploymentId + " cancelled after " + maxDeploymentTimeMs + "ms");
        this.deploymentId = deploymentId;
    }

    public String getDeploymentId() {
        return deploymentId;
    }
}
