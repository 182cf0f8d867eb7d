package com.ryuqq.deployer.core.exception;

/**
 * A deployment, deployment event or formation record does not exist.
 *
 * <p>Kept distinct from other failures so boundaries can surface it as a not-found condition.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public class NotFoundException extends DeployerException {

    private final String resource;
    private final String key;

    public NotFoundException(String resource, String key) {
        super(resource + " not found: " + key);
        this.resource = resource;
        this.key = key;
    }

    /**
     * @return resource kind (e.g. "deployment", "deployment event")
     */
    public String getResource() {
        return resource;
    }

    /**
     * @return lookup key that missed
     */
    public String getKey() {
        return key;
    }
}
