package com.ryuqq.deployer.application.admission;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * Encodes and decodes the payload of a deployment work item: {@code {"id": "<deploymentId>"}}.
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public class DeploymentJobCodec {

    /**
     * Work item job type of deployment executions.
     */
    public static final String JOB_TYPE = "Deployment";

    private final ObjectMapper mapper;

    public DeploymentJobCodec() {
        this(new ObjectMapper());
    }

    public DeploymentJobCodec(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    /**
     * Encodes the payload for a deployment.
     *
     * @param deploymentId deployment id
     * @return JSON payload
     */
    public String encode(String deploymentId) {
        if (deploymentId == null) {
            throw new IllegalArgumentException("deploymentId cannot be null");
        }
        try {
            return mapper.writeValueAsString(Map.of("id", deploymentId));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode deployment job for " + deploymentId, e);
        }
    }

    /**
     * Decodes the deployment id from a payload.
     *
     * @param payload JSON payload
     * @return deployment id
     * @throws IllegalArgumentException if the payload is not a JSON object with a non-blank string {@code id}
     */
    public String decode(String payload) {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed deployment job payload: " + payload, e);
        }
        JsonNode id = root == null ? null : root.get("id");
        if (id == null || !id.isTextual() || id.asText().isBlank()) {
            throw new IllegalArgumentException("Deployment job payload has no id: " + payload);
        }
        return id.asText();
    }
}
