package com.ryuqq.deployer.application.tail;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.deployer.core.model.DeploymentEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link TailSink} that renders a {@code text/event-stream} body.
 *
 * <p><strong>Framing:</strong></p>
 * <pre>
 * id: 42
 * data: {"id":42,"deployment_id":"...","release_id":"...","job_type":"web","job_state":"up","status":"running","created_at":"..."}
 *
 * :
 * </pre>
 *
 * <p>Each record is flushed immediately. The first write failure marks the writer closed;
 * later calls are no-ops.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public class EventStreamWriter implements TailSink {

    private static final Logger log = LoggerFactory.getLogger(EventStreamWriter.class);

    private final Writer out;
    private final ObjectMapper mapper;
    private volatile boolean open;

    /**
     * Creates a writer with the default JSON mapper.
     *
     * @param out response body writer
     */
    public EventStreamWriter(Writer out) {
        this(out, defaultMapper());
    }

    /**
     * Creates a writer with a custom JSON mapper.
     *
     * @param out response body writer
     * @param mapper JSON mapper
     * @throws IllegalArgumentException if any argument is null
     */
    public EventStreamWriter(Writer out, ObjectMapper mapper) {
        if (out == null) {
            throw new IllegalArgumentException("out cannot be null");
        }
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.out = out;
        this.mapper = mapper;
        this.open = true;
    }

    private static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Override
    public void send(DeploymentEvent event) {
        String data;
        try {
            data = mapper.writeValueAsString(toBody(event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize deployment event " + event.id(), e);
        }
        write("id: " + event.id() + "\ndata: " + data + "\n\n");
    }

    @Override
    public void keepAlive() {
        write(":\n");
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    /**
     * Marks the subscriber gone, e.g. when the client disconnects.
     */
    public void close() {
        open = false;
    }

    private synchronized void write(String record) {
        if (!open) {
            return;
        }
        try {
            out.write(record);
            out.flush();
        } catch (IOException e) {
            log.debug("Event stream subscriber went away", e);
            open = false;
        }
    }

    private static Map<String, Object> toBody(DeploymentEvent event) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", event.id());
        body.put("deployment_id", event.deploymentId());
        body.put("release_id", event.releaseId());
        body.put("job_type", event.jobType());
        body.put("job_state", event.jobState() == null ? null : event.jobState().wireName());
        body.put("status", event.status().wireName());
        body.put("created_at", event.createdAt());
        return body;
    }
}
