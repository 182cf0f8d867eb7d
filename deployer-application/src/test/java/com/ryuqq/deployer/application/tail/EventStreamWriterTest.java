package com.ryuqq.deployer.application.tail;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.deployer.core.model.DeploymentEvent;
import com.ryuqq.deployer.core.model.DeploymentStatus;
import com.ryuqq.deployer.core.model.JobState;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * EventStreamWriter 유닛 테스트.
 *
 * @author Deployer Team
 * @since 1.0.0
 */
class EventStreamWriterTest {

    private static final Instant CREATED_AT = Instant.parse("2026-03-01T12:30:00Z");

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void send_id_줄과_snake_case_JSON_data_줄_기록() throws IOException {
        // given
        StringWriter out = new StringWriter();
        EventStreamWriter writer = new EventStreamWriter(out);
        DeploymentEvent event = DeploymentEvent.draft("d1", "r2", "web", JobState.UP, DeploymentStatus.RUNNING)
            .persisted(12L, CREATED_AT);

        // when
        writer.send(event);

        // then
        String[] lines = out.toString().split("\n", -1);
        assertThat(lines[0]).isEqualTo("id: 12");
        assertThat(lines[1]).startsWith("data: ");
        assertThat(out.toString()).endsWith("\n\n");

        JsonNode data = mapper.readTree(lines[1].substring("data: ".length()));
        assertThat(data.get("id").asLong()).isEqualTo(12L);
        assertThat(data.get("deployment_id").asText()).isEqualTo("d1");
        assertThat(data.get("release_id").asText()).isEqualTo("r2");
        assertThat(data.get("job_type").asText()).isEqualTo("web");
        assertThat(data.get("job_state").asText()).isEqualTo("up");
        assertThat(data.get("status").asText()).isEqualTo("running");
        assertThat(data.get("created_at").asText()).isEqualTo("2026-03-01T12:30:00Z");
    }

    @Test
    void send_job_정보_없는_failed_이벤트는_null_필드() throws IOException {
        // given
        StringWriter out = new StringWriter();
        EventStreamWriter writer = new EventStreamWriter(out);
        DeploymentEvent event = DeploymentEvent.draft("d1", "r2", null, null, DeploymentStatus.FAILED)
            .persisted(3L, CREATED_AT);

        // when
        writer.send(event);

        // then
        String dataLine = out.toString().split("\n")[1];
        JsonNode data = mapper.readTree(dataLine.substring("data: ".length()));
        assertThat(data.get("job_type").isNull()).isTrue();
        assertThat(data.get("job_state").isNull()).isTrue();
        assertThat(data.get("status").asText()).isEqualTo("failed");
    }

    @Test
    void keepAlive_주석_줄_기록() {
        StringWriter out = new StringWriter();
        EventStreamWriter writer = new EventStreamWriter(out);

        writer.keepAlive();

        assertThat(out.toString()).isEqualTo(":\n");
    }

    @Test
    void write_실패시_닫힘_상태로_전환하고_이후_기록_무시() {
        // given
        FailingWriter out = new FailingWriter();
        EventStreamWriter writer = new EventStreamWriter(out);

        // when
        writer.keepAlive();
        writer.keepAlive();

        // then
        assertThat(writer.isOpen()).isFalse();
        assertThat(out.attempts).isEqualTo(1);
    }

    @Test
    void close_이후_기록_무시() {
        StringWriter out = new StringWriter();
        EventStreamWriter writer = new EventStreamWriter(out);

        writer.close();
        writer.keepAlive();

        assertThat(writer.isOpen()).isFalse();
        assertThat(out.toString()).isEmpty();
    }

    private static class FailingWriter extends Writer {

        private int attempts;

        @Override
        public void write(char[] buffer, int offset, int length) throws IOException {
            attempts++;
            throw new IOException("Broken pipe");
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    }
}
