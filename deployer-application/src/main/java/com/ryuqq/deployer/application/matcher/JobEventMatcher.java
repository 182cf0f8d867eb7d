package com.ryuqq.deployer.application.matcher;

import com.ryuqq.deployer.core.model.JobEvent;
import com.ryuqq.deployer.core.outcome.Matched;
import com.ryuqq.deployer.core.outcome.Unmatched;
import com.ryuqq.deployer.core.outcome.WaitOutcome;
import com.ryuqq.deployer.core.spi.JobEventStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 비동기 job event 스트림 위의 blocking 대기.
 *
 * <p>순서 없는 at-least-once 스트림에서 기대한 (type, state) 이벤트가 모두 관측될 때까지
 * 현재 스레드를 블로킹합니다.</p>
 *
 * <p><strong>판정 규칙:</strong></p>
 * <ul>
 *   <li>기대 집합에 남은 개수가 있는 (type, state) → 1 차감</li>
 *   <li>그 외 이벤트 (중복, 무관한 type/state/release) → 무시</li>
 *   <li>{@code crashed} 이벤트 → type, release와 무관하게 즉시 {@code Unmatched(CRASHED)}</li>
 *   <li>스트림 종료/오류 → {@code Unmatched(STREAM_CLOSED)}</li>
 *   <li>스레드 인터럽트 → {@code Unmatched(CANCELLED)}, 인터럽트 플래그 복원</li>
 * </ul>
 *
 * <p><strong>타임아웃:</strong></p>
 * <p>내장 타임아웃은 없습니다. 제한 시간이 필요하면 호출자가 대기 스레드를 인터럽트하거나
 * 스트림을 닫아야 합니다.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public class JobEventMatcher {

    private static final Logger log = LoggerFactory.getLogger(JobEventMatcher.class);

    /**
     * 기대 집합이 충족되거나 실패할 때까지 대기.
     *
     * @param stream 열린 job event 스트림
     * @param expected 이 대기가 소유하는 기대 집합 (대기 중 변경됨)
     * @return {@link Matched} 또는 {@link Unmatched}
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public WaitOutcome await(JobEventStream stream, ExpectedEvents expected) {
        if (stream == null) {
            throw new IllegalArgumentException("stream cannot be null");
        }
        if (expected == null) {
            throw new IllegalArgumentException("expected cannot be null");
        }

        if (expected.isSatisfied()) {
            return new Matched(expected.requested(), 0);
        }

        int consumed = 0;
        while (true) {
            JobEvent event;
            try {
                event = stream.next();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Wait cancelled with {} unmet", expected.remaining());
                return Unmatched.cancelled(expected.remaining(), e);
            } catch (RuntimeException e) {
                log.debug("Job event stream ended with {} unmet", expected.remaining(), e);
                return Unmatched.streamClosed(expected.remaining(), e);
            }
            consumed++;

            if (event.state().isTerminalFailure()) {
                log.debug("Crash observed while waiting for {}: {}", expected, event);
                return Unmatched.crashed(expected.remaining(), event);
            }

            if (event.releaseId() == null && expected.releaseId() != null) {
                log.debug("Skipping {} {} event without a release while waiting on release {}",
                    event.processType(), event.state().wireName(), expected.releaseId());
                continue;
            }

            if (expected.consume(event)) {
                log.debug("Consumed {} {} on release {}", event.processType(), event.state().wireName(), event.releaseId());
                if (expected.isSatisfied()) {
                    return new Matched(expected.requested(), consumed);
                }
            }
        }
    }
}
