package com.ryuqq.deployer.application.matcher;

import com.ryuqq.deployer.core.model.JobEvent;
import com.ryuqq.deployer.core.model.JobState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * 하나의 대기(wait)가 소유하는 기대 이벤트 집합.
 *
 * <p>process type → job state → 남은 개수를 보관하며, 선택적으로 하나의 release로 범위가 제한됩니다.
 * 대기를 수행하는 {@link JobEventMatcher}만 변경하므로 동기화하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ExpectedEvents expected = ExpectedEvents.forRelease("r2")
 *     .expect("web", JobState.UP, 1);
 * WaitOutcome outcome = matcher.await(stream, expected);
 * </pre>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public final class ExpectedEvents {

    private final String releaseId;
    private final TreeMap<String, EnumMap<JobState, Integer>> requested;
    private final TreeMap<String, EnumMap<JobState, Integer>> remaining;

    private ExpectedEvents(String releaseId) {
        this.releaseId = releaseId;
        this.requested = new TreeMap<>();
        this.remaining = new TreeMap<>();
    }

    /**
     * 특정 release의 이벤트만 세는 빈 집합 생성.
     *
     * @param releaseId 대상 release
     * @return 빈 기대 집합
     * @throws IllegalArgumentException releaseId가 null이거나 빈 경우
     */
    public static ExpectedEvents forRelease(String releaseId) {
        if (releaseId == null || releaseId.isBlank()) {
            throw new IllegalArgumentException("releaseId cannot be null or blank");
        }
        return new ExpectedEvents(releaseId);
    }

    /**
     * release와 무관하게 모든 이벤트를 세는 빈 집합 생성.
     *
     * @return 빈 기대 집합
     */
    public static ExpectedEvents anyRelease() {
        return new ExpectedEvents(null);
    }

    /**
     * tally 전체로부터 기대 집합 생성.
     *
     * @param releaseId 대상 release (null이면 범위 제한 없음)
     * @param tally type → state → count
     * @return 기대 집합
     */
    public static ExpectedEvents of(String releaseId, Map<String, Map<JobState, Integer>> tally) {
        if (tally == null) {
            throw new IllegalArgumentException("tally cannot be null");
        }
        ExpectedEvents expected = releaseId == null ? anyRelease() : forRelease(releaseId);
        for (Map.Entry<String, Map<JobState, Integer>> type : tally.entrySet()) {
            for (Map.Entry<JobState, Integer> state : type.getValue().entrySet()) {
                expected.expect(type.getKey(), state.getKey(), state.getValue());
            }
        }
        return expected;
    }

    /**
     * 기대 항목 추가. 같은 (type, state)를 다시 추가하면 개수가 누적됩니다.
     *
     * @param processType process type
     * @param state job state
     * @param count 기대 개수 (0이면 무시)
     * @return this
     * @throws IllegalArgumentException 인자가 유효하지 않은 경우
     */
    public ExpectedEvents expect(String processType, JobState state, int count) {
        if (processType == null || processType.isBlank()) {
            throw new IllegalArgumentException("processType cannot be null or blank");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative (current: " + count + ")");
        }
        if (count == 0) {
            return this;
        }
        requested.computeIfAbsent(processType, k -> new EnumMap<>(JobState.class)).merge(state, count, Integer::sum);
        remaining.computeIfAbsent(processType, k -> new EnumMap<>(JobState.class)).merge(state, count, Integer::sum);
        return this;
    }

    /**
     * 이벤트 하나를 소비.
     *
     * <p>범위 밖 release이거나 남은 개수가 없는 (type, state)이면 무시합니다.</p>
     *
     * @param event job event
     * @return 개수를 차감했으면 true
     */
    boolean consume(JobEvent event) {
        if (releaseId != null && !releaseId.equals(event.releaseId())) {
            return false;
        }
        EnumMap<JobState, Integer> states = remaining.get(event.processType());
        if (states == null) {
            return false;
        }
        Integer left = states.get(event.state());
        if (left == null) {
            return false;
        }
        if (left == 1) {
            states.remove(event.state());
            if (states.isEmpty()) {
                remaining.remove(event.processType());
            }
        } else {
            states.put(event.state(), left - 1);
        }
        return true;
    }

    /**
     * 모든 항목이 0에 도달했는지 여부.
     *
     * @return 충족되었으면 true
     */
    public boolean isSatisfied() {
        return remaining.isEmpty();
    }

    /**
     * 범위 release (없으면 null).
     *
     * @return release id
     */
    public String releaseId() {
        return releaseId;
    }

    /**
     * 최초 요청된 tally의 불변 스냅샷.
     *
     * @return type → state → count
     */
    public Map<String, Map<JobState, Integer>> requested() {
        return snapshot(requested);
    }

    /**
     * 아직 충족되지 않은 tally의 불변 스냅샷.
     *
     * @return type → state → 남은 count
     */
    public Map<String, Map<JobState, Integer>> remaining() {
        return snapshot(remaining);
    }

    private static Map<String, Map<JobState, Integer>> snapshot(TreeMap<String, EnumMap<JobState, Integer>> source) {
        Map<String, Map<JobState, Integer>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, EnumMap<JobState, Integer>> entry : source.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableMap(new EnumMap<>(entry.getValue())));
        }
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public String toString() {
        return "ExpectedEvents{releaseId=" + releaseId + ", remaining=" + remaining + "}";
    }
}
