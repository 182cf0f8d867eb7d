package com.ryuqq.deployer.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 특정 App Release의 프로세스 타입별 목표 인스턴스 수.
 *
 * <p>Formation은 항상 전체 매핑 단위로 덮어쓰기(overwrite)되며, 부분 병합(merge)은 허용되지 않습니다.
 * 따라서 변경은 {@link #withCount(String, int)}로 새 Formation을 만든 뒤 통째로 기록합니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>appId, releaseId: null 또는 빈 문자열 불가</li>
 *   <li>processes: null 불가, 모든 count는 0 이상</li>
 * </ul>
 *
 * <p>processes는 타입 이름 순으로 정렬된 불변 맵으로 보관됩니다 (재현 가능한 순회 순서).</p>
 *
 * @param appId App 식별자
 * @param releaseId Release 식별자
 * @param processes 프로세스 타입 → 목표 인스턴스 수
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public record Formation(
    String appId,
    String releaseId,
    SortedMap<String, Integer> processes
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 없거나 count가 음수인 경우
     */
    public Formation {
        if (appId == null || appId.isBlank()) {
            throw new IllegalArgumentException("appId cannot be null or blank");
        }
        if (releaseId == null || releaseId.isBlank()) {
            throw new IllegalArgumentException("releaseId cannot be null or blank");
        }
        if (processes == null) {
            throw new IllegalArgumentException("processes cannot be null");
        }
        TreeMap<String, Integer> copy = new TreeMap<>();
        for (Map.Entry<String, Integer> entry : processes.entrySet()) {
            Integer count = entry.getValue();
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new IllegalArgumentException("process type cannot be null or blank");
            }
            if (count == null || count < 0) {
                throw new IllegalArgumentException(
                    "count for process type '" + entry.getKey() + "' must be non-negative (current: " + count + ")"
                );
            }
            copy.put(entry.getKey(), count);
        }
        processes = Collections.unmodifiableSortedMap(copy);
    }

    /**
     * Formation 생성.
     *
     * @param appId App 식별자
     * @param releaseId Release 식별자
     * @param processes 프로세스 타입별 인스턴스 수
     * @return Formation 인스턴스
     */
    public static Formation of(String appId, String releaseId, Map<String, Integer> processes) {
        return new Formation(appId, releaseId, new TreeMap<>(processes));
    }

    /**
     * 프로세스가 하나도 없는 Formation 생성.
     *
     * @param appId App 식별자
     * @param releaseId Release 식별자
     * @return 빈 Formation
     */
    public static Formation empty(String appId, String releaseId) {
        return new Formation(appId, releaseId, new TreeMap<>());
    }

    /**
     * 프로세스 타입의 목표 인스턴스 수 (없으면 0).
     *
     * @param processType 프로세스 타입
     * @return 목표 인스턴스 수
     */
    public int count(String processType) {
        return processes.getOrDefault(processType, 0);
    }

    /**
     * 한 타입의 count만 바꾼 새 Formation (나머지 타입은 그대로 복사).
     *
     * @param processType 프로세스 타입
     * @param count 새 인스턴스 수 (0 이상)
     * @return 전체 매핑을 가진 새 Formation
     */
    public Formation withCount(String processType, int count) {
        TreeMap<String, Integer> next = new TreeMap<>(processes);
        next.put(processType, count);
        return new Formation(appId, releaseId, next);
    }

    /**
     * 모든 타입의 인스턴스 수 합계.
     *
     * @return 총 인스턴스 수
     */
    public int total() {
        int total = 0;
        for (int count : processes.values()) {
            total += count;
        }
        return total;
    }
}
