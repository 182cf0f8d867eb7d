package com.ryuqq.deployer.core.model;

/**
 * 배포 전략 종류 (닫힌 집합).
 *
 * <p>Deployment에는 이름(wire name)으로 저장되고, 실행 시점에 전략 구현으로 해석됩니다.
 * enum이므로 switch 식에서 모든 전략을 컴파일 타임에 빠짐없이 다룰 수 있습니다.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public enum StrategyKind {

    /**
     * 한 번에 한 인스턴스씩 교체.
     */
    ONE_BY_ONE("one-by-one"),

    /**
     * 새 Release 전체 기동 후 이전 Release 전체 종료.
     */
    ALL_AT_ONCE("all-at-once");

    private final String wireName;

    StrategyKind(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 외부 표현 조회.
     *
     * @return wire name (예: "one-by-one")
     */
    public String wireName() {
        return wireName;
    }

    /**
     * wire name으로 StrategyKind 조회.
     *
     * @param wireName 전략 이름
     * @return StrategyKind
     * @throws IllegalArgumentException null이거나 알 수 없는 이름인 경우
     */
    public static StrategyKind fromWireName(String wireName) {
        for (StrategyKind kind : values()) {
            if (kind.wireName.equals(wireName)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown deployment strategy: " + wireName);
    }
}
