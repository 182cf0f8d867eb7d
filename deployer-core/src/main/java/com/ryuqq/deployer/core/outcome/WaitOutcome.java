package com.ryuqq.deployer.core.outcome;

/**
 * 이벤트 대기(wait)의 결과.
 *
 * <p>WaitOutcome은 두 가지 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Matched}: 기대한 이벤트가 모두 관측됨</li>
 *   <li>{@link Unmatched}: 기대를 채우지 못하고 종료됨 (사유: {@link UnmetReason})</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 결과 종류가 닫혀 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * WaitOutcome outcome = matcher.await(stream, expected);
 * if (outcome instanceof Unmatched unmatched) {
 *     throw new DeploymentFailedException(deploymentId, unmatched);
 * }
 * Matched matched = (Matched) outcome;
 * </pre>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public sealed interface WaitOutcome permits Matched, Unmatched {

    /**
     * 대기가 성공했는지 확인.
     *
     * @return 성공 여부
     */
    default boolean isMatched() {
        return this instanceof Matched;
    }
}
