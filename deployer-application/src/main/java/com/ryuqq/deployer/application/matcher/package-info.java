/**
 * Job event 매칭.
 *
 * <p>순서가 보장되지 않는 scheduler 이벤트 스트림을 특정 결과에 대한 blocking 대기로 바꿉니다.</p>
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.deployer.application.matcher.ExpectedEvents} - 대기 하나가 소유하는 기대 집합</li>
 *   <li>{@link com.ryuqq.deployer.application.matcher.JobEventMatcher} - 기대 집합 충족까지 대기</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.deployer.application.matcher;
