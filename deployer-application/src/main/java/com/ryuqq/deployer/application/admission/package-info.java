/**
 * 배포 admission.
 *
 * <p>배포 행 저장과 실행 작업 등록을 담당합니다.</p>
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.deployer.application.admission.DeploymentRepo} - insert 후 enqueue</li>
 *   <li>{@link com.ryuqq.deployer.application.admission.DeploymentJobCodec} - 작업 payload JSON 인코딩</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.deployer.application.admission;
