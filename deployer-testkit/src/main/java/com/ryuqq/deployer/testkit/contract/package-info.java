/**
 * SPI contract tests.
 *
 * <p>Abstract JUnit 5 test classes that every adapter implementation extends. Each class declares
 * an abstract factory method for the implementation under test.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyDeploymentStoreContractTest extends DeploymentStoreContractTest {
 *     {@literal @}Override
 *     protected DeploymentStore createStore() {
 *         return new MyDeploymentStore(dataSource);
 *     }
 * }
 * </pre>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
package com.ryuqq.deployer.testkit.contract;
