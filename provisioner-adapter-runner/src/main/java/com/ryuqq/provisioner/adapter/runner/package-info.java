/**
 * Runner adapter package.
 *
 * <p>Executes provisioning plans against a {@link com.ryuqq.provisioner.core.spi.CloudProvider}.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.adapter.runner.IdempotentCreateStep} - One creation call with reuse recovery</li>
 *   <li>{@link com.ryuqq.provisioner.adapter.runner.PollingReadinessWaiter} - Polls resource state with backoff</li>
 *   <li>{@link com.ryuqq.provisioner.adapter.runner.DependencyGraphExecutor} - Sequential plan execution</li>
 *   <li>{@link com.ryuqq.provisioner.adapter.runner.StandardProvisioner} - Zone selection, plan building and execution</li>
 *   <li>{@link com.ryuqq.provisioner.adapter.runner.BackoffCalculator} - Exponential backoff with jitter</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.adapter.runner.RunnerConfig} - Readiness budget, poll intervals, run timeout</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.adapter.runner;
