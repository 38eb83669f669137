/**
 * Application entry point.
 *
 * <p>{@link com.ryuqq.provisioner.application.provisioner.Provisioner} is the single facade callers use:
 * it selects zones, builds the network and fleet plans, runs them and returns a
 * {@link com.ryuqq.provisioner.application.provisioner.ProvisioningRun} report.</p>
 *
 * <h2>Run Report</h2>
 * <ul>
 *   <li>Completed flag and failed step name</li>
 *   <li>Error kind, provider error code and message</li>
 *   <li>Ids of every resource created or reused so far, including a created but unbound one</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.application.provisioner;
