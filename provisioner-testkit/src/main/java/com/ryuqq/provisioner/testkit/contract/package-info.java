/**
 * Contract test support.
 *
 * <p>{@link com.ryuqq.provisioner.testkit.contract.AbstractProvisioningContractTest} runs the full
 * provisioning stack against the in-memory provider. Contract tests extend it to check ordering,
 * idempotent re-entry, readiness handling, reuse rules and failure reporting end to end.</p>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.testkit.contract;
