/**
 * Plan builders for the network and the compute fleet.
 *
 * <p>{@link com.ryuqq.provisioner.core.topology.NetworkTopologyBuilder} and
 * {@link com.ryuqq.provisioner.core.topology.FleetBuilder} turn a
 * {@link com.ryuqq.provisioner.core.config.ProvisioningConfig} into ordered plans. They
 * never call the provider; zone discovery happens before building and zone selection is
 * done by {@link com.ryuqq.provisioner.core.topology.ZoneSelector}.</p>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.core.topology;
