package com.ryuqq.provisioner.adapter.inmemory.provider;

import com.ryuqq.provisioner.core.model.LogicalName;
import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.model.ResourceParameters;

import java.util.List;

/**
 * A resource held by {@link InMemoryCloudProvider}.
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param kind resource kind
 * @param nameOrNull logical name (Name tag), null for seeded resources without one
 * @param id provider id
 * @param parameters parameters the resource was created with
 * @param ingress ingress rules with group references resolved to ids
 * @param defaultNetwork true for the account's default virtual network
 */
public record SimulatedResource(
    ResourceKind kind,
    LogicalName nameOrNull,
    String id,
    ResourceParameters parameters,
    List<RecordedIngress> ingress,
    boolean defaultNetwork
) {

    public SimulatedResource {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (parameters == null) {
            throw new IllegalArgumentException("parameters cannot be null");
        }
        ingress = ingress == null ? List.of() : List.copyOf(ingress);
    }

    /**
     * An ingress rule as the provider stores it.
     *
     * @param protocol protocol
     * @param fromPort first port
     * @param toPort last port
     * @param cidrOrNull source CIDR, null for group references
     * @param sourceGroupIdOrNull resolved source security group id, null for CIDR rules
     */
    public record RecordedIngress(
        String protocol,
        int fromPort,
        int toPort,
        String cidrOrNull,
        String sourceGroupIdOrNull
    ) {

        public boolean isGroupReference() {
            return sourceGroupIdOrNull != null;
        }
    }
}
