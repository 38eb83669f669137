package com.ryuqq.provisioner.adapter.inmemory.provider;

/**
 * Error codes raised by {@link InMemoryCloudProvider}.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class SimulatedErrorCodes {

    /**
     * A resource of the same kind already carries the requested logical name.
     */
    public static final String DUPLICATE_NAME = "DuplicateName";

    /**
     * The configured virtual network limit has been reached.
     */
    public static final String VIRTUAL_NETWORK_LIMIT_EXCEEDED = "VirtualNetworkLimitExceeded";

    /**
     * A parameter references an id the provider does not know.
     */
    public static final String REFERENCE_NOT_FOUND = "ReferenceNotFound";

    /**
     * {@code describe} was called with an unknown id.
     */
    public static final String RESOURCE_NOT_FOUND = "ResourceNotFound";

    private SimulatedErrorCodes() {
    }
}
