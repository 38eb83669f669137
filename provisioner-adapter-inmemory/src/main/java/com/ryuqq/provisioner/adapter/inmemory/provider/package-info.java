/**
 * Simulated cloud provider.
 *
 * <p>{@link com.ryuqq.provisioner.adapter.inmemory.provider.InMemoryCloudProvider} implements the
 * {@link com.ryuqq.provisioner.core.spi.CloudProvider} SPI without network access. It is the provider
 * behind the contract tests and can be used for dry runs of a configuration.</p>
 *
 * <h2>Simulated Behavior</h2>
 * <ul>
 *   <li>Unique names per kind ({@code DuplicateName} on collision)</li>
 *   <li>Virtual network limit ({@code VirtualNetworkLimitExceeded})</li>
 *   <li>Referenced ids must exist ({@code ReferenceNotFound})</li>
 *   <li>Pending phase for the virtual network and address translator</li>
 *   <li>Key material issued once, on key pair creation</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.adapter.inmemory.provider;
