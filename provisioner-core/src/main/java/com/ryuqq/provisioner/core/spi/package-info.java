/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interfaces that infrastructure adapters implement
 * to give the provisioning core access to a cloud provider.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.core.spi.CloudProvider} - Create, look up and describe resources; list availability zones</li>
 *   <li>{@link com.ryuqq.provisioner.core.spi.KeyMaterialSink} - Receives private key material of newly created key pairs</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (provisioner-adapter-inmemory, provisioner-adapter-aws) provide
 * concrete implementations. Provider error codes must be passed through unchanged in
 * {@link com.ryuqq.provisioner.core.spi.ProviderException}; the reuse decision belongs
 * to {@link com.ryuqq.provisioner.core.policy.ReusePolicy}.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on any provider SDK</li>
 *   <li><strong>Pluggability:</strong> In-memory simulation for tests, AWS SDK for real runs</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.core.spi;
