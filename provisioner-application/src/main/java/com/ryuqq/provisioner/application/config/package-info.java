/**
 * Properties-based loading of {@link com.ryuqq.provisioner.core.config.ProvisioningConfig}.
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.application.config;
