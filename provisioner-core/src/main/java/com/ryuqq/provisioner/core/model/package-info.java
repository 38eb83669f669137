/**
 * Resource descriptor model.
 *
 * <p>Typed, immutable descriptions of what to create. A
 * {@link com.ryuqq.provisioner.core.model.ResourceSpec} names its kind, fixed parameters and
 * the inputs it needs from earlier steps; a {@link com.ryuqq.provisioner.core.model.ResourceHandle}
 * is the only thing passed between steps once a resource exists.</p>
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.core.model.LogicalName} - Run-scoped resource name</li>
 *   <li>{@link com.ryuqq.provisioner.core.model.ResourceParameters} - Typed parameter mapping</li>
 *   <li>{@link com.ryuqq.provisioner.core.model.IngressRule} - CIDR or security-group-reference ingress</li>
 *   <li>{@link com.ryuqq.provisioner.core.model.InputRef} - Dependency on an earlier step's id</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.core.model;
