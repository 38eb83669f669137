/**
 * Run results and cancellation.
 *
 * <h2>Step Results</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.core.run.Created} - New resource created (and ready)</li>
 *   <li>{@link com.ryuqq.provisioner.core.run.Reused} - Existing resource adopted after a reuse-eligible error</li>
 *   <li>{@link com.ryuqq.provisioner.core.run.Failed} - Fatal error; the run stops here</li>
 * </ul>
 *
 * <p>{@link com.ryuqq.provisioner.core.run.Cancellation} lets an operator stop a run that is
 * blocked in a readiness wait.</p>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.core.run;
