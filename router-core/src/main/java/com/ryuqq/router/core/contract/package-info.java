/**
 * Dispatch envelope contract package.
 *
 * <p>This package defines the two envelopes exchanged with the host:</p>
 *
 * <h2>Records</h2>
 * <ul>
 *   <li>{@link com.ryuqq.router.core.contract.Request} - procedure name and request body</li>
 *   <li>{@link com.ryuqq.router.core.contract.Response} - success body or encoded error, never both</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Records are immutable by default</li>
 *   <li><strong>Validation:</strong> Compact constructors enforce invariants</li>
 *   <li><strong>Opacity:</strong> Bodies are {@link com.ryuqq.router.core.model.Payload}s the Router never inspects</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Router Team
 */
package com.ryuqq.router.core.contract;
