/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that adapters implement to plug concrete behaviour into
 * the Router.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.router.core.spi.HandlerRegistry} - procedure name to handler binding table</li>
 *   <li>{@link com.ryuqq.router.core.spi.DispatchObserver} - diagnostics the caller never sees</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., router-adapter-inmemory, router-adapter-runner) provide the concrete
 * implementations. {@link com.ryuqq.router.core.spi.noop} holds the defaults.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 *   <li><strong>No Global State:</strong> Every Router owns its own registry and observer</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Router Team
 */
package com.ryuqq.router.core.spi;
