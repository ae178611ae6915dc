/**
 * In-memory HandlerRegistry adapter implementation package.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.router.adapter.inmemory.registry.InMemoryHandlerRegistry}:
 *       Thread-safe implementation of {@link com.ryuqq.router.core.spi.HandlerRegistry}</li>
 * </ul>
 *
 * <p><strong>Design Principles:</strong></p>
 * <ul>
 *   <li><strong>Concurrency:</strong> Uses {@link java.util.concurrent.ConcurrentHashMap}</li>
 *   <li><strong>Instance State:</strong> Each registry is independent; there is no static table</li>
 * </ul>
 *
 * @see com.ryuqq.router.core.spi.HandlerRegistry
 * @author Router Team
 * @since 1.0.0
 */
package com.ryuqq.router.adapter.inmemory.registry;
