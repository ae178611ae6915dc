/**
 * Dispatcher entry-point contract.
 *
 * <p>{@link com.ryuqq.router.application.dispatcher.Dispatcher} is the single operation the
 * host calls. Implementations live in router-adapter-runner.</p>
 *
 * <h2>Architecture</h2>
 * <pre>
 * adapter-runner (Router)
 *   ↓ implements
 * application (Dispatcher, RouterConfig)
 *   ↓ depends on
 * core (Request, Response, Handler, ErrorEncoder, HandlerRegistry SPI)
 * </pre>
 *
 * @since 1.0.0
 * @author Router Team
 */
package com.ryuqq.router.application.dispatcher;
