/**
 * Router configuration surface.
 *
 * <p>A Router is configured once, at construction, by an ordered list of
 * {@link com.ryuqq.router.application.config.RouterOption}s folded over
 * {@link com.ryuqq.router.application.config.RouterConfig#defaults()}. There is no runtime
 * reconfiguration.</p>
 *
 * <h2>Built-in Options</h2>
 * <ul>
 *   <li>{@link com.ryuqq.router.application.config.RouterOptions#marshalErrorsWith} - replace the error encoder</li>
 *   <li>{@link com.ryuqq.router.application.config.RouterOptions#observeWith} - install a dispatch observer</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Router Team
 */
package com.ryuqq.router.application.config;
