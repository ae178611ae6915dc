/**
 * Handler capability package.
 *
 * <p>A {@link com.ryuqq.router.core.handler.Handler} turns a request body into a response body
 * or fails with an exception. Handlers come in two forms:</p>
 * <ul>
 *   <li>classes implementing {@code Handler} directly</li>
 *   <li>plain functions ({@link com.ryuqq.router.core.handler.HandlerFunction}) wrapped by
 *       {@link com.ryuqq.router.core.handler.FunctionHandler}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Router Team
 */
package com.ryuqq.router.core.handler;
