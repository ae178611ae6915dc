/**
 * Error encoding strategy package.
 *
 * <p>{@link com.ryuqq.router.core.encoding.ErrorEncoder} converts a handler failure into the
 * response's error payload. {@link com.ryuqq.router.core.encoding.ErrorEncoders#messageOnly()}
 * is the default and never fails.</p>
 *
 * @since 1.0.0
 * @author Router Team
 */
package com.ryuqq.router.core.encoding;
