/**
 * Dispatch-level exceptions.
 *
 * <p>Only failures of the routing mechanism live here. Handler failures never surface as
 * exceptions from the entry point; they are encoded into the response.</p>
 *
 * @since 1.0.0
 * @author Router Team
 */
package com.ryuqq.router.core.exception;
