/**
 * Value objects shared by every Router module.
 *
 * <p>{@link com.ryuqq.router.core.model.Payload} is the only type here: an uninterpreted
 * block of data carried by requests and responses. The Router never parses it.</p>
 *
 * @since 1.0.0
 * @author Router Team
 */
package com.ryuqq.router.core.model;
