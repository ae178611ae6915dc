/**
 * JSON Adapter - Jackson 기반 envelope 코덱과 호스트 진입점.
 *
 * <ul>
 *   <li>{@link com.ryuqq.router.adapter.json.JsonEnvelopeCodec} - request/response envelope 변환</li>
 *   <li>{@link com.ryuqq.router.adapter.json.JsonErrorEncoder} - 구조화된 오류 Payload</li>
 *   <li>{@link com.ryuqq.router.adapter.json.JsonRouterEndpoint} - JSON 문자열 진입점</li>
 * </ul>
 *
 * @author Router Team
 * @since 1.0.0
 */
package com.ryuqq.router.adapter.json;
