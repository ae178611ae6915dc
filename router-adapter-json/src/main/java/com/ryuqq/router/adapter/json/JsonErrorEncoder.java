package com.ryuqq.router.adapter.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.router.core.encoding.ErrorEncoder;
import com.ryuqq.router.core.encoding.ErrorEncoders;
import com.ryuqq.router.core.model.Payload;

/**
 * 오류를 {@code {"type": ..., "message": ...}} JSON으로 인코딩하는 ErrorEncoder.
 *
 * <p>type은 예외의 simple class name이며, 익명 클래스처럼 simple name이 없으면 전체 이름을 사용합니다.</p>
 *
 * <pre>
 * Router router = new Router(RouterOptions.marshalErrorsWith(new JsonErrorEncoder()));
 * </pre>
 *
 * @author Router Team
 * @since 1.0.0
 */
public final class JsonErrorEncoder implements ErrorEncoder {

    private final ObjectMapper mapper;

    public JsonErrorEncoder() {
        this(new ObjectMapper());
    }

    public JsonErrorEncoder(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    @Override
    public Payload encode(Exception error) throws Exception {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", typeName(error));
        node.put("message", ErrorEncoders.describe(error));
        return Payload.of(mapper.writeValueAsString(node));
    }

    private static String typeName(Exception error) {
        String simpleName = error.getClass().getSimpleName();
        return simpleName.isEmpty() ? error.getClass().getName() : simpleName;
    }
}
