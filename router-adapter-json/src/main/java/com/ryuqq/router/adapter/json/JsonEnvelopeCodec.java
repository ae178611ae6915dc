package com.ryuqq.router.adapter.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.util.RawValue;
import com.ryuqq.router.core.contract.Request;
import com.ryuqq.router.core.contract.Response;
import com.ryuqq.router.core.model.Payload;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Request/Response envelope의 JSON 표현을 다루는 코덱.
 *
 * <p><strong>Wire 형식:</strong></p>
 * <pre>
 * request:  {"procedure": "Do", "body": {"key": "value"}}
 * response: {"body": ...}  또는  {"error": ...}
 * </pre>
 *
 * <p><strong>Payload 변환 규칙:</strong></p>
 * <ul>
 *   <li>decode: body는 입력 텍스트를 잘라낸 그대로 Payload가 됨 (공백, 숫자 표기, 중복 키 보존)</li>
 *   <li>decode: body가 없거나 null이면 빈 Payload, procedure가 없으면 빈 이름</li>
 *   <li>encode body: 유효한 JSON 값이면 그대로 삽입, 아니면 JSON 문자열, 비어 있으면 null</li>
 *   <li>encode error: JSON 객체나 배열이면 그대로 삽입, 그 외 텍스트는 JSON 문자열 (빈 텍스트는 "")</li>
 * </ul>
 *
 * <p>인스턴스는 불변이며 스레드 안전합니다.</p>
 *
 * @author Router Team
 * @since 1.0.0
 */
public final class JsonEnvelopeCodec {

    static final String PROCEDURE_FIELD = "procedure";
    static final String BODY_FIELD = "body";
    static final String ERROR_FIELD = "error";

    private final ObjectMapper mapper;
    private final ObjectReader reader;

    /**
     * 기본 ObjectMapper로 생성.
     */
    public JsonEnvelopeCodec() {
        this(new ObjectMapper());
    }

    /**
     * 생성자.
     *
     * @param mapper Jackson ObjectMapper
     * @throws IllegalArgumentException mapper가 null인 경우
     */
    public JsonEnvelopeCodec(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
        this.reader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * JSON 텍스트를 Request로 변환.
     *
     * @param json request envelope
     * @return Request
     * @throws EnvelopeCodecException JSON이 잘못되었거나 envelope 형태가 아닌 경우
     */
    public Request decodeRequest(String json) {
        if (json == null) {
            throw new IllegalArgumentException("json cannot be null");
        }
        try (JsonParser parser = mapper.getFactory().createParser(json)) {
            return readRequest(parser, json);
        } catch (JsonProcessingException e) {
            throw new EnvelopeCodecException("malformed request envelope: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new EnvelopeCodecException("malformed request envelope: " + e.getMessage(), e);
        }
    }

    /**
     * UTF-8 JSON 바이트를 Request로 변환.
     *
     * @param json request envelope (UTF-8)
     * @return Request
     * @throws EnvelopeCodecException JSON이 잘못되었거나 envelope 형태가 아닌 경우
     */
    public Request decodeRequest(byte[] json) {
        if (json == null) {
            throw new IllegalArgumentException("json cannot be null");
        }
        return decodeRequest(new String(json, StandardCharsets.UTF_8));
    }

    /**
     * Response를 JSON 텍스트로 변환.
     *
     * <p>존재하지 않는 필드는 출력하지 않습니다.</p>
     *
     * @param response Response
     * @return response envelope
     */
    public String encodeResponse(Response response) {
        if (response == null) {
            throw new IllegalArgumentException("response cannot be null");
        }
        ObjectNode root = mapper.createObjectNode();
        if (response.isSuccess()) {
            putBody(root, response.body());
        } else {
            putError(root, response.error());
        }
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new EnvelopeCodecException("cannot write response envelope", e);
        }
    }

    private Request readRequest(JsonParser parser, String json) throws IOException {
        if (parser.nextToken() != JsonToken.START_OBJECT) {
            throw new EnvelopeCodecException("request envelope must be a JSON object");
        }

        String procedure = "";
        Payload body = Payload.empty();
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String field = parser.currentName();
            JsonToken value = parser.nextToken();
            if (PROCEDURE_FIELD.equals(field)) {
                procedure = readProcedure(parser, value);
            } else if (BODY_FIELD.equals(field)) {
                body = readRawBody(parser, value, json);
            } else {
                parser.skipChildren();
            }
        }

        if (parser.nextToken() != null) {
            throw new EnvelopeCodecException("unexpected content after request envelope");
        }
        return Request.of(procedure, body);
    }

    private String readProcedure(JsonParser parser, JsonToken value) throws IOException {
        if (value == JsonToken.VALUE_NULL) {
            return "";
        }
        if (value != JsonToken.VALUE_STRING) {
            throw new EnvelopeCodecException("procedure must be a JSON string but was " + value);
        }
        return parser.getText();
    }

    /**
     * body 값의 원본 텍스트를 그대로 잘라냅니다.
     *
     * <p>문자열 입력에 대한 parser이므로 location offset은 문자 단위입니다.</p>
     */
    private Payload readRawBody(JsonParser parser, JsonToken value, String json) throws IOException {
        if (value == JsonToken.VALUE_NULL) {
            return Payload.empty();
        }
        int start = (int) parser.currentTokenLocation().getCharOffset();
        parser.skipChildren();
        parser.finishToken();
        int end = (int) parser.currentLocation().getCharOffset();
        return Payload.of(json.substring(start, end));
    }

    private void putBody(ObjectNode root, Payload payload) {
        if (payload.isEmpty()) {
            root.putNull(BODY_FIELD);
            return;
        }
        JsonNode parsed = parse(payload.getValue());
        if (parsed != null) {
            root.putRawValue(BODY_FIELD, new RawValue(payload.getValue()));
        } else {
            root.put(BODY_FIELD, payload.getValue());
        }
    }

    private void putError(ObjectNode root, Payload payload) {
        JsonNode parsed = payload.isEmpty() ? null : parse(payload.getValue());
        if (parsed != null && parsed.isContainerNode()) {
            root.putRawValue(ERROR_FIELD, new RawValue(payload.getValue()));
        } else {
            root.put(ERROR_FIELD, payload.getValue());
        }
    }

    /**
     * 단일 JSON 값으로 읽히면 해당 노드, 아니면 null.
     */
    private JsonNode parse(String text) {
        try {
            JsonNode node = reader.readTree(text);
            return node == null || node.isMissingNode() ? null : node;
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
