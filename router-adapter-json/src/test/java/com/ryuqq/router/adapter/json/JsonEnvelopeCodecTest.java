package com.ryuqq.router.adapter.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.ryuqq.router.core.contract.Request;
import com.ryuqq.router.core.contract.Response;
import com.ryuqq.router.core.model.Payload;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * JsonEnvelopeCodec 테스트.
 */
class JsonEnvelopeCodecTest {

    private final JsonEnvelopeCodec codec = new JsonEnvelopeCodec();

    // ============================================================
    // decode
    // ============================================================

    @Test
    void decodeRequest_procedure와_body를_raw_JSON으로_읽음() {
        // when
        Request request = codec.decodeRequest("{\"procedure\":\"Do\",\"body\":{\"key\":\"value\"}}");

        // then
        assertThat(request.procedure()).isEqualTo("Do");
        assertThat(request.body()).isEqualTo(Payload.of("{\"key\":\"value\"}"));
    }

    @Test
    void decodeRequest_body_원문을_공백과_숫자_표기까지_그대로_보존() {
        // given
        String body = "{ \"key\": \"value\",\n  \"amount\": 0.12345678901234567890123, \"e\": 1e2 }";

        // when
        Request request = codec.decodeRequest("{\"procedure\":\"Do\", \"body\": " + body + " }");

        // then
        assertThat(request.body().getValue()).isEqualTo(body);
    }

    @Test
    void decodeRequest_body의_중복_키를_병합하지_않음() {
        // when
        Request request = codec.decodeRequest("{\"body\":{\"a\":1,\"a\":2},\"procedure\":\"Do\"}");

        // then
        assertThat(request.procedure()).isEqualTo("Do");
        assertThat(request.body().getValue()).isEqualTo("{\"a\":1,\"a\":2}");
    }

    @Test
    void decodeRequest_스칼라_body도_원문_그대로() {
        assertThat(codec.decodeRequest("{\"procedure\":\"Do\",\"body\":\"a\\u0041 b\"}").body().getValue())
            .isEqualTo("\"a\\u0041 b\"");
        assertThat(codec.decodeRequest("{\"procedure\":\"Do\",\"body\":-1.50E+3}").body().getValue())
            .isEqualTo("-1.50E+3");
        assertThat(codec.decodeRequest("{\"procedure\":\"Do\",\"body\":true}").body().getValue())
            .isEqualTo("true");
        assertThat(codec.decodeRequest("{\"procedure\":\"Do\",\"body\":[1, [2,3] ]}").body().getValue())
            .isEqualTo("[1, [2,3] ]");
    }

    @Test
    void decodeRequest_바이트_입력도_원문을_보존() {
        // given
        byte[] json = "{\"procedure\":\"Do\",\"body\":{\"이름\": \"값\", \"n\": 1.0}}".getBytes(StandardCharsets.UTF_8);

        // when
        Request request = codec.decodeRequest(json);

        // then
        assertThat(request.body().getValue()).isEqualTo("{\"이름\": \"값\", \"n\": 1.0}");
    }

    @Test
    void decodeRequest_바이트_입력도_동일하게_처리() {
        // given
        byte[] json = "{\"procedure\":\"주문생성\",\"body\":[1,2,3]}".getBytes(StandardCharsets.UTF_8);

        // when
        Request request = codec.decodeRequest(json);

        // then
        assertThat(request.procedure()).isEqualTo("주문생성");
        assertThat(request.body()).isEqualTo(Payload.of("[1,2,3]"));
    }

    @Test
    void decodeRequest_body가_없거나_null이면_빈_Payload() {
        assertThat(codec.decodeRequest("{\"procedure\":\"Do\"}").body().isEmpty()).isTrue();
        assertThat(codec.decodeRequest("{\"procedure\":\"Do\",\"body\":null}").body().isEmpty()).isTrue();
    }

    @Test
    void decodeRequest_procedure가_없으면_빈_이름() {
        // when
        Request request = codec.decodeRequest("{\"body\":\"x\"}");

        // then
        assertThat(request.procedure()).isEmpty();
        assertThat(request.body()).isEqualTo(Payload.of("\"x\""));
    }

    @Test
    void decodeRequest_잘못된_JSON은_EnvelopeCodecException() {
        assertThatThrownBy(() -> codec.decodeRequest("{\"procedure\":"))
            .isInstanceOf(EnvelopeCodecException.class)
            .hasMessageStartingWith("malformed request envelope")
            .hasCauseInstanceOf(JsonProcessingException.class);
    }

    @Test
    void decodeRequest_뒤에_남은_토큰이_있으면_예외() {
        assertThatThrownBy(() -> codec.decodeRequest("{\"procedure\":\"Do\"} {}"))
            .isInstanceOf(EnvelopeCodecException.class);
    }

    @Test
    void decodeRequest_객체가_아닌_root는_예외() {
        assertThatThrownBy(() -> codec.decodeRequest("[\"Do\"]"))
            .isInstanceOf(EnvelopeCodecException.class)
            .hasMessage("request envelope must be a JSON object");
        assertThatThrownBy(() -> codec.decodeRequest(""))
            .isInstanceOf(EnvelopeCodecException.class);
    }

    @Test
    void decodeRequest_문자열이_아닌_procedure는_예외() {
        assertThatThrownBy(() -> codec.decodeRequest("{\"procedure\":42}"))
            .isInstanceOf(EnvelopeCodecException.class)
            .hasMessageContaining("procedure must be a JSON string");
    }

    @Test
    void decodeRequest_null_입력은_IllegalArgumentException() {
        assertThatThrownBy(() -> codec.decodeRequest((String) null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("json cannot be null");
    }

    // ============================================================
    // encode
    // ============================================================

    @Test
    void encodeResponse_성공은_body만_출력() {
        // when
        String json = codec.encodeResponse(Response.success(Payload.of("{\"body\":\"response body\"}")));

        // then
        assertThat(json).isEqualTo("{\"body\":{\"body\":\"response body\"}}");
    }

    @Test
    void encodeResponse_평문_오류는_JSON_문자열로_출력() {
        // when
        String json = codec.encodeResponse(Response.failure(Payload.of("assert.AnError general error for testing")));

        // then
        assertThat(json).isEqualTo("{\"error\":\"assert.AnError general error for testing\"}");
    }

    @Test
    void encodeResponse_JSON_오류는_그대로_삽입() {
        // when
        String json = codec.encodeResponse(Response.failure(Payload.of("{\"type\":\"X\",\"message\":\"m\"}")));

        // then
        assertThat(json).isEqualTo("{\"error\":{\"type\":\"X\",\"message\":\"m\"}}");
    }

    @Test
    void encodeResponse_JSON_스칼라처럼_보이는_오류_메시지도_문자열() {
        assertThat(codec.encodeResponse(Response.failure(Payload.of("404")))).isEqualTo("{\"error\":\"404\"}");
        assertThat(codec.encodeResponse(Response.failure(Payload.of("true")))).isEqualTo("{\"error\":\"true\"}");
        assertThat(codec.encodeResponse(Response.failure(Payload.of("null")))).isEqualTo("{\"error\":\"null\"}");
    }

    @Test
    void encodeResponse_빈_오류는_빈_문자열로_출력() {
        assertThat(codec.encodeResponse(Response.failure(Payload.empty()))).isEqualTo("{\"error\":\"\"}");
    }

    @Test
    void encodeResponse_JSON_배열_오류는_그대로_삽입() {
        assertThat(codec.encodeResponse(Response.failure(Payload.of("[\"a\",\"b\"]"))))
            .isEqualTo("{\"error\":[\"a\",\"b\"]}");
    }

    @Test
    void encodeResponse_스칼라_body는_그대로_삽입() {
        assertThat(codec.encodeResponse(Response.success(Payload.of("42")))).isEqualTo("{\"body\":42}");
        assertThat(codec.encodeResponse(Response.success(Payload.of("\"ok\"")))).isEqualTo("{\"body\":\"ok\"}");
    }

    @Test
    void encodeResponse_body_원문의_공백과_숫자_표기를_보존() {
        // given
        String body = "{ \"amount\": 0.12345678901234567890123, \"e\": 1e2 }";

        // when
        String json = codec.encodeResponse(Response.success(Payload.of(body)));

        // then
        assertThat(json).isEqualTo("{\"body\":" + body + "}");
    }

    @Test
    void encodeResponse_빈_body는_null() {
        assertThat(codec.encodeResponse(Response.success(Payload.empty()))).isEqualTo("{\"body\":null}");
    }

    @Test
    void encodeResponse_JSON처럼_시작하지만_뒤에_텍스트가_있으면_문자열() {
        // when
        String json = codec.encodeResponse(Response.failure(Payload.of("404 not found")));

        // then
        assertThat(json).isEqualTo("{\"error\":\"404 not found\"}");
    }

    @Test
    void decode_후_encode하면_body가_보존됨() {
        // given
        Request request = codec.decodeRequest("{\"procedure\":\"Echo\",\"body\":{\"n\":1,\"tags\":[\"a\"]}}");

        // when
        String json = codec.encodeResponse(Response.success(request.body()));

        // then
        assertThat(json).isEqualTo("{\"body\":{\"n\":1,\"tags\":[\"a\"]}}");
    }
}
