package com.ryuqq.router.adapter.json;

import com.ryuqq.router.application.dispatcher.Dispatcher;
import com.ryuqq.router.core.context.InvocationContext;
import com.ryuqq.router.core.contract.Request;
import com.ryuqq.router.core.contract.Response;
import com.ryuqq.router.core.exception.UnrecognizedProcedureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON 이벤트를 받아 Dispatcher로 전달하는 호스트 진입점.
 *
 * <p>decode → {@link Dispatcher#handle} → encode 순서로 처리합니다.
 * Handler 오류는 response envelope의 error 필드로 돌아오고,
 * 등록되지 않은 procedure만 예외로 전파됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * JsonRouterEndpoint endpoint = new JsonRouterEndpoint(router);
 * String out = endpoint.invoke(InvocationContext.background(),
 *     "{\"procedure\":\"Do\",\"body\":{\"key\":\"value\"}}");
 * </pre>
 *
 * @author Router Team
 * @since 1.0.0
 */
public final class JsonRouterEndpoint {

    private static final Logger log = LoggerFactory.getLogger(JsonRouterEndpoint.class);

    private final Dispatcher dispatcher;
    private final JsonEnvelopeCodec codec;

    public JsonRouterEndpoint(Dispatcher dispatcher) {
        this(dispatcher, new JsonEnvelopeCodec());
    }

    public JsonRouterEndpoint(Dispatcher dispatcher, JsonEnvelopeCodec codec) {
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.dispatcher = dispatcher;
        this.codec = codec;
    }

    /**
     * JSON request envelope 처리.
     *
     * @param context 호출 컨텍스트 (Handler에 그대로 전달)
     * @param eventJson request envelope
     * @return response envelope
     * @throws UnrecognizedProcedureException procedure에 등록된 Handler가 없는 경우
     * @throws EnvelopeCodecException request envelope이 잘못된 경우
     */
    public String invoke(InvocationContext context, String eventJson) throws UnrecognizedProcedureException {
        Request request = codec.decodeRequest(eventJson);
        log.debug("Dispatching procedure '{}'", request.procedure());

        Response response = dispatcher.handle(context, request);
        if (response.isFailure()) {
            log.debug("Procedure '{}' returned an error payload", request.procedure());
        }
        return codec.encodeResponse(response);
    }
}
