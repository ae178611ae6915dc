package com.ryuqq.router.adapter.runner;

import com.ryuqq.router.adapter.inmemory.registry.InMemoryHandlerRegistry;
import com.ryuqq.router.application.config.RouterConfig;
import com.ryuqq.router.application.config.RouterOption;
import com.ryuqq.router.application.dispatcher.Dispatcher;
import com.ryuqq.router.core.context.InvocationContext;
import com.ryuqq.router.core.contract.Request;
import com.ryuqq.router.core.contract.Response;
import com.ryuqq.router.core.encoding.ErrorEncoders;
import com.ryuqq.router.core.exception.UnrecognizedProcedureException;
import com.ryuqq.router.core.handler.Handler;
import com.ryuqq.router.core.model.Payload;
import com.ryuqq.router.core.spi.DispatchObserver;
import com.ryuqq.router.core.spi.HandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Dispatcher 구현체.
 *
 * <p>procedure 이름으로 Handler를 찾아 호출하고, 결과를 Response로 정규화합니다.
 * Handler 오류는 호출자에게 전파되지 않고 error Payload로 인코딩됩니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>HandlerRegistry에서 procedure 조회</li>
 *   <li>없으면 UnrecognizedProcedureException</li>
 *   <li>Handler 호출 (context 변경 없이 전달)</li>
 *   <li>성공 시: Response.success(result), null 결과는 빈 Payload</li>
 *   <li>실패 시: ErrorEncoder 적용 → Response.failure(encoded)</li>
 *   <li>인코딩 실패 시: 원래 오류 메시지 평문 → Response.failure(message)</li>
 * </ol>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>handle()은 호출 간 상태를 공유하지 않으며 동시 호출 가능</li>
 *   <li>설정(RouterConfig)은 생성 후 불변</li>
 *   <li>route()는 트래픽 시작 전에 완료하는 것을 전제로 함</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Router router = new Router(RouterOptions.observeWith(new Slf4jDispatchObserver()))
 *     .route("CreateOrder", new CreateOrderHandler())
 *     .route("Ping", (context, body) -&gt; Payload.of("\"pong\""));
 *
 * Response response = router.handle(InvocationContext.background(), Request.of("Ping"));
 * </pre>
 *
 * @author Router Team
 * @since 1.0.0
 */
public final class Router implements Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Router.class);

    private final HandlerRegistry registry;
    private final RouterConfig config;

    /**
     * 생성자 (InMemoryHandlerRegistry 사용).
     *
     * @param options 순서대로 적용할 옵션
     * @throws IllegalArgumentException 옵션 중 null이 있는 경우
     */
    public Router(RouterOption... options) {
        this(new InMemoryHandlerRegistry(), options);
    }

    /**
     * 생성자 (HandlerRegistry 지정).
     *
     * @param registry Handler 등록 테이블
     * @param options 순서대로 적용할 옵션
     * @throws IllegalArgumentException registry가 null이거나 옵션 중 null이 있는 경우
     */
    public Router(HandlerRegistry registry, RouterOption... options) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
        this.config = RouterConfig.from(options);
    }

    /**
     * Handler 등록.
     *
     * <p>같은 procedure에 이미 Handler가 있으면 교체합니다 (마지막 등록 우선).</p>
     *
     * @param procedure procedure 이름
     * @param handler Handler
     * @return this (체이닝용)
     * @throws IllegalArgumentException procedure 또는 handler가 null인 경우
     */
    public Router route(String procedure, Handler handler) {
        registry.register(procedure, handler);
        return this;
    }

    @Override
    public Response handle(InvocationContext context, Request request) throws UnrecognizedProcedureException {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }

        String procedure = request.procedure();
        Optional<Handler> handler = registry.lookup(procedure);
        if (handler.isEmpty()) {
            notifyObserver(observer -> observer.onUnrecognizedProcedure(procedure));
            throw new UnrecognizedProcedureException(procedure);
        }

        Payload result;
        try {
            result = handler.get().handle(context, request.body());
        } catch (Exception e) {
            restoreInterruptIfNeeded(e);
            notifyObserver(observer -> observer.onHandlerError(procedure, e));
            return Response.failure(encodeError(procedure, e));
        }
        return Response.success(result != null ? result : Payload.empty());
    }

    /**
     * 등록된 procedure 이름 목록.
     *
     * @return 호출 시점의 불변 스냅샷
     */
    public Set<String> procedures() {
        return registry.procedures();
    }

    /**
     * 적용된 설정 조회.
     *
     * @return RouterConfig
     */
    public RouterConfig config() {
        return config;
    }

    /**
     * Handler 오류 인코딩.
     *
     * <p>ErrorEncoder가 예외를 던지거나 null을 반환하면 원래 오류 메시지를 평문으로 사용합니다.
     * 인코딩 실패는 Observer에만 전달되고 호출자에게는 보이지 않습니다.</p>
     *
     * @param procedure procedure 이름
     * @param error Handler 예외
     * @return 오류 Payload (null 불가)
     */
    private Payload encodeError(String procedure, Exception error) {
        Payload encoded;
        try {
            encoded = config.errorEncoder().encode(error);
        } catch (Exception encodingFailure) {
            restoreInterruptIfNeeded(encodingFailure);
            notifyObserver(observer -> observer.onErrorEncodingFailure(procedure, error, encodingFailure));
            return fallback(error);
        }

        if (encoded == null) {
            IllegalStateException nullResult = new IllegalStateException("errorEncoder returned null");
            notifyObserver(observer -> observer.onErrorEncodingFailure(procedure, error, nullResult));
            return fallback(error);
        }
        return encoded;
    }

    private Payload fallback(Exception error) {
        return Payload.of(ErrorEncoders.describe(error));
    }

    private void restoreInterruptIfNeeded(Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Observer 호출.
     *
     * <p>Observer 예외는 로그만 남기고 응답에 영향을 주지 않습니다.</p>
     */
    private void notifyObserver(Consumer<DispatchObserver> callback) {
        try {
            callback.accept(config.observer());
        } catch (RuntimeException e) {
            log.warn("DispatchObserver {} failed", config.observer().getClass().getName(), e);
        }
    }
}
