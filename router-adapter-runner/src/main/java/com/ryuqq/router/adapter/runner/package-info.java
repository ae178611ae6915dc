/**
 * Runner Adapter Layer - Dispatcher 구현체.
 *
 * <p>이 패키지는 Dispatcher 인터페이스의 구체적인 구현체를 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.router.adapter.runner.Router} - procedure 이름 기반 요청 디스패처</li>
 *   <li>{@link com.ryuqq.router.adapter.runner.Slf4jDispatchObserver} - SLF4J 로깅 Observer</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (Router)
 *   ↓ implements
 * application (Dispatcher interface, RouterConfig)
 *   ↓ depends on
 * core (Request, Response, Handler, ErrorEncoder)
 *   ↓ depends on
 * core/spi (HandlerRegistry, DispatchObserver)
 * </pre>
 *
 * @author Router Team
 * @since 1.0.0
 */
package com.ryuqq.router.adapter.runner;
