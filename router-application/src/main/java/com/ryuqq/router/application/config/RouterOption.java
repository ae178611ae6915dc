package com.ryuqq.router.application.config;

/**
 * Router 생성 옵션.
 *
 * <p>현재 설정을 받아 일부를 바꾼 새 설정을 반환합니다.
 * 생성자에 전달된 순서대로 적용되므로 같은 항목을 바꾸는 옵션이 여러 개면 마지막 옵션이 우선합니다.</p>
 *
 * @author Router Team
 * @since 1.0.0
 * @see RouterOptions
 */
@FunctionalInterface
public interface RouterOption {

    /**
     * 옵션 적용.
     *
     * @param config 이전 옵션까지 적용된 설정
     * @return 새 설정 (null 불가)
     */
    RouterConfig apply(RouterConfig config);
}
