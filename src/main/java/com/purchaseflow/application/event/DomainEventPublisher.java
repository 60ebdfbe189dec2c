package com.purchaseflow.application.event;

/**
 * 도메인 이벤트 발행 추상화 인터페이스
 *
 * 프로세서가 ApplicationEventPublisher에 직접 의존하지 않도록 합니다.
 */
public interface DomainEventPublisher {

    void publish(Object event);
}
