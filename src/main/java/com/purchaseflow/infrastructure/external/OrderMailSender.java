package com.purchaseflow.infrastructure.external;

/**
 * 주문 알림 메일 발송 인터페이스
 *
 * 메일 발송은 외부 시스템이 담당합니다.
 */
public interface OrderMailSender {

    /**
     * @param orderId 주문 ID
     * @param templateKey 메일 템플릿 키
     * @return 발송 요청 성공 여부
     */
    boolean send(Long orderId, String templateKey);
}
