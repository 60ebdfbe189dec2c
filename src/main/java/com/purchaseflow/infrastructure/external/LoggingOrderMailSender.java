package com.purchaseflow.infrastructure.external;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 실제 메일 서버 없이 발송 요청을 로그로만 남기는 구현체
 */
@Slf4j
@Component
public class LoggingOrderMailSender implements OrderMailSender {

    @Override
    public boolean send(Long orderId, String templateKey) {
        log.info("주문 메일 발송 요청: orderId={}, template={}", orderId, templateKey);
        return true;
    }
}
