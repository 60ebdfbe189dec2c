package com.purchaseflow.exception;

import com.purchaseflow.dto.ResponseCode;

/**
 * 저장 시점에 다른 요청이 먼저 같은 주문을 수정한 경우 발생합니다.
 * 호출자는 주문을 다시 조회한 뒤 재시도해야 합니다.
 */
public class ConcurrencyConflictException extends BusinessException {

    public ConcurrencyConflictException(Long orderId) {
        super(ResponseCode.ORDER_CONCURRENCY_CONFLICT,
                ResponseCode.ORDER_CONCURRENCY_CONFLICT.getMessage() + " orderId=" + orderId);
    }

    public ConcurrencyConflictException(Long orderId, Throwable cause) {
        super(ResponseCode.ORDER_CONCURRENCY_CONFLICT,
                ResponseCode.ORDER_CONCURRENCY_CONFLICT.getMessage() + " orderId=" + orderId, cause);
    }
}
