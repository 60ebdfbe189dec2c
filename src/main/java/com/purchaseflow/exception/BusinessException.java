package com.purchaseflow.exception;

import com.purchaseflow.dto.ResponseCode;
import lombok.Getter;

/**
 * 비즈니스 로직 예외
 *
 * 사용 예시:
 * - throw new BusinessException(ResponseCode.ORDER_NOT_FOUND);
 * - throw new BusinessException(ResponseCode.ORDER_NOT_FOUND, "주문을 찾을 수 없습니다: " + orderId);
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ResponseCode responseCode;
    private final String customMessage;

    public BusinessException(ResponseCode responseCode) {
        super(responseCode.getMessage());
        this.responseCode = responseCode;
        this.customMessage = null;
    }

    public BusinessException(ResponseCode responseCode, String customMessage) {
        super(customMessage);
        this.responseCode = responseCode;
        this.customMessage = customMessage;
    }

    public BusinessException(ResponseCode responseCode, String customMessage, Throwable cause) {
        super(customMessage, cause);
        this.responseCode = responseCode;
        this.customMessage = customMessage;
    }

    public String getErrorMessage() {
        return customMessage != null ? customMessage : responseCode.getMessage();
    }
}
