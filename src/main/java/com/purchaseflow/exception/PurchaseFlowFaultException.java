package com.purchaseflow.exception;

import com.purchaseflow.dto.ResponseCode;

/**
 * 프로세서가 더 이상 처리를 진행할 수 없는 경우 발생합니다.
 *
 * 일반 검증 오류와 달리 현재 단계의 남은 프로세서 실행을 즉시 중단시키고
 * 호출자에게 그대로 전파됩니다.
 */
public class PurchaseFlowFaultException extends BusinessException {

    public PurchaseFlowFaultException(ResponseCode responseCode, String message) {
        super(responseCode, message);
    }

    public PurchaseFlowFaultException(String message) {
        super(ResponseCode.FLOW_FAULT, message);
    }
}
