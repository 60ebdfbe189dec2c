package com.purchaseflow.domain.purchase;

import com.purchaseflow.dto.ResponseCode;

/**
 * 프로세서가 남긴 오류 또는 경고 한 건
 */
public record PurchaseMessage(
        String code,
        String message
) {
    public static PurchaseMessage of(ResponseCode responseCode, String message) {
        return new PurchaseMessage(responseCode.getCode(), message);
    }

    public static PurchaseMessage of(ResponseCode responseCode) {
        return of(responseCode, responseCode.getMessage());
    }
}
