package com.purchaseflow.application.dto;

import com.purchaseflow.domain.entity.Cart;
import com.purchaseflow.domain.purchase.PurchaseFlowResult;

import java.util.List;
import java.util.Map;

/**
 * 로그인 시 카트 병합 결과
 *
 * @param carts 병합 후 저장된 카트
 * @param validationResults 카트 키별 검증 결과 (검증이 중단된 카트는 포함되지 않음)
 * @param divided 카트가 하나로 합쳐지지 못하고 분리되었는지 여부
 */
public record CartConsolidationResult(
        List<Cart> carts,
        Map<String, PurchaseFlowResult> validationResults,
        boolean divided
) {
}
