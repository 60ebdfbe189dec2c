package com.purchaseflow.domain.purchase;

import java.util.List;

/**
 * 한 단계의 처리 결과
 *
 * 오류가 하나라도 있으면 실패이며, 호출자는 저장하지 않아야 합니다.
 * 경고만 있는 경우는 성공으로 취급합니다.
 */
public record PurchaseFlowResult(
        PurchasePhase phase,
        List<PurchaseMessage> errors,
        List<PurchaseMessage> warnings
) {
    public PurchaseFlowResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public boolean hasWarning() {
        return !warnings.isEmpty();
    }
}
