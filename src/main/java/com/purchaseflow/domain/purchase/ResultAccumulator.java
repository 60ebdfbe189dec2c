package com.purchaseflow.domain.purchase;

import java.util.ArrayList;
import java.util.List;

/**
 * 한 단계를 실행하는 동안 프로세서들이 남긴 오류와 경고를 모읍니다.
 */
public class ResultAccumulator {

    private final List<PurchaseMessage> errors = new ArrayList<>();
    private final List<PurchaseMessage> warnings = new ArrayList<>();

    public void addError(PurchaseMessage error) {
        errors.add(error);
    }

    public void addWarning(PurchaseMessage warning) {
        warnings.add(warning);
    }

    public boolean hasError() {
        return !errors.isEmpty();
    }

    public PurchaseFlowResult toResult(PurchasePhase phase) {
        return new PurchaseFlowResult(phase, errors, warnings);
    }
}
