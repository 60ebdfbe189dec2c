package com.purchaseflow.domain.purchase;

/**
 * 구매 플로우 단계
 *
 * 단계는 선언 순서대로 실행되며, 앞 단계가 성공해야 다음 단계로 진행합니다.
 */
public enum PurchasePhase {
    VALIDATE,   // 검증
    PREPARE,    // 확정 전 준비 (금액 계산 등)
    COMMIT      // 확정 (일자 기록, 알림)
}
