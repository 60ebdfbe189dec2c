package com.purchaseflow.domain.purchase;

/**
 * 구매 플로우가 호출된 채널
 */
public enum PurchaseChannel {
    FRONT,  // 쇼핑몰 (회원/비회원)
    ADMIN   // 관리자 화면
}
