package com.purchaseflow.domain.purchase;

/**
 * 처리 대상이 신규 생성인지 기존 데이터 편집인지 구분합니다.
 */
public enum PurchaseFlowType {
    NEW,
    EDIT
}
