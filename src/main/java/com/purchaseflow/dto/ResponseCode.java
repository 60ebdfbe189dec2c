package com.purchaseflow.dto;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 응답 코드 정의
 *
 * 코드 구조: {도메인}_{숫자}
 * - COMMON: 1xxx (공통)
 * - PRODUCT: 2xxx (상품)
 * - ORDER: 3xxx (주문)
 * - POINT: 5xxx (포인트)
 * - FLOW: 6xxx (구매 플로우)
 */
@Getter
@RequiredArgsConstructor
public enum ResponseCode {

    // ===== 공통 (1xxx) =====
    BAD_REQUEST("COMMON_1400", "잘못된 요청입니다."),

    // ===== 상품 (2xxx) =====
    PRODUCT_NOT_FOUND("PRODUCT_2001", "상품을 찾을 수 없습니다."),
    PRODUCT_OUT_OF_STOCK("PRODUCT_2002", "상품 재고가 부족합니다."),
    PRODUCT_STOCK_LIMITED("PRODUCT_2003", "재고가 부족하여 수량이 조정되었습니다."),
    PRODUCT_PRICE_CHANGED("PRODUCT_2004", "상품 가격이 변경되었습니다."),

    // ===== 주문 (3xxx) =====
    ORDER_NOT_FOUND("ORDER_3002", "주문을 찾을 수 없습니다."),
    ORDER_CONCURRENCY_CONFLICT("ORDER_3007", "다른 사용자가 먼저 주문을 수정했습니다. 다시 조회 후 시도해주세요."),
    ORDER_EMPTY_CART("ORDER_3008", "카트에 상품이 없습니다."),

    // ===== 포인트 (5xxx) =====
    POINT_INSUFFICIENT("POINT_5002", "포인트가 부족합니다."),
    POINT_INVALID_AMOUNT("POINT_5003", "유효하지 않은 포인트 금액입니다."),

    // ===== 구매 플로우 (6xxx) =====
    FLOW_FAULT("FLOW_6000", "구매 처리를 계속할 수 없습니다."),
    FLOW_STATUS_NOT_CONFIGURED("FLOW_6001", "주문 상태 설정이 없습니다."),
    FLOW_UNSUPPORTED_HOLDER("FLOW_6002", "지원하지 않는 처리 대상입니다.");

    private final String code;
    private final String message;
}
