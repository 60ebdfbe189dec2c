package com.purchaseflow.application.dto;

import com.purchaseflow.domain.entity.OrderStatusType;
import jakarta.validation.constraints.NotNull;

/**
 * 관리자 주문 편집 요청
 *
 * @param expectedVersion 편집 화면을 열 때 조회한 주문 버전
 * @param orderStatus 변경할 상태 (null이면 유지)
 * @param usePoint 변경할 사용 포인트 (null이면 유지)
 */
public record OrderEditRequest(
        @NotNull(message = "주문 버전은 필수입니다")
        Long expectedVersion,

        OrderStatusType orderStatus,

        Integer usePoint
) {
}
