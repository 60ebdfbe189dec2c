package com.purchaseflow.infrastructure.persistence.converter;

import com.purchaseflow.domain.vo.OrderStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * 주문 상태를 상태 ID 정수 컬럼으로 저장합니다.
 * 상태 ID의 의미는 저장하지 않으며 조회 시 OrderStatusResolver가 설정으로 판단합니다.
 */
@Converter(autoApply = true)
public class OrderStatusConverter implements AttributeConverter<OrderStatus, Integer> {

    @Override
    public Integer convertToDatabaseColumn(OrderStatus status) {
        if (status == null) {
            return null;
        }
        return status.getId();
    }

    @Override
    public OrderStatus convertToEntityAttribute(Integer id) {
        if (id == null) {
            return null;
        }
        return OrderStatus.of(id);
    }
}
