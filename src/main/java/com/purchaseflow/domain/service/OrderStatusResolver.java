package com.purchaseflow.domain.service;

import com.purchaseflow.config.OrderStatusProperties;
import com.purchaseflow.domain.entity.OrderStatusType;
import com.purchaseflow.domain.vo.OrderStatus;
import com.purchaseflow.dto.ResponseCode;
import com.purchaseflow.exception.PurchaseFlowFaultException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * 설정된 매핑으로 주문 상태의 의미를 판단합니다.
 *
 * 상태 ID를 코드에 고정하지 않고, 항상 의미(발송 완료인가?)로 비교합니다.
 */
@Component
@RequiredArgsConstructor
public class OrderStatusResolver {

    private final OrderStatusProperties properties;

    /**
     * @throws PurchaseFlowFaultException 해당 의미의 상태 ID가 설정되지 않은 경우
     */
    public OrderStatus resolve(OrderStatusType type) {
        Integer id = properties.getOrderStatus().get(type.getKey());
        if (id == null) {
            throw new PurchaseFlowFaultException(ResponseCode.FLOW_STATUS_NOT_CONFIGURED,
                    "주문 상태 설정이 없습니다: purchase-flow.order-status." + type.getKey());
        }
        return OrderStatus.of(id);
    }

    public boolean is(OrderStatus status, OrderStatusType type) {
        return resolve(type).equals(status);
    }

    public Optional<OrderStatusType> meaningOf(OrderStatus status) {
        if (status == null) {
            return Optional.empty();
        }
        return Arrays.stream(OrderStatusType.values())
                .filter(type -> Objects.equals(properties.getOrderStatus().get(type.getKey()), status.getId()))
                .findFirst();
    }
}
