package com.purchaseflow.domain.service;

import com.purchaseflow.config.OrderStatusProperties;
import com.purchaseflow.domain.entity.OrderStatusType;
import com.purchaseflow.domain.vo.OrderStatus;
import com.purchaseflow.dto.ResponseCode;
import com.purchaseflow.exception.PurchaseFlowFaultException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("OrderStatusResolver 테스트")
class OrderStatusResolverTest {

    private OrderStatusResolver resolver;

    @BeforeEach
    void setUp() {
        OrderStatusProperties properties = new OrderStatusProperties();
        properties.setOrderStatus(Map.of("new", 1, "delivered", 5, "paid", 6));
        resolver = new OrderStatusResolver(properties);
    }

    @Test
    @DisplayName("설정된 의미로 상태 ID를 찾는다")
    void resolve() {
        assertThat(resolver.resolve(OrderStatusType.DELIVERED)).isEqualTo(OrderStatus.of(5));
        assertThat(resolver.is(OrderStatus.of(6), OrderStatusType.PAID)).isTrue();
        assertThat(resolver.is(OrderStatus.of(6), OrderStatusType.DELIVERED)).isFalse();
    }

    @Test
    @DisplayName("설정되지 않은 의미는 플로우 중단 예외가 발생한다")
    void notConfigured() {
        assertThatThrownBy(() -> resolver.resolve(OrderStatusType.RETURNED))
                .isInstanceOf(PurchaseFlowFaultException.class)
                .extracting("responseCode")
                .isEqualTo(ResponseCode.FLOW_STATUS_NOT_CONFIGURED);
    }

    @Test
    @DisplayName("상태 ID로 의미를 역으로 찾는다")
    void meaningOf() {
        assertThat(resolver.meaningOf(OrderStatus.of(1))).contains(OrderStatusType.NEW);
        assertThat(resolver.meaningOf(OrderStatus.of(99))).isEmpty();
        assertThat(resolver.meaningOf(null)).isEmpty();
    }
}
