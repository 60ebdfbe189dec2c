package com.purchaseflow.infrastructure.persistence.converter;

import com.purchaseflow.domain.vo.Money;
import com.purchaseflow.domain.vo.OrderStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("JPA 컨버터 테스트")
class ConverterTest {

    private final MoneyConverter moneyConverter = new MoneyConverter();
    private final OrderStatusConverter orderStatusConverter = new OrderStatusConverter();

    @Test
    @DisplayName("금액은 원 단위 정수로 저장하고 다시 읽는다")
    void money() {
        assertThat(moneyConverter.convertToDatabaseColumn(Money.of(15000))).isEqualTo(15000);
        assertThat(moneyConverter.convertToEntityAttribute(15000)).isEqualTo(Money.of(15000));
    }

    @Test
    @DisplayName("주문 상태는 상태 ID로 저장하고 다시 읽는다")
    void orderStatus() {
        assertThat(orderStatusConverter.convertToDatabaseColumn(OrderStatus.of(5))).isEqualTo(5);
        assertThat(orderStatusConverter.convertToEntityAttribute(5)).isEqualTo(OrderStatus.of(5));
    }

    @Test
    @DisplayName("null은 양방향 모두 null로 변환한다")
    void nulls() {
        assertThat(moneyConverter.convertToDatabaseColumn(null)).isNull();
        assertThat(moneyConverter.convertToEntityAttribute(null)).isNull();
        assertThat(orderStatusConverter.convertToDatabaseColumn(null)).isNull();
        assertThat(orderStatusConverter.convertToEntityAttribute(null)).isNull();
    }
}
