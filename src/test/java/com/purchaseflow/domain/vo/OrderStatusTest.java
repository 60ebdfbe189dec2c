package com.purchaseflow.domain.vo;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("OrderStatus Value Object 테스트")
class OrderStatusTest {

    @Test
    @DisplayName("같은 ID의 상태는 같다")
    void equalsById() {
        assertThat(OrderStatus.of(5)).isEqualTo(OrderStatus.of(5));
        assertThat(OrderStatus.of(5)).isNotEqualTo(OrderStatus.of(6));
    }

    @Test
    @DisplayName("상태 ID는 양수여야 한다")
    void positiveId() {
        assertThatThrownBy(() -> OrderStatus.of(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
