package com.purchaseflow.domain.vo;

import java.util.Objects;

/**
 * 주문 상태 Value Object
 *
 * 상태 ID의 의미(발송 완료, 입금 완료 등)는 설정으로 결정되므로
 * 이 객체는 ID만 보관하고, 의미 판단은 OrderStatusResolver에 위임합니다.
 */
public final class OrderStatus {

    private final int id;

    private OrderStatus(int id) {
        if (id <= 0) {
            throw new IllegalArgumentException("주문 상태 ID는 양수여야 합니다");
        }
        this.id = id;
    }

    public static OrderStatus of(int id) {
        return new OrderStatus(id);
    }

    public int getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id == ((OrderStatus) o).id;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "OrderStatus(" + id + ")";
    }
}
