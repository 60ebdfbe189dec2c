package com.purchaseflow.domain.vo;

import java.util.Objects;

/**
 * 금액을 나타내는 Value Object
 * 불변 객체로 설계되어 안전한 금액 연산을 제공합니다.
 */
public class Money {

    private final int amount;

    private Money(int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("금액은 0 이상이어야 합니다");
        }
        this.amount = amount;
    }

    public static Money of(int amount) {
        return new Money(amount);
    }

    public static Money zero() {
        return new Money(0);
    }

    public int getAmount() {
        return amount;
    }

    public Money add(Money other) {
        return new Money(this.amount + other.amount);
    }

    /**
     * 금액을 뺍니다. 결과가 음수이면 0원을 반환합니다.
     */
    public Money subtractOrZero(Money other) {
        return new Money(Math.max(0, this.amount - other.amount));
    }

    public Money multiply(int multiplier) {
        if (multiplier < 0) {
            throw new IllegalArgumentException("곱하는 값은 0 이상이어야 합니다");
        }
        return new Money(this.amount * multiplier);
    }

    public boolean isGreaterThanOrEqual(Money other) {
        return this.amount >= other.amount;
    }

    public boolean isZero() {
        return this.amount == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Money money = (Money) o;
        return amount == money.amount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount);
    }

    @Override
    public String toString() {
        return String.format("%d원", amount);
    }
}
