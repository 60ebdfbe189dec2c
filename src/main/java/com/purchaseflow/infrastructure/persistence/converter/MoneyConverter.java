package com.purchaseflow.infrastructure.persistence.converter;

import com.purchaseflow.domain.vo.Money;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * 금액을 원 단위 정수 컬럼으로 저장합니다.
 * 가격, 합계, 포인트 잔액처럼 Money 타입인 모든 필드에 자동 적용됩니다.
 */
@Converter(autoApply = true)
public class MoneyConverter implements AttributeConverter<Money, Integer> {

    @Override
    public Integer convertToDatabaseColumn(Money money) {
        if (money == null) {
            return null;
        }
        return money.getAmount();
    }

    @Override
    public Money convertToEntityAttribute(Integer amount) {
        if (amount == null) {
            return null;
        }
        return Money.of(amount);
    }
}
