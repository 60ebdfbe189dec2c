package com.purchaseflow.domain.entity;

import com.purchaseflow.domain.vo.Money;

import java.util.List;

/**
 * 구매 플로우가 처리하는 집합체 (카트 또는 주문)
 *
 * 식별자가 없으면 신규 생성, 있으면 편집 흐름으로 취급됩니다.
 */
public interface ItemHolder {

    Long getId();

    List<? extends Item> getItems();

    /**
     * 처리 전 상태를 보존하기 위한 분리된(detached) 복사본을 만듭니다.
     * 복사본의 하위 요소도 모두 새 인스턴스입니다.
     */
    ItemHolder copy();

    default Money getItemsTotal() {
        return getItems().stream()
                .map(Item::getTotalPrice)
                .reduce(Money.zero(), Money::add);
    }

    default int getTotalQuantity() {
        return getItems().stream()
                .mapToInt(Item::getQuantity)
                .sum();
    }
}
