package com.purchaseflow.domain.entity;

import com.purchaseflow.domain.vo.Money;

/**
 * 카트/주문에 담긴 상품 한 줄
 */
public interface Item {

    Long getProductId();

    String getProductName();

    Money getPrice();

    int getQuantity();

    int getSaleTypeId();

    void changeQuantity(int quantity);

    void changePrice(Money price);

    default Money getTotalPrice() {
        return getPrice().multiply(getQuantity());
    }
}
