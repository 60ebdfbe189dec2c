package com.purchaseflow.domain.entity;

import com.purchaseflow.domain.entity.base.BaseEntity;
import com.purchaseflow.domain.vo.Money;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 주문 당시의 상품 정보를 스냅샷으로 저장하여
 * 향후 상품 정보 변경에 영향받지 않도록 합니다.
 */
@Entity
@Table(name = "order_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderItem extends BaseEntity implements Item {

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "product_name", nullable = false, length = 200)
    private String productName;

    @Column(name = "price", nullable = false)
    private Money price;

    @Column(name = "quantity", nullable = false)
    private int quantity;

    @Column(name = "sale_type_id", nullable = false)
    private int saleTypeId;

    public OrderItem(Long productId, String productName, Money price, int quantity, int saleTypeId) {
        if (productId == null) {
            throw new IllegalArgumentException("상품 ID는 필수입니다");
        }
        if (quantity < 1) {
            throw new IllegalArgumentException("수량은 1개 이상이어야 합니다");
        }
        this.productId = productId;
        this.productName = productName;
        this.price = price;
        this.quantity = quantity;
        this.saleTypeId = saleTypeId;
    }

    public static OrderItem from(Item item) {
        return new OrderItem(item.getProductId(), item.getProductName(), item.getPrice(),
                item.getQuantity(), item.getSaleTypeId());
    }

    @Override
    public void changeQuantity(int quantity) {
        if (quantity < 0) {
            throw new IllegalArgumentException("수량은 0 이상이어야 합니다");
        }
        this.quantity = quantity;
    }

    @Override
    public void changePrice(Money price) {
        this.price = price;
    }

    OrderItem copy() {
        OrderItem copied = new OrderItem();
        copied.setId(getId());
        copied.productId = productId;
        copied.productName = productName;
        copied.price = price;
        copied.quantity = quantity;
        copied.saleTypeId = saleTypeId;
        return copied;
    }
}
