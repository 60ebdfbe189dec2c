package com.purchaseflow.domain.entity;

import com.purchaseflow.domain.entity.base.BaseEntity;
import com.purchaseflow.domain.vo.Money;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "cart_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CartItem extends BaseEntity implements Item {

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

    public CartItem(Product product, int quantity) {
        if (product == null) {
            throw new IllegalArgumentException("상품 정보는 필수입니다");
        }
        if (quantity < 1) {
            throw new IllegalArgumentException("수량은 1개 이상이어야 합니다");
        }
        this.productId = product.getId();
        this.productName = product.getName();
        this.price = product.getPrice();
        this.quantity = quantity;
        this.saleTypeId = product.getSaleTypeId();
    }

    private CartItem(Item source) {
        this.productId = source.getProductId();
        this.productName = source.getProductName();
        this.price = source.getPrice();
        this.quantity = source.getQuantity();
        this.saleTypeId = source.getSaleTypeId();
    }

    /**
     * 다른 카트의 상품을 새 카트 상품으로 옮겨 담습니다. 식별자는 복사하지 않습니다.
     */
    public static CartItem from(Item source) {
        return new CartItem(source);
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

    public void addQuantity(int quantity) {
        changeQuantity(this.quantity + quantity);
    }

    CartItem copy() {
        CartItem copied = new CartItem(this);
        copied.setId(getId());
        return copied;
    }
}
