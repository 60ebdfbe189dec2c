package com.purchaseflow.domain.entity;

import com.purchaseflow.domain.entity.base.BaseTimeEntity;
import com.purchaseflow.domain.vo.Money;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "products")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Product extends BaseTimeEntity {

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "price", nullable = false)
    private Money price;

    @Column(name = "stock", nullable = false)
    private int stock;

    @Column(name = "stock_unlimited", nullable = false)
    private boolean stockUnlimited;

    @Column(name = "sale_type_id", nullable = false)
    private int saleTypeId;

    public Product(Long id, String name, int price, int stock, int saleTypeId) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("상품명은 필수입니다");
        }
        if (stock < 0) {
            throw new IllegalArgumentException("재고는 0 이상이어야 합니다");
        }
        if (id != null) {
            setId(id);
        }
        this.name = name;
        this.price = Money.of(price);
        this.stock = stock;
        this.saleTypeId = saleTypeId;
        initializeTimestamps();
    }

    public static Product unlimited(Long id, String name, int price, int saleTypeId) {
        Product product = new Product(id, name, price, 0, saleTypeId);
        product.stockUnlimited = true;
        return product;
    }

    public boolean isOutOfStock() {
        return !stockUnlimited && stock == 0;
    }

    public boolean hasStock(int quantity) {
        return stockUnlimited || stock >= quantity;
    }

    public void changePrice(int price) {
        this.price = Money.of(price);
        updateTimestamp();
    }
}
