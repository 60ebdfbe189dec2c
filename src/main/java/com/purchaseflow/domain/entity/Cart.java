package com.purchaseflow.domain.entity;

import com.purchaseflow.domain.entity.base.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 카트 Entity
 *
 * 하나의 카트에는 같은 판매 유형의 상품만 담을 수 있습니다.
 * 판매 유형이 다른 상품은 별도의 카트로 분리됩니다.
 */
@Entity
@Table(name = "carts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Cart extends BaseTimeEntity implements ItemHolder {

    @Column(name = "customer_id")
    private Long customerId;

    @Column(name = "sale_type_id", nullable = false)
    private int saleTypeId;

    @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true)
    @JoinColumn(name = "cart_id")
    private List<CartItem> items = new ArrayList<>();

    public Cart(Long customerId, int saleTypeId) {
        this.customerId = customerId;
        this.saleTypeId = saleTypeId;
        initializeTimestamps();
    }

    public String getCartKey() {
        return (customerId == null ? "guest" : customerId) + "_" + saleTypeId;
    }

    @Override
    public List<CartItem> getItems() {
        return Collections.unmodifiableList(items);
    }

    public boolean canAccept(Item item) {
        return item.getSaleTypeId() == saleTypeId;
    }

    /**
     * 상품을 담습니다. 이미 같은 상품이 있으면 수량을 합산합니다.
     *
     * @throws IllegalArgumentException 판매 유형이 다른 상품인 경우
     */
    public void addItem(Item item) {
        if (!canAccept(item)) {
            throw new IllegalArgumentException(
                    "판매 유형이 다른 상품은 같은 카트에 담을 수 없습니다: saleTypeId=" + item.getSaleTypeId());
        }
        items.stream()
                .filter(existing -> Objects.equals(existing.getProductId(), item.getProductId()))
                .findFirst()
                .ifPresentOrElse(
                        existing -> existing.addQuantity(item.getQuantity()),
                        () -> items.add(CartItem.from(item)));
        updateTimestamp();
    }

    /**
     * 수량이 0이 된 상품을 제거합니다.
     */
    public void removeEmptyItems() {
        items.removeIf(item -> item.getQuantity() == 0);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override
    public Cart copy() {
        Cart copied = new Cart();
        copied.setId(getId());
        copied.copyTimestampsFrom(this);
        copied.customerId = customerId;
        copied.saleTypeId = saleTypeId;
        items.forEach(item -> copied.items.add(item.copy()));
        return copied;
    }
}
