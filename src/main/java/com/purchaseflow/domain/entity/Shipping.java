package com.purchaseflow.domain.entity;

import com.purchaseflow.domain.entity.base.BaseEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 배송지 정보
 *
 * 주문이 값으로 소유하며, 주문에 대한 역참조를 두지 않습니다.
 */
@Entity
@Table(name = "shippings")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Shipping extends BaseEntity {

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "address", nullable = false, length = 255)
    private String address;

    @Column(name = "shipping_commit_date")
    private LocalDateTime shippingCommitDate;

    public Shipping(String name, String address) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("수령인 이름은 필수입니다");
        }
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("배송 주소는 필수입니다");
        }
        this.name = name;
        this.address = address;
    }

    public void stampShippingCommitDate(LocalDateTime shippingCommitDate) {
        this.shippingCommitDate = shippingCommitDate;
    }

    Shipping copy() {
        Shipping copied = new Shipping(name, address);
        copied.setId(getId());
        copied.shippingCommitDate = shippingCommitDate;
        return copied;
    }
}
