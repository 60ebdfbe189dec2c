package com.purchaseflow.domain.entity;

import com.purchaseflow.domain.entity.base.BaseTimeEntity;
import com.purchaseflow.domain.vo.Money;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 회원(구매자) Entity
 */
@Entity
@Table(name = "customers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Customer extends BaseTimeEntity {

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "email", nullable = false, unique = true, length = 255)
    private String email;

    @Column(name = "point_balance", nullable = false)
    private Money pointBalance;

    public Customer(Long id, String name, String email, int pointBalance) {
        if (id != null && id <= 0) {
            throw new IllegalArgumentException("회원 ID는 양수여야 합니다");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("회원 이름은 필수입니다");
        }
        if (id != null) {
            setId(id);
        }
        this.name = name;
        this.email = email;
        this.pointBalance = Money.of(pointBalance);
        initializeTimestamps();
    }

    /**
     * @param amount 확인할 포인트
     * @return 보유 포인트가 충분하면 true
     */
    public boolean hasPoint(int amount) {
        return pointBalance.isGreaterThanOrEqual(Money.of(amount));
    }
}
