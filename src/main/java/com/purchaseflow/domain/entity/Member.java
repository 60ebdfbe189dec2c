package com.purchaseflow.domain.entity;

import com.purchaseflow.domain.entity.base.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 관리자(스태프) Entity
 */
@Entity
@Table(name = "members")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Member extends BaseTimeEntity {

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "login_date")
    private LocalDateTime loginDate;

    public Member(Long id, String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("관리자 이름은 필수입니다");
        }
        if (id != null) {
            setId(id);
        }
        this.name = name;
        initializeTimestamps();
    }

    public void updateLoginDate(LocalDateTime loginDate) {
        this.loginDate = loginDate;
        updateTimestamp();
    }
}
