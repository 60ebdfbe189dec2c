package com.purchaseflow.domain.entity.base;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import lombok.Getter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * 생성/수정 시간을 관리하는 Entity 기본 클래스
 */
@MappedSuperclass
@Getter
public abstract class BaseTimeEntity extends BaseEntity {

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 저장 전 엔티티의 생성/수정 시간을 초기화합니다.
     */
    protected void initializeTimestamps() {
        this.createdAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 스냅샷 복사 시 원본의 시간 정보를 그대로 옮깁니다.
     */
    protected void copyTimestampsFrom(BaseTimeEntity source) {
        this.createdAt = source.createdAt;
        this.updatedAt = source.updatedAt;
    }

    public void updateTimestamp() {
        this.updatedAt = LocalDateTime.now();
    }
}
