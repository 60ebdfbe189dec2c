package com.purchaseflow.domain.purchase;

import com.purchaseflow.domain.actor.Actor;
import com.purchaseflow.domain.actor.CustomerActor;
import com.purchaseflow.domain.actor.StaffActor;
import com.purchaseflow.domain.entity.ItemHolder;
import com.purchaseflow.dto.ResponseCode;
import lombok.Getter;

/**
 * 구매 플로우 한 번의 실행 문맥
 *
 * 처리 전 스냅샷(origin)과 처리 대상(target), 실행 주체, 채널을 묶습니다.
 * 신규/편집 구분은 생성 시점에 target의 식별자 유무로 한 번만 결정합니다.
 * 실행 중인 단계의 오류/경고 수집기는 PurchaseFlow가 연결합니다.
 */
@Getter
public class PurchaseContext {

    private final ItemHolder originHolder;
    private final ItemHolder targetHolder;
    private final Actor actor;
    private final PurchaseChannel channel;
    private final PurchaseFlowType flowType;

    private ResultAccumulator accumulator;

    public PurchaseContext(ItemHolder originHolder, ItemHolder targetHolder, Actor actor, PurchaseChannel channel) {
        if (originHolder == null || targetHolder == null) {
            throw new IllegalArgumentException("처리 대상과 원본 스냅샷은 필수입니다");
        }
        if (originHolder == targetHolder) {
            throw new IllegalArgumentException("원본 스냅샷은 처리 대상과 다른 인스턴스여야 합니다");
        }
        if (channel == null) {
            throw new IllegalArgumentException("채널은 필수입니다");
        }
        this.originHolder = originHolder;
        this.targetHolder = targetHolder;
        this.actor = actor;
        this.channel = channel;
        this.flowType = targetHolder.getId() == null ? PurchaseFlowType.NEW : PurchaseFlowType.EDIT;
    }

    /**
     * 현재 상태 그대로를 원본으로 삼는 문맥을 만듭니다. (정합성 검증용)
     */
    public static PurchaseContext snapshotOf(ItemHolder target, Actor actor, PurchaseChannel channel) {
        return new PurchaseContext(target.copy(), target, actor, channel);
    }

    public boolean isNew() {
        return flowType == PurchaseFlowType.NEW;
    }

    public boolean isCustomer() {
        return actor instanceof CustomerActor;
    }

    public boolean isStaff() {
        return actor instanceof StaffActor;
    }

    public void addError(ResponseCode responseCode, String message) {
        currentAccumulator().addError(PurchaseMessage.of(responseCode, message));
    }

    public void addWarning(ResponseCode responseCode, String message) {
        currentAccumulator().addWarning(PurchaseMessage.of(responseCode, message));
    }

    void bind(ResultAccumulator accumulator) {
        this.accumulator = accumulator;
    }

    void unbind() {
        this.accumulator = null;
    }

    private ResultAccumulator currentAccumulator() {
        if (accumulator == null) {
            throw new IllegalStateException("실행 중인 구매 플로우 단계가 없습니다");
        }
        return accumulator;
    }
}
