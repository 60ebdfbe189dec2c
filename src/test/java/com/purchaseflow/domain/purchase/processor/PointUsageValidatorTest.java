package com.purchaseflow.domain.purchase.processor;

import com.purchaseflow.domain.actor.Actor;
import com.purchaseflow.domain.actor.CustomerActor;
import com.purchaseflow.domain.actor.StaffActor;
import com.purchaseflow.domain.entity.Customer;
import com.purchaseflow.domain.entity.Member;
import com.purchaseflow.domain.entity.Order;
import com.purchaseflow.domain.entity.OrderItem;
import com.purchaseflow.domain.purchase.PurchaseChannel;
import com.purchaseflow.domain.purchase.PurchaseContext;
import com.purchaseflow.domain.purchase.PurchaseFlow;
import com.purchaseflow.domain.purchase.PurchaseFlowResult;
import com.purchaseflow.domain.purchase.PurchaseMessage;
import com.purchaseflow.domain.purchase.PurchasePhase;
import com.purchaseflow.domain.vo.Money;
import com.purchaseflow.domain.vo.OrderStatus;
import com.purchaseflow.dto.ResponseCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PointUsageValidator 테스트")
class PointUsageValidatorTest {

    private final PurchaseFlow flow = new PurchaseFlow("test", Map.of(
            PurchasePhase.VALIDATE, List.of(new PointUsageValidator())
    ));

    private Order orderUsingPoint(int usePoint) {
        Order order = new Order(1L, OrderStatus.of(1));
        order.addItem(new OrderItem(1L, "키보드", Money.of(10000), 1, 1));
        order.changeUsePoint(usePoint);
        return order;
    }

    private PurchaseFlowResult validate(Order order, Actor actor) {
        return flow.validate(order, PurchaseContext.snapshotOf(order, actor, PurchaseChannel.FRONT));
    }

    @Test
    @DisplayName("보유 포인트 이내로 사용하면 통과한다")
    void withinBalance() {
        CustomerActor actor = new CustomerActor(new Customer(1L, "회원", "customer@test.com", 5000));

        PurchaseFlowResult result = validate(orderUsingPoint(3000), actor);

        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    @DisplayName("보유 포인트보다 많이 사용하면 오류다")
    void overBalance() {
        CustomerActor actor = new CustomerActor(new Customer(1L, "회원", "customer@test.com", 1000));

        PurchaseFlowResult result = validate(orderUsingPoint(3000), actor);

        assertThat(result.errors()).extracting(PurchaseMessage::code)
                .containsExactly(ResponseCode.POINT_INSUFFICIENT.getCode());
    }

    @Test
    @DisplayName("상품 합계보다 많이 사용하면 오류다")
    void overItemsTotal() {
        CustomerActor actor = new CustomerActor(new Customer(1L, "회원", "customer@test.com", 50000));

        PurchaseFlowResult result = validate(orderUsingPoint(20000), actor);

        assertThat(result.errors()).extracting(PurchaseMessage::code)
                .containsExactly(ResponseCode.POINT_INVALID_AMOUNT.getCode());
    }

    @Test
    @DisplayName("음수 포인트는 오류다")
    void negative() {
        StaffActor staff = new StaffActor(new Member(1L, "관리자"));

        PurchaseFlowResult result = validate(orderUsingPoint(-1), staff);

        assertThat(result.errors()).extracting(PurchaseMessage::code)
                .containsExactly(ResponseCode.POINT_INVALID_AMOUNT.getCode());
    }

    @Test
    @DisplayName("관리자 편집은 회원 보유 포인트를 확인하지 않는다")
    void staffSkipsBalanceCheck() {
        StaffActor staff = new StaffActor(new Member(1L, "관리자"));

        PurchaseFlowResult result = validate(orderUsingPoint(3000), staff);

        assertThat(result.isSuccess()).isTrue();
    }
}
