package com.purchaseflow.application.service;

import com.purchaseflow.application.dto.CheckoutRequest;
import com.purchaseflow.application.dto.OrderEditRequest;
import com.purchaseflow.application.dto.OrderProcessResponse;
import com.purchaseflow.domain.actor.CustomerActor;
import com.purchaseflow.domain.actor.StaffActor;
import com.purchaseflow.domain.entity.Cart;
import com.purchaseflow.domain.entity.Order;
import com.purchaseflow.domain.entity.OrderStatusType;
import com.purchaseflow.domain.entity.Shipping;
import com.purchaseflow.domain.purchase.PurchaseChannel;
import com.purchaseflow.domain.purchase.PurchaseContext;
import com.purchaseflow.domain.purchase.PurchaseFlow;
import com.purchaseflow.domain.purchase.PurchaseFlowResult;
import com.purchaseflow.domain.purchase.PurchaseMessage;
import com.purchaseflow.domain.purchase.PurchasePhase;
import com.purchaseflow.domain.repository.OrderRepository;
import com.purchaseflow.domain.service.OrderStatusResolver;
import com.purchaseflow.dto.ResponseCode;
import com.purchaseflow.exception.BusinessException;
import com.purchaseflow.exception.ConcurrencyConflictException;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.interceptor.TransactionAspectSupport;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 주문 Application 서비스
 *
 * 책임:
 * - 주문하기(신규 주문): 카트로 주문을 만들고 쇼핑 플로우 실행
 * - 관리자 주문 편집: 편집 전 스냅샷을 남기고 주문 플로우 실행
 * - 단계 순서 보장 (검증 → 준비 → 확정), 모든 단계 성공 시에만 저장
 *
 * 주의:
 * - 업무 규칙은 각 프로세서에 위임
 * - 동시 편집은 버전 비교로 감지하며, 충돌 시 호출자가 다시 조회 후 재시도
 */
@Slf4j
@Service
@Validated
public class OrderService {

    private final PurchaseFlow shoppingPurchaseFlow;
    private final PurchaseFlow orderPurchaseFlow;
    private final OrderRepository orderRepository;
    private final OrderStatusResolver statusResolver;

    public OrderService(@Qualifier("shoppingPurchaseFlow") PurchaseFlow shoppingPurchaseFlow,
                        @Qualifier("orderPurchaseFlow") PurchaseFlow orderPurchaseFlow,
                        OrderRepository orderRepository,
                        OrderStatusResolver statusResolver) {
        this.shoppingPurchaseFlow = shoppingPurchaseFlow;
        this.orderPurchaseFlow = orderPurchaseFlow;
        this.orderRepository = orderRepository;
        this.statusResolver = statusResolver;
    }

    @Transactional
    public OrderProcessResponse checkout(CustomerActor actor, Cart cart, @Valid CheckoutRequest request) {
        if (cart.isEmpty()) {
            throw new BusinessException(ResponseCode.ORDER_EMPTY_CART);
        }

        OrderStatusType initialStatus = request.paymentCompleted() ? OrderStatusType.PAID : OrderStatusType.NEW;
        Order order = Order.fromCart(cart, actor.getActorId(), statusResolver.resolve(initialStatus));
        order.changeUsePoint(request.usePoint());
        request.shippings().forEach(shipping -> order.addShipping(new Shipping(shipping.name(), shipping.address())));

        PurchaseContext context = new PurchaseContext(order.copy(), order, actor, PurchaseChannel.FRONT);
        log.info("주문하기 시작: customerId={}, items={}", actor.getActorId(), order.getItems().size());
        return process(shoppingPurchaseFlow, order, context);
    }

    @Transactional
    public OrderProcessResponse editOrder(Long orderId, @Valid OrderEditRequest request, StaffActor staff) {
        Order order = orderRepository.getByIdOrThrow(orderId);
        if (!Objects.equals(order.getVersion(), request.expectedVersion())) {
            log.warn("주문 편집 충돌: orderId={}, expected={}, actual={}",
                    orderId, request.expectedVersion(), order.getVersion());
            throw new ConcurrencyConflictException(orderId);
        }

        Order origin = order.copy();
        if (request.orderStatus() != null) {
            order.changeStatus(statusResolver.resolve(request.orderStatus()));
        }
        if (request.usePoint() != null) {
            order.changeUsePoint(request.usePoint());
        }

        PurchaseContext context = new PurchaseContext(origin, order, staff, PurchaseChannel.ADMIN);
        log.info("주문 편집 시작: orderId={}, memberId={}", orderId, staff.getActorId());
        return process(orderPurchaseFlow, order, context);
    }

    /**
     * 단계를 순서대로 실행하고, 모두 성공하면 저장합니다.
     * 한 단계라도 오류가 있으면 다음 단계로 진행하지 않습니다.
     */
    private OrderProcessResponse process(PurchaseFlow flow, Order order, PurchaseContext context) {
        List<PurchaseMessage> warnings = new ArrayList<>();

        for (PurchasePhase phase : PurchasePhase.values()) {
            PurchaseFlowResult result = flow.run(phase, order, context);
            warnings.addAll(result.warnings());
            if (!result.isSuccess()) {
                discardChanges();
                return new OrderProcessResponse(order.getId(), false, phase, result.errors(), warnings);
            }
        }

        Order saved = orderRepository.save(order);
        log.info("주문 저장 완료: orderId={}, flow={}", saved.getId(), flow.getName());
        return new OrderProcessResponse(saved.getId(), true, null, List.of(), warnings);
    }

    /**
     * 검증에 실패한 주문이 변경 감지로 저장되지 않도록 트랜잭션을 롤백 대상으로 표시합니다.
     */
    private void discardChanges() {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            TransactionAspectSupport.currentTransactionStatus().setRollbackOnly();
        }
    }
}
