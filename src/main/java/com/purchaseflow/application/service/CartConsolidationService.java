package com.purchaseflow.application.service;

import com.purchaseflow.application.dto.CartConsolidationResult;
import com.purchaseflow.domain.actor.CustomerActor;
import com.purchaseflow.domain.entity.Cart;
import com.purchaseflow.domain.purchase.PurchaseChannel;
import com.purchaseflow.domain.purchase.PurchaseContext;
import com.purchaseflow.domain.purchase.PurchaseFlow;
import com.purchaseflow.domain.purchase.PurchaseFlowResult;
import com.purchaseflow.domain.service.CartDomainService;
import com.purchaseflow.exception.PurchaseFlowFaultException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 로그인 시 카트 병합 Application 서비스
 *
 * 흐름:
 * 1. 저장된 카트와 세션 카트 병합
 * 2. 카트마다 검증 단계 실행 (재고/가격 변동 확인)
 * 3. 검증 결과와 관계없이 병합 결과 저장
 * 4. 카트가 2개 이상 남으면 분리 신호 반환
 *
 * 한 카트의 검증 실패나 중단은 다른 카트의 검증과 저장을 막지 않습니다.
 */
@Slf4j
@Service
public class CartConsolidationService {

    private final CartDomainService cartDomainService;
    private final PurchaseFlow cartPurchaseFlow;

    public CartConsolidationService(CartDomainService cartDomainService,
                                    @Qualifier("cartPurchaseFlow") PurchaseFlow cartPurchaseFlow) {
        this.cartDomainService = cartDomainService;
        this.cartPurchaseFlow = cartPurchaseFlow;
    }

    @Transactional
    public CartConsolidationResult consolidate(CustomerActor actor, String sessionId) {
        List<Cart> mergedCarts = cartDomainService.mergeFromPersistedCart(actor.customer(), sessionId);

        Map<String, PurchaseFlowResult> results = new LinkedHashMap<>();
        for (Cart cart : mergedCarts) {
            validate(cart, actor, results);
        }

        List<Cart> savedCarts = cartDomainService.save(actor.customer(), sessionId, mergedCarts);
        boolean divided = savedCarts.size() > 1;

        log.info("로그인 카트 병합 완료: customerId={}, carts={}, divided={}",
                actor.getActorId(), savedCarts.size(), divided);
        return new CartConsolidationResult(savedCarts, results, divided);
    }

    private void validate(Cart cart, CustomerActor actor, Map<String, PurchaseFlowResult> results) {
        PurchaseContext context = PurchaseContext.snapshotOf(cart, actor, PurchaseChannel.FRONT);
        try {
            results.put(cart.getCartKey(), cartPurchaseFlow.validate(cart, context));
        } catch (PurchaseFlowFaultException e) {
            log.error("카트 검증 중단, 병합은 계속 진행: cartKey={}, reason={}", cart.getCartKey(), e.getErrorMessage());
        }
    }
}
