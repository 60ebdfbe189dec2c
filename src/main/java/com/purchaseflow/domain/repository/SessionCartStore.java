package com.purchaseflow.domain.repository;

import com.purchaseflow.domain.entity.Cart;

import java.util.List;

/**
 * 세션에 보관된 카트
 *
 * 세션 저장 방식은 외부에서 결정하며, 구매 플로우는 이 인터페이스로만 접근합니다.
 */
public interface SessionCartStore {

    List<Cart> getCarts(String sessionId);

    void saveCarts(String sessionId, List<Cart> carts);
}
