package com.purchaseflow.infrastructure.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.purchaseflow.domain.entity.Cart;
import com.purchaseflow.domain.repository.SessionCartStore;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Caffeine 로컬 캐시 기반 세션 카트 저장소
 *
 * - 마지막 접근 후 30분이 지난 세션은 만료 (세션 타임아웃과 동일)
 * - 보관 세션 수 상한으로 메모리 사용량 제한
 * - 엔티티를 그대로 보관하지 않고 복사본을 저장하고 복사본을 돌려준다
 */
@Component
public class InMemorySessionCartStore implements SessionCartStore {

    public static final int SESSION_TTL_MINUTES = 30;
    public static final int MAX_SESSIONS = 10_000;

    private final Cache<String, List<Cart>> store;

    public InMemorySessionCartStore() {
        this(Ticker.systemTicker());
    }

    InMemorySessionCartStore(Ticker ticker) {
        this.store = Caffeine.newBuilder()
                .expireAfterAccess(SESSION_TTL_MINUTES, TimeUnit.MINUTES)
                .maximumSize(MAX_SESSIONS)
                .ticker(ticker)
                .build();
    }

    @Override
    public List<Cart> getCarts(String sessionId) {
        List<Cart> carts = store.getIfPresent(sessionId);
        return carts == null ? List.of() : copyOf(carts);
    }

    @Override
    public void saveCarts(String sessionId, List<Cart> carts) {
        store.put(sessionId, copyOf(carts));
    }

    private static List<Cart> copyOf(List<Cart> carts) {
        return carts.stream().map(Cart::copy).toList();
    }
}
