package com.purchaseflow.domain.service;

import com.purchaseflow.domain.entity.Cart;
import com.purchaseflow.domain.entity.Customer;
import com.purchaseflow.domain.repository.CartRepository;
import com.purchaseflow.domain.repository.SessionCartStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 카트 도메인 서비스
 *
 * 책임:
 * - 로그인 시 저장된 카트와 세션 카트 병합
 * - 병합된 카트를 세션과 저장소에 반영
 *
 * 판매 유형이 다른 상품은 한 카트에 담을 수 없으므로
 * 병합 결과는 판매 유형별로 하나씩의 카트가 됩니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CartDomainService {

    private final CartRepository cartRepository;
    private final SessionCartStore sessionCartStore;

    /**
     * 회원의 저장된 카트와 현재 세션의 카트를 병합합니다.
     * 같은 상품은 수량을 합산하고, 저장된 카트의 상품 순서를 먼저 유지합니다.
     * 세션에 이미 같은 카트 키가 있는 저장된 카트는 이전 병합 결과이므로 다시 합치지 않습니다.
     *
     * @return 판매 유형별로 병합된 새 카트 목록 (아직 저장되지 않음)
     */
    @Transactional(readOnly = true)
    public List<Cart> mergeFromPersistedCart(Customer customer, String sessionId) {
        List<Cart> sessionCarts = sessionCartStore.getCarts(sessionId);
        Set<String> sessionCartKeys = sessionCarts.stream()
                .map(Cart::getCartKey)
                .collect(Collectors.toSet());
        List<Cart> persistedCarts = cartRepository.findByCustomerId(customer.getId()).stream()
                .filter(cart -> !sessionCartKeys.contains(cart.getCartKey()))
                .toList();

        Map<Integer, Cart> merged = new LinkedHashMap<>();
        Stream.concat(persistedCarts.stream(), sessionCarts.stream())
                .flatMap(cart -> cart.getItems().stream())
                .forEach(item -> merged
                        .computeIfAbsent(item.getSaleTypeId(), saleTypeId -> new Cart(customer.getId(), saleTypeId))
                        .addItem(item));

        log.debug("카트 병합: customerId={}, persisted={}, session={}, merged={}",
                customer.getId(), persistedCarts.size(), sessionCarts.size(), merged.size());
        return new ArrayList<>(merged.values());
    }

    /**
     * 병합된 카트로 회원의 저장된 카트와 세션 카트를 교체합니다.
     * 수량이 0이 된 상품과 비어 있는 카트는 저장하지 않습니다.
     *
     * @return 저장된 카트 목록
     */
    @Transactional
    public List<Cart> save(Customer customer, String sessionId, List<Cart> carts) {
        List<Cart> nonEmptyCarts = new ArrayList<>();
        for (Cart cart : carts) {
            cart.removeEmptyItems();
            if (!cart.isEmpty()) {
                nonEmptyCarts.add(cart);
            }
        }

        cartRepository.deleteAll(cartRepository.findByCustomerId(customer.getId()));
        List<Cart> saved = cartRepository.saveAll(nonEmptyCarts);
        sessionCartStore.saveCarts(sessionId, saved);
        return saved;
    }
}
