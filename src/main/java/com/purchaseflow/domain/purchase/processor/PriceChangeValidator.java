package com.purchaseflow.domain.purchase.processor;

import com.purchaseflow.domain.entity.Item;
import com.purchaseflow.domain.entity.ItemHolder;
import com.purchaseflow.domain.purchase.PurchaseContext;
import com.purchaseflow.domain.purchase.PurchaseProcessor;
import com.purchaseflow.domain.repository.ProductRepository;
import com.purchaseflow.dto.ResponseCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 담은 이후 상품 가격이 바뀌었으면 현재 가격으로 갱신하고 경고를 남깁니다.
 * 상품이 없는 경우는 StockValidator가 오류로 처리합니다.
 */
@Component
@RequiredArgsConstructor
public class PriceChangeValidator implements PurchaseProcessor {

    private final ProductRepository productRepository;

    @Override
    public void process(ItemHolder target, PurchaseContext context) {
        for (Item item : target.getItems()) {
            productRepository.findById(item.getProductId())
                    .filter(product -> !product.getPrice().equals(item.getPrice()))
                    .ifPresent(product -> {
                        context.addWarning(ResponseCode.PRODUCT_PRICE_CHANGED,
                                product.getName() + "의 가격이 " + item.getPrice() + "에서 "
                                        + product.getPrice() + "으로 변경되었습니다");
                        item.changePrice(product.getPrice());
                    });
        }
    }
}
