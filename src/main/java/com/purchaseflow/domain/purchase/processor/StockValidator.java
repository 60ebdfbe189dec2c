package com.purchaseflow.domain.purchase.processor;

import com.purchaseflow.domain.entity.Item;
import com.purchaseflow.domain.entity.ItemHolder;
import com.purchaseflow.domain.entity.Product;
import com.purchaseflow.domain.purchase.PurchaseContext;
import com.purchaseflow.domain.purchase.PurchaseProcessor;
import com.purchaseflow.domain.repository.ProductRepository;
import com.purchaseflow.dto.ResponseCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 재고 검증
 *
 * - 상품이 없거나 품절이면 오류
 * - 담긴 수량이 재고보다 많으면 재고 수량으로 줄이고 경고
 */
@Component
@RequiredArgsConstructor
public class StockValidator implements PurchaseProcessor {

    private final ProductRepository productRepository;

    @Override
    public void process(ItemHolder target, PurchaseContext context) {
        for (Item item : target.getItems()) {
            Optional<Product> found = productRepository.findById(item.getProductId());
            if (found.isEmpty()) {
                context.addError(ResponseCode.PRODUCT_NOT_FOUND,
                        "상품을 찾을 수 없습니다: " + item.getProductName());
                continue;
            }

            Product product = found.get();
            if (product.isOutOfStock()) {
                context.addError(ResponseCode.PRODUCT_OUT_OF_STOCK,
                        "품절된 상품입니다: " + product.getName());
            } else if (!product.hasStock(item.getQuantity())) {
                item.changeQuantity(product.getStock());
                context.addWarning(ResponseCode.PRODUCT_STOCK_LIMITED,
                        product.getName() + "의 수량이 재고 " + product.getStock() + "개로 조정되었습니다");
            }
        }
    }
}
