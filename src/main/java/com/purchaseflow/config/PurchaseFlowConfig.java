package com.purchaseflow.config;

import com.purchaseflow.domain.purchase.PurchaseFlow;
import com.purchaseflow.domain.purchase.PurchasePhase;
import com.purchaseflow.domain.purchase.processor.OrderDatePurchaseProcessor;
import com.purchaseflow.domain.purchase.processor.OrderStatusNotificationProcessor;
import com.purchaseflow.domain.purchase.processor.OrderTotalCalculator;
import com.purchaseflow.domain.purchase.processor.PointUsageValidator;
import com.purchaseflow.domain.purchase.processor.PriceChangeValidator;
import com.purchaseflow.domain.purchase.processor.StockValidator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * 구매 플로우 구성
 *
 * 플로우별로 단계마다 실행할 프로세서와 그 순서를 선언합니다.
 * 같은 단계 안에서 뒤의 프로세서는 앞 프로세서의 변경 결과를 전제로 할 수 있습니다.
 */
@Configuration
public class PurchaseFlowConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * 카트 화면, 로그인 시 카트 병합
     */
    @Bean
    public PurchaseFlow cartPurchaseFlow(StockValidator stockValidator,
                                         PriceChangeValidator priceChangeValidator) {
        return new PurchaseFlow("cart", Map.of(
                PurchasePhase.VALIDATE, List.of(stockValidator, priceChangeValidator)
        ));
    }

    /**
     * 주문하기 (신규 주문)
     */
    @Bean
    public PurchaseFlow shoppingPurchaseFlow(StockValidator stockValidator,
                                             PriceChangeValidator priceChangeValidator,
                                             PointUsageValidator pointUsageValidator,
                                             OrderTotalCalculator orderTotalCalculator,
                                             OrderDatePurchaseProcessor orderDatePurchaseProcessor,
                                             OrderStatusNotificationProcessor orderStatusNotificationProcessor) {
        return new PurchaseFlow("shopping", Map.of(
                PurchasePhase.VALIDATE, List.of(stockValidator, priceChangeValidator, pointUsageValidator),
                PurchasePhase.PREPARE, List.of(orderTotalCalculator),
                PurchasePhase.COMMIT, List.of(orderDatePurchaseProcessor, orderStatusNotificationProcessor)
        ));
    }

    /**
     * 관리자 주문 편집
     */
    @Bean
    public PurchaseFlow orderPurchaseFlow(PointUsageValidator pointUsageValidator,
                                          OrderTotalCalculator orderTotalCalculator,
                                          OrderDatePurchaseProcessor orderDatePurchaseProcessor,
                                          OrderStatusNotificationProcessor orderStatusNotificationProcessor) {
        return new PurchaseFlow("order", Map.of(
                PurchasePhase.VALIDATE, List.of(pointUsageValidator),
                PurchasePhase.PREPARE, List.of(orderTotalCalculator),
                PurchasePhase.COMMIT, List.of(orderDatePurchaseProcessor, orderStatusNotificationProcessor)
        ));
    }
}
