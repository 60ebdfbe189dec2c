package com.purchaseflow.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * 주문 상태 의미 → 상태 ID 매핑
 *
 * <pre>
 * purchase-flow:
 *   order-status:
 *     new: 1
 *     delivered: 5
 *     paid: 6
 * </pre>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "purchase-flow")
public class OrderStatusProperties {

    private Map<String, Integer> orderStatus = new HashMap<>();
}
