package com.purchaseflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PurchaseFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(PurchaseFlowApplication.class, args);
    }
}
