package com.purchaseflow.application.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record CheckoutRequest(
        @NotNull(message = "사용 포인트는 필수입니다")
        Integer usePoint,

        @NotEmpty(message = "배송지는 1개 이상이어야 합니다")
        @Valid
        List<ShippingRequest> shippings,

        boolean paymentCompleted
) {
    public record ShippingRequest(
            @NotBlank(message = "수령인 이름은 필수입니다")
            String name,

            @NotBlank(message = "배송 주소는 필수입니다")
            String address
    ) {}
}
