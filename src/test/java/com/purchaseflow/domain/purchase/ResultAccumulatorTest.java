package com.purchaseflow.domain.purchase;

import com.purchaseflow.dto.ResponseCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ResultAccumulator 테스트")
class ResultAccumulatorTest {

    @Test
    @DisplayName("경고만 있으면 오류가 없는 것으로 본다")
    void warningOnly() {
        // given
        ResultAccumulator accumulator = new ResultAccumulator();

        // when
        accumulator.addWarning(PurchaseMessage.of(ResponseCode.PRODUCT_PRICE_CHANGED));

        // then
        assertThat(accumulator.hasError()).isFalse();
        assertThat(accumulator.toResult(PurchasePhase.VALIDATE).isSuccess()).isTrue();
    }

    @Test
    @DisplayName("오류가 하나라도 있으면 단계 결과는 실패다")
    void withError() {
        // given
        ResultAccumulator accumulator = new ResultAccumulator();

        // when
        accumulator.addError(PurchaseMessage.of(ResponseCode.PRODUCT_OUT_OF_STOCK));
        accumulator.addWarning(PurchaseMessage.of(ResponseCode.PRODUCT_STOCK_LIMITED));

        // then
        assertThat(accumulator.hasError()).isTrue();
        PurchaseFlowResult result = accumulator.toResult(PurchasePhase.VALIDATE);
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.phase()).isEqualTo(PurchasePhase.VALIDATE);
        assertThat(result.errors()).hasSize(1);
        assertThat(result.warnings()).hasSize(1);
    }
}
