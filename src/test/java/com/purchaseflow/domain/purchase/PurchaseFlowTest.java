package com.purchaseflow.domain.purchase;

import com.purchaseflow.domain.actor.CustomerActor;
import com.purchaseflow.domain.entity.Cart;
import com.purchaseflow.domain.entity.Customer;
import com.purchaseflow.dto.ResponseCode;
import com.purchaseflow.exception.PurchaseFlowFaultException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PurchaseFlow 테스트")
class PurchaseFlowTest {

    private final List<String> executed = new ArrayList<>();

    private Cart cart;
    private PurchaseContext context;

    @BeforeEach
    void setUp() {
        Customer customer = new Customer(1L, "회원", "customer@test.com", 0);
        cart = new Cart(1L, 1);
        context = PurchaseContext.snapshotOf(cart, new CustomerActor(customer), PurchaseChannel.FRONT);
    }

    private PurchaseProcessor passing(String name) {
        return (target, context) -> executed.add(name);
    }

    private PurchaseProcessor failing(String name) {
        return (target, context) -> {
            executed.add(name);
            context.addError(ResponseCode.PRODUCT_OUT_OF_STOCK, name + " 오류");
        };
    }

    private PurchaseProcessor warning(String name) {
        return (target, context) -> {
            executed.add(name);
            context.addWarning(ResponseCode.PRODUCT_PRICE_CHANGED, name + " 경고");
        };
    }

    private PurchaseProcessor faulting(String name) {
        return (target, context) -> {
            executed.add(name);
            throw new PurchaseFlowFaultException(name + " 중단");
        };
    }

    @Test
    @DisplayName("검증 오류가 나도 같은 단계의 나머지 프로세서를 모두 실행한다")
    void run_ErrorDoesNotStopPhase() {
        // given
        PurchaseFlow flow = new PurchaseFlow("test", Map.of(
                PurchasePhase.VALIDATE, List.of(passing("first"), failing("second"), passing("third"))
        ));

        // when
        PurchaseFlowResult result = flow.validate(cart, context);

        // then
        assertThat(executed).containsExactly("first", "second", "third");
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0).code()).isEqualTo(ResponseCode.PRODUCT_OUT_OF_STOCK.getCode());
        assertThat(result.errors().get(0).message()).isEqualTo("second 오류");
        assertThat(result.phase()).isEqualTo(PurchasePhase.VALIDATE);
    }

    @Test
    @DisplayName("경고만 있으면 성공으로 취급한다")
    void run_WarningIsStillSuccess() {
        PurchaseFlow flow = new PurchaseFlow("test", Map.of(
                PurchasePhase.VALIDATE, List.of(warning("first"), passing("second"))
        ));

        PurchaseFlowResult result = flow.validate(cart, context);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.hasWarning()).isTrue();
        assertThat(result.warnings()).extracting(PurchaseMessage::message).containsExactly("first 경고");
    }

    @Test
    @DisplayName("중단 예외가 발생하면 남은 프로세서를 실행하지 않고 호출자에게 전파한다")
    void run_FaultAbortsPhase() {
        // given
        PurchaseFlow flow = new PurchaseFlow("test", Map.of(
                PurchasePhase.VALIDATE, List.of(failing("first"), faulting("second"), passing("third"))
        ));

        // when & then
        assertThatThrownBy(() -> flow.validate(cart, context))
                .isInstanceOf(PurchaseFlowFaultException.class)
                .hasMessage("second 중단");
        assertThat(executed).containsExactly("first", "second");
    }

    @Test
    @DisplayName("요청한 단계의 프로세서만 선언 순서대로 실행한다")
    void run_OnlyRequestedPhase() {
        // given
        PurchaseFlow flow = new PurchaseFlow("test", Map.of(
                PurchasePhase.VALIDATE, List.of(passing("validate")),
                PurchasePhase.PREPARE, List.of(passing("prepare-1"), passing("prepare-2")),
                PurchasePhase.COMMIT, List.of(passing("commit"))
        ));

        // when
        flow.prepare(cart, context);

        // then
        assertThat(executed).containsExactly("prepare-1", "prepare-2");
    }

    @Test
    @DisplayName("단계마다 결과가 따로 집계된다")
    void run_ResultsArePerPhase() {
        PurchaseFlow flow = new PurchaseFlow("test", Map.of(
                PurchasePhase.VALIDATE, List.of(failing("validate")),
                PurchasePhase.PREPARE, List.of(passing("prepare"))
        ));

        PurchaseFlowResult validateResult = flow.validate(cart, context);
        PurchaseFlowResult prepareResult = flow.prepare(cart, context);

        assertThat(validateResult.isSuccess()).isFalse();
        assertThat(prepareResult.isSuccess()).isTrue();
    }

    @Test
    @DisplayName("등록된 프로세서가 없는 단계는 성공이다")
    void run_EmptyPhase() {
        PurchaseFlow flow = new PurchaseFlow("test", Map.of());

        PurchaseFlowResult result = flow.commit(cart, context);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    @DisplayName("문맥의 대상과 다른 집합체는 처리하지 않는다")
    void run_HolderMismatch_Throws() {
        PurchaseFlow flow = new PurchaseFlow("test", Map.of());

        assertThatThrownBy(() -> flow.validate(new Cart(1L, 1), context))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("실행이 끝나면 문맥에서 결과 수집기가 해제된다")
    void run_UnbindsAccumulator() {
        PurchaseFlow flow = new PurchaseFlow("test", Map.of(
                PurchasePhase.VALIDATE, List.of(passing("first"))
        ));

        flow.validate(cart, context);

        assertThatThrownBy(() -> context.addWarning(ResponseCode.BAD_REQUEST, "늦은 경고"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("등록된 프로세서 목록은 외부에서 바꿀 수 없다")
    void processors_AreImmutable() {
        List<PurchaseProcessor> processors = new ArrayList<>(List.of(passing("first")));
        PurchaseFlow flow = new PurchaseFlow("test", Map.of(PurchasePhase.VALIDATE, processors));

        processors.add(passing("late"));

        assertThat(flow.getProcessors(PurchasePhase.VALIDATE)).hasSize(1);
        assertThatThrownBy(() -> flow.getProcessors(PurchasePhase.VALIDATE).add(passing("x")))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
