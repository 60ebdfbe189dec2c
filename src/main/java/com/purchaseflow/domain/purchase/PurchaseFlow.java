package com.purchaseflow.domain.purchase;

import com.purchaseflow.domain.entity.ItemHolder;
import com.purchaseflow.exception.PurchaseFlowFaultException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 구매 플로우
 *
 * 단계별로 등록된 프로세서를 선언 순서대로 실행하고 결과를 모읍니다.
 * - 검증 오류가 나도 같은 단계의 나머지 프로세서는 계속 실행한다
 * - PurchaseFlowFaultException이 발생하면 남은 프로세서를 실행하지 않고 호출자에게 전파한다
 * - 저장은 하지 않는다. 성공한 결과를 확인한 호출자가 저장한다
 *
 * 프로세서 목록은 생성 시점에 확정되며 실행 중에 바뀌지 않습니다.
 */
@Slf4j
public class PurchaseFlow {

    @Getter
    private final String name;
    private final Map<PurchasePhase, List<PurchaseProcessor>> processors;

    public PurchaseFlow(String name, Map<PurchasePhase, List<PurchaseProcessor>> processors) {
        this.name = name;
        this.processors = new EnumMap<>(PurchasePhase.class);
        processors.forEach((phase, list) -> this.processors.put(phase, List.copyOf(list)));
    }

    public List<PurchaseProcessor> getProcessors(PurchasePhase phase) {
        return processors.getOrDefault(phase, List.of());
    }

    /**
     * 한 단계를 실행합니다.
     *
     * @param phase 실행할 단계
     * @param holder 처리 대상 (context의 target과 같은 인스턴스)
     * @param context 실행 문맥
     * @return 단계 처리 결과
     * @throws PurchaseFlowFaultException 프로세서가 처리를 계속할 수 없는 경우
     */
    public PurchaseFlowResult run(PurchasePhase phase, ItemHolder holder, PurchaseContext context) {
        if (holder != context.getTargetHolder()) {
            throw new IllegalArgumentException("처리 대상이 문맥의 대상과 다릅니다");
        }

        ResultAccumulator accumulator = new ResultAccumulator();
        context.bind(accumulator);
        try {
            for (PurchaseProcessor processor : getProcessors(phase)) {
                String processorName = processor.getClass().getSimpleName();
                log.debug("프로세서 실행: flow={}, channel={}, phase={}, processor={}",
                        name, context.getChannel(), phase, processorName);
                try {
                    processor.process(holder, context);
                } catch (PurchaseFlowFaultException e) {
                    log.error("구매 플로우 중단: flow={}, channel={}, phase={}, processor={}, reason={}",
                            name, context.getChannel(), phase, processorName, e.getErrorMessage());
                    throw e;
                }
            }
        } finally {
            context.unbind();
        }

        PurchaseFlowResult result = accumulator.toResult(phase);
        if (accumulator.hasError()) {
            log.warn("구매 플로우 검증 실패: flow={}, channel={}, phase={}, errors={}",
                    name, context.getChannel(), phase, result.errors());
        }
        return result;
    }

    public PurchaseFlowResult validate(ItemHolder holder, PurchaseContext context) {
        return run(PurchasePhase.VALIDATE, holder, context);
    }

    public PurchaseFlowResult prepare(ItemHolder holder, PurchaseContext context) {
        return run(PurchasePhase.PREPARE, holder, context);
    }

    public PurchaseFlowResult commit(ItemHolder holder, PurchaseContext context) {
        return run(PurchasePhase.COMMIT, holder, context);
    }
}
