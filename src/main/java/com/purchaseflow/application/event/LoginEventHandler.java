package com.purchaseflow.application.event;

import com.purchaseflow.application.dto.CartConsolidationResult;
import com.purchaseflow.application.dto.LoginResult;
import com.purchaseflow.application.service.CartConsolidationService;
import com.purchaseflow.domain.actor.Actor;
import com.purchaseflow.domain.actor.CustomerActor;
import com.purchaseflow.domain.actor.StaffActor;
import com.purchaseflow.domain.entity.Member;
import com.purchaseflow.domain.repository.MemberRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 로그인 성공 후처리 핸들러
 *
 * - 관리자: 로그인 일시를 바로 저장한다 (구매 플로우를 거치지 않음)
 * - 회원: 저장된 카트와 세션 카트를 병합하고 검증한다
 *
 * 세션에 값을 직접 쓰지 않고 LoginResult로 돌려주며,
 * 세션 반영은 인증 처리 계층이 담당합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoginEventHandler {

    private final MemberRepository memberRepository;
    private final CartConsolidationService cartConsolidationService;
    private final Clock clock;

    public LoginResult onInteractiveLogin(InteractiveLoginEvent event) {
        Actor actor = event.actor();

        if (actor instanceof StaffActor staff) {
            recordLoginDate(staff.member());
            return LoginResult.none();
        }
        if (actor instanceof CustomerActor customer) {
            CartConsolidationResult result = cartConsolidationService.consolidate(customer, event.sessionId());
            return new LoginResult(result.divided());
        }
        throw new IllegalStateException("지원하지 않는 로그인 주체입니다: " + actor);
    }

    /**
     * Best Effort: 저장 실패가 로그인 자체를 막지 않도록 로그만 남긴다
     */
    private void recordLoginDate(Member member) {
        try {
            member.updateLoginDate(LocalDateTime.now(clock));
            memberRepository.save(member);
            log.info("관리자 로그인 일시 기록: memberId={}", member.getId());
        } catch (RuntimeException e) {
            log.error("관리자 로그인 일시 저장 실패: memberId={}", member.getId(), e);
        }
    }
}
