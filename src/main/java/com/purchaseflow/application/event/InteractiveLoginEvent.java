package com.purchaseflow.application.event;

import com.purchaseflow.domain.actor.Actor;

/**
 * 로그인 성공 이벤트
 *
 * @param actor 인증된 주체
 * @param sessionId 로그인 요청의 세션 ID
 */
public record InteractiveLoginEvent(
        Actor actor,
        String sessionId
) {
}
