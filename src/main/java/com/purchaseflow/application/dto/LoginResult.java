package com.purchaseflow.application.dto;

/**
 * 로그인 후처리 결과
 *
 * 호출자는 cartDivided가 true이면 세션에 안내 메시지 플래그를 한 번 기록합니다.
 */
public record LoginResult(
        boolean cartDivided
) {
    public static LoginResult none() {
        return new LoginResult(false);
    }
}
