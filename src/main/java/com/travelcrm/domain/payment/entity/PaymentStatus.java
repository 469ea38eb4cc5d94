package com.travelcrm.domain.payment.entity;

public enum PaymentStatus {
    PENDING,    // 결제 대기
    SUCCESS,    // 결제 완료 (capture/accept, settlement)
    FAILED,     // 거절·취소 (deny, cancel)
    EXPIRED,    // 결제 기한 만료 (expire)
    REFUND;     // 환불 (refund)

    public boolean isTerminal() {
        return this != PENDING;
    }

    // 알림 재전송·순서 뒤바뀜에 대비한 전이 규칙. 종료 상태는 SUCCESS → REFUND 만 허용
    public boolean canTransitionTo(PaymentStatus next) {
        if (this == next) {
            return false;
        }
        return switch (this) {
            case PENDING -> true;
            case SUCCESS -> next == REFUND;
            default -> false;
        };
    }
}
