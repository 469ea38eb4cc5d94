package com.travelcrm.domain.booking.entity;

import java.util.EnumSet;
import java.util.Set;

public enum BookingStatus {
    PENDING,    // 예약 생성, 결제 대기
    PAID,       // 결제 완료
    CONFIRMED,  // 출발 확정 (관리자)
    CANCELED,   // 취소 (잔여석 반환)
    COMPLETED;  // 여행 완료 (관리자)

    // 패키지 정원을 차지하는 상태
    private static final Set<BookingStatus> SLOT_HOLDING = EnumSet.of(PENDING, PAID, CONFIRMED);

    // 인원·출발일·메모 수정 불가 상태
    private static final Set<BookingStatus> LOCKED = EnumSet.of(PAID, CONFIRMED, COMPLETED);

    // 고객 등급 산정 시 결제 예약으로 집계하는 상태
    private static final Set<BookingStatus> PAID_STATES = EnumSet.of(PAID, CONFIRMED, COMPLETED);

    public boolean holdsSlot() {
        return SLOT_HOLDING.contains(this);
    }

    public boolean isLocked() {
        return LOCKED.contains(this);
    }

    public boolean countsAsPaid() {
        return PAID_STATES.contains(this);
    }

    // 관리자 상태 변경: PAID → CONFIRMED/COMPLETED, CONFIRMED → COMPLETED
    public boolean canProgressTo(BookingStatus next) {
        return switch (this) {
            case PAID -> next == CONFIRMED || next == COMPLETED;
            case CONFIRMED -> next == COMPLETED;
            default -> false;
        };
    }
}
