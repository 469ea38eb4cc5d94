package com.travelcrm.domain.customer.entity;

public enum CustomerStatus {
    PROSPECT,   // 결제 예약 0건
    ACTIVE,     // 결제 예약 1~2건
    LOYAL;      // 결제 예약 3건 이상

    private static final long LOYAL_THRESHOLD = 3;
    private static final long ACTIVE_THRESHOLD = 1;

    public static CustomerStatus fromPaidBookingCount(long paidBookings) {
        if (paidBookings >= LOYAL_THRESHOLD) {
            return LOYAL;
        }
        if (paidBookings >= ACTIVE_THRESHOLD) {
            return ACTIVE;
        }
        return PROSPECT;
    }
}
