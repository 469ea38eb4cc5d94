package com.travelcrm.domain.booking.dto;

import com.travelcrm.domain.booking.entity.BookingStatus;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder(toBuilder = true)
public class BookingSearchCondition {
    private BookingStatus status;
    private Long customerId;
    private Long packageId;
    private String keyword;     // 예약 번호 부분 검색
    private int page;           // 1부터 시작
    private int size;

    public long offset() {
        return (long) (page - 1) * size;
    }
}
