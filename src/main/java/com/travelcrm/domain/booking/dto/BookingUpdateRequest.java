package com.travelcrm.domain.booking.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

// null 인 필드는 변경하지 않는다
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingUpdateRequest {

    @Min(value = 1, message = "인원은 1명 이상이어야 합니다")
    private Integer participants;

    private LocalDateTime departureDate;

    @Size(max = 1000, message = "메모는 1000자 이하여야 합니다")
    private String notes;
}
