package com.travelcrm.domain.booking.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingCreateRequest {

    // 직원이 대리 예약할 때 필수. 고객 본인 요청이면 무시된다
    @Schema(example = "1")
    private Long customerId;

    @Schema(example = "1")
    @NotNull(message = "패키지 ID는 필수입니다")
    private Long packageId;

    @Schema(example = "2")
    @NotNull(message = "인원은 필수입니다")
    @Min(value = 1, message = "인원은 1명 이상이어야 합니다")
    private Integer participants;

    @Schema(example = "2026-12-01T09:00:00")
    @NotNull(message = "출발일은 필수입니다")
    private LocalDateTime departureDate;

    @Size(max = 1000, message = "메모는 1000자 이하여야 합니다")
    private String notes;
}
