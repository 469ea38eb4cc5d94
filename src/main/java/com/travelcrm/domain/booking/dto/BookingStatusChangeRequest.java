package com.travelcrm.domain.booking.dto;

import com.travelcrm.domain.booking.entity.BookingStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class BookingStatusChangeRequest {

    @Schema(example = "CONFIRMED")
    @NotNull(message = "변경할 상태는 필수입니다")
    private BookingStatus status;
}
