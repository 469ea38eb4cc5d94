package com.travelcrm.domain.booking.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("bookings")
public class Booking {

    @Id
    private Long id;

    // 고객 공유용 예약 번호 (unique)
    private String bookingCode;

    private Long customerId;
    private Long packageId;

    private Integer participants;

    // 패키지 가격 × 인원 (결제 이후 고정)
    private BigDecimal totalAmount;

    private LocalDateTime departureDate;
    private BookingStatus status;
    private String notes;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
