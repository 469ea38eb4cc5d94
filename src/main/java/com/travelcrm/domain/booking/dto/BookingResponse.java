package com.travelcrm.domain.booking.dto;

import com.travelcrm.domain.booking.entity.Booking;
import com.travelcrm.domain.booking.entity.BookingStatus;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Getter
@Builder
public class BookingResponse {
    private Long id;
    private String bookingCode;
    private Long customerId;
    private Long packageId;
    private Integer participants;
    private BigDecimal totalAmount;
    private LocalDateTime departureDate;
    private BookingStatus status;
    private String notes;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static BookingResponse from(Booking booking) {
        return BookingResponse.builder()
                .id(booking.getId())
                .bookingCode(booking.getBookingCode())
                .customerId(booking.getCustomerId())
                .packageId(booking.getPackageId())
                .participants(booking.getParticipants())
                .totalAmount(booking.getTotalAmount())
                .departureDate(booking.getDepartureDate())
                .status(booking.getStatus())
                .notes(booking.getNotes())
                .createdAt(booking.getCreatedAt())
                .updatedAt(booking.getUpdatedAt())
                .build();
    }
}
