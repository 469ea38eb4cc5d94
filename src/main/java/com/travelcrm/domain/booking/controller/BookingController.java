package com.travelcrm.domain.booking.controller;

import com.travelcrm.domain.booking.dto.BookingCreateRequest;
import com.travelcrm.domain.booking.dto.BookingResponse;
import com.travelcrm.domain.booking.dto.BookingSearchCondition;
import com.travelcrm.domain.booking.dto.BookingStatusChangeRequest;
import com.travelcrm.domain.booking.dto.BookingUpdateRequest;
import com.travelcrm.domain.booking.entity.BookingStatus;
import com.travelcrm.domain.booking.service.BookingService;
import com.travelcrm.domain.payment.dto.PaymentInitResponse;
import com.travelcrm.domain.payment.service.PaymentService;
import com.travelcrm.global.dto.PageResponse;
import com.travelcrm.global.exception.BusinessException;
import com.travelcrm.global.exception.ErrorCode;
import com.travelcrm.global.security.Caller;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@Tag(name = "Booking", description = "예약 API")
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private static final int MAX_PAGE_SIZE = 100;

    private final BookingService bookingService;
    private final PaymentService paymentService;

    @Operation(summary = "예약 생성", description = "고객 본인 요청이면 customerId 는 토큰의 고객으로 고정됩니다.")
    @PostMapping
    public Mono<ResponseEntity<BookingResponse>> createBooking(@Valid @RequestBody BookingCreateRequest request) {
        return Caller.current()
                .flatMap(caller -> {
                    Long customerId = caller.isCustomer() ? caller.getId() : request.getCustomerId();
                    if (customerId == null) {
                        return Mono.error(new BusinessException(ErrorCode.INVALID_INPUT, "고객 ID는 필수입니다"));
                    }
                    return bookingService.createBooking(request, customerId);
                })
                .map(response -> ResponseEntity.status(HttpStatus.CREATED).body(response));
    }

    @Operation(summary = "예약 수정", description = "결제 이후 또는 취소된 예약은 수정할 수 없습니다.")
    @PutMapping("/{bookingId}")
    public Mono<ResponseEntity<BookingResponse>> updateBooking(
            @PathVariable Long bookingId,
            @Valid @RequestBody BookingUpdateRequest request) {
        return bookingService.updateBooking(bookingId, request)
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "예약 취소", description = "결제된 예약은 환불 완료 후에만 취소할 수 있습니다.")
    @PatchMapping("/{bookingId}/cancel")
    public Mono<ResponseEntity<BookingResponse>> cancelBooking(@PathVariable Long bookingId) {
        return bookingService.cancelBooking(bookingId)
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "예약 상태 변경 (관리자)", description = "PAID → CONFIRMED/COMPLETED, CONFIRMED → COMPLETED")
    @PatchMapping("/{bookingId}/status")
    public Mono<ResponseEntity<BookingResponse>> changeStatus(
            @PathVariable Long bookingId,
            @Valid @RequestBody BookingStatusChangeRequest request) {
        return bookingService.changeStatus(bookingId, request.getStatus())
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "결제 시작", description = "Midtrans Snap 토큰을 발급합니다. 유효한 기존 결제가 있으면 그대로 반환합니다.")
    @PostMapping("/{bookingId}/pay")
    public Mono<ResponseEntity<PaymentInitResponse>> initiatePayment(@PathVariable Long bookingId) {
        return Caller.current()
                .flatMap(caller -> paymentService.initiatePayment(bookingId, caller))
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "예약 상세 조회")
    @GetMapping("/{bookingId}")
    public Mono<ResponseEntity<BookingResponse>> getBooking(@PathVariable Long bookingId) {
        return Caller.current()
                .flatMap(caller -> bookingService.getBooking(bookingId, caller))
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "예약 번호로 조회")
    @GetMapping("/code/{bookingCode}")
    public Mono<ResponseEntity<BookingResponse>> getBookingByCode(@PathVariable String bookingCode) {
        return Caller.current()
                .flatMap(caller -> bookingService.getBookingByCode(bookingCode, caller))
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "예약 목록 조회", description = "최신 생성순. 고객은 본인 예약만 조회됩니다.")
    @GetMapping
    public Mono<ResponseEntity<PageResponse<BookingResponse>>> searchBookings(
            @Parameter(description = "예약 상태") @RequestParam(required = false) BookingStatus status,
            @RequestParam(required = false) Long customerId,
            @RequestParam(required = false) Long packageId,
            @Parameter(description = "예약 번호 검색어") @RequestParam(required = false) String keyword,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int size) {
        BookingSearchCondition condition = BookingSearchCondition.builder()
                .status(status)
                .customerId(customerId)
                .packageId(packageId)
                .keyword(keyword)
                .page(Math.max(page, 1))
                .size(Math.min(Math.max(size, 1), MAX_PAGE_SIZE))
                .build();

        return Caller.current()
                .flatMap(caller -> bookingService.searchBookings(condition, caller))
                .map(ResponseEntity::ok);
    }
}
