package com.travelcrm.domain.booking.service;

import com.travelcrm.domain.booking.dto.BookingCreateRequest;
import com.travelcrm.domain.booking.dto.BookingResponse;
import com.travelcrm.domain.booking.dto.BookingSearchCondition;
import com.travelcrm.domain.booking.dto.BookingUpdateRequest;
import com.travelcrm.domain.booking.entity.Booking;
import com.travelcrm.domain.booking.entity.BookingStatus;
import com.travelcrm.domain.booking.repository.BookingQueryRepository;
import com.travelcrm.domain.booking.repository.BookingRepository;
import com.travelcrm.domain.customer.service.CustomerStatusService;
import com.travelcrm.domain.payment.entity.PaymentStatus;
import com.travelcrm.domain.payment.repository.PaymentRepository;
import com.travelcrm.domain.travelpackage.entity.TravelPackage;
import com.travelcrm.domain.travelpackage.repository.TravelPackageRepository;
import com.travelcrm.domain.travelpackage.service.PackageAvailabilityService;
import com.travelcrm.global.dto.PageResponse;
import com.travelcrm.global.exception.BusinessException;
import com.travelcrm.global.exception.ErrorCode;
import com.travelcrm.global.security.Caller;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService {

    private static final DateTimeFormatter CODE_DATE_FORMAT = DateTimeFormatter.ofPattern("yyMMdd");

    private final BookingRepository bookingRepository;
    private final BookingQueryRepository bookingQueryRepository;
    private final PaymentRepository paymentRepository;
    private final TravelPackageRepository travelPackageRepository;
    private final PackageAvailabilityService packageAvailabilityService;
    private final CustomerStatusService customerStatusService;
    private final BookingEventProducer bookingEventProducer;
    private final TransactionalOperator transactionalOperator;

    // 예약 생성. 패키지 행을 잠근 상태에서 잔여석 확인과 저장을 한 트랜잭션으로 처리한다
    public Mono<BookingResponse> createBooking(BookingCreateRequest request, Long customerId) {
        int participants = request.getParticipants();

        // 1. 고객 존재 확인
        return customerStatusService.findCustomerOrThrow(customerId)
                // 2. 패키지 잠금 → 잔여석 확인 → 저장
                .then(Mono.defer(() -> transactionalOperator.transactional(
                        packageAvailabilityService.lockPackage(request.getPackageId())
                                .flatMap(travelPackage -> packageAvailabilityService.calculate(travelPackage, participants)
                                        .flatMap(availability -> {
                                            if (!availability.isAvailable()) {
                                                return Mono.error(new BusinessException(ErrorCode.NOT_ENOUGH_SLOTS,
                                                        String.format("잔여석이 부족합니다. 남은 인원: %d, 요청 인원: %d",
                                                                availability.getAvailableSlots(), participants)));
                                            }
                                            LocalDateTime now = LocalDateTime.now();
                                            Booking booking = Booking.builder()
                                                    .bookingCode(generateBookingCode())
                                                    .customerId(customerId)
                                                    .packageId(travelPackage.getId())
                                                    .participants(participants)
                                                    .totalAmount(calculateTotal(travelPackage, participants))
                                                    .departureDate(request.getDepartureDate())
                                                    .status(BookingStatus.PENDING)
                                                    .notes(request.getNotes())
                                                    .createdAt(now)
                                                    .updatedAt(now)
                                                    .build();
                                            return bookingRepository.save(booking);
                                        })))))
                .doOnSuccess(saved -> log.info("예약 생성: bookingId={}, code={}, customerId={}, packageId={}, participants={}",
                        saved.getId(), saved.getBookingCode(), customerId, saved.getPackageId(), participants))
                .map(BookingResponse::from);
    }

    // 예약 수정. 결제 이후(PAID, CONFIRMED, COMPLETED)와 취소 예약은 변경 불가
    public Mono<BookingResponse> updateBooking(Long bookingId, BookingUpdateRequest request) {
        return transactionalOperator.transactional(
                        findBookingForUpdate(bookingId)
                                .flatMap(booking -> {
                                    if (booking.getStatus().isLocked()) {
                                        return Mono.error(new BusinessException(ErrorCode.BOOKING_NOT_MODIFIABLE));
                                    }
                                    if (booking.getStatus() == BookingStatus.CANCELED) {
                                        return Mono.error(new BusinessException(ErrorCode.BOOKING_CANCELED));
                                    }

                                    Integer participants = request.getParticipants();
                                    Mono<Booking> prepared = participants != null && !participants.equals(booking.getParticipants())
                                            ? ensureNoPaymentInProgress(booking)
                                                    .then(Mono.defer(() -> applyParticipants(booking, participants)))
                                            : Mono.just(booking);

                                    return prepared.flatMap(target -> {
                                        if (request.getDepartureDate() != null) {
                                            target.setDepartureDate(request.getDepartureDate());
                                        }
                                        if (request.getNotes() != null) {
                                            target.setNotes(request.getNotes());
                                        }
                                        target.setUpdatedAt(LocalDateTime.now());
                                        return bookingRepository.save(target);
                                    });
                                }))
                .doOnSuccess(saved -> log.info("예약 수정: bookingId={}, participants={}, totalAmount={}",
                        saved.getId(), saved.getParticipants(), saved.getTotalAmount()))
                .map(BookingResponse::from);
    }

    // 예약 취소. 결제된 예약은 환불(REFUND) 처리된 경우에만 취소할 수 있다
    public Mono<BookingResponse> cancelBooking(Long bookingId) {
        return transactionalOperator.transactional(
                        findBookingForUpdate(bookingId)
                                .flatMap(this::cancel))
                .flatMap(this::publishIfChanged)
                .map(BookingResponse::from);
    }

    // 관리자 상태 진행 (PAID → CONFIRMED/COMPLETED, CONFIRMED → COMPLETED)
    public Mono<BookingResponse> changeStatus(Long bookingId, BookingStatus target) {
        return transactionalOperator.transactional(
                        findBookingForUpdate(bookingId)
                                .flatMap(booking -> {
                                    if (!booking.getStatus().canProgressTo(target)) {
                                        return Mono.error(new BusinessException(ErrorCode.INVALID_STATUS_TRANSITION,
                                                String.format("%s 상태에서 %s 상태로 변경할 수 없습니다",
                                                        booking.getStatus(), target)));
                                    }
                                    return applyStatus(booking, target);
                                }))
                .flatMap(this::publishIfChanged)
                .map(BookingResponse::from);
    }

    // 결제 결과 반영 등 내부 호출용 직접 상태 변경. 전이 검증은 호출자 책임
    public Mono<Booking> updateBookingStatus(Long bookingId, BookingStatus status) {
        return findBookingOrThrow(bookingId)
                .flatMap(booking -> updateBookingStatus(booking, status));
    }

    public Mono<Booking> updateBookingStatus(Booking booking, BookingStatus status) {
        return applyStatus(booking, status).map(BookingTransition::getBooking);
    }

    public Mono<BookingResponse> getBooking(Long bookingId, Caller caller) {
        return findBookingOrThrow(bookingId)
                .flatMap(booking -> checkOwnership(booking, caller))
                .map(BookingResponse::from);
    }

    public Mono<BookingResponse> getBookingByCode(String bookingCode, Caller caller) {
        return bookingRepository.findByBookingCode(bookingCode)
                .switchIfEmpty(Mono.error(new BusinessException(ErrorCode.BOOKING_NOT_FOUND)))
                .flatMap(booking -> checkOwnership(booking, caller))
                .map(BookingResponse::from);
    }

    // 고객은 본인 예약만 조회되도록 customerId 조건을 강제한다
    public Mono<PageResponse<BookingResponse>> searchBookings(BookingSearchCondition condition, Caller caller) {
        BookingSearchCondition scoped = caller.isCustomer()
                ? condition.toBuilder().customerId(caller.getId()).build()
                : condition;

        return bookingQueryRepository.search(scoped)
                .map(BookingResponse::from)
                .collectList()
                .zipWith(bookingQueryRepository.count(scoped))
                .map(tuple -> PageResponse.of(tuple.getT1(), scoped.getPage(), scoped.getSize(), tuple.getT2()));
    }

    public Mono<Booking> findBookingOrThrow(Long bookingId) {
        return bookingRepository.findById(bookingId)
                .switchIfEmpty(Mono.error(new BusinessException(ErrorCode.BOOKING_NOT_FOUND)));
    }

    public Mono<Booking> checkOwnership(Booking booking, Caller caller) {
        if (!caller.canAccessCustomer(booking.getCustomerId())) {
            return Mono.error(new BusinessException(ErrorCode.ACCESS_DENIED));
        }
        return Mono.just(booking);
    }

    private Mono<Booking> findBookingForUpdate(Long bookingId) {
        return bookingRepository.findByIdForUpdate(bookingId)
                .switchIfEmpty(Mono.error(new BusinessException(ErrorCode.BOOKING_NOT_FOUND)));
    }

    // 발급된 Snap 토큰은 기존 총액으로 결제되므로, 토큰이 살아 있는 동안 인원(총액) 변경을 막는다
    private Mono<Void> ensureNoPaymentInProgress(Booking booking) {
        LocalDateTime now = LocalDateTime.now();
        return paymentRepository.findByBookingId(booking.getId())
                .filter(payment -> payment.isReusableAt(now))
                .flatMap(payment -> {
                    log.warn("진행 중인 결제로 인원 변경 거부: bookingId={}, orderId={}",
                            booking.getId(), payment.getOrderId());
                    return Mono.<Void>error(new BusinessException(ErrorCode.PAYMENT_IN_PROGRESS));
                })
                .then();
    }

    // 인원 증가분만 잔여석 검사. 감소는 검사 없이 허용
    private Mono<Booking> applyParticipants(Booking booking, int participants) {
        int additional = participants - booking.getParticipants();

        Mono<TravelPackage> travelPackageMono = additional > 0
                ? packageAvailabilityService.lockPackage(booking.getPackageId())
                        .flatMap(travelPackage -> packageAvailabilityService.calculate(travelPackage, additional)
                                .flatMap(availability -> availability.isAvailable()
                                        ? Mono.just(travelPackage)
                                        : Mono.error(new BusinessException(ErrorCode.NOT_ENOUGH_SLOTS,
                                                String.format("잔여석이 부족합니다. 남은 인원: %d, 추가 인원: %d",
                                                        availability.getAvailableSlots(), additional)))))
                : travelPackageRepository.findById(booking.getPackageId())
                        .switchIfEmpty(Mono.error(new BusinessException(ErrorCode.PACKAGE_NOT_FOUND)));

        return travelPackageMono.map(travelPackage -> {
            booking.setParticipants(participants);
            booking.setTotalAmount(calculateTotal(travelPackage, participants));
            return booking;
        });
    }

    private Mono<BookingTransition> cancel(Booking booking) {
        switch (booking.getStatus()) {
            case COMPLETED:
                return Mono.error(new BusinessException(ErrorCode.BOOKING_ALREADY_COMPLETED));
            case CANCELED:
                return Mono.just(BookingTransition.unchanged(booking));
            case PAID:
            case CONFIRMED:
                return paymentRepository.findByBookingId(booking.getId())
                        .filter(payment -> payment.getStatus() == PaymentStatus.REFUND)
                        .switchIfEmpty(Mono.error(new BusinessException(ErrorCode.BOOKING_NOT_CANCELABLE)))
                        .flatMap(refunded -> applyStatus(booking, BookingStatus.CANCELED));
            default:
                return applyStatus(booking, BookingStatus.CANCELED);
        }
    }

    // 상태 저장 + PAID/COMPLETED 전환 시 고객 등급 재산정
    private Mono<BookingTransition> applyStatus(Booking booking, BookingStatus status) {
        BookingStatus previous = booking.getStatus();
        if (previous == status) {
            return Mono.just(BookingTransition.unchanged(booking));
        }
        booking.setStatus(status);
        booking.setUpdatedAt(LocalDateTime.now());

        return bookingRepository.save(booking)
                .doOnSuccess(saved -> log.info("예약 상태 변경: bookingId={}, {} -> {}", saved.getId(), previous, status))
                .flatMap(saved -> status == BookingStatus.PAID || status == BookingStatus.COMPLETED
                        ? customerStatusService.updateCustomerStatus(saved.getCustomerId()).thenReturn(saved)
                        : Mono.just(saved))
                .map(saved -> BookingTransition.changed(saved, previous));
    }

    // 커밋 이후 발행
    private Mono<Booking> publishIfChanged(BookingTransition transition) {
        if (!transition.isChanged()) {
            return Mono.just(transition.getBooking());
        }
        return bookingEventProducer.sendBookingStatusEvent(transition.getBooking())
                .thenReturn(transition.getBooking());
    }

    private static BigDecimal calculateTotal(TravelPackage travelPackage, int participants) {
        return travelPackage.getPrice().multiply(BigDecimal.valueOf(participants));
    }

    // BK{yyMMdd}-{8자리 hex}
    private static String generateBookingCode() {
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase();
        return "BK" + LocalDate.now().format(CODE_DATE_FORMAT) + "-" + random;
    }

    @Getter
    private static class BookingTransition {
        private final Booking booking;
        private final BookingStatus previousStatus;
        private final boolean changed;

        private BookingTransition(Booking booking, BookingStatus previousStatus, boolean changed) {
            this.booking = booking;
            this.previousStatus = previousStatus;
            this.changed = changed;
        }

        static BookingTransition changed(Booking booking, BookingStatus previousStatus) {
            return new BookingTransition(booking, previousStatus, true);
        }

        static BookingTransition unchanged(Booking booking) {
            return new BookingTransition(booking, booking.getStatus(), false);
        }
    }
}
