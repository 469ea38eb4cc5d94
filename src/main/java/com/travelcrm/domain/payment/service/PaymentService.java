package com.travelcrm.domain.payment.service;

import com.travelcrm.domain.booking.entity.Booking;
import com.travelcrm.domain.booking.entity.BookingStatus;
import com.travelcrm.domain.booking.service.BookingService;
import com.travelcrm.domain.customer.entity.Customer;
import com.travelcrm.domain.customer.service.CustomerStatusService;
import com.travelcrm.domain.payment.client.MidtransClient;
import com.travelcrm.domain.payment.dto.PaymentInitResponse;
import com.travelcrm.domain.payment.dto.TransactionStatusResponse;
import com.travelcrm.domain.payment.entity.Payment;
import com.travelcrm.domain.payment.entity.PaymentStatus;
import com.travelcrm.domain.payment.repository.PaymentRepository;
import com.travelcrm.domain.travelpackage.entity.TravelPackage;
import com.travelcrm.domain.travelpackage.repository.TravelPackageRepository;
import com.travelcrm.global.config.MidtransProperties;
import com.travelcrm.global.exception.BusinessException;
import com.travelcrm.global.exception.ErrorCode;
import com.travelcrm.global.security.Caller;
import com.travelcrm.global.util.RedisKeyGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentService {

    private static final Duration INIT_LOCK_TTL = Duration.ofSeconds(30);

    private final PaymentRepository paymentRepository;
    private final BookingService bookingService;
    private final CustomerStatusService customerStatusService;
    private final TravelPackageRepository travelPackageRepository;
    private final MidtransClient midtransClient;
    private final MidtransProperties midtransProperties;
    private final ReactiveRedisTemplate<String, String> redisTemplate;

    // 결제 시작 (Snap 트랜잭션 생성)
    public Mono<PaymentInitResponse> initiatePayment(Long bookingId, Caller caller) {
        String lockKey = RedisKeyGenerator.paymentInitLockKey(bookingId);

        // 1. 예약 조회 + 소유권 확인
        return bookingService.findBookingOrThrow(bookingId)
                .flatMap(booking -> bookingService.checkOwnership(booking, caller))
                .flatMap(booking -> {
                    // 2. PENDING 예약만 결제 가능
                    if (booking.getStatus() != BookingStatus.PENDING) {
                        return Mono.error(new BusinessException(ErrorCode.PAYMENT_NOT_ALLOWED));
                    }
                    // 3. 예약 단위 락을 잡은 상태에서 기존 결제 재사용 또는 신규 생성
                    return Mono.usingWhen(
                            acquireLock(lockKey, caller),
                            locked -> preparePayment(booking),
                            locked -> redisTemplate.delete(lockKey));
                });
    }

    // PG 거래 상태 조회 (로컬에 존재하는 주문만)
    public Mono<TransactionStatusResponse> getTransactionStatus(String orderId) {
        return paymentRepository.findByOrderId(orderId)
                .switchIfEmpty(Mono.error(new BusinessException(ErrorCode.PAYMENT_NOT_FOUND)))
                .flatMap(payment -> midtransClient.getTransactionStatus(orderId));
    }

    private Mono<String> acquireLock(String lockKey, Caller caller) {
        return redisTemplate.opsForValue()
                .setIfAbsent(lockKey, String.valueOf(caller.getId()), INIT_LOCK_TTL)
                .flatMap(acquired -> {
                    if (!Boolean.TRUE.equals(acquired)) {
                        log.warn("결제 시작 락 획득 실패: key={}", lockKey);
                        return Mono.error(new BusinessException(ErrorCode.LOCK_ACQUISITION_FAILED));
                    }
                    return Mono.just(lockKey);
                });
    }

    private Mono<PaymentInitResponse> preparePayment(Booking booking) {
        LocalDateTime now = LocalDateTime.now();
        BigDecimal chargeAmount = toChargeAmount(booking.getTotalAmount());
        return paymentRepository.findByBookingId(booking.getId())
                .flatMap(existing -> {
                    if (existing.isReusableFor(chargeAmount, now)) {
                        log.info("기존 결제 재사용: bookingId={}, orderId={}", booking.getId(), existing.getOrderId());
                        return Mono.just(PaymentInitResponse.of(existing, true));
                    }
                    if (existing.isReusableAt(now)) {
                        log.warn("예약 금액 변경으로 결제 재생성: bookingId={}, orderId={}, {} -> {}",
                                booking.getId(), existing.getOrderId(), existing.getAmount(), chargeAmount);
                    }
                    return createTransaction(booking, existing);
                })
                .switchIfEmpty(Mono.defer(() -> createTransaction(booking, null)));
    }

    // PG 호출이 성공한 뒤에만 저장한다. 만료된 기존 결제 행은 새 주문으로 덮어쓴다 (예약:결제 = 1:1)
    private Mono<PaymentInitResponse> createTransaction(Booking booking, Payment existing) {
        String orderId = generateOrderId(booking.getBookingCode());
        long grossAmount = toChargeAmount(booking.getTotalAmount()).longValueExact();

        return Mono.zip(
                        customerStatusService.findCustomerOrThrow(booking.getCustomerId()),
                        travelPackageRepository.findById(booking.getPackageId())
                                .switchIfEmpty(Mono.error(new BusinessException(ErrorCode.PACKAGE_NOT_FOUND))))
                .flatMap(tuple -> midtransClient.createSnapTransaction(
                        buildSnapParameter(orderId, grossAmount, booking, tuple.getT1(), tuple.getT2())))
                .flatMap(snap -> {
                    LocalDateTime now = LocalDateTime.now();
                    Payment payment = existing != null ? existing : Payment.builder()
                            .bookingId(booking.getId())
                            .createdAt(now)
                            .build();
                    payment.setOrderId(orderId);
                    payment.setToken(snap.getToken());
                    payment.setRedirectUrl(snap.getRedirectUrl());
                    // webhook 의 gross_amount 와 비교되는 값이므로 PG 에 보낸 금액 그대로 저장
                    payment.setAmount(BigDecimal.valueOf(grossAmount));
                    payment.setStatus(PaymentStatus.PENDING);
                    payment.setPaymentType(null);
                    payment.setPaidAt(null);
                    payment.setExpiredAt(now.plusHours(midtransProperties.getExpiryHours()));
                    payment.setUpdatedAt(now);
                    return paymentRepository.save(payment);
                })
                .doOnSuccess(saved -> log.info("결제 생성: paymentId={}, bookingId={}, orderId={}, amount={}",
                        saved.getId(), booking.getId(), orderId, saved.getAmount()))
                .map(saved -> PaymentInitResponse.of(saved, false));
    }

    private Map<String, Object> buildSnapParameter(String orderId, long grossAmount, Booking booking,
                                                   Customer customer, TravelPackage travelPackage) {
        String callbackBase = midtransProperties.getFrontendUrl() + "/bookings/" + booking.getId();

        Map<String, Object> customerDetails = new HashMap<>();
        customerDetails.put("first_name", customer.getName());
        customerDetails.put("email", customer.getEmail());
        if (customer.getPhone() != null) {
            customerDetails.put("phone", customer.getPhone());
        }

        // Midtrans 는 item 합계와 gross_amount 가 일치해야 한다. 인원으로 나눈 나머지는 별도 항목으로 보낸다
        int participants = booking.getParticipants();
        long unitPrice = grossAmount / participants;
        long remainder = grossAmount - unitPrice * participants;

        List<Map<String, Object>> items = new ArrayList<>();
        items.add(Map.of(
                "id", "PKG-" + travelPackage.getId(),
                "price", unitPrice,
                "quantity", participants,
                "name", truncate(travelPackage.getName(), 50)));
        if (remainder > 0) {
            items.add(Map.of(
                    "id", "ROUNDING",
                    "price", remainder,
                    "quantity", 1,
                    "name", "Rounding adjustment"));
        }

        return Map.of(
                "transaction_details", Map.of(
                        "order_id", orderId,
                        "gross_amount", grossAmount),
                "customer_details", customerDetails,
                "item_details", items,
                "expiry", Map.of(
                        "unit", "hours",
                        "duration", midtransProperties.getExpiryHours()),
                "callbacks", Map.of(
                        "finish", callbackBase + "/payment/finish",
                        "error", callbackBase + "/payment/error",
                        "pending", callbackBase + "/payment/pending"));
    }

    // TRV-{bookingCode}-{epochMillis}-{6자리 hex}
    private static String generateOrderId(String bookingCode) {
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 6).toUpperCase();
        return "TRV-" + bookingCode + "-" + System.currentTimeMillis() + "-" + random;
    }

    // IDR 은 소수 단위가 없으므로 반올림한 정수 금액을 청구한다
    static BigDecimal toChargeAmount(BigDecimal totalAmount) {
        return totalAmount.setScale(0, RoundingMode.HALF_UP);
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        return value.length() <= max ? value : value.substring(0, max);
    }
}
