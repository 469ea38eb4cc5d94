package com.travelcrm.domain.customer.service;

import com.travelcrm.domain.booking.repository.BookingRepository;
import com.travelcrm.domain.customer.entity.Customer;
import com.travelcrm.domain.customer.entity.CustomerStatus;
import com.travelcrm.domain.customer.repository.CustomerRepository;
import com.travelcrm.global.exception.BusinessException;
import com.travelcrm.global.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Slf4j
@Service
@RequiredArgsConstructor
public class CustomerStatusService {

    private final CustomerRepository customerRepository;
    private final BookingRepository bookingRepository;

    // 고객이 없으면 CUSTOMER_NOT_FOUND 예외
    public Mono<Customer> findCustomerOrThrow(Long customerId) {
        return customerRepository.findById(customerId)
                .switchIfEmpty(Mono.error(new BusinessException(ErrorCode.CUSTOMER_NOT_FOUND)));
    }

    // 결제 예약(PAID, CONFIRMED, COMPLETED) 수로 고객 등급 재산정.
    // 0건 PROSPECT, 1~2건 ACTIVE, 3건 이상 LOYAL. 값이 바뀔 때만 저장하므로 반복 호출해도 안전하다.
    public Mono<CustomerStatus> updateCustomerStatus(Long customerId) {
        return findCustomerOrThrow(customerId)
                .zipWith(bookingRepository.countPaidBookingsByCustomerId(customerId).defaultIfEmpty(0L))
                .flatMap(tuple -> {
                    Customer customer = tuple.getT1();
                    long paidBookings = tuple.getT2();
                    CustomerStatus previous = customer.getStatus();
                    CustomerStatus derived = CustomerStatus.fromPaidBookingCount(paidBookings);

                    if (derived == previous) {
                        return Mono.just(derived);
                    }
                    customer.setStatus(derived);
                    customer.setUpdatedAt(LocalDateTime.now());
                    return customerRepository.save(customer)
                            .doOnSuccess(saved -> log.info("고객 등급 변경: customerId={}, {} -> {}, paidBookings={}",
                                    customerId, previous, derived, paidBookings))
                            .thenReturn(derived);
                });
    }
}
