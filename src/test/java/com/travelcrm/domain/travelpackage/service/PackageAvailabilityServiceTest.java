package com.travelcrm.domain.travelpackage.service;

import com.travelcrm.domain.booking.repository.BookingRepository;
import com.travelcrm.domain.travelpackage.entity.TravelPackage;
import com.travelcrm.domain.travelpackage.repository.TravelPackageRepository;
import com.travelcrm.global.exception.BusinessException;
import com.travelcrm.global.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PackageAvailabilityServiceTest {

    @Mock
    private TravelPackageRepository travelPackageRepository;

    @Mock
    private BookingRepository bookingRepository;

    private PackageAvailabilityService packageAvailabilityService;

    @BeforeEach
    void setUp() {
        packageAvailabilityService = new PackageAvailabilityService(travelPackageRepository, bookingRepository);
    }

    @Test
    @DisplayName("예약이 없으면 정원 전체가 잔여석이고, 7명 예약 후 4명 요청은 불가")
    void availabilityReflectsSlotHoldingBookings() {
        when(travelPackageRepository.findById(1L)).thenReturn(Mono.just(travelPackage(true)));
        when(bookingRepository.sumSlotHoldingParticipantsByPackageId(1L))
                .thenReturn(Mono.just(0L))
                .thenReturn(Mono.just(7L));

        StepVerifier.create(packageAvailabilityService.checkAvailability(1L, 10))
                .assertNext(result -> {
                    assertThat(result.isAvailable()).isTrue();
                    assertThat(result.getAvailableSlots()).isEqualTo(10);
                    assertThat(result.getBookedParticipants()).isZero();
                })
                .verifyComplete();

        StepVerifier.create(packageAvailabilityService.checkAvailability(1L, 4))
                .assertNext(result -> {
                    assertThat(result.isAvailable()).isFalse();
                    assertThat(result.getAvailableSlots()).isEqualTo(3);
                    assertThat(result.getRequestedParticipants()).isEqualTo(4);
                    assertThat(result.getQuota()).isEqualTo(10);
                })
                .verifyComplete();
    }

    @Test
    void exactRemainingSlotsIsAvailable() {
        when(travelPackageRepository.findById(1L)).thenReturn(Mono.just(travelPackage(true)));
        when(bookingRepository.sumSlotHoldingParticipantsByPackageId(1L)).thenReturn(Mono.just(7L));

        StepVerifier.create(packageAvailabilityService.checkAvailability(1L, 3))
                .assertNext(result -> assertThat(result.isAvailable()).isTrue())
                .verifyComplete();
    }

    @Test
    void missingPackageFailsWithNotFound() {
        when(travelPackageRepository.findById(99L)).thenReturn(Mono.empty());

        StepVerifier.create(packageAvailabilityService.checkAvailability(99L, 1))
                .expectErrorSatisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.PACKAGE_NOT_FOUND))
                .verify();
    }

    @Test
    void inactivePackageIsRejected() {
        when(travelPackageRepository.findById(1L)).thenReturn(Mono.just(travelPackage(false)));

        StepVerifier.create(packageAvailabilityService.checkAvailability(1L, 1))
                .expectErrorSatisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.PACKAGE_INACTIVE))
                .verify();
        verify(bookingRepository, never()).sumSlotHoldingParticipantsByPackageId(anyLong());
    }

    @Test
    void participantsMustBePositive() {
        StepVerifier.create(packageAvailabilityService.checkAvailability(1L, 0))
                .expectErrorSatisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_INPUT))
                .verify();
    }

    @Test
    void lockPackageReadsRowForUpdate() {
        when(travelPackageRepository.findByIdForUpdate(1L)).thenReturn(Mono.just(travelPackage(true)));

        StepVerifier.create(packageAvailabilityService.lockPackage(1L))
                .assertNext(locked -> assertThat(locked.getId()).isEqualTo(1L))
                .verifyComplete();
        verify(travelPackageRepository, never()).findById(anyLong());
    }

    private static TravelPackage travelPackage(boolean active) {
        return TravelPackage.builder()
                .id(1L)
                .name("Bali 4D3N")
                .destination("Bali")
                .price(new BigDecimal("3500000"))
                .quota(10)
                .isActive(active)
                .build();
    }
}
