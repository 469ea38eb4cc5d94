package com.travelcrm.domain.travelpackage.controller;

import com.travelcrm.domain.travelpackage.dto.AvailabilityResponse;
import com.travelcrm.domain.travelpackage.service.PackageAvailabilityService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@Tag(name = "Package", description = "여행 패키지 API")
@RestController
@RequestMapping("/api/v1/packages")
@RequiredArgsConstructor
public class PackageController {

    private final PackageAvailabilityService packageAvailabilityService;

    @Operation(
            summary = "잔여석 조회",
            description = "요청 인원 기준으로 예약 가능 여부와 잔여석을 반환합니다. PENDING/PAID/CONFIRMED 예약이 정원을 차지합니다."
    )
    @GetMapping("/{packageId}/availability")
    public Mono<ResponseEntity<AvailabilityResponse>> checkAvailability(
            @Parameter(description = "패키지 ID", required = true)
            @PathVariable Long packageId,
            @Parameter(description = "요청 인원", example = "2")
            @RequestParam(defaultValue = "1") int participants) {
        return packageAvailabilityService.checkAvailability(packageId, participants)
                .map(ResponseEntity::ok);
    }
}
