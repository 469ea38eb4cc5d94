package com.travelcrm.domain.travelpackage.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Table("travel_packages")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TravelPackage {

    @Id
    private Long id;

    private String name;
    private String destination;
    private String description;

    // 1인 가격
    private BigDecimal price;

    // 최대 참가 인원
    private Integer quota;

    // 판매 기간 [startDate, endDate)
    private LocalDateTime startDate;
    private LocalDateTime endDate;

    private Boolean isActive;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
