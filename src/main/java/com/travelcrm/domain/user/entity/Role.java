package com.travelcrm.domain.user.entity;

public enum Role {
    ADMIN,      // 전체 권한
    SALES,      // 고객·예약 관리
    CS,         // 고객 응대
    MANAGER,    // 리포트 조회
    CUSTOMER    // 고객 (본인 예약만)
}
