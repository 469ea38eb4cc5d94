package com.travelcrm.global.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력입니다"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C002", "서버 오류가 발생했습니다"),
    DUPLICATE_RESOURCE(HttpStatus.CONFLICT, "C003", "이미 존재하는 데이터입니다"),

    // Auth
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "A001", "이메일 또는 비밀번호가 올바르지 않습니다"),
    ACCOUNT_DISABLED(HttpStatus.FORBIDDEN, "A002", "비활성화된 계정입니다"),
    ACCESS_DENIED(HttpStatus.FORBIDDEN, "A003", "접근 권한이 없습니다"),

    // Customer
    CUSTOMER_NOT_FOUND(HttpStatus.NOT_FOUND, "U001", "고객을 찾을 수 없습니다"),

    // Travel package
    PACKAGE_NOT_FOUND(HttpStatus.NOT_FOUND, "K001", "여행 패키지를 찾을 수 없습니다"),
    PACKAGE_INACTIVE(HttpStatus.BAD_REQUEST, "K002", "판매 중이 아닌 여행 패키지입니다"),
    NOT_ENOUGH_SLOTS(HttpStatus.BAD_REQUEST, "K003", "잔여 좌석이 부족합니다"),

    // Booking
    BOOKING_NOT_FOUND(HttpStatus.NOT_FOUND, "B001", "예약을 찾을 수 없습니다"),
    BOOKING_NOT_MODIFIABLE(HttpStatus.BAD_REQUEST, "B002", "결제 또는 완료된 예약은 수정할 수 없습니다"),
    BOOKING_CANCELED(HttpStatus.BAD_REQUEST, "B003", "취소된 예약입니다"),
    BOOKING_ALREADY_COMPLETED(HttpStatus.BAD_REQUEST, "B004", "완료된 예약은 취소할 수 없습니다"),
    BOOKING_NOT_CANCELABLE(HttpStatus.BAD_REQUEST, "B005", "결제된 예약은 환불 완료 후에만 취소할 수 있습니다"),
    INVALID_STATUS_TRANSITION(HttpStatus.BAD_REQUEST, "B006", "허용되지 않는 예약 상태 변경입니다"),
    PAYMENT_IN_PROGRESS(HttpStatus.BAD_REQUEST, "B007", "진행 중인 결제가 있어 인원을 변경할 수 없습니다"),

    // Payment
    PAYMENT_NOT_FOUND(HttpStatus.NOT_FOUND, "P001", "결제 정보를 찾을 수 없습니다"),
    PAYMENT_AMOUNT_MISMATCH(HttpStatus.BAD_REQUEST, "P002", "결제 금액이 일치하지 않습니다"),
    PAYMENT_NOT_ALLOWED(HttpStatus.BAD_REQUEST, "P003", "결제 대기 중인 예약만 결제를 시작할 수 있습니다"),
    INVALID_SIGNATURE(HttpStatus.FORBIDDEN, "P004", "유효하지 않은 서명입니다"),
    PAYMENT_GATEWAY_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "P005", "결제 트랜잭션 생성에 실패했습니다"),

    // Lock
    LOCK_ACQUISITION_FAILED(HttpStatus.CONFLICT, "L001", "다른 요청이 처리 중입니다. 잠시 후 다시 시도해주세요");

    private final HttpStatus status;
    private final String code;
    private final String message;
}
