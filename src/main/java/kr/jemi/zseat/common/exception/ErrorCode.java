package kr.jemi.zseat.common.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {

    INVALID_REQUEST(ErrorType.INVALID_INPUT, "요청 값이 올바르지 않습니다"),
    INVALID_BOOKING_REQUEST(ErrorType.INVALID_INPUT, "예약 요청이 올바르지 않습니다"),
    INVALID_SEAT_ID(ErrorType.INVALID_INPUT, "좌석 번호 형식이 올바르지 않습니다"),
    BOOKING_DATE_MISMATCH(ErrorType.INVALID_INPUT, "예약 날짜가 이벤트 날짜와 일치하지 않습니다"),
    SAME_DAY_BOOKING(ErrorType.INVALID_INPUT, "당일 좌석은 예약할 수 없습니다"),
    INVALID_EVENT(ErrorType.INVALID_INPUT, "이벤트 정보가 올바르지 않습니다"),
    INVALID_CAPACITY(ErrorType.INVALID_INPUT, "좌석 수는 1~260 사이여야 합니다"),
    SAME_DAY_EVENT(ErrorType.INVALID_INPUT, "당일 이벤트는 생성할 수 없습니다"),
    SAME_DAY_EVENT_ACCESS(ErrorType.INVALID_INPUT, "당일 이벤트는 조회할 수 없습니다"),
    ADMIN_ONLY(ErrorType.FORBIDDEN, "관리자만 사용할 수 있습니다"),
    EVENT_NOT_FOUND(ErrorType.NOT_FOUND, "이벤트를 찾을 수 없습니다"),
    SEAT_NOT_FOUND(ErrorType.NOT_FOUND, "존재하지 않는 좌석이 포함되어 있습니다"),
    DUPLICATE_SEAT_IN_BATCH(ErrorType.CONFLICT, "같은 좌석이 중복으로 요청되었습니다"),
    SEAT_ALREADY_BOOKED(ErrorType.CONFLICT, "이미 예약된 좌석이 포함되어 있습니다"),
    REGISTRATION_CLOSED(ErrorType.CONFLICT, "예약이 마감된 이벤트입니다"),
    REGISTRATION_ALREADY_CLOSED(ErrorType.CONFLICT, "이미 예약이 마감되었습니다"),
    EVENT_DATE_TAKEN(ErrorType.CONFLICT, "해당 날짜에 이미 이벤트가 있습니다"),
    EVENT_HAS_BOOKINGS(ErrorType.CONFLICT, "예약이 있는 이벤트입니다"),
    BOOKING_CONTENTION(ErrorType.INTERNAL, "좌석 예약 처리 중 충돌이 반복되었습니다. 잠시 후 다시 시도해 주세요"),
    INTERNAL_ERROR(ErrorType.INTERNAL, "내부 서버 오류가 발생했습니다");

    private final ErrorType type;
    private final String message;

    ErrorCode(ErrorType type, String message) {
        this.type = type;
        this.message = message;
    }

    public ErrorType getType() {
        return type;
    }

    public HttpStatus getStatus() {
        return type.getStatus();
    }

    public String getMessage() {
        return message;
    }
}
