package kr.jemi.zseat.booking.domain;

import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 배치 안의 좌석 하나에 대한 예약 요청.
 */
public record SeatRequest(String seatId, String name, String email, String phone, LocalDate date) {

    private static final Pattern SEAT_ID_FORMAT = Pattern.compile("^[A-Z][1-9][0-9]?$");

    /**
     * 비어 있는 필수 항목 이름. 모두 채워져 있으면 empty.
     */
    public Optional<String> missingField() {
        if (isBlank(seatId)) return Optional.of("seatId");
        if (isBlank(name)) return Optional.of("name");
        if (isBlank(email)) return Optional.of("email");
        if (date == null) return Optional.of("bookingDate");
        return Optional.empty();
    }

    public boolean hasValidSeatId() {
        return isValidSeatId(seatId);
    }

    public static boolean isValidSeatId(String seatId) {
        return seatId != null && SEAT_ID_FORMAT.matcher(seatId).matches();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
