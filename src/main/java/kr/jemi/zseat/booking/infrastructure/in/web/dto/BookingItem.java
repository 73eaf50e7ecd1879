package kr.jemi.zseat.booking.infrastructure.in.web.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import kr.jemi.zseat.booking.domain.SeatRequest;

import java.time.LocalDate;

/**
 * 형식(이메일, 전화번호)만 여기서 검사하고 필수값/좌석 번호는 예약 서비스가 검사한다.
 */
public record BookingItem(
        String seatId,
        String name,
        @Email(regexp = "^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$") String email,
        @Pattern(regexp = "^(\\+?\\d{1,3}[-.\\s]?)?\\d{10}$") String phone,
        LocalDate bookingDate
) {

    public SeatRequest toSeatRequest() {
        return new SeatRequest(seatId, name, email, phone, bookingDate);
    }
}
