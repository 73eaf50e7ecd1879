package kr.jemi.zseat.booking.domain;

import java.time.LocalDate;

public record EventSchedule(long eventId, LocalDate date, boolean registrationClosed) {

    /**
     * 마감된 이벤트도 관리자는 예약할 수 있다.
     */
    public boolean acceptsBookingFrom(boolean admin) {
        return !registrationClosed || admin;
    }

    public boolean isOn(LocalDate day) {
        return date.equals(day);
    }
}
