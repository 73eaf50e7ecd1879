package kr.jemi.zseat.event.api;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * 예약 마감 시점의 명단. 마감 트랜잭션 안에서 발행된다.
 */
public record RegistrationClosedEvent(
        long eventId,
        String name,
        LocalDate date,
        LocalTime time,
        String venue,
        List<Attendee> roster
) {

    public RegistrationClosedEvent {
        roster = List.copyOf(roster);
    }

    public record Attendee(String seatId, String name, String email, String phone) {
    }
}
