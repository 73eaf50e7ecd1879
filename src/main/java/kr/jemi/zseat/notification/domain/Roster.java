package kr.jemi.zseat.notification.domain;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * 예약 마감 시점에 운영자에게 보내는 전체 예약자 명단.
 */
public record Roster(long eventId, String eventName, LocalDate date, LocalTime time, String venue, List<RosterRow> rows) {

    public Roster {
        rows = List.copyOf(rows);
    }

    public List<BookingConfirmation> confirmations() {
        return rows.stream()
                .map(row -> row.toConfirmation(date))
                .toList();
    }
}
