package kr.jemi.zseat.booking.api;

import java.time.LocalDate;
import java.util.List;

/**
 * 예약 배치가 커밋된 뒤 예약자 이메일별로 확인 알림을 보내기 위한 이벤트.
 */
public record SeatsBookedEvent(long eventId, LocalDate date, List<Recipient> recipients) {

    public SeatsBookedEvent {
        recipients = List.copyOf(recipients);
    }

    public record Recipient(String email, String name, List<String> seatIds) {

        public Recipient {
            seatIds = List.copyOf(seatIds);
        }
    }
}
