package kr.jemi.zseat.notification.infrastructure.out.log;

import kr.jemi.zseat.notification.application.port.out.NotificationPort;
import kr.jemi.zseat.notification.domain.BookingConfirmation;
import kr.jemi.zseat.notification.domain.Roster;
import kr.jemi.zseat.notification.domain.RosterRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 실제 메일 발송 대신 발송 내용을 로그로 남기는 게이트웨이.
 */
@Component
public class LoggingNotificationAdapter implements NotificationPort {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationAdapter.class);

    private final String ownerEmail;

    public LoggingNotificationAdapter(@Value("${zseat.notification.owner-email}") String ownerEmail) {
        this.ownerEmail = ownerEmail;
    }

    @Override
    public void notifyBookingConfirmed(BookingConfirmation confirmation) {
        log.info("[예약 확인] to={}, name={}, date={}, seats={}",
                confirmation.email(), confirmation.name(), confirmation.date(), confirmation.seatIds());
    }

    @Override
    public void notifyRosterReady(Roster roster) {
        log.info("[예약자 명단] to={}, event={}, date={} {}, venue={}, bookings={}",
                ownerEmail, roster.eventName(), roster.date(), roster.time(), roster.venue(), roster.rows().size());
        for (RosterRow row : roster.rows()) {
            log.info("[예약자 명단]   {} {} {} {}",
                    row.seatId(), row.name(), row.email(), row.phone() == null ? "N/A" : row.phone());
        }
    }
}
