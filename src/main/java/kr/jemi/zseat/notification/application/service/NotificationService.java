package kr.jemi.zseat.notification.application.service;

import kr.jemi.zseat.notification.application.port.in.SendBookingConfirmationsUseCase;
import kr.jemi.zseat.notification.application.port.in.SendRosterUseCase;
import kr.jemi.zseat.notification.application.port.out.NotificationPort;
import kr.jemi.zseat.notification.domain.BookingConfirmation;
import kr.jemi.zseat.notification.domain.Roster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 예약은 이미 커밋된 상태이므로 발송 실패는 로그만 남기고 재시도하지 않는다.
 * 한 건의 실패가 나머지 발송을 막지 않는다.
 */
@Service
public class NotificationService implements SendBookingConfirmationsUseCase, SendRosterUseCase {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final NotificationPort notificationPort;

    public NotificationService(NotificationPort notificationPort) {
        this.notificationPort = notificationPort;
    }

    @Override
    public int sendConfirmations(List<BookingConfirmation> confirmations) {
        int sent = 0;
        for (BookingConfirmation confirmation : confirmations) {
            if (send(confirmation)) {
                sent++;
            }
        }
        return sent;
    }

    @Override
    public void sendRoster(Roster roster) {
        // 1. 예약자별 확인 알림 (좌석 1건당 1회)
        int sent = sendConfirmations(roster.confirmations());

        // 2. 운영자에게 전체 명단
        try {
            notificationPort.notifyRosterReady(roster);
        } catch (Exception e) {
            log.error("명단 발송 실패: eventId={}, rows={}", roster.eventId(), roster.rows().size(), e);
        }
        log.info("마감 알림 처리: eventId={}, confirmations={}/{}", roster.eventId(), sent, roster.rows().size());
    }

    private boolean send(BookingConfirmation confirmation) {
        try {
            notificationPort.notifyBookingConfirmed(confirmation);
            return true;
        } catch (Exception e) {
            log.error("예약 확인 알림 실패: email={}, seats={}, date={}",
                    confirmation.email(), confirmation.seatIds(), confirmation.date(), e);
            return false;
        }
    }
}
