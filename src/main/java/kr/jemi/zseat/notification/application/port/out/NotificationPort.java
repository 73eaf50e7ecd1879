package kr.jemi.zseat.notification.application.port.out;

import kr.jemi.zseat.notification.domain.BookingConfirmation;
import kr.jemi.zseat.notification.domain.Roster;

public interface NotificationPort {

    void notifyBookingConfirmed(BookingConfirmation confirmation);

    void notifyRosterReady(Roster roster);
}
