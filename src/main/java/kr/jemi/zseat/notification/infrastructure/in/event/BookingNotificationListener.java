package kr.jemi.zseat.notification.infrastructure.in.event;

import kr.jemi.zseat.booking.api.SeatsBookedEvent;
import kr.jemi.zseat.event.api.RegistrationClosedEvent;
import kr.jemi.zseat.notification.application.port.in.SendBookingConfirmationsUseCase;
import kr.jemi.zseat.notification.application.port.in.SendRosterUseCase;
import kr.jemi.zseat.notification.domain.BookingConfirmation;
import kr.jemi.zseat.notification.domain.Roster;
import kr.jemi.zseat.notification.domain.RosterRow;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.List;

@Component
public class BookingNotificationListener {

    private final SendBookingConfirmationsUseCase sendBookingConfirmationsUseCase;
    private final SendRosterUseCase sendRosterUseCase;

    public BookingNotificationListener(SendBookingConfirmationsUseCase sendBookingConfirmationsUseCase,
                                       SendRosterUseCase sendRosterUseCase) {
        this.sendBookingConfirmationsUseCase = sendBookingConfirmationsUseCase;
        this.sendRosterUseCase = sendRosterUseCase;
    }

    @Async
    @TransactionalEventListener
    public void handle(SeatsBookedEvent event) {
        List<BookingConfirmation> confirmations = event.recipients().stream()
                .map(recipient -> new BookingConfirmation(
                        recipient.email(), recipient.name(), recipient.seatIds(), event.date()))
                .toList();
        sendBookingConfirmationsUseCase.sendConfirmations(confirmations);
    }

    @Async
    @TransactionalEventListener
    public void handle(RegistrationClosedEvent event) {
        List<RosterRow> rows = event.roster().stream()
                .map(attendee -> new RosterRow(attendee.seatId(), attendee.name(), attendee.email(), attendee.phone()))
                .toList();
        sendRosterUseCase.sendRoster(
                new Roster(event.eventId(), event.name(), event.date(), event.time(), event.venue(), rows));
    }
}
