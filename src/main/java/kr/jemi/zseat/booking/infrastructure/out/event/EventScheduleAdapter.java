package kr.jemi.zseat.booking.infrastructure.out.event;

import kr.jemi.zseat.booking.application.port.out.EventSchedulePort;
import kr.jemi.zseat.booking.domain.EventSchedule;
import kr.jemi.zseat.event.api.EventFacade;
import kr.jemi.zseat.event.api.EventView;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class EventScheduleAdapter implements EventSchedulePort {

    private final EventFacade eventFacade;

    public EventScheduleAdapter(EventFacade eventFacade) {
        this.eventFacade = eventFacade;
    }

    @Override
    public Optional<EventSchedule> findSchedule(long eventId) {
        return eventFacade.findEvent(eventId).map(EventScheduleAdapter::toSchedule);
    }

    @Override
    public Optional<EventSchedule> lockSchedule(long eventId) {
        return eventFacade.lockEventForBooking(eventId).map(EventScheduleAdapter::toSchedule);
    }

    private static EventSchedule toSchedule(EventView view) {
        return new EventSchedule(view.id(), view.date(), view.registrationClosed());
    }
}
