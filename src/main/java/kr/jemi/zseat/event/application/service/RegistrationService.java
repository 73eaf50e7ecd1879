package kr.jemi.zseat.event.application.service;

import kr.jemi.zseat.common.auth.Requester;
import kr.jemi.zseat.common.exception.BusinessException;
import kr.jemi.zseat.common.exception.ErrorCode;
import kr.jemi.zseat.event.api.RegistrationClosedEvent;
import kr.jemi.zseat.event.application.port.in.CloseRegistrationUseCase;
import kr.jemi.zseat.event.application.port.in.GetRosterUseCase;
import kr.jemi.zseat.event.application.port.out.EventPort;
import kr.jemi.zseat.event.application.port.out.SeatInventoryPort;
import kr.jemi.zseat.event.domain.Event;
import kr.jemi.zseat.event.domain.RosterEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class RegistrationService implements CloseRegistrationUseCase, GetRosterUseCase {

    private static final Logger log = LoggerFactory.getLogger(RegistrationService.class);

    private final EventPort eventPort;
    private final SeatInventoryPort seatInventoryPort;
    private final ApplicationEventPublisher eventPublisher;

    public RegistrationService(EventPort eventPort,
                               SeatInventoryPort seatInventoryPort,
                               ApplicationEventPublisher eventPublisher) {
        this.eventPort = eventPort;
        this.seatInventoryPort = seatInventoryPort;
        this.eventPublisher = eventPublisher;
    }

    /**
     * 마감 후 명단은 커밋 뒤 notification 모듈이 비동기로 발송한다.
     */
    @Override
    @Transactional
    public Event closeRegistration(long eventId, Requester requester) {
        requester.requireAdmin();

        // 1. 진행 중인 예약이 끝날 때까지 대기하며 이벤트 잠금
        Event event = eventPort.findByIdForUpdate(eventId)
                .orElseThrow(() -> new BusinessException(ErrorCode.EVENT_NOT_FOUND, String.valueOf(eventId)));
        if (event.isRegistrationClosed()) {
            throw new BusinessException(ErrorCode.REGISTRATION_ALREADY_CLOSED, String.valueOf(eventId));
        }

        // 2. 마감 (false → true, 단 한 번)
        event.closeRegistration();
        event = eventPort.update(event);

        // 3. 이벤트 날짜의 전체 명단
        List<RosterEntry> roster = seatInventoryPort.findRoster(eventId, event.getDate());

        // 4. 커밋 후 발송
        eventPublisher.publishEvent(toClosedEvent(event, roster));

        log.info("예약 마감: eventId={}, date={}, bookings={}", eventId, event.getDate(), roster.size());
        return event;
    }

    @Override
    @Transactional(readOnly = true)
    public List<RosterEntry> getRoster(long eventId, Requester requester) {
        requester.requireAdmin();
        Event event = eventPort.findById(eventId)
                .orElseThrow(() -> new BusinessException(ErrorCode.EVENT_NOT_FOUND, String.valueOf(eventId)));
        return seatInventoryPort.findRoster(eventId, event.getDate());
    }

    private static RegistrationClosedEvent toClosedEvent(Event event, List<RosterEntry> roster) {
        List<RegistrationClosedEvent.Attendee> attendees = roster.stream()
                .map(entry -> new RegistrationClosedEvent.Attendee(
                        entry.seatId(), entry.name(), entry.email(), entry.phone()))
                .toList();
        return new RegistrationClosedEvent(event.getId(), event.getName(), event.getDate(),
                event.getTime(), event.getVenue(), attendees);
    }
}
