package kr.jemi.zseat.event.application.service;

import io.hypersistence.tsid.TSID;
import kr.jemi.zseat.common.auth.Requester;
import kr.jemi.zseat.common.exception.BusinessException;
import kr.jemi.zseat.common.exception.ErrorCode;
import kr.jemi.zseat.event.api.EventFacade;
import kr.jemi.zseat.event.api.EventView;
import kr.jemi.zseat.event.application.port.in.CreateEventCommand;
import kr.jemi.zseat.event.application.port.in.CreateEventUseCase;
import kr.jemi.zseat.event.application.port.in.DeleteEventUseCase;
import kr.jemi.zseat.event.application.port.in.GetEventUseCase;
import kr.jemi.zseat.event.application.port.in.InitializeSeatsUseCase;
import kr.jemi.zseat.event.application.port.out.EventPort;
import kr.jemi.zseat.event.application.port.out.SeatInventoryPort;
import kr.jemi.zseat.event.domain.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Service
public class EventService implements CreateEventUseCase, DeleteEventUseCase, GetEventUseCase,
        InitializeSeatsUseCase, EventFacade {

    private static final Logger log = LoggerFactory.getLogger(EventService.class);

    private final EventPort eventPort;
    private final SeatInventoryPort seatInventoryPort;
    private final TSID.Factory tsidFactory;
    private final Clock clock;
    private final int recentDays;

    public EventService(EventPort eventPort,
                        SeatInventoryPort seatInventoryPort,
                        TSID.Factory tsidFactory,
                        Clock clock,
                        @Value("${zseat.event.recent-days}") int recentDays) {
        this.eventPort = eventPort;
        this.seatInventoryPort = seatInventoryPort;
        this.tsidFactory = tsidFactory;
        this.clock = clock;
        this.recentDays = recentDays;
    }

    /**
     * 이벤트와 좌석은 한 트랜잭션에서 함께 생성된다.
     */
    @Override
    @Transactional
    public Event create(CreateEventCommand command, Requester requester) {
        requester.requireAdmin();
        validate(command);

        // 1. 같은 날짜의 이벤트는 하나만
        if (eventPort.existsByDate(command.date())) {
            throw new BusinessException(ErrorCode.EVENT_DATE_TAKEN, command.date().toString());
        }

        // 2. 당일 이벤트 금지
        if (command.date().equals(LocalDate.now(clock))) {
            throw new BusinessException(ErrorCode.SAME_DAY_EVENT, command.date().toString());
        }

        // 3. 이벤트 저장 + 좌석 생성
        Event event = Event.create(tsidFactory.generate().toLong(), command.name(), command.date(),
                command.time(), command.description(), command.venue(), command.capacity(),
                LocalDateTime.now(clock));
        try {
            event = eventPort.insert(event);
        } catch (DataIntegrityViolationException e) {
            // existsByDate 이후 다른 요청이 같은 날짜를 먼저 저장한 경우
            log.warn("이벤트 날짜 중복: date={}", command.date());
            throw new BusinessException(ErrorCode.EVENT_DATE_TAKEN, command.date().toString());
        }
        int seatCount = seatInventoryPort.ensureSeats(event.getId(), event.getCapacity());

        log.info("이벤트 생성: eventId={}, date={}, capacity={}, seats={}",
                event.getId(), event.getDate(), event.getCapacity(), seatCount);
        return event;
    }

    @Override
    @Transactional
    public void delete(long eventId, Requester requester) {
        requester.requireAdmin();
        eventPort.findByIdForUpdate(eventId)
                .orElseThrow(() -> new BusinessException(ErrorCode.EVENT_NOT_FOUND, String.valueOf(eventId)));

        if (seatInventoryPort.hasBookings(eventId)) {
            throw new BusinessException(ErrorCode.EVENT_HAS_BOOKINGS, String.valueOf(eventId));
        }

        seatInventoryPort.deleteSeats(eventId);
        eventPort.delete(eventId);
        log.info("이벤트 삭제: eventId={}", eventId);
    }

    @Override
    @Transactional(readOnly = true)
    public Event getEvent(long eventId) {
        Event event = eventPort.findById(eventId)
                .orElseThrow(() -> new BusinessException(ErrorCode.EVENT_NOT_FOUND, String.valueOf(eventId)));
        if (event.getDate().equals(LocalDate.now(clock))) {
            throw new BusinessException(ErrorCode.SAME_DAY_EVENT_ACCESS, event.getDate().toString());
        }
        return event;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Event> listUpcoming() {
        return eventPort.findUpcoming(LocalDate.now(clock));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Event> listRecent() {
        LocalDateTime since = LocalDateTime.now(clock).minusDays(recentDays);
        return eventPort.findRecent(LocalDate.now(clock), since);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Event> listPast(Requester requester) {
        requester.requireAdmin();
        return eventPort.findPast(LocalDate.now(clock));
    }

    /**
     * 예약이 하나도 없을 때만 허용한다. 재생성 시 기존 예약이 지워지기 때문이다.
     */
    @Override
    @Transactional
    public int initializeSeats(long eventId, Requester requester) {
        requester.requireAdmin();
        Event event = eventPort.findByIdForUpdate(eventId)
                .orElseThrow(() -> new BusinessException(ErrorCode.EVENT_NOT_FOUND, String.valueOf(eventId)));

        if (seatInventoryPort.hasBookings(eventId)) {
            throw new BusinessException(ErrorCode.EVENT_HAS_BOOKINGS, String.valueOf(eventId));
        }

        int seatCount = seatInventoryPort.ensureSeats(eventId, event.getCapacity());
        log.info("좌석 초기화 요청 처리: eventId={}, seats={}", eventId, seatCount);
        return seatCount;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<EventView> findEvent(long eventId) {
        return eventPort.findById(eventId).map(EventService::toView);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<EventView> lockEventForBooking(long eventId) {
        return eventPort.findByIdForShare(eventId).map(EventService::toView);
    }

    private void validate(CreateEventCommand command) {
        if (isBlank(command.name())) {
            throw new BusinessException(ErrorCode.INVALID_EVENT, "name");
        }
        if (command.date() == null) {
            throw new BusinessException(ErrorCode.INVALID_EVENT, "date");
        }
        if (command.time() == null) {
            throw new BusinessException(ErrorCode.INVALID_EVENT, "time");
        }
        if (isBlank(command.description())) {
            throw new BusinessException(ErrorCode.INVALID_EVENT, "description");
        }
        if (isBlank(command.venue())) {
            throw new BusinessException(ErrorCode.INVALID_EVENT, "venue");
        }
        if (!Event.isSupportedCapacity(command.capacity())) {
            throw new BusinessException(ErrorCode.INVALID_CAPACITY, String.valueOf(command.capacity()));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static EventView toView(Event event) {
        return new EventView(event.getId(), event.getDate(), event.getCapacity(), event.isRegistrationClosed());
    }
}
