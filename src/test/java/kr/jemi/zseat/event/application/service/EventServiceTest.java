package kr.jemi.zseat.event.application.service;

import io.hypersistence.tsid.TSID;
import kr.jemi.zseat.common.auth.Requester;
import kr.jemi.zseat.common.exception.BusinessException;
import kr.jemi.zseat.common.exception.ErrorCode;
import kr.jemi.zseat.event.application.port.in.CreateEventCommand;
import kr.jemi.zseat.event.application.port.out.EventPort;
import kr.jemi.zseat.event.application.port.out.SeatInventoryPort;
import kr.jemi.zseat.event.domain.Event;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
class EventServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 5, 20);
    private static final LocalDate EVENT_DATE = LocalDate.of(2025, 6, 1);
    private static final int RECENT_DAYS = 7;

    @Mock
    private EventPort eventPort;

    @Mock
    private SeatInventoryPort seatInventoryPort;

    private final TSID.Factory tsidFactory = TSID.Factory.newInstance256(0);

    private final Clock clock = Clock.fixed(Instant.parse("2025-05-20T10:00:00Z"), ZoneOffset.UTC);

    private EventService eventService;

    @BeforeEach
    void setUp() {
        eventService = new EventService(eventPort, seatInventoryPort, tsidFactory, clock, RECENT_DAYS);
    }

    private static CreateEventCommand command(LocalDate date, int capacity) {
        return new CreateEventCommand("Professor Sahab", date, LocalTime.of(19, 30), "stand-up", "Main Hall", capacity);
    }

    private static Event event(long id, boolean closed) {
        return new Event(id, "Professor Sahab", EVENT_DATE, LocalTime.of(19, 30), "stand-up", "Main Hall",
                15, closed, LocalDateTime.of(2025, 5, 19, 9, 0));
    }

    @Nested
    @DisplayName("create() - 이벤트 생성")
    class Create {

        @Test
        @DisplayName("정상 생성: 이벤트를 저장한 뒤 좌석 수만큼 좌석을 만든다")
        void shouldInsertThenEnsureSeats() {
            // given
            given(eventPort.existsByDate(EVENT_DATE)).willReturn(false);
            given(eventPort.insert(any(Event.class))).willAnswer(inv -> inv.getArgument(0));
            given(seatInventoryPort.ensureSeats(anyLong(), eq(15))).willReturn(15);

            // when
            Event event = eventService.create(command(EVENT_DATE, 15), Requester.administrator());

            // then
            assertThat(event.getDate()).isEqualTo(EVENT_DATE);
            assertThat(event.isRegistrationClosed()).isFalse();
            assertThat(event.getCreatedAt()).isEqualTo(LocalDateTime.of(2025, 5, 20, 10, 0));
            InOrder inOrder = inOrder(eventPort, seatInventoryPort);
            inOrder.verify(eventPort).insert(any(Event.class));
            inOrder.verify(seatInventoryPort).ensureSeats(event.getId(), 15);
        }

        @Test
        @DisplayName("같은 날짜에 이벤트가 있으면 EVENT_DATE_TAKEN(Conflict)")
        void shouldRejectTakenDate() {
            // given
            given(eventPort.existsByDate(EVENT_DATE)).willReturn(true);

            // when & then
            assertThatThrownBy(() -> eventService.create(command(EVENT_DATE, 15), Requester.administrator()))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.EVENT_DATE_TAKEN);
            then(eventPort).should(never()).insert(any());
            then(seatInventoryPort).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("오늘 날짜 이벤트는 SAME_DAY_EVENT(InvalidInput)")
        void shouldRejectToday() {
            // given
            given(eventPort.existsByDate(TODAY)).willReturn(false);

            // when & then
            assertThatThrownBy(() -> eventService.create(command(TODAY, 15), Requester.administrator()))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.SAME_DAY_EVENT);
            then(eventPort).should(never()).insert(any());
        }

        @ParameterizedTest
        @ValueSource(ints = {0, -1, 261})
        @DisplayName("좌석 수가 1~260을 벗어나면 INVALID_CAPACITY이고 저장소를 건드리지 않는다")
        void shouldRejectCapacityOutOfRange(int capacity) {
            assertThatThrownBy(() -> eventService.create(command(EVENT_DATE, capacity), Requester.administrator()))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.INVALID_CAPACITY);
            then(eventPort).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("필수 항목이 비어 있으면 INVALID_EVENT")
        void shouldRejectMissingField() {
            CreateEventCommand command = new CreateEventCommand("Show", EVENT_DATE, null, "d", "v", 10);

            assertThatThrownBy(() -> eventService.create(command, Requester.administrator()))
                    .isInstanceOf(BusinessException.class)
                    .hasMessageContaining("time")
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.INVALID_EVENT);
        }

        @Test
        @DisplayName("저장 시 날짜 유니크 제약에 걸리면 EVENT_DATE_TAKEN으로 변환하고 좌석은 만들지 않는다")
        void shouldTranslateUniqueViolation() {
            // given
            given(eventPort.existsByDate(EVENT_DATE)).willReturn(false);
            given(eventPort.insert(any(Event.class))).willThrow(new DataIntegrityViolationException("uk_event_date"));

            // when & then
            assertThatThrownBy(() -> eventService.create(command(EVENT_DATE, 15), Requester.administrator()))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.EVENT_DATE_TAKEN);
            then(seatInventoryPort).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("관리자가 아니면 ADMIN_ONLY")
        void shouldRequireAdmin() {
            assertThatThrownBy(() -> eventService.create(command(EVENT_DATE, 15), Requester.user()))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.ADMIN_ONLY);
            then(eventPort).shouldHaveNoInteractions();
        }
    }

    @Nested
    @DisplayName("delete() - 이벤트 삭제")
    class Delete {

        @Test
        @DisplayName("예약이 없으면 좌석을 지운 뒤 이벤트를 지운다")
        void shouldDeleteSeatsThenEvent() {
            // given
            given(eventPort.findByIdForUpdate(1L)).willReturn(Optional.of(event(1L, false)));
            given(seatInventoryPort.hasBookings(1L)).willReturn(false);

            // when
            eventService.delete(1L, Requester.administrator());

            // then
            InOrder inOrder = inOrder(seatInventoryPort, eventPort);
            inOrder.verify(seatInventoryPort).deleteSeats(1L);
            inOrder.verify(eventPort).delete(1L);
        }

        @Test
        @DisplayName("예약이 하나라도 있으면 EVENT_HAS_BOOKINGS(Conflict)이고 아무것도 지우지 않는다")
        void shouldRejectWhenBooked() {
            // given
            given(eventPort.findByIdForUpdate(1L)).willReturn(Optional.of(event(1L, false)));
            given(seatInventoryPort.hasBookings(1L)).willReturn(true);

            // when & then
            assertThatThrownBy(() -> eventService.delete(1L, Requester.administrator()))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.EVENT_HAS_BOOKINGS);
            then(seatInventoryPort).should(never()).deleteSeats(anyLong());
            then(eventPort).should(never()).delete(anyLong());
        }

        @Test
        @DisplayName("없는 이벤트는 EVENT_NOT_FOUND")
        void shouldRejectMissingEvent() {
            given(eventPort.findByIdForUpdate(1L)).willReturn(Optional.empty());

            assertThatThrownBy(() -> eventService.delete(1L, Requester.administrator()))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.EVENT_NOT_FOUND);
        }
    }

    @Nested
    @DisplayName("목록 조회")
    class Listing {

        @Test
        @DisplayName("listUpcoming()/listPast()는 시계 기준 오늘로 조회한다")
        void shouldUseClockToday() {
            given(eventPort.findUpcoming(TODAY)).willReturn(List.of(event(1L, false)));
            given(eventPort.findPast(TODAY)).willReturn(List.of());

            assertThat(eventService.listUpcoming()).hasSize(1);
            assertThat(eventService.listPast(Requester.administrator())).isEmpty();
        }

        @Test
        @DisplayName("listRecent()는 최근 N일 안에 생성된 이벤트를 조회한다")
        void shouldUseRecentWindow() {
            given(eventPort.findRecent(TODAY, LocalDateTime.of(2025, 5, 13, 10, 0))).willReturn(List.of());

            assertThat(eventService.listRecent()).isEmpty();
        }

        @Test
        @DisplayName("지난 이벤트 목록은 관리자 전용이다")
        void pastRequiresAdmin() {
            assertThatThrownBy(() -> eventService.listPast(Requester.user()))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.ADMIN_ONLY);
        }
    }

    @Nested
    @DisplayName("initializeSeats() - 좌석 재초기화")
    class InitializeSeats {

        @Test
        @DisplayName("예약이 없으면 이벤트 좌석 수로 좌석을 맞춘다")
        void shouldEnsureWithEventCapacity() {
            given(eventPort.findByIdForUpdate(1L)).willReturn(Optional.of(event(1L, false)));
            given(seatInventoryPort.hasBookings(1L)).willReturn(false);
            given(seatInventoryPort.ensureSeats(1L, 15)).willReturn(15);

            assertThat(eventService.initializeSeats(1L, Requester.administrator())).isEqualTo(15);
        }

        @Test
        @DisplayName("예약이 있으면 기존 예약을 지우지 않도록 거절한다")
        void shouldRejectWhenBooked() {
            given(eventPort.findByIdForUpdate(1L)).willReturn(Optional.of(event(1L, false)));
            given(seatInventoryPort.hasBookings(1L)).willReturn(true);

            assertThatThrownBy(() -> eventService.initializeSeats(1L, Requester.administrator()))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.EVENT_HAS_BOOKINGS);
            then(seatInventoryPort).should(never()).ensureSeats(anyLong(), anyInt());
        }
    }

    @Test
    @DisplayName("getEvent()는 없는 이벤트에 EVENT_NOT_FOUND를 던진다")
    void getEventNotFound() {
        given(eventPort.findById(9L)).willReturn(Optional.empty());

        assertThatThrownBy(() -> eventService.getEvent(9L))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.EVENT_NOT_FOUND);
    }

    @Test
    @DisplayName("getEvent()는 오늘 열리는 이벤트를 SAME_DAY_EVENT_ACCESS로 거절한다")
    void getEventSameDay() {
        Event today = new Event(3L, "Professor Sahab", TODAY, LocalTime.of(19, 30), "stand-up", "Main Hall",
                15, false, LocalDateTime.of(2025, 5, 1, 9, 0));
        given(eventPort.findById(3L)).willReturn(Optional.of(today));

        assertThatThrownBy(() -> eventService.getEvent(3L))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.SAME_DAY_EVENT_ACCESS);
    }

    @Test
    @DisplayName("getEvent()는 다른 날짜의 이벤트를 그대로 반환한다")
    void getEventOtherDay() {
        given(eventPort.findById(1L)).willReturn(Optional.of(event(1L, false)));

        assertThat(eventService.getEvent(1L).getDate()).isEqualTo(EVENT_DATE);
    }
}
