package kr.jemi.zseat.event.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import kr.jemi.zseat.common.auth.Requester;
import kr.jemi.zseat.event.application.port.in.CloseRegistrationUseCase;
import kr.jemi.zseat.event.application.port.in.CreateEventUseCase;
import kr.jemi.zseat.event.application.port.in.DeleteEventUseCase;
import kr.jemi.zseat.event.application.port.in.GetEventUseCase;
import kr.jemi.zseat.event.application.port.in.GetRosterUseCase;
import kr.jemi.zseat.event.application.port.in.InitializeSeatsUseCase;
import kr.jemi.zseat.event.domain.Event;
import kr.jemi.zseat.event.infrastructure.in.web.dto.CreateEventRequest;
import kr.jemi.zseat.event.infrastructure.in.web.dto.EventResponse;
import kr.jemi.zseat.event.infrastructure.in.web.dto.RosterEntryResponse;
import kr.jemi.zseat.event.infrastructure.in.web.dto.SeatInitializationResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Tag(name = "Event", description = "이벤트 관리 및 예약 마감")
@RestController
public class EventApiController {

    private final CreateEventUseCase createEventUseCase;
    private final DeleteEventUseCase deleteEventUseCase;
    private final GetEventUseCase getEventUseCase;
    private final CloseRegistrationUseCase closeRegistrationUseCase;
    private final GetRosterUseCase getRosterUseCase;
    private final InitializeSeatsUseCase initializeSeatsUseCase;

    public EventApiController(CreateEventUseCase createEventUseCase,
                              DeleteEventUseCase deleteEventUseCase,
                              GetEventUseCase getEventUseCase,
                              CloseRegistrationUseCase closeRegistrationUseCase,
                              GetRosterUseCase getRosterUseCase,
                              InitializeSeatsUseCase initializeSeatsUseCase) {
        this.createEventUseCase = createEventUseCase;
        this.deleteEventUseCase = deleteEventUseCase;
        this.getEventUseCase = getEventUseCase;
        this.closeRegistrationUseCase = closeRegistrationUseCase;
        this.getRosterUseCase = getRosterUseCase;
        this.initializeSeatsUseCase = initializeSeatsUseCase;
    }

    @Operation(summary = "이벤트 생성", description = "이벤트와 좌석을 함께 생성합니다. 관리자 전용이며 당일/중복 날짜는 생성할 수 없습니다.")
    @PostMapping("/api/events")
    public ResponseEntity<EventResponse> create(
            @Parameter(description = "요청자 역할 (ADMIN)") @RequestHeader(value = Requester.ROLE_HEADER, required = false) String role,
            @Valid @RequestBody CreateEventRequest request) {
        Event event = createEventUseCase.create(request.toCommand(), Requester.ofRole(role));
        return ResponseEntity.status(HttpStatus.CREATED).body(EventResponse.from(event));
    }

    @Operation(summary = "예정 이벤트 목록", description = "내일 이후 예약이 열려 있는 이벤트를 날짜 오름차순으로 반환합니다.")
    @GetMapping("/api/events")
    public ResponseEntity<List<EventResponse>> listUpcoming() {
        return ResponseEntity.ok(toResponses(getEventUseCase.listUpcoming()));
    }

    @Operation(summary = "최근 등록 이벤트 목록")
    @GetMapping("/api/events/recent")
    public ResponseEntity<List<EventResponse>> listRecent() {
        return ResponseEntity.ok(toResponses(getEventUseCase.listRecent()));
    }

    @Operation(summary = "지난 이벤트 목록", description = "지난 날짜이거나 예약이 마감된 이벤트를 날짜 내림차순으로 반환합니다. 관리자 전용.")
    @GetMapping("/api/events/past")
    public ResponseEntity<List<EventResponse>> listPast(
            @Parameter(description = "요청자 역할 (ADMIN)") @RequestHeader(value = Requester.ROLE_HEADER, required = false) String role) {
        return ResponseEntity.ok(toResponses(getEventUseCase.listPast(Requester.ofRole(role))));
    }

    @Operation(summary = "이벤트 조회", description = "당일 이벤트는 조회할 수 없습니다.")
    @GetMapping("/api/events/{eventId}")
    public ResponseEntity<EventResponse> get(@PathVariable long eventId) {
        return ResponseEntity.ok(EventResponse.from(getEventUseCase.getEvent(eventId)));
    }

    @Operation(summary = "이벤트 삭제", description = "예약이 하나도 없는 이벤트만 좌석과 함께 삭제합니다. 관리자 전용.")
    @DeleteMapping("/api/events/{eventId}")
    public ResponseEntity<Void> delete(
            @Parameter(description = "요청자 역할 (ADMIN)") @RequestHeader(value = Requester.ROLE_HEADER, required = false) String role,
            @PathVariable long eventId) {
        deleteEventUseCase.delete(eventId, Requester.ofRole(role));
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "예약 마감", description = "예약을 마감하고 예약자 명단 발송을 요청합니다. 관리자 전용.")
    @PostMapping("/api/events/{eventId}/registration/close")
    public ResponseEntity<EventResponse> closeRegistration(
            @Parameter(description = "요청자 역할 (ADMIN)") @RequestHeader(value = Requester.ROLE_HEADER, required = false) String role,
            @PathVariable long eventId) {
        Event event = closeRegistrationUseCase.closeRegistration(eventId, Requester.ofRole(role));
        return ResponseEntity.ok(EventResponse.from(event));
    }

    @Operation(summary = "예약자 명단 조회", description = "이벤트 날짜의 모든 예약을 좌석 순서로 반환합니다. 관리자 전용.")
    @GetMapping("/api/events/{eventId}/bookings")
    public ResponseEntity<List<RosterEntryResponse>> roster(
            @Parameter(description = "요청자 역할 (ADMIN)") @RequestHeader(value = Requester.ROLE_HEADER, required = false) String role,
            @PathVariable long eventId) {
        List<RosterEntryResponse> response = getRosterUseCase.getRoster(eventId, Requester.ofRole(role)).stream()
                .map(RosterEntryResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "좌석 초기화", description = "예약이 없는 이벤트의 좌석을 이벤트 좌석 수에 맞춰 다시 만듭니다. 관리자 전용.")
    @PostMapping("/api/events/{eventId}/seats/initialize")
    public ResponseEntity<SeatInitializationResponse> initializeSeats(
            @Parameter(description = "요청자 역할 (ADMIN)") @RequestHeader(value = Requester.ROLE_HEADER, required = false) String role,
            @PathVariable long eventId) {
        int seatCount = initializeSeatsUseCase.initializeSeats(eventId, Requester.ofRole(role));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new SeatInitializationResponse(String.valueOf(eventId), seatCount));
    }

    private static List<EventResponse> toResponses(List<Event> events) {
        return events.stream().map(EventResponse::from).toList();
    }
}
