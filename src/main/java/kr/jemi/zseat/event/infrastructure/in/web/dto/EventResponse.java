package kr.jemi.zseat.event.infrastructure.in.web.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import kr.jemi.zseat.event.domain.Event;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

public record EventResponse(
        String id,
        String name,
        LocalDate date,
        @JsonFormat(pattern = "HH:mm") LocalTime time,
        String description,
        String venue,
        int capacity,
        boolean registrationClosed,
        LocalDateTime createdAt
) {

    // TSID는 JS number 범위를 넘으므로 문자열로 내려준다
    public static EventResponse from(Event event) {
        return new EventResponse(
                String.valueOf(event.getId()),
                event.getName(),
                event.getDate(),
                event.getTime(),
                event.getDescription(),
                event.getVenue(),
                event.getCapacity(),
                event.isRegistrationClosed(),
                event.getCreatedAt()
        );
    }
}
