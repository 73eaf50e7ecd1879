package kr.jemi.zseat.event.application.port.in;

import java.time.LocalDate;
import java.time.LocalTime;

public record CreateEventCommand(
        String name,
        LocalDate date,
        LocalTime time,
        String description,
        String venue,
        int capacity
) {
}
