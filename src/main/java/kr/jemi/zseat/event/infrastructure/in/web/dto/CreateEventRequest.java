package kr.jemi.zseat.event.infrastructure.in.web.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import kr.jemi.zseat.event.application.port.in.CreateEventCommand;

import java.time.LocalDate;
import java.time.LocalTime;

public record CreateEventRequest(
        @NotBlank String name,
        @NotNull LocalDate date,
        @NotNull @JsonFormat(pattern = "HH:mm") LocalTime time,
        @NotBlank String description,
        @NotBlank String venue,
        @Min(1) @Max(260) int capacity
) {

    public CreateEventCommand toCommand() {
        return new CreateEventCommand(name, date, time, description, venue, capacity);
    }
}
