package kr.jemi.zseat.seat.domain;

import jakarta.validation.constraints.NotBlank;
import kr.jemi.zseat.common.validation.SelfValidating;

public record Occupant(
        @NotBlank String name,
        @NotBlank String email,
        String phone
) implements SelfValidating {

    // 필드 대입 후에 검증해야 하므로 compact 생성자를 쓰지 않는다
    public Occupant(String name, String email, String phone) {
        this.name = name;
        this.email = email;
        this.phone = phone;
        validateSelf();
    }
}
