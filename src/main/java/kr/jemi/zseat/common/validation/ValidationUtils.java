package kr.jemi.zseat.common.validation;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;

import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

public final class ValidationUtils {

    private static final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    private ValidationUtils() {}

    /**
     * 위반 항목은 필드 이름순으로 "필드=거부된 값: 메시지" 형태로 모은다.
     */
    public static void validate(Object target) {
        Set<ConstraintViolation<Object>> violations = validator.validate(target);
        if (violations.isEmpty()) {
            return;
        }
        String message = violations.stream()
                .sorted(Comparator.comparing((ConstraintViolation<Object> v) -> v.getPropertyPath().toString())
                        .thenComparing(ConstraintViolation::getMessage))
                .map(ValidationUtils::describe)
                .collect(Collectors.joining(", "));
        throw new IllegalArgumentException(target.getClass().getSimpleName() + " 검증 실패: " + message);
    }

    private static String describe(ConstraintViolation<Object> violation) {
        return violation.getPropertyPath() + "=" + violation.getInvalidValue() + ": " + violation.getMessage();
    }
}
