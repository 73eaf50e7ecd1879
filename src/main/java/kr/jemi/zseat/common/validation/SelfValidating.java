package kr.jemi.zseat.common.validation;

public interface SelfValidating {

    default void validateSelf() {
        ValidationUtils.validate(this);
    }
}
