package kr.jemi.zseat.common.auth;

import kr.jemi.zseat.common.exception.BusinessException;
import kr.jemi.zseat.common.exception.ErrorCode;

/**
 * 인증 계층이 이미 확인한 호출자. 코어는 인증하지 않고 admin 여부만 본다.
 */
public record Requester(boolean admin) {

    public static final String ROLE_HEADER = "X-Requester-Role";
    public static final String ADMIN_ROLE = "ADMIN";

    public static Requester user() {
        return new Requester(false);
    }

    public static Requester administrator() {
        return new Requester(true);
    }

    public static Requester ofRole(String role) {
        return new Requester(ADMIN_ROLE.equalsIgnoreCase(role));
    }

    public void requireAdmin() {
        if (!admin) {
            throw new BusinessException(ErrorCode.ADMIN_ONLY);
        }
    }
}
