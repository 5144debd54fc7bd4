package com.clutch.backend.auth.identity.status.dto;

import com.clutch.backend.auth.identity.dto.AccountResponse;
import com.fasterxml.jackson.annotation.JsonInclude;

/** 비로그인이면 account 필드는 내려가지 않는다. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthStatusResponse(boolean authenticated, AccountResponse account) {

    public static AuthStatusResponse anonymous() {
        return new AuthStatusResponse(false, null);
    }

    public static AuthStatusResponse of(AccountResponse account) {
        return new AuthStatusResponse(true, account);
    }
}
