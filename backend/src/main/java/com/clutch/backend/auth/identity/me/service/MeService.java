package com.clutch.backend.auth.identity.me.service;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.clutch.backend.auth.domain.Account;
import com.clutch.backend.auth.identity.dto.AccountResponse;
import com.clutch.backend.auth.repo.AccountRepository;
import com.clutch.backend.global.ApiException;
import com.clutch.backend.global.ErrorCode;
import com.clutch.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;

/**
 * 내 정보 조회
 *
 * - 필터에서 이미 계정 활성 여부를 봤지만, 그 사이 비활성화/삭제됐을 수 있어 다시 확인한다.
 */
@Service
@RequiredArgsConstructor
public class MeService {

    private final AccountRepository accountRepository;

    @Transactional(readOnly = true)
    public AccountResponse me(AuthPrincipal principal) {
        if (principal == null) {
            throw new ApiException(ErrorCode.AUTH_REQUIRED);
        }

        Account account = accountRepository.findById(principal.accountId())
                .filter(Account::isActive)
                .orElseThrow(() -> new ApiException(ErrorCode.TOKEN_INVALID));

        return AccountResponse.from(account);
    }
}
