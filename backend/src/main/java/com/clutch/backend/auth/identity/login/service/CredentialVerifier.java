package com.clutch.backend.auth.identity.login.service;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.clutch.backend.auth.domain.Account;
import com.clutch.backend.auth.repo.AccountRepository;
import com.clutch.backend.auth.support.EmailNormalizer;
import com.clutch.backend.global.ApiException;
import com.clutch.backend.global.ErrorCode;

/**
 * 이메일 + 비밀번호 -> Account
 *
 * 보안:
 * - 이메일 없음 / 비밀번호 불일치 / 비활성 계정 모두 같은 INVALID_CREDENTIALS (같은 메시지)
 *   -> 응답만으로 계정 존재 여부나 상태를 추측할 수 없다.
 * - 없는 이메일도 더미 해시로 matches를 한 번 돌린다. (응답 시간으로 구분 불가)
 */
@Service
public class CredentialVerifier {

    private final AccountRepository accountRepository;
    private final PasswordEncoder passwordEncoder;
    private final String dummyHash;

    public CredentialVerifier(AccountRepository accountRepository, PasswordEncoder passwordEncoder) {
        this.accountRepository = accountRepository;
        this.passwordEncoder = passwordEncoder;
        // 같은 encoder(같은 cost)로 만든 해시여야 비용이 같다.
        this.dummyHash = passwordEncoder.encode("clutch-no-such-account");
    }

    @Transactional(readOnly = true)
    public Account verify(String rawEmail, String rawPassword) {
        // 컨트롤러 @Valid가 있어도 서비스는 한 번 더 본다.
        if (isBlank(rawEmail) || isBlank(rawPassword)) {
            throw new ApiException(ErrorCode.INVALID_CREDENTIALS);
        }

        Account account = accountRepository.findByEmail(EmailNormalizer.normalize(rawEmail)).orElse(null);
        if (account == null) {
            passwordEncoder.matches(rawPassword, dummyHash);
            throw new ApiException(ErrorCode.INVALID_CREDENTIALS);
        }

        if (!passwordEncoder.matches(rawPassword, account.getPasswordHash())) {
            throw new ApiException(ErrorCode.INVALID_CREDENTIALS);
        }

        if (!account.isActive()) {
            throw new ApiException(ErrorCode.INVALID_CREDENTIALS);
        }

        return account;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
