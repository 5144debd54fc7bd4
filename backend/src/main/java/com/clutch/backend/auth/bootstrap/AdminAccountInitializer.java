package com.clutch.backend.auth.bootstrap;

import java.time.Clock;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.clutch.backend.auth.config.AdminBootstrapProperties;
import com.clutch.backend.auth.domain.Account;
import com.clutch.backend.auth.repo.AccountRepository;
import com.clutch.backend.auth.support.EmailNormalizer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 부팅 시 관리자 계정 시드
 *
 * - app.bootstrap.admin.{email,name,password} 가 모두 있을 때만 동작
 * - 같은 이메일 계정이 이미 있으면 아무 것도 바꾸지 않는다. (재기동해도 멱등)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdminAccountInitializer implements ApplicationRunner {

    private final AdminBootstrapProperties props;
    private final AccountRepository accountRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (!props.isConfigured()) {
            log.debug("관리자 시드 설정 없음: 건너뜀");
            return;
        }

        String email = EmailNormalizer.normalize(props.email());
        if (accountRepository.existsByEmail(email)) {
            log.info("관리자 계정 이미 존재: email={}", email);
            return;
        }

        Account admin = accountRepository.save(Account.create(
                email,
                passwordEncoder.encode(props.password()),
                props.name().trim(),
                true,
                clock.instant()
        ));
        log.info("관리자 계정 생성: accountId={}, email={}", admin.getId(), email);
    }
}
