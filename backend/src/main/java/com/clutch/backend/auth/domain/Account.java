package com.clutch.backend.auth.domain;

import java.time.Instant;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * accounts 테이블 = "계정 저장소"
 *
 * 인증 코어 입장에서는 읽기 전용이다.
 * - 로그인: email로 조회 -> password_hash 비교 -> active 확인
 * - 리프레시/액세스 검증: JWT sub(id)로 조회 -> active 확인
 * - admin은 토큰의 admin 클레임과 권한(ROLE_ADMIN)으로 이어진다.
 */
@Entity
@Table(name = "accounts", uniqueConstraints = {
        @UniqueConstraint(name = "uq_accounts_email", columnNames = "email")
})
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Account {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id; // JWT sub

    @Column(nullable = false, length = 255)
    private String email; // 정규화(trim + 소문자)된 로그인 ID

    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash; // BCrypt 해시 (원문 저장 금지)

    @Column(nullable = false, length = 100)
    private String name;

    @Column(name = "is_admin", nullable = false)
    private boolean admin;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static Account create(String email, String passwordHash, String name, boolean admin, Instant now) {
        Account a = new Account();
        a.email = email;
        a.passwordHash = passwordHash;
        a.name = name;
        a.admin = admin;
        a.active = true;
        a.createdAt = now;
        a.updatedAt = now;
        return a;
    }

    public void deactivate(Instant now) {
        this.active = false;
        this.updatedAt = now;
    }

    public Long getId() {return id;}
    public String getEmail() {return email;}
    public String getPasswordHash() {return passwordHash;}
    public String getName() {return name;}
    public boolean isAdmin() {return admin;}
    public boolean isActive() {return active;}
    public Instant getCreatedAt() {return createdAt;}
    public Instant getUpdatedAt() {return updatedAt;}
}
