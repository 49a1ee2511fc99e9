package com.guestlist.backend.auth.identity.domain;

import java.time.LocalDateTime;
import java.util.Set;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Entity
@Table(name = "users", uniqueConstraints = {
        @UniqueConstraint(name = "uq_users_email", columnNames = "email"),
        @UniqueConstraint(name = "uq_users_user_name", columnNames = "user_name")
})
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class User {

    public static final String DEFAULT_ROLE = "user";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String email;

    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash;

    @Column(name = "user_name", nullable = false, length = 50)
    private String userName;

    // "user,admin" 형태로 저장
    @Convert(converter = RoleSetConverter.class)
    @Column(nullable = false, length = 255)
    private Set<String> roles;

    @Column(name = "is_allowed", nullable = false)
    private boolean allowed;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static User create(String email, String passwordHash, String userName, LocalDateTime now) {
        User u = new User();
        u.email = email;
        u.passwordHash = passwordHash;
        u.userName = userName;
        u.roles = Set.of(DEFAULT_ROLE);
        u.allowed = false; // 관리자가 허가하기 전까지는 false
        u.createdAt = now;
        return u;
    }
}
