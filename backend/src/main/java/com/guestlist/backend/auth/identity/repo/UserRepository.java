package com.guestlist.backend.auth.identity.repo;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;

import com.guestlist.backend.auth.identity.domain.User;

public interface UserRepository extends JpaRepository<User, Long> {
    Optional<User> findByEmail(String email);
    boolean existsByEmail(String email);
    boolean existsByUserName(String userName);
}
