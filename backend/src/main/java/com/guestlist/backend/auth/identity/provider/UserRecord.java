package com.guestlist.backend.auth.identity.provider;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import com.guestlist.backend.auth.identity.domain.User;

/**
 * 세션 계층이 보는 사용자 상태 스냅샷 (엔티티를 직접 넘기지 않는다)
 */
public record UserRecord(Long id, String email, String userName, Set<String> roles, boolean allowed) {

    public UserRecord {
        roles = Collections.unmodifiableSet(new LinkedHashSet<>(roles)); // 순서 유지
    }

    public static UserRecord from(User user) {
        return new UserRecord(user.getId(), user.getEmail(), user.getUserName(), user.getRoles(), user.isAllowed());
    }
}
