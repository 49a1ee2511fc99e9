package com.guestlist.backend.auth.identity.login.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.guestlist.backend.global.jackson.TrimStringDeserializer;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record LoginRequest(
        @JsonDeserialize(using = TrimStringDeserializer.class)
        @Email @NotBlank String email,
        @NotBlank String password // 비밀번호 평문 (trim 하지 않음)
) {}
