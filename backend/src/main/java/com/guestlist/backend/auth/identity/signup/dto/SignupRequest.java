package com.guestlist.backend.auth.identity.signup.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.guestlist.backend.global.jackson.TrimStringDeserializer;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SignupRequest(
        @JsonDeserialize(using = TrimStringDeserializer.class)
        @Email @NotBlank @Size(max = 255) String email,

        @NotBlank @Size(min = 8, max = 72) String password, // BCrypt는 72바이트까지만 본다

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank @Size(max = 50) String userName
) {}
