package com.travelcrm.domain.auth.dto;

import com.travelcrm.domain.user.entity.Role;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@AllArgsConstructor
public class AuthResponse {

    private Long id;
    private String email;
    private String name;
    private Role role;
    private String token;
    private long expiresIn;     // ms
}
