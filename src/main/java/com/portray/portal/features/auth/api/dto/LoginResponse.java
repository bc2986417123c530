package com.portray.portal.features.auth.api.dto;

import java.time.Instant;

public record LoginResponse(
    UserView user,
    String token,
    Instant expiresAt,
    String redirectPath
) {}
