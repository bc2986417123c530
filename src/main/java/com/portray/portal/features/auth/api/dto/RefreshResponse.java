package com.portray.portal.features.auth.api.dto;

import java.time.Instant;

public record RefreshResponse(String token, Instant expiresAt) {}
