package com.portray.portal.features.users.api.dto;

import com.portray.portal.common.security.UserRole;
import jakarta.validation.constraints.NotNull;

public record ChangeRoleRequest(@NotNull UserRole role) {}
