package com.portray.portal.features.menus.api.dto;

import com.portray.portal.features.menus.domain.MenuType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record CreateMenuRequest(
    @NotBlank String name,
    @NotBlank String label,
    String icon,
    String route,
    @NotNull MenuType menuType,
    Long parentId,
    Integer sortOrder
) {}
