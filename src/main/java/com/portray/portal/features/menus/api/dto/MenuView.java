package com.portray.portal.features.menus.api.dto;

import com.portray.portal.features.menus.domain.Menu;
import com.portray.portal.features.menus.domain.MenuType;

import java.time.Instant;

public record MenuView(
    Long id,
    String name,
    String label,
    String icon,
    String route,
    Long parentId,
    int sortOrder,
    MenuType menuType,
    boolean isActive,
    Instant createdAt,
    Instant updatedAt
) {
    public static MenuView from(Menu menu) {
        return new MenuView(menu.getId(), menu.getName(), menu.getLabel(), menu.getIcon(), menu.getRoute(),
                menu.getParentId(), menu.getSortOrder(), menu.getMenuType(), menu.isActive(),
                menu.getCreatedAt(), menu.getUpdatedAt());
    }
}
