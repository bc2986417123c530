package com.portray.portal.features.menus.api.dto;

/**
 * Partial update; null fields keep their current value. The menu type is fixed at creation.
 */
public record UpdateMenuRequest(
    String name,
    String label,
    String icon,
    String route,
    Long parentId,
    Integer sortOrder
) {}
