package com.portray.portal.features.menus.api.dto;

public record ReorderMenuItem(Long id, Integer sortOrder, Long parentId) {}
