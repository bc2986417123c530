package com.portray.portal.features.menus.api.dto;

import java.util.List;

/**
 * A group link with its page links in sort order.
 */
public record MenuTreeNode(MenuView menu, List<MenuView> children) {}
