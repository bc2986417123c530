package com.portray.portal.features.menus.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.junit.jupiter.api.Assertions.*;

class MenuTest {

    static Menu withId(Menu menu, long id) {
        ReflectionTestUtils.setField(menu, "id", id);
        return menu;
    }

    @Test
    @DisplayName("Page link hangs under a group link")
    void pageLinkUnderGroupLink() {
        Menu group = withId(Menu.groupLink("ops", "Operations", "Anchor", null, 1), 1L);

        Menu page = Menu.pageLink(group, "berths", "Berths", "Ship", "/ops/berths", 2);

        assertEquals(MenuType.PLINK, page.getMenuType());
        assertEquals(1L, page.getParentId());
        assertTrue(page.isActive());
    }

    @Test
    @DisplayName("Page link cannot hang under another page link")
    void pageLinkUnderPageLink() {
        Menu group = withId(Menu.groupLink("ops", "Operations", null, null, 1), 1L);
        Menu page = withId(Menu.pageLink(group, "berths", "Berths", null, "/ops/berths", 1), 2L);

        assertThrows(IllegalArgumentException.class, () -> Menu.pageLink(page, "nested", "Nested", null, "/x", 1));
        assertThrows(IllegalArgumentException.class, () -> Menu.pageLink(null, "orphan", "Orphan", null, "/y", 1));
    }

    @Test
    @DisplayName("Group link cannot be moved under a parent")
    void groupLinkHasNoParent() {
        Menu group = withId(Menu.groupLink("ops", "Operations", null, null, 1), 1L);
        Menu other = withId(Menu.groupLink("admin", "Admin", null, null, 2), 2L);

        assertThrows(IllegalArgumentException.class, () -> group.moveUnder(other));
        assertNull(group.getParentId());
    }

    @Test
    @DisplayName("Menu type labels parse case-insensitively")
    void menuTypeLabels() {
        assertEquals(MenuType.GLINK, MenuType.fromLabel("glink"));
        assertEquals(MenuType.PLINK, MenuType.fromLabel("PLINK"));
        assertThrows(IllegalArgumentException.class, () -> MenuType.fromLabel("link"));
    }
}
