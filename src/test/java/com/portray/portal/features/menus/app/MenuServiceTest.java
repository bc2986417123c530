package com.portray.portal.features.menus.app;

import com.portray.portal.common.exception.ConflictException;
import com.portray.portal.features.menus.api.dto.CreateMenuRequest;
import com.portray.portal.features.menus.api.dto.MenuTreeNode;
import com.portray.portal.features.menus.api.dto.MenuView;
import com.portray.portal.features.menus.api.dto.ReorderMenuItem;
import com.portray.portal.features.menus.domain.Menu;
import com.portray.portal.features.menus.domain.MenuRepository;
import com.portray.portal.features.menus.domain.MenuType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class MenuServiceTest {

    private MenuRepository menuRepository;
    private MenuService menuService;

    private Menu dashboard;
    private Menu operations;
    private Menu berths;
    private Menu gates;

    @BeforeEach
    void setUp() {
        menuRepository = mock(MenuRepository.class);
        menuService = new MenuService(menuRepository);
        when(menuRepository.save(any(Menu.class))).thenAnswer(inv -> inv.getArgument(0));

        dashboard = withId(Menu.groupLink("dashboard", "Dashboard", "Home", "/dashboard", 1), 1L);
        operations = withId(Menu.groupLink("operations", "Operations", "Anchor", null, 2), 2L);
        gates = withId(Menu.pageLink(operations, "gates", "Gates", null, "/ops/gates", 1), 4L);
        berths = withId(Menu.pageLink(operations, "berths", "Berths", null, "/ops/berths", 2), 3L);
        for (Menu menu : List.of(dashboard, operations, berths, gates)) {
            when(menuRepository.findById(menu.getId())).thenReturn(Optional.of(menu));
        }
        when(menuRepository.findAllByOrderBySortOrderAscIdAsc()).thenReturn(List.of(dashboard, gates, operations, berths));
    }

    private static Menu withId(Menu menu, long id) {
        ReflectionTestUtils.setField(menu, "id", id);
        return menu;
    }

    @Test
    @DisplayName("Tree groups page links under their group link in sort order")
    void buildsTree() {
        List<MenuTreeNode> tree = menuService.tree();

        assertEquals(2, tree.size());
        assertEquals("dashboard", tree.get(0).menu().name());
        assertTrue(tree.get(0).children().isEmpty());
        assertEquals("operations", tree.get(1).menu().name());
        assertEquals(List.of("gates", "berths"), tree.get(1).children().stream().map(MenuView::name).toList());
    }

    @Test
    @DisplayName("Page link whose parent is a page link is refused")
    void createRejectsPlinkParent() {
        CreateMenuRequest request = new CreateMenuRequest("nested", "Nested", null, "/n", MenuType.PLINK, 3L, 1);

        assertThrows(IllegalArgumentException.class, () -> menuService.create(request));
        verify(menuRepository, never()).save(any());
    }

    @Test
    @DisplayName("Group link with a parent is refused; page link without one too")
    void createChecksParentPresence() {
        assertThrows(IllegalArgumentException.class, () -> menuService.create(
                new CreateMenuRequest("g", "G", null, null, MenuType.GLINK, 1L, 1)));
        assertThrows(IllegalArgumentException.class, () -> menuService.create(
                new CreateMenuRequest("p", "P", null, "/p", MenuType.PLINK, null, 1)));
    }

    @Test
    @DisplayName("Duplicate name is a conflict")
    void duplicateName() {
        when(menuRepository.existsByName("dashboard")).thenReturn(true);

        assertThrows(ConflictException.class, () -> menuService.create(
                new CreateMenuRequest("dashboard", "Dash", null, "/d", MenuType.GLINK, null, 9)));
    }

    @Test
    @DisplayName("Creates a page link under a group link")
    void createsPlink() {
        MenuView view = menuService.create(
                new CreateMenuRequest("yard", "Yard", "Box", "/ops/yard", MenuType.PLINK, 2L, 3));

        assertEquals(MenuType.PLINK, view.menuType());
        assertEquals(2L, view.parentId());
        assertEquals(3, view.sortOrder());
    }

    @Test
    @DisplayName("Group link with children cannot be deleted")
    void deleteGroupWithChildren() {
        when(menuRepository.existsByParentId(2L)).thenReturn(true);

        assertThrows(ConflictException.class, () -> menuService.delete(2L));
        verify(menuRepository, never()).delete(any());

        menuService.delete(3L);
        verify(menuRepository).delete(berths);
    }

    @Test
    @DisplayName("Bulk reorder moves and re-parents in one go")
    void reorders() {
        Menu admin = withId(Menu.groupLink("admin", "Admin", null, null, 3), 5L);
        when(menuRepository.findById(5L)).thenReturn(Optional.of(admin));

        List<MenuView> result = menuService.reorder(List.of(
                new ReorderMenuItem(3L, 1, null),
                new ReorderMenuItem(4L, 1, 5L),
                new ReorderMenuItem(1L, 4, null)));

        assertEquals(3, result.size());
        assertEquals(1, berths.getSortOrder());
        assertEquals(5L, gates.getParentId());
        assertEquals(4, dashboard.getSortOrder());
    }

    @Test
    @DisplayName("Reorder refuses to put a group link under a parent")
    void reorderRejectsGlinkParent() {
        assertThrows(IllegalArgumentException.class,
                () -> menuService.reorder(List.of(new ReorderMenuItem(1L, 1, 2L))));
    }
}
