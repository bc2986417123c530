package com.portray.portal.features.menus.app;

import com.portray.portal.common.exception.ConflictException;
import com.portray.portal.common.exception.NotFoundException;
import com.portray.portal.features.menus.api.dto.CreateMenuRequest;
import com.portray.portal.features.menus.api.dto.MenuTreeNode;
import com.portray.portal.features.menus.api.dto.MenuView;
import com.portray.portal.features.menus.api.dto.ReorderMenuItem;
import com.portray.portal.features.menus.api.dto.UpdateMenuRequest;
import com.portray.portal.features.menus.domain.Menu;
import com.portray.portal.features.menus.domain.MenuRepository;
import com.portray.portal.features.menus.domain.MenuType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maintains the two-level navigation tree. Group links sit at the root; page links
 * always reference a group link as parent.
 */
@Service
public class MenuService {

    private static final Logger log = LoggerFactory.getLogger(MenuService.class);

    private final MenuRepository menuRepository;

    public MenuService(MenuRepository menuRepository) {
        this.menuRepository = menuRepository;
    }

    @Transactional(readOnly = true)
    public List<MenuView> list() {
        return menuRepository.findAllByOrderBySortOrderAscIdAsc().stream()
                .map(MenuView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<MenuTreeNode> tree() {
        List<Menu> all = menuRepository.findAllByOrderBySortOrderAscIdAsc();

        Map<Long, List<MenuView>> children = new LinkedHashMap<>();
        for (Menu menu : all) {
            if (menu.isGroupLink()) {
                children.put(menu.getId(), new ArrayList<>());
            }
        }
        for (Menu menu : all) {
            if (!menu.isGroupLink()) {
                List<MenuView> siblings = children.get(menu.getParentId());
                if (siblings != null) {
                    siblings.add(MenuView.from(menu));
                }
            }
        }

        return all.stream()
                .filter(Menu::isGroupLink)
                .map(group -> new MenuTreeNode(MenuView.from(group), List.copyOf(children.get(group.getId()))))
                .toList();
    }

    @Transactional(readOnly = true)
    public MenuView get(Long id) {
        return MenuView.from(load(id));
    }

    @Transactional
    public MenuView create(CreateMenuRequest request) {
        String name = request.name().trim();
        if (menuRepository.existsByName(name)) {
            throw new ConflictException("Menu name already exists: " + name);
        }
        int sortOrder = request.sortOrder() != null ? request.sortOrder() : 0;

        Menu menu;
        if (request.menuType() == MenuType.GLINK) {
            if (request.parentId() != null) {
                throw new IllegalArgumentException("A group link cannot have a parent");
            }
            menu = Menu.groupLink(name, request.label().trim(), request.icon(), request.route(), sortOrder);
        } else {
            if (request.parentId() == null) {
                throw new IllegalArgumentException("A page link requires a parent group link");
            }
            menu = Menu.pageLink(loadParent(request.parentId()), name, request.label().trim(),
                    request.icon(), request.route(), sortOrder);
        }
        menuRepository.save(menu);

        log.info("Menu {} ({}) created", menu.getId(), menu.getMenuType().getLabel());
        return MenuView.from(menu);
    }

    @Transactional
    public MenuView update(Long id, UpdateMenuRequest request) {
        Menu menu = load(id);

        if (request.name() != null && !request.name().trim().equals(menu.getName())) {
            String name = request.name().trim();
            if (menuRepository.existsByName(name)) {
                throw new ConflictException("Menu name already exists: " + name);
            }
            menu.rename(name);
        }
        if (request.label() != null || request.icon() != null || request.route() != null) {
            menu.updateDisplay(
                    request.label() != null ? request.label().trim() : menu.getLabel(),
                    request.icon() != null ? request.icon() : menu.getIcon(),
                    request.route() != null ? request.route() : menu.getRoute());
        }
        if (request.sortOrder() != null) {
            menu.reorder(request.sortOrder());
        }
        if (request.parentId() != null && !request.parentId().equals(menu.getParentId())) {
            menu.moveUnder(loadParent(request.parentId()));
        }

        menuRepository.save(menu);
        return MenuView.from(menu);
    }

    @Transactional
    public MenuView toggleStatus(Long id) {
        Menu menu = load(id);
        menu.toggleActive();
        menuRepository.save(menu);
        log.info("Menu {} is now {}", id, menu.isActive() ? "active" : "inactive");
        return MenuView.from(menu);
    }

    @Transactional
    public void delete(Long id) {
        Menu menu = load(id);
        if (menu.isGroupLink() && menuRepository.existsByParentId(id)) {
            throw new ConflictException("Menu " + id + " still has page links");
        }
        menuRepository.delete(menu);
        log.info("Menu {} deleted", id);
    }

    /**
     * Applies a batch of positions in one transaction. Any invalid item rolls back the whole batch.
     */
    @Transactional
    public List<MenuView> reorder(List<ReorderMenuItem> items) {
        List<MenuView> updated = new ArrayList<>(items.size());
        for (ReorderMenuItem item : items) {
            if (item.id() == null || item.sortOrder() == null) {
                throw new IllegalArgumentException("Each reorder entry needs an id and a sortOrder");
            }
            Menu menu = load(item.id());
            menu.reorder(item.sortOrder());
            if (item.parentId() != null && !item.parentId().equals(menu.getParentId())) {
                menu.moveUnder(loadParent(item.parentId()));
            }
            menuRepository.save(menu);
            updated.add(MenuView.from(menu));
        }
        log.info("Reordered {} menu entries", updated.size());
        return updated;
    }

    private Menu loadParent(Long parentId) {
        Menu parent = menuRepository.findById(parentId)
                .orElseThrow(() -> new IllegalArgumentException("Parent menu not found: " + parentId));
        if (!parent.isGroupLink()) {
            throw new IllegalArgumentException("Parent menu " + parentId + " is not a group link");
        }
        return parent;
    }

    private Menu load(Long id) {
        return menuRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Menu not found: " + id));
    }
}
