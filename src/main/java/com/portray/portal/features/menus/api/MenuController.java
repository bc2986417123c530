package com.portray.portal.features.menus.api;

import com.portray.portal.features.menus.api.dto.CreateMenuRequest;
import com.portray.portal.features.menus.api.dto.MenuTreeNode;
import com.portray.portal.features.menus.api.dto.MenuView;
import com.portray.portal.features.menus.api.dto.ReorderMenuItem;
import com.portray.portal.features.menus.api.dto.UpdateMenuRequest;
import com.portray.portal.features.menus.app.MenuService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/menus")
public class MenuController {

    private final MenuService menuService;

    public MenuController(MenuService menuService) {
        this.menuService = menuService;
    }

    @GetMapping
    public ResponseEntity<List<MenuView>> list() {
        return ResponseEntity.ok(menuService.list());
    }

    @GetMapping("/tree")
    public ResponseEntity<List<MenuTreeNode>> tree() {
        return ResponseEntity.ok(menuService.tree());
    }

    @GetMapping("/{id}")
    public ResponseEntity<MenuView> get(@PathVariable Long id) {
        return ResponseEntity.ok(menuService.get(id));
    }

    @PostMapping
    @PreAuthorize("hasRole('SYSTEM_ADMIN')")
    public ResponseEntity<MenuView> create(@Valid @RequestBody CreateMenuRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(menuService.create(request));
    }

    @PatchMapping("/{id}")
    @PreAuthorize("hasRole('SYSTEM_ADMIN')")
    public ResponseEntity<MenuView> update(@PathVariable Long id, @RequestBody UpdateMenuRequest request) {
        return ResponseEntity.ok(menuService.update(id, request));
    }

    @PatchMapping("/{id}/toggle-status")
    @PreAuthorize("hasRole('SYSTEM_ADMIN')")
    public ResponseEntity<MenuView> toggleStatus(@PathVariable Long id) {
        return ResponseEntity.ok(menuService.toggleStatus(id));
    }

    @PatchMapping("/reorder")
    @PreAuthorize("hasRole('SYSTEM_ADMIN')")
    public ResponseEntity<List<MenuView>> reorder(@RequestBody List<ReorderMenuItem> items) {
        return ResponseEntity.ok(menuService.reorder(items));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('SYSTEM_ADMIN')")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        menuService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
