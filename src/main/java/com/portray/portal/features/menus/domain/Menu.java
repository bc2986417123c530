package com.portray.portal.features.menus.domain;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.Objects;

/**
 * Navigation node of a two-level tree. Built only through {@link #groupLink} and
 * {@link #pageLink}, so a group link never has a parent and a page link always hangs
 * under a group link.
 */
@Entity
@Table(name = "menus")
public class Menu extends com.portray.portal.common.domain.Entity<Long> {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(nullable = false)
    private String label;

    private String icon;
    private String route;

    @Column(name = "parent_id")
    private Long parentId;

    @Column(name = "sort_order", nullable = false)
    private int sortOrder;

    @Column(name = "menu_type", nullable = false, updatable = false)
    private MenuType menuType;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Menu() {
        // JPA constructor
    }

    private Menu(MenuType menuType, Long parentId, String name, String label, String icon, String route,
                 int sortOrder) {
        this.menuType = menuType;
        this.parentId = parentId;
        this.name = Objects.requireNonNull(name);
        this.label = Objects.requireNonNull(label);
        this.icon = icon;
        this.route = route;
        this.sortOrder = sortOrder;
        this.active = true;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    public static Menu groupLink(String name, String label, String icon, String route, int sortOrder) {
        return new Menu(MenuType.GLINK, null, name, label, icon, route, sortOrder);
    }

    public static Menu pageLink(Menu parent, String name, String label, String icon, String route, int sortOrder) {
        return new Menu(MenuType.PLINK, requireGroupLink(parent), name, label, icon, route, sortOrder);
    }

    private static Long requireGroupLink(Menu parent) {
        if (parent == null || !parent.isGroupLink()) {
            throw new IllegalArgumentException("A page link must belong to a group link");
        }
        return Objects.requireNonNull(parent.getId(), "parent id");
    }

    @Override
    public Long getId() { return id; }
    public String getName() { return name; }
    public String getLabel() { return label; }
    public String getIcon() { return icon; }
    public String getRoute() { return route; }
    public Long getParentId() { return parentId; }
    public int getSortOrder() { return sortOrder; }
    public MenuType getMenuType() { return menuType; }
    public boolean isActive() { return active; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public boolean isGroupLink() {
        return menuType == MenuType.GLINK;
    }

    public void rename(String name) {
        this.name = Objects.requireNonNull(name);
    }

    public void updateDisplay(String label, String icon, String route) {
        this.label = Objects.requireNonNull(label);
        this.icon = icon;
        this.route = route;
    }

    public void reorder(int sortOrder) {
        this.sortOrder = sortOrder;
    }

    public void moveUnder(Menu parent) {
        if (isGroupLink()) {
            throw new IllegalArgumentException("A group link cannot have a parent");
        }
        this.parentId = requireGroupLink(parent);
    }

    public void toggleActive() {
        this.active = !this.active;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
