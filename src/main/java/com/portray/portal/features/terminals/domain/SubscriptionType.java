package com.portray.portal.features.terminals.domain;

import jakarta.persistence.*;

/**
 * Fixed lookup seeded by migration (1, 12, 24 and 48 months).
 */
@Entity
@Table(name = "subscription_types")
public class SubscriptionType {

    @Id
    private Integer id;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(nullable = false)
    private int months;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    protected SubscriptionType() {
        // JPA constructor
    }

    public SubscriptionType(Integer id, String name, int months) {
        if (months <= 0) {
            throw new IllegalArgumentException("Subscription months must be positive");
        }
        this.id = id;
        this.name = name;
        this.months = months;
        this.active = true;
    }

    public Integer getId() { return id; }
    public String getName() { return name; }
    public int getMonths() { return months; }
    public boolean isActive() { return active; }
}
