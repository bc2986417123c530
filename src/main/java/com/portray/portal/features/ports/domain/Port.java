package com.portray.portal.features.ports.domain;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.Objects;

@Entity
@Table(name = "ports")
public class Port extends com.portray.portal.common.domain.Entity<Long> {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "port_name", nullable = false)
    private String portName;

    @Column(name = "display_name", nullable = false, length = 6)
    private String displayName;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(nullable = false)
    private String address;

    @Column(nullable = false)
    private String country;

    @Column(nullable = false)
    private String state;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Port() {
        // JPA constructor
    }

    public Port(String portName, String displayName, Long organizationId,
                String address, String country, String state) {
        this.organizationId = Objects.requireNonNull(organizationId);
        update(portName, displayName, address, country, state);
        this.active = true;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @Override
    public Long getId() { return id; }
    public String getPortName() { return portName; }
    public String getDisplayName() { return displayName; }
    public Long getOrganizationId() { return organizationId; }
    public String getAddress() { return address; }
    public String getCountry() { return country; }
    public String getState() { return state; }
    public boolean isActive() { return active; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public void update(String portName, String displayName, String address, String country, String state) {
        this.portName = Objects.requireNonNull(portName);
        this.displayName = Objects.requireNonNull(displayName);
        this.address = Objects.requireNonNull(address);
        this.country = Objects.requireNonNull(country);
        this.state = Objects.requireNonNull(state);
    }

    public void moveTo(Long organizationId) {
        this.organizationId = Objects.requireNonNull(organizationId);
    }

    public void toggleActive() {
        this.active = !this.active;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
