package com.portray.portal.features.organizations.domain;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.Objects;

@Entity
@Table(name = "organizations")
public class Organization extends com.portray.portal.common.domain.Entity<Long> {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_name", nullable = false, unique = true)
    private String organizationName;

    @Column(name = "display_name", nullable = false, unique = true)
    private String displayName;

    @Column(name = "organization_code", nullable = false, unique = true)
    private String organizationCode;

    @Column(name = "register_office", nullable = false)
    private String registerOffice;

    @Column(nullable = false)
    private String country;

    private String telephone;
    private String fax;
    private String website;

    @Column(name = "logo_url")
    private String logoUrl;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Organization() {
        // JPA constructor
    }

    public Organization(String organizationName, String displayName, String organizationCode,
                        String registerOffice, String country) {
        this.organizationName = Objects.requireNonNull(organizationName);
        this.displayName = Objects.requireNonNull(displayName);
        this.organizationCode = Objects.requireNonNull(organizationCode);
        this.registerOffice = Objects.requireNonNull(registerOffice);
        this.country = Objects.requireNonNull(country);
        this.active = true;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @Override
    public Long getId() { return id; }
    public String getOrganizationName() { return organizationName; }
    public String getDisplayName() { return displayName; }
    public String getOrganizationCode() { return organizationCode; }
    public String getRegisterOffice() { return registerOffice; }
    public String getCountry() { return country; }
    public String getTelephone() { return telephone; }
    public String getFax() { return fax; }
    public String getWebsite() { return website; }
    public String getLogoUrl() { return logoUrl; }
    public boolean isActive() { return active; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public void rename(String organizationName, String displayName, String organizationCode) {
        this.organizationName = Objects.requireNonNull(organizationName);
        this.displayName = Objects.requireNonNull(displayName);
        this.organizationCode = Objects.requireNonNull(organizationCode);
    }

    public void updateDetails(String registerOffice, String country, String telephone,
                              String fax, String website, String logoUrl) {
        this.registerOffice = Objects.requireNonNull(registerOffice);
        this.country = Objects.requireNonNull(country);
        this.telephone = telephone;
        this.fax = fax;
        this.website = website;
        this.logoUrl = logoUrl;
    }

    public void toggleActive() {
        this.active = !this.active;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
