package com.portray.portal.features.terminals.domain;

import com.portray.portal.common.domain.AggregateRoot;
import com.portray.portal.features.terminals.domain.events.TerminalActivated;
import com.portray.portal.features.terminals.domain.events.TerminalStatusChanged;
import com.portray.portal.features.terminals.domain.events.TerminalSubmitted;
import jakarta.persistence.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * A terminal of a port and its review/subscription lifecycle.
 *
 * Status moves from "Processing for activation" to Active (by activation) or Rejected.
 * The activation end date is derived from start date and subscription months at activation
 * time and is never set any other way. Once active, only the {@link TerminalProfile} fields
 * can be edited.
 */
@Entity
@Table(name = "terminals")
public class Terminal extends AggregateRoot<Long> {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "port_id", nullable = false, updatable = false)
    private Long portId;

    @Column(name = "terminal_name", nullable = false)
    private String terminalName;

    @Column(name = "short_code", nullable = false, unique = true, length = 6)
    private String shortCode;

    private String gst;
    private String pan;

    @Column(nullable = false)
    private String currency;

    @Column(nullable = false)
    private String timezone;

    @Column(name = "billing_address", nullable = false)
    private String billingAddress;

    @Column(name = "billing_city", nullable = false)
    private String billingCity;

    @Column(name = "billing_pin_code", nullable = false)
    private String billingPinCode;

    @Column(name = "billing_phone", nullable = false)
    private String billingPhone;

    @Column(name = "billing_fax")
    private String billingFax;

    @Column(name = "shipping_address", nullable = false)
    private String shippingAddress;

    @Column(name = "shipping_city", nullable = false)
    private String shippingCity;

    @Column(name = "shipping_pin_code", nullable = false)
    private String shippingPinCode;

    @Column(name = "shipping_phone", nullable = false)
    private String shippingPhone;

    @Column(name = "shipping_fax")
    private String shippingFax;

    @Column(name = "same_as_billing", nullable = false)
    private boolean sameAsBilling;

    @Column(nullable = false)
    private TerminalStatus status;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "subscription_type_id")
    private Integer subscriptionTypeId;

    @Column(name = "activation_start_date")
    private LocalDate activationStartDate;

    @Column(name = "activation_end_date")
    private LocalDate activationEndDate;

    @Column(name = "work_order_no")
    private String workOrderNo;

    @Column(name = "work_order_date")
    private LocalDate workOrderDate;

    @Column(name = "created_by", updatable = false)
    private String createdBy;

    @Version
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Terminal() {
        // JPA constructor
    }

    public Terminal(Long portId, TerminalProfile profile, String createdBy) {
        this.portId = Objects.requireNonNull(portId);
        this.createdBy = Objects.requireNonNull(createdBy);
        this.currency = "INR";
        applyProfile(profile);
        requireProfileComplete();
        this.status = TerminalStatus.PROCESSING_FOR_ACTIVATION;
        this.active = false;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    /**
     * Calendar-month addition; a start day missing from the target month falls back to
     * that month's last day (2024-01-31 plus one month is 2024-02-29).
     */
    public static LocalDate computeEndDate(LocalDate start, int months) {
        Objects.requireNonNull(start, "activationStartDate");
        if (months <= 0) {
            throw new IllegalArgumentException("Subscription months must be positive");
        }
        return start.plusMonths(months);
    }

    /**
     * Records the submission event. Called once the terminal has its id.
     */
    public void markSubmitted(Instant at) {
        registerEvent(new TerminalSubmitted(id, portId, terminalName, shortCode, createdBy, at));
    }

    /**
     * Fixes the subscription window and makes the terminal active. Activating an active
     * terminal renews it with the new window.
     *
     * @return true when this was a renewal of an already active terminal
     * @throws IllegalStateException for a rejected terminal
     */
    public boolean activate(SubscriptionType subscriptionType, LocalDate startDate,
                            String workOrderNo, LocalDate workOrderDate, Instant at) {
        Objects.requireNonNull(subscriptionType, "subscriptionType");
        if (status == TerminalStatus.REJECTED) {
            throw new IllegalStateException(
                    "A rejected terminal cannot be activated; set it back to Processing for activation first");
        }
        boolean renewal = status == TerminalStatus.ACTIVE;

        this.subscriptionTypeId = subscriptionType.getId();
        this.activationStartDate = startDate;
        this.activationEndDate = computeEndDate(startDate, subscriptionType.getMonths());
        if (workOrderNo != null) {
            this.workOrderNo = workOrderNo;
        }
        if (workOrderDate != null) {
            this.workOrderDate = workOrderDate;
        }
        this.status = TerminalStatus.ACTIVE;
        this.active = true;

        registerEvent(new TerminalActivated(id, subscriptionTypeId, subscriptionType.getMonths(),
                activationStartDate, activationEndDate, renewal, at));
        return renewal;
    }

    public void changeStatus(TerminalStatus newStatus, Instant at) {
        Objects.requireNonNull(newStatus, "status");
        TerminalStatus previous = this.status;
        this.status = newStatus;
        this.active = newStatus == TerminalStatus.ACTIVE;
        if (previous != newStatus) {
            registerEvent(new TerminalStatusChanged(id, previous, newStatus, at));
        }
    }

    /**
     * Applies an update. For an active terminal only profile fields are taken; the other
     * supplied fields are ignored and their names returned. Status is never applied here.
     * Changing the proposed subscription or start date of an inactive terminal clears its end
     * date until the next activation.
     *
     * @return names of the fields that were ignored
     */
    public List<String> applyChanges(TerminalChanges changes) {
        if (changes.profile() != null) {
            applyProfile(changes.profile());
        }
        if (status == TerminalStatus.ACTIVE) {
            return changes.restrictedFields();
        }

        boolean windowChanged = false;
        if (changes.subscriptionTypeId() != null && !changes.subscriptionTypeId().equals(subscriptionTypeId)) {
            this.subscriptionTypeId = changes.subscriptionTypeId();
            windowChanged = true;
        }
        if (changes.activationStartDate() != null && !changes.activationStartDate().equals(activationStartDate)) {
            this.activationStartDate = changes.activationStartDate();
            windowChanged = true;
        }
        // the end date belongs to the window fixed by the last activation
        if (windowChanged) {
            this.activationEndDate = null;
        }
        if (changes.workOrderNo() != null) {
            this.workOrderNo = changes.workOrderNo();
        }
        if (changes.workOrderDate() != null) {
            this.workOrderDate = changes.workOrderDate();
        }
        return List.of();
    }

    private void applyProfile(TerminalProfile p) {
        if (p == null) {
            return;
        }
        if (p.terminalName() != null) terminalName = p.terminalName().trim();
        if (p.shortCode() != null) shortCode = p.shortCode().trim();
        if (p.gst() != null) gst = p.gst();
        if (p.pan() != null) pan = p.pan();
        if (p.currency() != null) currency = p.currency();
        if (p.timezone() != null) timezone = p.timezone();
        if (p.billingAddress() != null) billingAddress = p.billingAddress();
        if (p.billingCity() != null) billingCity = p.billingCity();
        if (p.billingPinCode() != null) billingPinCode = p.billingPinCode();
        if (p.billingPhone() != null) billingPhone = p.billingPhone();
        if (p.billingFax() != null) billingFax = p.billingFax();
        if (p.shippingAddress() != null) shippingAddress = p.shippingAddress();
        if (p.shippingCity() != null) shippingCity = p.shippingCity();
        if (p.shippingPinCode() != null) shippingPinCode = p.shippingPinCode();
        if (p.shippingPhone() != null) shippingPhone = p.shippingPhone();
        if (p.shippingFax() != null) shippingFax = p.shippingFax();
        if (p.sameAsBilling() != null) sameAsBilling = p.sameAsBilling();

        if (sameAsBilling) {
            shippingAddress = billingAddress;
            shippingCity = billingCity;
            shippingPinCode = billingPinCode;
            shippingPhone = billingPhone;
            shippingFax = billingFax;
        }
        if (shortCode != null && shortCode.length() > 6) {
            throw new IllegalArgumentException("Short code must be at most 6 characters");
        }
    }

    private void requireProfileComplete() {
        Objects.requireNonNull(terminalName, "terminalName");
        Objects.requireNonNull(shortCode, "shortCode");
        Objects.requireNonNull(timezone, "timezone");
        Objects.requireNonNull(billingAddress, "billingAddress");
        Objects.requireNonNull(billingCity, "billingCity");
        Objects.requireNonNull(billingPinCode, "billingPinCode");
        Objects.requireNonNull(billingPhone, "billingPhone");
        Objects.requireNonNull(shippingAddress, "shippingAddress");
        Objects.requireNonNull(shippingCity, "shippingCity");
        Objects.requireNonNull(shippingPinCode, "shippingPinCode");
        Objects.requireNonNull(shippingPhone, "shippingPhone");
    }

    @Override
    public Long getId() { return id; }
    public Long getPortId() { return portId; }
    public String getTerminalName() { return terminalName; }
    public String getShortCode() { return shortCode; }
    public String getGst() { return gst; }
    public String getPan() { return pan; }
    public String getCurrency() { return currency; }
    public String getTimezone() { return timezone; }
    public String getBillingAddress() { return billingAddress; }
    public String getBillingCity() { return billingCity; }
    public String getBillingPinCode() { return billingPinCode; }
    public String getBillingPhone() { return billingPhone; }
    public String getBillingFax() { return billingFax; }
    public String getShippingAddress() { return shippingAddress; }
    public String getShippingCity() { return shippingCity; }
    public String getShippingPinCode() { return shippingPinCode; }
    public String getShippingPhone() { return shippingPhone; }
    public String getShippingFax() { return shippingFax; }
    public boolean isSameAsBilling() { return sameAsBilling; }
    public TerminalStatus getStatus() { return status; }
    public boolean isActive() { return active; }
    public Integer getSubscriptionTypeId() { return subscriptionTypeId; }
    public LocalDate getActivationStartDate() { return activationStartDate; }
    public LocalDate getActivationEndDate() { return activationEndDate; }
    public String getWorkOrderNo() { return workOrderNo; }
    public LocalDate getWorkOrderDate() { return workOrderDate; }
    public String getCreatedBy() { return createdBy; }
    public long getVersion() { return version; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
