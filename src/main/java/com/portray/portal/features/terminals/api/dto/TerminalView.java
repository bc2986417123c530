package com.portray.portal.features.terminals.api.dto;

import com.portray.portal.features.terminals.domain.Terminal;
import com.portray.portal.features.terminals.domain.TerminalStatus;

import java.time.Instant;
import java.time.LocalDate;

public record TerminalView(
    Long id,
    Long portId,
    String terminalName,
    String shortCode,
    String gst,
    String pan,
    String currency,
    String timezone,
    String billingAddress,
    String billingCity,
    String billingPinCode,
    String billingPhone,
    String billingFax,
    String shippingAddress,
    String shippingCity,
    String shippingPinCode,
    String shippingPhone,
    String shippingFax,
    boolean sameAsBilling,
    TerminalStatus status,
    boolean isActive,
    Integer subscriptionTypeId,
    LocalDate activationStartDate,
    LocalDate activationEndDate,
    String workOrderNo,
    LocalDate workOrderDate,
    String createdBy,
    long version,
    Instant createdAt,
    Instant updatedAt
) {
    public static TerminalView from(Terminal t) {
        return new TerminalView(
            t.getId(), t.getPortId(), t.getTerminalName(), t.getShortCode(), t.getGst(), t.getPan(),
            t.getCurrency(), t.getTimezone(),
            t.getBillingAddress(), t.getBillingCity(), t.getBillingPinCode(), t.getBillingPhone(), t.getBillingFax(),
            t.getShippingAddress(), t.getShippingCity(), t.getShippingPinCode(), t.getShippingPhone(),
            t.getShippingFax(), t.isSameAsBilling(),
            t.getStatus(), t.isActive(), t.getSubscriptionTypeId(),
            t.getActivationStartDate(), t.getActivationEndDate(), t.getWorkOrderNo(), t.getWorkOrderDate(),
            t.getCreatedBy(), t.getVersion(), t.getCreatedAt(), t.getUpdatedAt()
        );
    }
}
