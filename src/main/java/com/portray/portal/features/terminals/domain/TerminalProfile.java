package com.portray.portal.features.terminals.domain;

/**
 * The descriptive fields of a terminal: names, codes, tax ids, currency, timezone and both
 * addresses. These remain editable after activation. Null components mean "unchanged" when
 * used as an update.
 */
public record TerminalProfile(
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
    Boolean sameAsBilling
) {}
