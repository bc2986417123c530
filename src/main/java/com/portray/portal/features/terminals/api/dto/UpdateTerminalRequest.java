package com.portray.portal.features.terminals.api.dto;

import com.portray.portal.features.terminals.domain.TerminalProfile;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Partial update; null fields keep their current value.
 */
public record UpdateTerminalRequest(
    String terminalName,
    @Size(max = 6, message = "Short code must be at most 6 characters")
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
    Boolean sameAsBilling,

    String status,
    Integer subscriptionTypeId,
    LocalDate activationStartDate,
    String workOrderNo,
    LocalDate workOrderDate
) {
    public TerminalProfile toProfile() {
        return new TerminalProfile(terminalName, shortCode, gst, pan, currency, timezone,
                billingAddress, billingCity, billingPinCode, billingPhone, billingFax,
                shippingAddress, shippingCity, shippingPinCode, shippingPhone, shippingFax,
                sameAsBilling);
    }

    public List<String> profileFieldsSupplied() {
        List<String> names = new ArrayList<>();
        addIfPresent(names, "terminalName", terminalName);
        addIfPresent(names, "shortCode", shortCode);
        addIfPresent(names, "gst", gst);
        addIfPresent(names, "pan", pan);
        addIfPresent(names, "currency", currency);
        addIfPresent(names, "timezone", timezone);
        addIfPresent(names, "billingAddress", billingAddress);
        addIfPresent(names, "billingCity", billingCity);
        addIfPresent(names, "billingPinCode", billingPinCode);
        addIfPresent(names, "billingPhone", billingPhone);
        addIfPresent(names, "billingFax", billingFax);
        addIfPresent(names, "shippingAddress", shippingAddress);
        addIfPresent(names, "shippingCity", shippingCity);
        addIfPresent(names, "shippingPinCode", shippingPinCode);
        addIfPresent(names, "shippingPhone", shippingPhone);
        addIfPresent(names, "shippingFax", shippingFax);
        addIfPresent(names, "sameAsBilling", sameAsBilling);
        return names;
    }

    private static void addIfPresent(List<String> names, String name, Object value) {
        if (value != null) {
            names.add(name);
        }
    }
}
