package com.portray.portal.features.terminals.api.dto;

import com.portray.portal.features.terminals.domain.TerminalProfile;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateTerminalRequest(
    @NotBlank String terminalName,

    @NotBlank @Size(max = 6, message = "Short code must be at most 6 characters")
    String shortCode,

    String gst,
    String pan,
    String currency,
    @NotBlank String timezone,

    @NotBlank String billingAddress,
    @NotBlank String billingCity,
    @NotBlank String billingPinCode,
    @NotBlank String billingPhone,
    String billingFax,

    String shippingAddress,
    String shippingCity,
    String shippingPinCode,
    String shippingPhone,
    String shippingFax,
    Boolean sameAsBilling
) {
    public TerminalProfile toProfile() {
        return new TerminalProfile(terminalName, shortCode, gst, pan, currency, timezone,
                billingAddress, billingCity, billingPinCode, billingPhone, billingFax,
                shippingAddress, shippingCity, shippingPinCode, shippingPhone, shippingFax,
                sameAsBilling);
    }
}
