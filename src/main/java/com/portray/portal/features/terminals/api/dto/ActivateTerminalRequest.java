package com.portray.portal.features.terminals.api.dto;

import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

public record ActivateTerminalRequest(
    @NotNull(message = "Activation start date is required")
    LocalDate activationStartDate,

    @NotNull(message = "Subscription type is required")
    Integer subscriptionTypeId,

    String workOrderNo,
    LocalDate workOrderDate
) {}
