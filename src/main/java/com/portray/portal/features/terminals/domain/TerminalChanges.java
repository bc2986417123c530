package com.portray.portal.features.terminals.domain;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * A partial terminal update: profile fields plus the subscription and review fields that are
 * frozen once the terminal is active. Null means "unchanged".
 */
public record TerminalChanges(
    TerminalProfile profile,
    TerminalStatus status,
    Integer subscriptionTypeId,
    LocalDate activationStartDate,
    String workOrderNo,
    LocalDate workOrderDate
) {
    /**
     * Names of the supplied fields that an active terminal does not accept.
     */
    public List<String> restrictedFields() {
        List<String> names = new ArrayList<>();
        if (status != null) {
            names.add("status");
        }
        if (subscriptionTypeId != null) {
            names.add("subscriptionTypeId");
        }
        if (activationStartDate != null) {
            names.add("activationStartDate");
        }
        if (workOrderNo != null) {
            names.add("workOrderNo");
        }
        if (workOrderDate != null) {
            names.add("workOrderDate");
        }
        return names;
    }
}
