package com.portray.portal.features.terminals.api.dto;

import com.portray.portal.features.terminals.domain.SubscriptionType;

public record SubscriptionTypeView(Integer id, String name, int months) {
    public static SubscriptionTypeView from(SubscriptionType type) {
        return new SubscriptionTypeView(type.getId(), type.getName(), type.getMonths());
    }
}
