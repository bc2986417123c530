package com.portray.portal.features.terminals.domain;

import java.util.List;
import java.util.Optional;

public interface SubscriptionTypeRepository {
    Optional<SubscriptionType> findById(Integer id);
    List<SubscriptionType> findByActiveTrueOrderByMonthsAsc();
}
