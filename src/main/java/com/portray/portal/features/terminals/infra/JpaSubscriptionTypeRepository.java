package com.portray.portal.features.terminals.infra;

import com.portray.portal.features.terminals.domain.SubscriptionType;
import com.portray.portal.features.terminals.domain.SubscriptionTypeRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JpaSubscriptionTypeRepository
        extends JpaRepository<SubscriptionType, Integer>, SubscriptionTypeRepository {

    @Override
    List<SubscriptionType> findByActiveTrueOrderByMonthsAsc();
}
