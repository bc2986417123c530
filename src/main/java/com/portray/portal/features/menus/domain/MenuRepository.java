package com.portray.portal.features.menus.domain;

import java.util.List;
import java.util.Optional;

public interface MenuRepository {
    Menu save(Menu menu);
    Optional<Menu> findById(Long id);
    List<Menu> findAllByOrderBySortOrderAscIdAsc();
    boolean existsByName(String name);
    boolean existsByParentId(Long parentId);
    void delete(Menu menu);
}
