package com.portray.portal.features.menus.infra;

import com.portray.portal.features.menus.domain.Menu;
import com.portray.portal.features.menus.domain.MenuRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JpaMenuRepository extends JpaRepository<Menu, Long>, MenuRepository {

    @Override
    List<Menu> findAllByOrderBySortOrderAscIdAsc();

    @Override
    boolean existsByName(String name);

    @Override
    boolean existsByParentId(Long parentId);
}
