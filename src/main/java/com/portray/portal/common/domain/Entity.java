package com.portray.portal.common.domain;

import java.io.Serializable;
import java.util.Objects;

/**
 * Base type for persistent domain objects. Identity-based equality once an id is assigned.
 */
public abstract class Entity<ID extends Serializable> {

    protected Entity() {
    }

    protected Entity(ID id) {
        Objects.requireNonNull(id, "id");
    }

    public abstract ID getId();

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Entity<?> other = (Entity<?>) o;
        return getId() != null && getId().equals(other.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
