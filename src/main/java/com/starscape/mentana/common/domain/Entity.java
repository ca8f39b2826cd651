package com.starscape.mentana.common.domain;

import java.io.Serializable;
import java.util.Objects;

/**
 * Base class for entities with identity-based equality.
 * The id is fixed at construction and never reassigned.
 */
public abstract class Entity<ID extends Serializable> {

    private final ID id;

    protected Entity(ID id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    public ID getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Entity<?> other = (Entity<?>) o;
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }
}
