package com.starscape.tweets.common.domain;

import java.io.Serializable;

/**
 * Base class for persistent entities with an application-assigned identity.
 * Subclasses map the id column themselves and expose it through {@link #getId()}.
 * Two entities are equal when they are of the same class and share a non-null id.
 */
public abstract class Entity<ID extends Serializable> {
    
    protected Entity() {
        // JPA constructor
    }
    
    protected Entity(ID id) {
        if (id == null || id.toString().isBlank()) {
            throw new IllegalArgumentException("Entity ID cannot be blank");
        }
    }
    
    public abstract ID getId();
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity<?> other = (Entity<?>) o;
        return getId() != null && getId().equals(other.getId());
    }
    
    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
