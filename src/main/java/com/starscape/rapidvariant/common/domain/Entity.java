package com.starscape.rapidvariant.common.domain;

import java.io.Serializable;
import java.util.Objects;

public abstract class Entity<ID extends Serializable> {
    
    private transient ID identity;
    
    protected Entity() {
        // JPA constructor
    }
    
    protected Entity(ID id) {
        if (id == null) {
            throw new IllegalArgumentException("Entity ID cannot be null");
        }
        this.identity = id;
    }
    
    public ID getId() {
        return identity;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity<?> other = (Entity<?>) o;
        return getId() != null && Objects.equals(getId(), other.getId());
    }
    
    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
