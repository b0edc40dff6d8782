package com.starscape.rapidvariant.common.domain;

/**
 * Marker for immutable types compared by value.
 */
public interface ValueObject {
}
