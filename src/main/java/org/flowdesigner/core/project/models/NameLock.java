package org.flowdesigner.core.project.models;

/**
 * Why a field's name cannot be edited directly.
 * The two lock reasons never coexist: an object field cannot take an origin and an origin-linked field cannot
 * become an object field.
 */
public enum NameLock {
    NONE,
    FROM_OBJECT_TYPE,  // name mirrors the project's object type
    FROM_ORIGIN;       // name mirrors the origin field

    public boolean isLocked() {
        return this != NONE;
    }
}
