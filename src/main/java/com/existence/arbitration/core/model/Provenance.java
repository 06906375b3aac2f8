package com.existence.arbitration.core.model;

/**
 * Origin of a binding. AI-created bindings with low confidence start out pending.
 */
public enum Provenance {
    USER,
    AI,
    SYSTEM
}
