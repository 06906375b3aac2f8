package com.existence.arbitration.core.model;

/**
 * Kind of actor recorded on a status transition.
 */
public enum ActorType {
    USER,
    SYSTEM,
    AI
}
