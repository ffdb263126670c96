package com.lodestar.core.fact;

/**
 * Representation kind of a fact, as declared by its emission.
 * Purely descriptive: the engine never interprets it.
 */
public enum FactKind {
    FACT,
    PROGRESS,
    AUTHORIZATION,
    KNOWLEDGE,
    ARTIFACT,
    DIAGNOSTIC
}
