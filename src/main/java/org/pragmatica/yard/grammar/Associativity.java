package org.pragmatica.yard.grammar;

/**
 * Grouping direction for a run of operators with equal precedence.
 */
public enum Associativity {
    LEFT,
    RIGHT
}
