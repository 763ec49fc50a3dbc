package com.openforge.recall.belief;

/**
 * Source of the active belief snapshot used by belief alignment.
 */
public interface ActiveBeliefProvider {

    ActiveBeliefSet current();
}
