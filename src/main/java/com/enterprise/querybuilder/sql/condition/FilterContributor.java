package com.enterprise.querybuilder.sql.condition;

/**
 * Supplies extra WHERE predicates from outside the builder (a filter DSL, a
 * tenant guard, ...). Invoked at most once per build, after the built-in
 * filters.
 *
 * <p>The contributor numbers its own placeholders: with numbering on, its
 * first placeholder is {@code placeholder + (parameterOffset + 1)}.
 */
@FunctionalInterface
public interface FilterContributor {

    /**
     * @param parameterOffset number of the last placeholder emitted so far
     * @param placeholder     the dialect's placeholder token, e.g. {@code @p}
     * @param inSequence      whether placeholders are numbered
     * @return fragments joined with AND, plus their arguments in placeholder order
     */
    FilterContribution contribute(int parameterOffset, String placeholder, boolean inSequence);
}
