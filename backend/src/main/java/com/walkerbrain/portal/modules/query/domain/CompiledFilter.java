package com.walkerbrain.portal.modules.query.domain;

import java.util.List;

/**
 * Sorted predicate list plus its canonical text. Two filter sets that differ only in construction order
 * compile to equal instances.
 */
public record CompiledFilter(List<StorePredicate> predicates, String canonical) {

    public static final CompiledFilter EMPTY = new CompiledFilter(List.of(), "");

    public CompiledFilter {
        predicates = List.copyOf(predicates);
    }

    public boolean matchesNothing() {
        return predicates.stream().anyMatch(p -> p.operator() == PredicateOperator.MATCH_NONE);
    }

    public boolean isEmpty() {
        return predicates.isEmpty();
    }
}
