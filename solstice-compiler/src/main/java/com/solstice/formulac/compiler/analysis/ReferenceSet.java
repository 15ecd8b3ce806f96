package com.solstice.formulac.compiler.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything a formula references, as recovered by {@link FormulaAnalyzer}.
 *
 * @param variables            variable names, in order of first appearance (aggregation members included)
 * @param parameters           maximal parameter paths, alias prefixes already substituted
 * @param aggregationVariables names listed in {@code add(entity, period, [...])} calls
 * @param listCandidates       other literal string lists that may name variables
 * @param aliases              alias name to parameter path prefix ({@code ""} for the root)
 * @param conditionalCalls     {@code where(...)} call sites, verbatim
 * @param entityCalls          every entity or member call site found
 * @param entityType           first parameter of the formula signature
 * @param structural           false when the pattern scan replaced structural parsing
 */
public record ReferenceSet(
        Set<String> variables,
        Set<String> parameters,
        Set<String> aggregationVariables,
        Set<String> listCandidates,
        Map<String, String> aliases,
        List<String> conditionalCalls,
        List<EntityCall> entityCalls,
        String entityType,
        boolean structural
) {

    /**
     * A call such as {@code person("income", period)} or {@code household.members("age", period)}.
     *
     * @param accessor the called entity keyword or member accessor
     * @param variable the referenced variable
     */
    public record EntityCall(String accessor, String variable) {
    }

    public ReferenceSet {
        variables = Collections.unmodifiableSet(new LinkedHashSet<>(variables));
        parameters = Collections.unmodifiableSet(new LinkedHashSet<>(parameters));
        aggregationVariables = Collections.unmodifiableSet(new LinkedHashSet<>(aggregationVariables));
        listCandidates = Collections.unmodifiableSet(new LinkedHashSet<>(listCandidates));
        aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
        conditionalCalls = List.copyOf(conditionalCalls);
        entityCalls = List.copyOf(entityCalls);
    }

    public static ReferenceSet empty(String entityType) {
        return new ReferenceSet(Set.of(), Set.of(), Set.of(), Set.of(), Map.of(),
                List.of(), List.of(), entityType, true);
    }

    public boolean isEmpty() {
        return variables.isEmpty() && parameters.isEmpty() && listCandidates.isEmpty();
    }
}
