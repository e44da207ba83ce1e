package com.valkyrlabs.gruff.security;

import java.util.List;
import java.util.Set;

/**
 * Row restriction for list queries over ACL-scoped rows.
 *
 * <p>
 * When {@link #isUseFilter()} is {@code false} the accessible set was too large to
 * inline; the caller fetches without the clause, over-fetching, and applies
 * {@link GraphAccessEvaluator#filterByPermission} to the rows.
 * </p>
 */
public class AclListFilter {

    private final boolean useFilter;
    private final String clause;
    private final List<Object> bindings;
    private final Set<Long> accessibleAclIds;

    public AclListFilter(boolean useFilter, String clause, List<Object> bindings, Set<Long> accessibleAclIds) {
        this.useFilter = useFilter;
        this.clause = clause;
        this.bindings = List.copyOf(bindings);
        this.accessibleAclIds = Set.copyOf(accessibleAclIds);
    }

    public boolean isUseFilter() {
        return useFilter;
    }

    /**
     * SQL predicate with positional {@code ?} placeholders, {@code null} when the
     * filter is not used.
     */
    public String getClause() {
        return clause;
    }

    /** Values for the placeholders of {@link #getClause()}, in order. */
    public List<Object> getBindings() {
        return bindings;
    }

    public Set<Long> getAccessibleAclIds() {
        return accessibleAclIds;
    }

    @Override
    public String toString() {
        return "AclListFilter[useFilter=" + useFilter + ", clause=" + clause + ", accessible="
                + accessibleAclIds.size() + "]";
    }
}
