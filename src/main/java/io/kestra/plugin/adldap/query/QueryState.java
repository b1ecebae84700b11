package io.kestra.plugin.adldap.query;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Frozen view of a {@link Search} taken when a query runs, so that running it never observes later mutations.
 */
@Value
@Builder
public class QueryState {
    @Singular
    List<String> selects;

    @Singular
    List<Predicate> predicates;

    /** Resolved target, {@code null} meaning the directory root. */
    String dn;

    /** False when no DN was set and no base DN could be found, {@code dn} is then unusable. */
    @Builder.Default
    boolean resolved = true;

    @Builder.Default
    SearchMode mode = SearchMode.RECURSIVE;

    boolean raw;

    String sortField;

    @Builder.Default
    SortDirection sortDirection = SortDirection.DESC;

    /**
     * Renders the filter of this state; recomputed on every call.
     */
    public String getFilter() {
        return FilterBuilder.render(predicates);
    }

    public boolean isSorted() {
        return sortField != null;
    }
}
