package io.kestra.plugin.adldap.query;

import io.kestra.plugin.adldap.client.DirectoryConfiguration;
import io.kestra.plugin.adldap.client.DirectoryConnection;
import io.kestra.plugin.adldap.client.RawEntry;
import io.kestra.plugin.adldap.exceptions.EntryNotFoundException;
import io.kestra.plugin.adldap.models.ActiveDirectory;
import io.kestra.plugin.adldap.models.Entry;
import io.kestra.plugin.adldap.models.EntryMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Fluent search over the directory.
 * <p>
 * Criteria are accumulated through the chained methods, then each terminal operation freezes them into a
 * {@link QueryState}, asks the connection according to the search mode and maps what comes back. Read and search
 * failures are reported as an empty {@link Optional}, distinct from a successful search matching nothing.
 * <p>
 * Instances are not thread-safe.
 */
public class Search {
    private static final Logger logger = LoggerFactory.getLogger(Search.class);

    private final DirectoryConnection connection;
    private final DirectoryConfiguration configuration;
    private final FilterBuilder query = new FilterBuilder();

    private boolean dnSet = false;
    private String dn;

    private boolean read = false;
    private boolean recursive = true;

    private String sortField;
    private SortDirection sortDirection = SortDirection.DESC;

    public Search(DirectoryConnection connection, DirectoryConfiguration configuration) {
        this.connection = connection;
        this.configuration = configuration;
    }

    /* SELECTION */

    public Search select(String... fields) {
        return this.select(Arrays.asList(fields));
    }

    public Search select(List<String> fields) {
        query.select(fields);
        return this;
    }

    /* CRITERIA */

    public Search where(String field, String value) {
        return this.where(field, Operator.EQUALS, value);
    }

    public Search where(String field, String operator, String value) {
        return this.where(field, Operator.fromSymbol(operator), value);
    }

    public Search where(String field, Operator operator, String value) {
        query.addPredicate(field, operator, value, BooleanOperator.AND);
        return this;
    }

    public Search whereContains(String field, String value) {
        return this.where(field, Operator.CONTAINS, value);
    }

    public Search whereStartsWith(String field, String value) {
        return this.where(field, Operator.STARTS_WITH, value);
    }

    public Search whereEndsWith(String field, String value) {
        return this.where(field, Operator.ENDS_WITH, value);
    }

    public Search whereHas(String field) {
        return this.where(field, Operator.HAS, null);
    }

    public Search orWhere(String field, String value) {
        return this.orWhere(field, Operator.EQUALS, value);
    }

    public Search orWhere(String field, String operator, String value) {
        return this.orWhere(field, Operator.fromSymbol(operator), value);
    }

    public Search orWhere(String field, Operator operator, String value) {
        query.addPredicate(field, operator, value, BooleanOperator.OR);
        return this;
    }

    public Search orWhereContains(String field, String value) {
        return this.orWhere(field, Operator.CONTAINS, value);
    }

    public Search orWhereStartsWith(String field, String value) {
        return this.orWhere(field, Operator.STARTS_WITH, value);
    }

    public Search orWhereEndsWith(String field, String value) {
        return this.orWhere(field, Operator.ENDS_WITH, value);
    }

    public Search orWhereHas(String field) {
        return this.orWhere(field, Operator.HAS, null);
    }

    /**
     * Appends an already formed filter clause, e.g. {@code (memberOf:1.2.840.113556.1.4.1941:=CN=Admins,DC=acme)}.
     */
    public Search rawFilter(String clause) {
        query.addRawFilter(clause, BooleanOperator.AND);
        return this;
    }

    public Search orRawFilter(String clause) {
        query.addRawFilter(clause, BooleanOperator.OR);
        return this;
    }

    /* SCOPE */

    /**
     * Sets the DN to search from. {@code null} targets the directory root, an empty string the base DN.
     */
    public Search setDn(String dn) {
        this.dnSet = true;
        this.dn = dn;
        return this;
    }

    /**
     * @return the DN the next query runs against, {@code null} for the directory root.
     */
    public String getDn() {
        if (dnSet && dn == null) {
            return null;
        }
        if (dnSet && !dn.isEmpty()) {
            return dn;
        }
        return this.getBaseDn().orElse(null);
    }

    public Optional<String> getBaseDn() {
        String baseDn = configuration.getBaseDn();
        if (baseDn != null && !baseDn.isBlank()) {
            return Optional.of(baseDn);
        }
        return this.findBaseDn();
    }

    public Search read() {
        return this.read(true);
    }

    public Search read(boolean read) {
        this.read = read;
        return this;
    }

    public Search recursive() {
        return this.recursive(true);
    }

    public Search recursive(boolean recursive) {
        this.recursive = recursive;
        return this;
    }

    public Search sortBy(String field) {
        return this.sortBy(field, "desc");
    }

    public Search sortBy(String field, String direction) {
        this.sortField = field;
        this.sortDirection = SortDirection.of(direction);
        return this;
    }

    public FilterBuilder getQueryBuilder() {
        return query;
    }

    public String getQuery() {
        return query.render();
    }

    /**
     * Freezes the current criteria, resolving the target DN.
     */
    public QueryState snapshot(boolean raw) {
        String target = this.getDn();

        return QueryState.builder()
            .selects(query.getSelects())
            .predicates(query.getPredicates())
            .dn(target)
            .resolved(target != null || (dnSet && dn == null))
            .mode(SearchMode.of(read, recursive))
            .raw(raw)
            .sortField(sortField)
            .sortDirection(sortDirection)
            .build();
    }

    /* TERMINALS */

    public Optional<List<Entry>> query(String filter) {
        QueryState state = this.snapshot(false);

        return this.execute(state, filter)
            .map(entries -> entries.stream().map(EntryMapper::map).collect(Collectors.toList()))
            .map(entries -> sort(entries, state, entry -> entry.getFirstAttribute(state.getSortField())));
    }

    public Optional<List<RawEntry>> queryRaw(String filter) {
        QueryState state = this.snapshot(true);

        return this.execute(state, filter)
            .map(entries -> sort(entries, state, entry -> entry.first(state.getSortField())));
    }

    public Optional<List<Entry>> get() {
        return this.query(this.getQuery());
    }

    public Optional<List<RawEntry>> getRaw() {
        return this.queryRaw(this.getQuery());
    }

    /**
     * Every entry carrying a common name below the target DN.
     */
    public Optional<List<Entry>> all() {
        query.addWildcard(ActiveDirectory.COMMON_NAME);
        return this.get();
    }

    public Optional<Entry> first() {
        return this.get().flatMap(entries -> entries.stream().findFirst());
    }

    public Optional<RawEntry> firstRaw() {
        return this.getRaw().flatMap(entries -> entries.stream().findFirst());
    }

    /**
     * Finds an entry through ambiguous name resolution.
     */
    public Optional<Entry> find(String anr) {
        return this.where(ActiveDirectory.ANR, anr).first();
    }

    public Entry findOrFail(String anr) throws EntryNotFoundException {
        return this.find(anr)
            .orElseThrow(() -> new EntryNotFoundException("Unable to find record in Active Directory."));
    }

    public Optional<Entry> findByDn(String dn) {
        return this.setDn(dn)
            .read(true)
            .where(ActiveDirectory.OBJECT_CLASS, Operator.WILDCARD, null)
            .first();
    }

    public Entry findByDnOrFail(String dn) throws EntryNotFoundException {
        return this.findByDn(dn)
            .orElseThrow(() -> new EntryNotFoundException(String.format("Unable to find record \"%s\" in Active Directory.", dn)));
    }

    /**
     * Reads the root DSE for the default naming context of the domain.
     */
    public Optional<String> findBaseDn() {
        return new Search(connection, configuration)
            .setDn(null)
            .read()
            .select(ActiveDirectory.DEFAULT_NAMING_CONTEXT)
            .where(ActiveDirectory.OBJECT_CLASS, Operator.WILDCARD, null)
            .firstRaw()
            .flatMap(entry -> entry.first(ActiveDirectory.DEFAULT_NAMING_CONTEXT));
    }

    public Optional<Paginator> paginate() {
        return this.paginate(configuration.getDefaultPageSize(), 0, true);
    }

    /**
     * Fetches every page of a subtree search then exposes the page {@code currentPage} (zero based) of the
     * combined results.
     *
     * @param isCritical whether the server must fail the search rather than ignore the paging control
     * @return empty when any page request failed
     */
    public Optional<Paginator> paginate(int perPage, int currentPage, boolean isCritical) {
        if (perPage <= 0) {
            throw new IllegalArgumentException("Page size must be strictly positive, got " + perPage);
        }
        if (currentPage < 0) {
            throw new IllegalArgumentException("Page number can't be negative, got " + currentPage);
        }

        QueryState state = this.snapshot(false);
        if (!state.isResolved()) {
            return unresolved();
        }
        PageIterator pages = new PageIterator(connection, state.getDn(), state.getFilter(), state.getSelects(), perPage, isCritical);

        if (!pages.hasNext()) {
            return Optional.empty();
        }

        List<RawEntry> rawEntries = new ArrayList<>();
        pages.forEachRemaining(page -> rawEntries.addAll(page.getEntries()));

        if (pages.isFailed()) {
            logger.warn("Paged search on '{}' failed after {} page(s), dropping the partial results", state.getDn(), pages.getFetched());
            return Optional.empty();
        }

        List<Entry> entries = rawEntries.stream().map(EntryMapper::map).collect(Collectors.toList());

        return Optional.of(new Paginator(
            sort(entries, state, entry -> entry.getFirstAttribute(state.getSortField())),
            perPage,
            currentPage,
            pages.getFetched()
        ));
    }

    private Optional<List<RawEntry>> execute(QueryState state, String filter) {
        if (!state.isResolved()) {
            return unresolved();
        }

        switch (state.getMode()) {
            case READ:
                return connection.read(state.getDn(), filter, state.getSelects());
            case RECURSIVE:
                return connection.search(state.getDn(), filter, state.getSelects());
            default:
                return connection.listing(state.getDn(), filter, state.getSelects());
        }
    }

    private static <T> Optional<T> unresolved() {
        logger.warn("No base DN configured and none found in the root DSE, not searching from the directory root");
        return Optional.empty();
    }

    /**
     * Stable sort on the first value of the sort field, ignoring case. Rows without the field take no part in
     * the ordering and keep their relative order after the sorted rows.
     */
    static <T> List<T> sort(List<T> rows, QueryState state, Function<T, Optional<String>> key) {
        if (!state.isSorted() || rows.isEmpty()) {
            return rows;
        }

        List<T> keyed = new ArrayList<>();
        List<T> missing = new ArrayList<>();
        rows.forEach(row -> (key.apply(row).isPresent() ? keyed : missing).add(row));

        Comparator<T> comparator = Comparator.comparing((T row) -> key.apply(row).orElseThrow(), String.CASE_INSENSITIVE_ORDER);
        if (state.getSortDirection() == SortDirection.DESC) {
            comparator = comparator.reversed();
        }
        keyed.sort(comparator);

        keyed.addAll(missing);
        return keyed;
    }
}
