package io.kestra.plugin.adldap;

import io.kestra.core.exceptions.IllegalVariableEvaluationException;
import io.kestra.core.models.annotations.Example;
import io.kestra.core.models.annotations.Metric;
import io.kestra.core.models.annotations.Plugin;
import io.kestra.core.models.annotations.PluginProperty;
import io.kestra.core.models.executions.metrics.Counter;
import io.kestra.core.models.executions.metrics.Timer;
import io.kestra.core.models.tasks.RunnableTask;
import io.kestra.core.runners.RunContext;
import io.kestra.plugin.adldap.client.Adldap;
import io.kestra.plugin.adldap.models.Entry;
import io.kestra.plugin.adldap.query.Operator;
import io.kestra.plugin.adldap.query.Paginator;
import io.kestra.plugin.adldap.query.Search;
import io.kestra.plugin.adldap.query.SearchMode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.Value;
import lombok.experimental.SuperBuilder;
import lombok.extern.jackson.Jacksonized;
import org.slf4j.Logger;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@SuperBuilder
@ToString
@EqualsAndHashCode
@Getter
@NoArgsConstructor
@Schema(
    title = "Query Active Directory entries.",
    description = """
        Builds an LDAP filter from a list of conditions, runs it below a DN and stores the matching entries in an ION file.
        Each entry is typed from its objectCategory (USER, GROUP, COMPUTER, CONTAINER, PRINTER, EXCHANGE_SERVER or GENERIC)."""
)
@Plugin(
    examples = {
        @Example(
            title = "List the enabled users of a department, sorted by account name.",
            full = true,
            code = """
                id: adldap_query
                namespace: company.team

                tasks:
                  - id: query
                    type: io.kestra.plugin.adldap.Query
                    hostname: dc01.acme.org
                    port: "389"
                    userDn: svc-kestra@acme.org
                    password: "{{ secret('AD_PASSWORD') }}"
                    baseDn: dc=acme,dc=org
                    conditions:
                      - field: objectCategory
                        value: person
                      - field: department
                        operator: starts_with
                        value: Sales
                      - field: userAccountControl
                        operator: "!"
                        value: "514"
                    attributes:
                      - samaccountname
                      - mail
                    sortBy: samaccountname
                    sortDirection: asc
                """
        ),
        @Example(
            title = "Export every group of the domain using paged searches.",
            code = {"""
                id: export_groups
                type: io.kestra.plugin.adldap.Query
                hostname: dc01.acme.org
                port: "636"
                ssl: true
                userDn: svc-kestra@acme.org
                password: "{{ secret('AD_PASSWORD') }}"
                conditions:
                  - field: objectCategory
                    value: group
                pageSize: 500
                """}
        )
    },
    metrics = {
        @Metric(
            name = "entries.found",
            type = Counter.TYPE,
            description = "The total number of entries found by the query."
        ),
        @Metric(
            name = "search.mean.time",
            type = Timer.TYPE,
            description = "The time taken to complete the query."
        )
    }
)
public class Query extends AdldapConnection implements RunnableTask<Query.Output> {
    /** INPUTS ---------------------------------------------------------------------------------------------------- // **/

    @Schema(
        title = "Conditions",
        description = """
            Conditions combined left to right. A condition with `or: true` is joined with OR to everything before it,
            otherwise with AND. Consecutive conditions sharing the same boolean are grouped together.
            Operators : `=`, `!`, `*`, `!*`, `>=`, `<=`, `~=`, `contains`, `starts_with`, `ends_with`."""
    )
    @PluginProperty(dynamic = true)
    private List<Condition> conditions;

    @Schema(
        title = "Raw filter",
        description = "An already formed LDAP filter clause appended with AND to the conditions."
    )
    @PluginProperty(dynamic = true)
    private String rawFilter;

    @Schema(
        title = "DN",
        description = "DN to search from, the base DN by default."
    )
    @PluginProperty(dynamic = true)
    private String dn;

    @Schema(
        title = "Attributes",
        description = "Specific attributes to retrieve from the matching entries. Retrieves all attributes by default."
    )
    @PluginProperty(dynamic = true)
    private List<String> attributes;

    @Schema(
        title = "Search mode",
        description = """
            READ -- Only the entry at the DN.
            RECURSIVE -- The whole subtree below the DN.
            LISTING -- The immediate children of the DN."""
    )
    @PluginProperty
    @NotNull
    @Default
    private SearchMode mode = SearchMode.RECURSIVE;

    @Schema(
        title = "Sort field",
        description = "Attribute to sort entries on, case insensitively. Entries without it come last in server order."
    )
    @PluginProperty(dynamic = true)
    private String sortBy;

    @Schema(
        title = "Sort direction",
        allowableValues = {"asc", "desc"}
    )
    @PluginProperty(dynamic = true)
    @Default
    private String sortDirection = "desc";

    @Schema(
        title = "Page size",
        description = """
            Enable LDAP paging (RFC2696) and fetch results by chunks of this size, always searching the subtree.
            Use this to retrieve every matching entry when there are more than the server size limit."""
    )
    @PluginProperty
    private Integer pageSize;

    @Schema(
        title = "Paging is critical",
        description = "Whether the server must reject the search when it can't honour the paging control, instead of ignoring it. " +
            "When set, a page cut short by the server size limit fails the query; otherwise the truncated page is kept."
    )
    @PluginProperty
    @Default
    private Boolean sizeLimitIsCritical = true;

    @Schema(
        title = "Raw entries",
        description = "Store entries as the server returned them, without the mapped type."
    )
    @PluginProperty
    @Default
    private Boolean raw = false;

    /** OUTPUTS --------------------------------------------------------------------------------------------------- // **/

    @Builder
    @Getter
    public static class Output implements io.kestra.core.models.tasks.Output {
        @Schema(
            title = "Result file URI",
            description = "An ION file holding one struct per entry: dn, type and attributes."
        )
        private final URI uri;

        @Schema(
            title = "Number of entries found"
        )
        private final Integer size;
    }

    @Value
    @Builder
    @Jacksonized
    public static class Condition {
        @Schema(title = "Attribute to test")
        @NotNull
        String field;

        @Schema(title = "Operator symbol")
        @Builder.Default
        String operator = "=";

        @Schema(title = "Value to compare with, unused by `*` and `!*`")
        String value;

        @Schema(title = "Join with OR instead of AND")
        @Builder.Default
        Boolean or = false;
    }

    /** CODE ------------------------------------------------------------------------------------------------------ // **/

    @Override
    public Query.Output run(RunContext runContext) throws Exception {
        Logger logger = runContext.logger();

        List<Entry> entries;
        long searchTime;

        try (Adldap directory = this.openDirectory(runContext)) {
            Search search = this.buildSearch(directory, runContext);
            logger.debug("Querying with filter {}", search.getQuery());

            long startTime = System.currentTimeMillis();
            entries = this.execute(search)
                .orElseThrow(() -> new IllegalStateException("Directory query failed, see previous logs for the LDAP response."));
            searchTime = System.currentTimeMillis() - startTime;
        }

        URI storedResults = Utils.storeEntries(runContext, entries, Boolean.TRUE.equals(this.raw));

        runContext.metric(Counter.of("entries.found", entries.size(), "origin", "Query"));
        runContext.metric(Timer.of("search.mean.time", Duration.ofMillis(searchTime), "origin", "Query"));

        return Output.builder()
            .uri(storedResults)
            .size(entries.size())
            .build();
    }

    Search buildSearch(Adldap directory, RunContext runContext) throws IllegalVariableEvaluationException {
        Search search = directory.search()
            .select(renderList(runContext, this.attributes))
            .read(this.mode == SearchMode.READ)
            .recursive(this.mode != SearchMode.LISTING);

        if (this.conditions != null) {
            for (Condition condition : this.conditions) {
                String field = runContext.render(condition.getField());
                Operator operator = Operator.fromSymbol(condition.getOperator() == null ? "=" : runContext.render(condition.getOperator()));
                String value = condition.getValue() == null ? null : runContext.render(condition.getValue());

                if (Boolean.TRUE.equals(condition.getOr())) {
                    search.orWhere(field, operator, value);
                } else {
                    search.where(field, operator, value);
                }
            }
        }

        if (this.rawFilter != null) {
            search.rawFilter(runContext.render(this.rawFilter).replaceAll("\n\\s*", ""));
        }
        if (this.dn != null) {
            search.setDn(runContext.render(this.dn));
        }
        if (this.sortBy != null) {
            search.sortBy(runContext.render(this.sortBy), this.sortDirection == null ? "desc" : runContext.render(this.sortDirection));
        }

        return search;
    }

    private Optional<List<Entry>> execute(Search search) {
        if (this.pageSize != null && this.pageSize > 0) {
            return search.paginate(this.pageSize, 0, this.sizeLimitIsCritical == null || this.sizeLimitIsCritical)
                .map(Paginator::getResults);
        }
        if (Boolean.TRUE.equals(this.raw)) {
            return search.getRaw()
                .map(rawEntries -> rawEntries.stream().map(Entry::new).collect(Collectors.toList()));
        }
        return search.get();
    }
}
