package io.kestra.plugin.adldap;

import io.kestra.core.models.annotations.Example;
import io.kestra.core.models.annotations.Metric;
import io.kestra.core.models.annotations.Plugin;
import io.kestra.core.models.annotations.PluginProperty;
import io.kestra.core.models.executions.metrics.Counter;
import io.kestra.core.models.tasks.RunnableTask;
import io.kestra.core.runners.RunContext;
import io.kestra.plugin.adldap.client.Adldap;
import io.kestra.plugin.adldap.exceptions.EntryNotFoundException;
import io.kestra.plugin.adldap.management.Groups;
import io.kestra.plugin.adldap.models.Entry;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import org.slf4j.Logger;

import java.net.URI;
import java.util.List;

@SuperBuilder
@ToString
@EqualsAndHashCode
@Getter
@NoArgsConstructor
@Schema(
    title = "List the members or the memberships of an Active Directory group.",
    description = """
        MEMBERS -- The users of the group, stored as entries like the Query task does.
        NESTED_GROUPS -- The DNs of the groups member of the group, following nested groups when `recursive` is set.
        PARENT_GROUPS -- The DN of the group then the DNs of every group it belongs to, directly or not."""
)
@Plugin(
    examples = {
        @Example(
            full = true,
            code = """
                id: adldap_audit_admins
                namespace: company.team

                tasks:
                  - id: admins
                    type: io.kestra.plugin.adldap.GroupMembers
                    hostname: dc01.acme.org
                    port: "636"
                    ssl: true
                    userDn: svc-kestra@acme.org
                    password: "{{ secret('AD_PASSWORD') }}"
                    group: Domain Admins
                    listing: MEMBERS
                    attributes:
                      - samaccountname
                      - mail
                """
        )
    },
    metrics = {
        @Metric(
            name = "entries.found",
            type = Counter.TYPE,
            description = "The number of members or groups listed."
        )
    }
)
public class GroupMembers extends AdldapConnection implements RunnableTask<GroupMembers.Output> {
    @Schema(
        title = "Group",
        description = "Name of the group, resolved through ambiguous name resolution."
    )
    @PluginProperty(dynamic = true)
    @NotNull
    private String group;

    @Schema(
        title = "What to list"
    )
    @PluginProperty
    @NotNull
    @Default
    private Listing listing = Listing.MEMBERS;

    @Schema(
        title = "Attributes",
        description = "Attributes to retrieve for each member with the MEMBERS listing. Retrieves all attributes by default."
    )
    @PluginProperty(dynamic = true)
    private List<String> attributes;

    @Schema(
        title = "Follow nested groups",
        description = "For the NESTED_GROUPS listing. Defaults to `recursiveGroups`."
    )
    @PluginProperty
    private Boolean recursive;

    public enum Listing {
        MEMBERS,
        NESTED_GROUPS,
        PARENT_GROUPS
    }

    @Builder
    @Getter
    public static class Output implements io.kestra.core.models.tasks.Output {
        @Schema(
            title = "Result file URI",
            description = "An ION file holding entries for MEMBERS, `{dn: ...}` structs otherwise."
        )
        private final URI uri;

        @Schema(
            title = "Number of members or groups listed"
        )
        private final Integer size;
    }

    @Override
    public GroupMembers.Output run(RunContext runContext) throws Exception {
        Logger logger = runContext.logger();
        String rGroup = runContext.render(this.group);

        URI uri;
        int size;

        try (Adldap directory = this.openDirectory(runContext)) {
            Groups groups = directory.groups();

            switch (this.listing) {
                case NESTED_GROUPS: {
                    List<String> nested = groups.inGroup(rGroup, this.recursive)
                        .orElseThrow(() -> notFound(rGroup));
                    uri = Utils.storeDns(runContext, nested);
                    size = nested.size();
                    break;
                }
                case PARENT_GROUPS: {
                    List<String> parents = groups.recursiveGroups(rGroup);
                    if (parents.isEmpty()) {
                        throw notFound(rGroup);
                    }
                    uri = Utils.storeDns(runContext, parents);
                    size = parents.size();
                    break;
                }
                default: {
                    List<Entry> members = groups.members(rGroup, renderList(runContext, this.attributes))
                        .orElseThrow(() -> notFound(rGroup));
                    uri = Utils.storeEntries(runContext, members, false);
                    size = members.size();
                }
            }
        }

        logger.info("Listed {} {} of group '{}'", size, this.listing, rGroup);
        runContext.metric(Counter.of("entries.found", size, "origin", "GroupMembers"));

        return Output.builder()
            .uri(uri)
            .size(size)
            .build();
    }

    private static EntryNotFoundException notFound(String group) {
        return new EntryNotFoundException(String.format("Unable to find group \"%s\" in Active Directory.", group));
    }
}
