package io.kestra.plugin.adldap;

import io.kestra.core.models.annotations.Example;
import io.kestra.core.models.annotations.Metric;
import io.kestra.core.models.annotations.Plugin;
import io.kestra.core.models.annotations.PluginProperty;
import io.kestra.core.models.executions.metrics.Counter;
import io.kestra.core.runners.RunContext;
import io.kestra.plugin.adldap.management.GroupAttributes;
import io.kestra.plugin.adldap.management.Groups;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.List;

@SuperBuilder
@ToString
@EqualsAndHashCode
@Getter
@NoArgsConstructor
@Schema(
    title = "Create an Active Directory group.",
    description = "Creates the group `CN=<group>,OU=<last container>,...,OU=<first container>,<base DN>` with the group name as account name."
)
@Plugin(
    examples = {
        @Example(
            full = true,
            code = """
                id: adldap_create_group
                namespace: company.team

                tasks:
                  - id: create
                    type: io.kestra.plugin.adldap.CreateGroup
                    hostname: dc01.acme.org
                    port: "389"
                    userDn: svc-kestra@acme.org
                    password: "{{ secret('AD_PASSWORD') }}"
                    group: Sales-EMEA
                    description: Sales people of the EMEA region
                    containers:
                      - Groups
                      - Sales
                """
        )
    },
    metrics = {
        @Metric(
            name = "changes.done",
            type = Counter.TYPE,
            description = "1 when the group was created, 0 otherwise."
        )
    }
)
public class CreateGroup extends AbstractGroupTask {
    @Schema(
        title = "Description"
    )
    @PluginProperty(dynamic = true)
    private String description;

    @Schema(
        title = "Containers",
        description = "Organizational units holding the group below the base DN, outermost first."
    )
    @PluginProperty(dynamic = true)
    @NotEmpty
    private List<String> containers;

    @Override
    protected boolean apply(Groups groups, String groupName, RunContext runContext) throws Exception {
        return groups.create(GroupAttributes.builder()
            .groupName(groupName)
            .description(this.description == null ? null : runContext.render(this.description))
            .containers(renderList(runContext, this.containers))
            .build()
        );
    }
}
