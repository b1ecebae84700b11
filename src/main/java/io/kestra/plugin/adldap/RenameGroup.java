package io.kestra.plugin.adldap;

import io.kestra.core.models.annotations.Example;
import io.kestra.core.models.annotations.Plugin;
import io.kestra.core.models.annotations.PluginProperty;
import io.kestra.core.runners.RunContext;
import io.kestra.plugin.adldap.management.Groups;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
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
    title = "Rename an Active Directory group, optionally moving it to other containers."
)
@Plugin(
    examples = {
        @Example(
            code = {"""
                id: rename
                type: io.kestra.plugin.adldap.RenameGroup
                hostname: dc01.acme.org
                port: "389"
                userDn: svc-kestra@acme.org
                password: "{{ secret('AD_PASSWORD') }}"
                group: Sales-EMEA
                newName: Sales-Europe
                containers:
                  - Groups
                  - Sales
                """}
        )
    }
)
public class RenameGroup extends AbstractGroupTask {
    @Schema(
        title = "New common name of the group"
    )
    @PluginProperty(dynamic = true)
    @NotNull
    private String newName;

    @Schema(
        title = "Containers",
        description = "Organizational units to move the group to below the base DN, outermost first. The group stays where it is when empty."
    )
    @PluginProperty(dynamic = true)
    private List<String> containers;

    @Override
    protected boolean apply(Groups groups, String groupName, RunContext runContext) throws Exception {
        return groups.rename(groupName, runContext.render(this.newName), renderList(runContext, this.containers));
    }
}
