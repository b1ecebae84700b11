package io.kestra.plugin.adldap;

import io.kestra.core.models.annotations.Example;
import io.kestra.core.models.annotations.Plugin;
import io.kestra.core.runners.RunContext;
import io.kestra.plugin.adldap.management.Groups;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@SuperBuilder
@ToString
@EqualsAndHashCode
@Getter
@NoArgsConstructor
@Schema(
    title = "Delete an Active Directory group."
)
@Plugin(
    examples = {
        @Example(
            code = {"""
                id: delete
                type: io.kestra.plugin.adldap.DeleteGroup
                hostname: dc01.acme.org
                port: "389"
                userDn: svc-kestra@acme.org
                password: "{{ secret('AD_PASSWORD') }}"
                group: Sales-Europe
                failOnRefusal: true
                """}
        )
    }
)
public class DeleteGroup extends AbstractGroupTask {
    @Override
    protected boolean apply(Groups groups, String groupName, RunContext runContext) throws Exception {
        return groups.delete(groupName);
    }
}
