package io.kestra.plugin.adldap;

import io.kestra.core.models.annotations.Example;
import io.kestra.core.models.annotations.Plugin;
import io.kestra.core.models.annotations.PluginProperty;
import io.kestra.core.runners.RunContext;
import io.kestra.plugin.adldap.management.Groups;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
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
    title = "Remove a user, a group or a contact from an Active Directory group."
)
@Plugin(
    examples = {
        @Example(
            title = "Remove a nested group.",
            code = {"""
                id: remove_nested
                type: io.kestra.plugin.adldap.RemoveGroupMember
                hostname: dc01.acme.org
                port: "389"
                userDn: svc-kestra@acme.org
                password: "{{ secret('AD_PASSWORD') }}"
                group: Sales
                member: Sales-Interns
                kind: GROUP
                """}
        )
    }
)
public class RemoveGroupMember extends AbstractGroupTask {
    @Schema(
        title = "Member",
        description = "Account name of a user, name of a group, or DN of a contact depending on `kind`."
    )
    @PluginProperty(dynamic = true)
    @NotNull
    private String member;

    @Schema(
        title = "Kind of member"
    )
    @PluginProperty
    @NotNull
    @Builder.Default
    private MemberKind kind = MemberKind.USER;

    @Override
    protected boolean apply(Groups groups, String groupName, RunContext runContext) throws Exception {
        String rMember = runContext.render(this.member);

        switch (this.kind) {
            case GROUP:
                return groups.removeGroup(groupName, rMember);
            case CONTACT:
                return groups.removeContact(groupName, rMember);
            default:
                return groups.removeUser(groupName, rMember);
        }
    }
}
