@PluginSubGroup(
    title = "Active Directory",
    description = "This sub-group of plugins contains tasks to query Active Directory and manage its groups.",
    categories = {PluginSubGroup.PluginCategory.DATABASE, PluginSubGroup.PluginCategory.TOOL}
)
package io.kestra.plugin.adldap;

import io.kestra.core.models.annotations.PluginSubGroup;
