package io.kestra.plugin.adldap.client;

import lombok.Builder;
import lombok.Value;

/**
 * Settings shared by every query and management operation of one {@link Adldap} instance.
 */
@Value
@Builder
public class DirectoryConfiguration {
    /** Base DN of the domain, discovered from the root DSE when blank. */
    String baseDn;

    /** Suffix appended to bare account names, e.g. {@code @acme.org}. */
    String accountSuffix;

    /** Whether group membership lookups follow nested groups by default. */
    @Builder.Default
    boolean recursiveGroups = true;

    @Builder.Default
    int defaultPageSize = 50;
}
