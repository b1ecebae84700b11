package io.kestra.plugin.adldap.client;

import lombok.Builder;
import lombok.Value;

/**
 * Parameters of one simple paged results request (RFC 2696).
 */
@Value
@Builder
public class PageControl {
    int pageSize;

    boolean critical;

    /** Opaque cookie from the previous page, {@code null} on the first request. */
    byte[] cookie;
}
