package io.kestra.plugin.adldap.client;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * A single page of a paged search along with the cookie the server handed back for the next request.
 * A {@code null} cookie means the server has nothing more to send.
 */
@Getter
@ToString
public final class RawPage {
    private final List<RawEntry> entries;
    @ToString.Exclude
    private final byte[] cookie;

    public RawPage(List<RawEntry> entries, byte[] cookie) {
        this.entries = List.copyOf(entries);
        this.cookie = cookie == null || cookie.length == 0 ? null : cookie.clone();
    }

    public boolean isLast() {
        return cookie == null;
    }
}
