package io.kestra.plugin.adldap.client;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

/**
 * Converts binary security identifiers to their {@code S-R-I-S-S...} textual form.
 */
public final class Sids {
    private static final Set<String> SID_ATTRIBUTES = Set.of("objectsid", "sidhistory");

    private Sids() {
    }

    static boolean isSidAttribute(String name) {
        return SID_ATTRIBUTES.contains(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Renders a binary SID as text. Values that do not have the layout of a revision 1 SID are decoded as UTF-8,
     * which lets directories storing SIDs as plain strings round-trip unchanged.
     */
    public static String toText(byte[] sid) {
        if (!isBinarySid(sid)) {
            return new String(sid, StandardCharsets.UTF_8);
        }

        int subAuthorities = sid[1] & 0xFF;

        long authority = 0;
        for (int i = 2; i < 8; i++) {
            authority = (authority << 8) | (sid[i] & 0xFF);
        }

        StringBuilder text = new StringBuilder("S-").append(sid[0] & 0xFF).append('-').append(authority);
        for (int i = 0; i < subAuthorities; i++) {
            int offset = 8 + 4 * i;
            long subAuthority = (sid[offset] & 0xFFL)
                | (sid[offset + 1] & 0xFFL) << 8
                | (sid[offset + 2] & 0xFFL) << 16
                | (sid[offset + 3] & 0xFFL) << 24;
            text.append('-').append(subAuthority);
        }
        return text.toString();
    }

    private static boolean isBinarySid(byte[] sid) {
        return sid.length >= 8 && sid[0] == 1 && sid.length == 8 + 4 * (sid[1] & 0xFF);
    }
}
