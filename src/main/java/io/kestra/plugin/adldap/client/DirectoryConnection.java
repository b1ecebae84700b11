package io.kestra.plugin.adldap.client;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The primitives the query and management layers need from an LDAP server.
 * <p>
 * Read operations return an empty {@link Optional} when the server could not be asked or refused the request,
 * and an empty list when the request succeeded without any match. A {@code null} DN designates the directory root.
 * Write operations report the server outcome as a boolean; they never retry.
 */
public interface DirectoryConnection extends AutoCloseable {
    /** Base scope search on a single DN. */
    Optional<List<RawEntry>> read(String dn, String filter, List<String> attributes);

    /** Subtree search below a DN. */
    Optional<List<RawEntry>> search(String dn, String filter, List<String> attributes);

    /** One level search, the immediate children of a DN. */
    Optional<List<RawEntry>> listing(String dn, String filter, List<String> attributes);

    /** Subtree search fetching one page only. */
    Optional<RawPage> searchPage(String dn, String filter, List<String> attributes, PageControl control);

    boolean add(String dn, Map<String, List<String>> attributes);

    boolean modAdd(String dn, Map<String, List<String>> attributes);

    boolean modReplace(String dn, Map<String, List<String>> attributes);

    boolean modDelete(String dn, Map<String, List<String>> attributes);

    /**
     * Moves or renames an entry.
     *
     * @param newRdn the new relative DN, e.g. {@code CN=Sales}
     * @param newParent the new superior DN, {@code null} to stay under the current one
     * @param deleteOldRdn whether the previous RDN value is removed from the entry
     */
    boolean rename(String dn, String newRdn, String newParent, boolean deleteOldRdn);

    boolean delete(String dn);

    @Override
    void close();
}
