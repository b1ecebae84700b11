package io.kestra.plugin.adldap.client;

import com.unboundid.asn1.ASN1OctetString;
import com.unboundid.ldap.sdk.Attribute;
import com.unboundid.ldap.sdk.LDAPConnection;
import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.LDAPResult;
import com.unboundid.ldap.sdk.LDAPSearchException;
import com.unboundid.ldap.sdk.Modification;
import com.unboundid.ldap.sdk.ModificationType;
import com.unboundid.ldap.sdk.ResultCode;
import com.unboundid.ldap.sdk.SearchRequest;
import com.unboundid.ldap.sdk.SearchResult;
import com.unboundid.ldap.sdk.SearchResultEntry;
import com.unboundid.ldap.sdk.SearchScope;
import com.unboundid.ldap.sdk.controls.SimplePagedResultsControl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link DirectoryConnection} backed by an already bound UnboundID {@link LDAPConnection}.
 */
public class UnboundIdDirectoryConnection implements DirectoryConnection {
    static final String MATCH_ALL = "(objectclass=*)";

    private final LDAPConnection connection;
    private final Logger logger;

    public UnboundIdDirectoryConnection(LDAPConnection connection) {
        this(connection, LoggerFactory.getLogger(UnboundIdDirectoryConnection.class));
    }

    public UnboundIdDirectoryConnection(LDAPConnection connection, Logger logger) {
        this.connection = connection;
        this.logger = logger;
    }

    @Override
    public Optional<List<RawEntry>> read(String dn, String filter, List<String> attributes) {
        return this.execute(this.request(dn, SearchScope.BASE, filter, attributes));
    }

    @Override
    public Optional<List<RawEntry>> search(String dn, String filter, List<String> attributes) {
        return this.execute(this.request(dn, SearchScope.SUB, filter, attributes));
    }

    @Override
    public Optional<List<RawEntry>> listing(String dn, String filter, List<String> attributes) {
        return this.execute(this.request(dn, SearchScope.ONE, filter, attributes));
    }

    @Override
    public Optional<RawPage> searchPage(String dn, String filter, List<String> attributes, PageControl control) {
        SearchRequest request = this.request(dn, SearchScope.SUB, filter, attributes);
        request.setControls(new SimplePagedResultsControl(
            control.getPageSize(),
            control.getCookie() == null ? null : new ASN1OctetString(control.getCookie()),
            control.isCritical()
        ));

        SearchResult result;
        try {
            result = connection.search(request);
        } catch (LDAPSearchException e) {
            if (e.getResultCode() != ResultCode.SIZE_LIMIT_EXCEEDED) {
                logger.warn("Paged search failed, LDAP response : {}", e.getResultString());
                return Optional.empty();
            }
            if (control.isCritical()) {
                logger.warn("LDAP size limit exceeded on a critical paged search, LDAP response : {}", e.getResultString());
                return Optional.empty();
            }
            logger.info("LDAP size limit exceeded; treating page as partial success.");
            result = e.getSearchResult();
        }

        byte[] cookie = null;
        try {
            SimplePagedResultsControl responseControl = SimplePagedResultsControl.get(result);
            if (responseControl != null && responseControl.getCookie() != null) {
                cookie = responseControl.getCookie().getValue();
            }
        } catch (LDAPException e) {
            logger.warn("Unable to decode paged results control: {}", e.getResultString());
        }

        return Optional.of(new RawPage(toRawEntries(result.getSearchEntries()), cookie));
    }

    @Override
    public boolean add(String dn, Map<String, List<String>> attributes) {
        List<Attribute> ldapAttributes = new ArrayList<>();
        attributes.forEach((name, values) -> ldapAttributes.add(new Attribute(name, values)));

        try {
            return isSuccess(connection.add(dn, ldapAttributes));
        } catch (LDAPException e) {
            logger.error("Unable to add entry '{}': {}", dn, e.getResultString());
            return false;
        }
    }

    @Override
    public boolean modAdd(String dn, Map<String, List<String>> attributes) {
        return this.modify(dn, ModificationType.ADD, attributes);
    }

    @Override
    public boolean modReplace(String dn, Map<String, List<String>> attributes) {
        return this.modify(dn, ModificationType.REPLACE, attributes);
    }

    @Override
    public boolean modDelete(String dn, Map<String, List<String>> attributes) {
        return this.modify(dn, ModificationType.DELETE, attributes);
    }

    @Override
    public boolean rename(String dn, String newRdn, String newParent, boolean deleteOldRdn) {
        try {
            return isSuccess(connection.modifyDN(dn, newRdn, deleteOldRdn, newParent));
        } catch (LDAPException e) {
            logger.error("Unable to rename entry '{}' to '{}': {}", dn, newRdn, e.getResultString());
            return false;
        }
    }

    @Override
    public boolean delete(String dn) {
        try {
            return isSuccess(connection.delete(dn));
        } catch (LDAPException e) {
            logger.error("Unable to delete entry '{}': {}", dn, e.getResultString());
            return false;
        }
    }

    @Override
    public void close() {
        connection.close();
    }

    private boolean modify(String dn, ModificationType type, Map<String, List<String>> attributes) {
        List<Modification> modifications = new ArrayList<>();
        attributes.forEach((name, values) -> modifications.add(
            values == null || values.isEmpty()
                ? new Modification(type, name)
                : new Modification(type, name, values.toArray(new String[0]))
        ));

        try {
            return isSuccess(connection.modify(dn, modifications));
        } catch (LDAPException e) {
            logger.error("Unable to modify entry '{}' ({}): {}", dn, type.getName(), e.getResultString());
            return false;
        }
    }

    private SearchRequest request(String dn, SearchScope scope, String filter, List<String> attributes) {
        String[] requested = attributes == null || attributes.isEmpty()
            ? new String[]{SearchRequest.ALL_USER_ATTRIBUTES}
            : attributes.toArray(new String[0]);

        try {
            return new SearchRequest(
                dn == null ? "" : dn,
                scope,
                filter == null || filter.isBlank() ? MATCH_ALL : filter,
                requested
            );
        } catch (LDAPException e) {
            throw new IllegalArgumentException("Invalid LDAP filter '" + filter + "': " + e.getResultString(), e);
        }
    }

    private Optional<List<RawEntry>> execute(SearchRequest request) {
        try {
            SearchResult result = connection.search(request);
            return Optional.of(toRawEntries(result.getSearchEntries()));
        } catch (LDAPSearchException e) {
            // Some servers return SIZE_LIMIT_EXCEEDED along with the entries they managed to send
            if (e.getResultCode() == ResultCode.SIZE_LIMIT_EXCEEDED) {
                logger.info("LDAP size limit exceeded; treating as partial success.");
                return Optional.of(toRawEntries(e.getSearchEntries()));
            }
            if (e.getResultCode() == ResultCode.NO_SUCH_OBJECT) {
                logger.debug("No entry at '{}'", request.getBaseDN());
                return Optional.of(List.of());
            }

            logger.warn("Search failed, LDAP response : {}", e.getResultString());
            return Optional.empty();
        }
    }

    private static boolean isSuccess(LDAPResult result) {
        return result.getResultCode() == ResultCode.SUCCESS;
    }

    static List<RawEntry> toRawEntries(List<SearchResultEntry> entries) {
        List<RawEntry> results = new ArrayList<>(entries.size());
        for (SearchResultEntry entry : entries) {
            Map<String, List<String>> attributes = new LinkedHashMap<>();
            for (Attribute attribute : entry.getAttributes()) {
                List<String> values = new ArrayList<>();
                if (Sids.isSidAttribute(attribute.getBaseName())) {
                    for (byte[] value : attribute.getValueByteArrays()) {
                        values.add(Sids.toText(value));
                    }
                } else {
                    values.addAll(List.of(attribute.getValues()));
                }
                attributes.put(attribute.getName(), values);
            }
            results.add(new RawEntry(entry.getDN(), attributes));
        }
        return results;
    }
}
