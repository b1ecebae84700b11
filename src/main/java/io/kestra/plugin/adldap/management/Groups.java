package io.kestra.plugin.adldap.management;

import com.unboundid.ldap.sdk.RDN;
import io.kestra.plugin.adldap.client.Adldap;
import io.kestra.plugin.adldap.client.DirectoryConnection;
import io.kestra.plugin.adldap.exceptions.InvalidAttributeException;
import io.kestra.plugin.adldap.models.ActiveDirectory;
import io.kestra.plugin.adldap.models.Entry;
import io.kestra.plugin.adldap.query.Predicate;
import io.kestra.plugin.adldap.query.Search;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Group lookups, membership changes and group lifecycle.
 * <p>
 * Groups are designated by any name ambiguous name resolution understands (usually the account name or the
 * common name). Write operations return the directory outcome as is, {@code false} when a designated group,
 * user or contact can't be found.
 */
public class Groups {
    private final Adldap adldap;
    private final DirectoryConnection connection;

    public Groups(Adldap adldap) {
        this.adldap = adldap;
        this.connection = adldap.getConnection();
    }

    /* LOOKUPS */

    public Optional<List<Entry>> all() {
        return this.all(null);
    }

    /**
     * @param namePattern common name to match, {@code *} standing for any characters
     */
    public Optional<List<Entry>> all(String namePattern) {
        return this.search(null, namePattern, List.of(), true);
    }

    public Optional<List<Entry>> allSecurity() {
        return this.allSecurity(null);
    }

    public Optional<List<Entry>> allSecurity(String namePattern) {
        return this.search(ActiveDirectory.SECURITY_GROUP, namePattern, List.of(), true);
    }

    public Optional<List<Entry>> allDistribution() {
        return this.allDistribution(null);
    }

    public Optional<List<Entry>> allDistribution(String namePattern) {
        return this.search(ActiveDirectory.DISTRIBUTION_GROUP, namePattern, List.of(), true);
    }

    public Optional<List<Entry>> search(String samAccountType, List<String> select, boolean sorted) {
        return this.search(samAccountType, null, select, sorted);
    }

    /**
     * Lists groups, optionally restricted to one {@code sAMAccountType} and to a common name pattern.
     *
     * @param samAccountType account type to match, {@code null} for every group
     * @param namePattern common name to match where {@code *} stands for any characters, {@code null} or {@code *}
     *                    for every name
     * @param sorted whether results are ordered by ascending account name
     */
    public Optional<List<Entry>> search(String samAccountType, String namePattern, List<String> select, boolean sorted) {
        Search search = adldap.search()
            .select(select)
            .where(ActiveDirectory.OBJECT_CATEGORY, ActiveDirectory.OBJECT_CATEGORY_GROUP);

        if (samAccountType != null) {
            search.where(ActiveDirectory.ACCOUNT_TYPE, samAccountType);
        }
        if (namePattern != null && !namePattern.isBlank() && !namePattern.equals("*")) {
            search.rawFilter(namePatternClause(namePattern));
        }
        if (sorted) {
            search.sortBy(ActiveDirectory.ACCOUNT_NAME, "asc");
        }

        return search.get();
    }

    public Optional<Entry> find(String groupName) {
        return this.find(groupName, List.of());
    }

    public Optional<Entry> find(String groupName, List<String> fields) {
        return adldap.search()
            .select(fields)
            .where(ActiveDirectory.OBJECT_CATEGORY, ActiveDirectory.OBJECT_CATEGORY_GROUP)
            .where(ActiveDirectory.ANR, groupName)
            .first();
    }

    public Optional<Entry> info(String groupName, List<String> fields) {
        return this.find(groupName, fields);
    }

    public Optional<String> dn(String groupName) {
        return this.find(groupName).map(Entry::getDn);
    }

    /**
     * Resolves the member entries of a group that are users.
     *
     * @return empty when the group does not exist
     */
    public Optional<List<Entry>> members(String groupName, List<String> fields) {
        Optional<Entry> group = this.find(groupName);
        if (group.isEmpty()) {
            return Optional.empty();
        }

        List<Entry> members = new ArrayList<>();
        for (String memberDn : group.get().getAttribute(ActiveDirectory.MEMBER)) {
            adldap.search()
                .setDn(memberDn)
                .read()
                .select(fields)
                .where(ActiveDirectory.OBJECT_CLASS, "user")
                .where(ActiveDirectory.OBJECT_CLASS, "person")
                .first()
                .ifPresent(members::add);
        }
        return Optional.of(members);
    }

    /**
     * Lists the DNs of the groups that are members of a group.
     *
     * @param recursive whether the members of member groups are followed too, {@code null} for the configured default
     * @return empty when the group does not exist
     */
    public Optional<List<String>> inGroup(String groupName, Boolean recursive) {
        boolean followNested = recursive != null ? recursive : adldap.getConfiguration().isRecursiveGroups();

        Optional<Entry> group = this.find(groupName);
        if (group.isEmpty()) {
            return Optional.empty();
        }

        Set<String> visited = new LinkedHashSet<>();
        visited.add(normalize(group.get().getDn()));

        Set<String> nested = new LinkedHashSet<>();
        this.collectMemberGroups(group.get(), followNested, visited, nested);
        return Optional.of(new ArrayList<>(nested));
    }

    /**
     * Lists the DN of a group followed by the DNs of every group it belongs to, directly or through other groups.
     */
    public List<String> recursiveGroups(String groupName) {
        Optional<Entry> group = this.find(groupName);
        if (group.isEmpty()) {
            return Collections.emptyList();
        }

        Set<String> visited = new LinkedHashSet<>();
        List<String> groups = new ArrayList<>();
        this.collectParentGroups(group.get(), visited, groups);
        return groups;
    }

    /**
     * Finds the DN of the group whose SID is the user SID with its relative identifier replaced by {@code groupRid}.
     *
     * @param groupRid relative identifier of the group, as found in a user's {@code primaryGroupID}
     * @param userSid textual SID of the user, e.g. {@code S-1-5-21-1004336348-1177238915-682003330-1104}
     */
    public Optional<String> getPrimaryGroup(Integer groupRid, String userSid) throws InvalidAttributeException {
        if (groupRid == null) {
            throw new InvalidAttributeException("Missing compulsory field [Group ID]");
        }
        if (userSid == null || userSid.isBlank()) {
            throw new InvalidAttributeException("Missing compulsory field [User ID]");
        }

        int lastDash = userSid.lastIndexOf('-');
        if (!userSid.toUpperCase(Locale.ROOT).startsWith("S-") || lastDash <= 1) {
            throw new InvalidAttributeException(String.format("Invalid SID \"%s\"", userSid));
        }

        String groupSid = userSid.substring(0, lastDash + 1) + Integer.toUnsignedString(groupRid);

        return adldap.search()
            .where(ActiveDirectory.OBJECT_SID, groupSid)
            .first()
            .map(Entry::getDn);
    }

    /* MEMBERSHIP */

    public boolean addGroup(String parent, String child) {
        Optional<String> parentDn = this.dn(parent);
        Optional<String> childDn = this.dn(child);

        if (parentDn.isEmpty() || childDn.isEmpty()) {
            return false;
        }
        return connection.modAdd(parentDn.get(), member(childDn.get()));
    }

    public boolean addUser(String groupName, String username) {
        Optional<String> groupDn = this.dn(groupName);
        Optional<String> userDn = adldap.users().dn(username);

        if (groupDn.isEmpty() || userDn.isEmpty()) {
            return false;
        }
        return connection.modAdd(groupDn.get(), member(userDn.get()));
    }

    public boolean addContact(String groupName, String contactDn) {
        Optional<String> groupDn = this.dn(groupName);

        if (groupDn.isEmpty() || contactDn == null || contactDn.isBlank()) {
            return false;
        }
        return connection.modAdd(groupDn.get(), member(contactDn));
    }

    public boolean removeGroup(String parent, String child) {
        Optional<String> parentDn = this.dn(parent);
        Optional<String> childDn = this.dn(child);

        if (parentDn.isEmpty() || childDn.isEmpty()) {
            return false;
        }
        return connection.modDelete(parentDn.get(), member(childDn.get()));
    }

    public boolean removeUser(String groupName, String username) {
        Optional<String> groupDn = this.dn(groupName);
        Optional<String> userDn = adldap.users().dn(username);

        if (groupDn.isEmpty() || userDn.isEmpty()) {
            return false;
        }
        return connection.modDelete(groupDn.get(), member(userDn.get()));
    }

    public boolean removeContact(String groupName, String contactDn) {
        Optional<String> groupDn = this.dn(groupName);

        if (groupDn.isEmpty() || contactDn == null || contactDn.isBlank()) {
            return false;
        }
        return connection.modDelete(groupDn.get(), member(contactDn));
    }

    /* LIFECYCLE */

    /**
     * Creates a group under the given organizational units of the base DN.
     *
     * @throws InvalidAttributeException when the name or the containers are missing, before anything is sent
     */
    public boolean create(GroupAttributes attributes) throws InvalidAttributeException {
        attributes.validateRequired();

        Map<String, List<String>> add = new LinkedHashMap<>();
        add.put(ActiveDirectory.COMMON_NAME, List.of(attributes.getGroupName()));
        add.put(ActiveDirectory.ACCOUNT_NAME, List.of(attributes.getGroupName()));
        add.put(ActiveDirectory.OBJECT_CLASS, List.of(ActiveDirectory.OBJECT_CLASS_GROUP));
        if (attributes.getDescription() != null && !attributes.getDescription().isBlank()) {
            add.put(ActiveDirectory.DESCRIPTION, List.of(attributes.getDescription()));
        }

        String dn = new RDN("CN", attributes.getGroupName()) + "," + this.containerDn(attributes.getContainers());
        return connection.add(dn, add);
    }

    public boolean delete(String groupName) throws InvalidAttributeException {
        if (groupName == null || groupName.isBlank()) {
            throw new InvalidAttributeException("Missing compulsory field [Group]");
        }

        Optional<String> dn = this.dn(groupName);
        return dn.isPresent() && connection.delete(dn.get());
    }

    /**
     * Renames a group and moves it under the given organizational units, outermost first. An empty container list
     * keeps the group where it is.
     */
    public boolean rename(String groupName, String newName, List<String> containers) throws InvalidAttributeException {
        if (newName == null || newName.isBlank()) {
            throw new InvalidAttributeException("Missing compulsory field [newName]");
        }

        Optional<String> dn = this.dn(groupName);
        if (dn.isEmpty()) {
            return false;
        }

        String newParent = containers == null || containers.isEmpty() ? null : this.containerDn(containers);
        return connection.rename(dn.get(), new RDN("CN", newName).toString(), newParent, true);
    }

    private String containerDn(List<String> containers) throws InvalidAttributeException {
        List<String> reversed = new ArrayList<>(containers);
        Collections.reverse(reversed);

        StringBuilder dn = new StringBuilder();
        for (String container : reversed) {
            dn.append(new RDN("OU", container)).append(',');
        }

        String baseDn = adldap.getBaseDn()
            .orElseThrow(() -> new InvalidAttributeException("Unable to determine the base DN of the directory"));
        return dn.append(baseDn).toString();
    }

    private void collectMemberGroups(Entry group, boolean recursive, Set<String> visited, Set<String> nested) {
        for (String memberDn : group.getAttribute(ActiveDirectory.MEMBER)) {
            Optional<Entry> memberGroup = this.readGroup(memberDn);
            if (memberGroup.isEmpty()) {
                continue;
            }

            // visited holds the listed group itself, so a cycle never lists it as its own member
            if (!visited.add(normalize(memberGroup.get().getDn()))) {
                continue;
            }

            nested.add(memberGroup.get().getDn());
            if (recursive) {
                this.collectMemberGroups(memberGroup.get(), true, visited, nested);
            }
        }
    }

    private void collectParentGroups(Entry group, Set<String> visited, List<String> groups) {
        if (!visited.add(normalize(group.getDn()))) {
            return;
        }
        groups.add(group.getDn());

        for (String parentDn : group.getMemberOf()) {
            this.readGroup(parentDn).ifPresent(parent -> this.collectParentGroups(parent, visited, groups));
        }
    }

    private Optional<Entry> readGroup(String dn) {
        return adldap.search()
            .setDn(dn)
            .read()
            .select(ActiveDirectory.DISTINGUISHED_NAME, ActiveDirectory.OBJECT_CATEGORY, ActiveDirectory.MEMBER, ActiveDirectory.MEMBER_OF)
            .where(ActiveDirectory.OBJECT_CATEGORY, ActiveDirectory.OBJECT_CATEGORY_GROUP)
            .first();
    }

    private static Map<String, List<String>> member(String dn) {
        return Map.of(ActiveDirectory.MEMBER, List.of(dn));
    }

    // wildcards are kept, every other character is escaped
    private static String namePatternClause(String namePattern) {
        return "(" + ActiveDirectory.COMMON_NAME + "=" + Arrays.stream(namePattern.replaceAll("\\*+", "*").split("\\*", -1))
            .map(Predicate::escape)
            .collect(Collectors.joining("*")) + ")";
    }

    private static String normalize(String dn) {
        return dn.toLowerCase(Locale.ROOT).replace(", ", ",");
    }
}
