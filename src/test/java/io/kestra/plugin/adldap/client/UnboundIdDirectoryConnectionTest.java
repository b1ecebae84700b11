package io.kestra.plugin.adldap.client;

import com.unboundid.ldap.listener.InMemoryDirectoryServer;
import com.unboundid.ldap.listener.InMemoryDirectoryServerConfig;
import com.unboundid.ldap.sdk.Attribute;
import io.kestra.plugin.adldap.Commons;
import io.kestra.plugin.adldap.query.Paginator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

class UnboundIdDirectoryConnectionTest {
    private InMemoryDirectoryServer server;
    private UnboundIdDirectoryConnection connection;

    @BeforeEach
    void start() throws Exception {
        server = Commons.startDirectory();
        connection = new UnboundIdDirectoryConnection(server.getConnection());
    }

    @AfterEach
    void stop() {
        connection.close();
        server.shutDown(true);
    }

    @Test
    void read_returns_the_entry_only() {
        List<RawEntry> entries = connection.read(Commons.JDOE_DN, null, List.of("cn", "mail")).orElseThrow();

        assertThat(entries.size(), is(1));
        RawEntry jdoe = entries.get(0);
        assertThat(jdoe.getDn(), is(Commons.JDOE_DN));
        assertThat(jdoe.getAttributes().keySet(), containsInAnyOrder("cn", "mail"));
        assertThat(jdoe.first("mail"), is(Optional.of("john.doe@acme.org")));
    }

    @Test
    void search_and_listing_scopes() {
        List<String> subtree = dns(connection.search(Commons.BASE_DN, "(objectclass=organizationalUnit)", List.of()).orElseThrow());
        List<String> children = dns(connection.listing("ou=Groups," + Commons.BASE_DN, null, List.of("cn")).orElseThrow());

        assertThat(subtree, containsInAnyOrder(
            "ou=Users,dc=acme,dc=org", "ou=Groups,dc=acme,dc=org", "ou=Sales,ou=Groups,dc=acme,dc=org", "ou=Computers,dc=acme,dc=org"
        ));
        assertThat(children, containsInAnyOrder(
            "ou=Sales,ou=Groups,dc=acme,dc=org", Commons.SALES_DN, Commons.DOMAIN_USERS_DN, Commons.NEWSLETTER_DN
        ));
    }

    @Test
    void root_dse_is_readable() {
        List<RawEntry> rootDse = connection.read(null, null, List.of("defaultNamingContext")).orElseThrow();

        assertThat(rootDse.get(0).first("defaultnamingcontext"), is(Optional.of(Commons.BASE_DN)));
    }

    @Test
    void missing_base_is_an_empty_result() {
        assertThat(connection.search("ou=Nowhere," + Commons.BASE_DN, "(cn=*)", List.of()).orElseThrow(), empty());
    }

    @Test
    void invalid_filter_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> connection.search(Commons.BASE_DN, "(cn=a", List.of()));
    }

    @Test
    void binary_sids_are_decoded() throws Exception {
        server.add(new com.unboundid.ldap.sdk.Entry(
            "cn=Binary,ou=Groups," + Commons.BASE_DN,
            new Attribute("objectClass", "top", "group"),
            new Attribute("cn", "Binary"),
            new Attribute("objectSid", SidsTest.DOMAIN_USERS)
        ));

        RawEntry entry = connection.read("cn=Binary,ou=Groups," + Commons.BASE_DN, null, List.of("objectSid")).orElseThrow().get(0);

        assertThat(entry.first("objectsid"), is(Optional.of("S-1-5-21-1-2-3-513")));
    }

    @Test
    void paged_search_walks_every_page() {
        Adldap directory = new Adldap(connection, DirectoryConfiguration.builder().baseDn(Commons.BASE_DN).build());

        Paginator paginator = directory.search()
            .setDn("ou=Users," + Commons.BASE_DN)
            .where("objectclass", "person")
            .sortBy("cn", "asc")
            .paginate(2, 0, true)
            .orElseThrow();

        assertThat(paginator.count(), is(4));
        assertThat(paginator.getPages(), is(2));
        assertThat(paginator.getCurrentPageResults().stream().map(e -> e.getCommonName().orElseThrow()).collect(Collectors.toList()),
            contains("Alice Smith", "Bruce Wayne"));
    }

    @Test
    void single_page_has_no_cookie() {
        RawPage page = connection.searchPage(Commons.BASE_DN, "(objectcategory=group)", List.of("cn"), PageControl.builder()
            .pageSize(100)
            .critical(true)
            .build()
        ).orElseThrow();

        assertThat(page.getEntries().size(), is(4));
        assertThat(page.isLast(), is(true));
    }

    @Test
    void size_limit_is_partial_only_when_not_critical() throws Exception {
        InMemoryDirectoryServerConfig config = new InMemoryDirectoryServerConfig(Commons.BASE_DN);
        config.setSchema(null);
        config.setMaxSizeLimit(2);
        InMemoryDirectoryServer limited = new InMemoryDirectoryServer(config);
        limited.addEntries(Commons.domain());
        limited.startListening();

        UnboundIdDirectoryConnection limitedConnection = new UnboundIdDirectoryConnection(limited.getConnection());
        try {
            Optional<RawPage> critical = limitedConnection.searchPage(Commons.BASE_DN, "(objectcategory=group)", List.of("cn"),
                PageControl.builder().pageSize(100).critical(true).build());
            Optional<RawPage> lenient = limitedConnection.searchPage(Commons.BASE_DN, "(objectcategory=group)", List.of("cn"),
                PageControl.builder().pageSize(100).critical(false).build());

            assertThat(critical, is(Optional.empty()));
            assertThat(lenient.orElseThrow().getEntries().size(), is(2));
        } finally {
            limitedConnection.close();
            limited.shutDown(true);
        }
    }

    @Test
    void add_modify_rename_delete() throws Exception {
        String dn = "cn=Support,ou=Groups," + Commons.BASE_DN;

        assertThat(connection.add(dn, Map.of(
            "objectClass", List.of("top", "group"),
            "cn", List.of("Support"),
            "description", List.of("first")
        )), is(true));

        assertThat(connection.modAdd(dn, Map.of("member", List.of(Commons.JDOE_DN, Commons.ASMITH_DN))), is(true));
        assertThat(connection.modDelete(dn, Map.of("member", List.of(Commons.JDOE_DN))), is(true));
        assertThat(connection.modReplace(dn, Map.of("description", List.of("second"))), is(true));

        RawEntry support = connection.read(dn, null, List.of()).orElseThrow().get(0);
        assertThat(support.get("member"), contains(Commons.ASMITH_DN));
        assertThat(support.get("description"), contains("second"));

        assertThat(connection.modDelete(dn, Map.of("description", List.of())), is(true));
        assertThat(connection.read(dn, null, List.of()).orElseThrow().get(0).has("description"), is(false));

        assertThat(connection.rename(dn, "cn=Helpdesk", "ou=Sales,ou=Groups," + Commons.BASE_DN, true), is(true));
        String moved = "cn=Helpdesk,ou=Sales,ou=Groups," + Commons.BASE_DN;
        assertThat(server.entryExists(dn), is(false));
        assertThat(List.of(server.getEntry(moved).getAttributeValues("cn")), hasItem("Helpdesk"));
        assertThat(List.of(server.getEntry(moved).getAttributeValues("cn")), not(hasItem("Support")));

        assertThat(connection.delete(moved), is(true));
        assertThat(server.entryExists(moved), is(false));
    }

    @Test
    void refused_writes_return_false() {
        assertThat(connection.add(Commons.SALES_DN, Map.of("cn", List.of("Sales"))), is(false));
        assertThat(connection.delete("cn=Nobody," + Commons.BASE_DN), is(false));
        assertThat(connection.modAdd("cn=Nobody," + Commons.BASE_DN, Map.of("member", List.of(Commons.JDOE_DN))), is(false));
        assertThat(connection.rename("cn=Nobody," + Commons.BASE_DN, "cn=Somebody", null, true), is(false));
    }

    private static List<String> dns(List<RawEntry> entries) {
        return entries.stream().map(RawEntry::getDn).collect(Collectors.toList());
    }
}
