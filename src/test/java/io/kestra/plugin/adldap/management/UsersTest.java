package io.kestra.plugin.adldap.management;

import com.unboundid.ldap.listener.InMemoryDirectoryServer;
import io.kestra.plugin.adldap.Commons;
import io.kestra.plugin.adldap.client.Adldap;
import io.kestra.plugin.adldap.client.DirectoryConfiguration;
import io.kestra.plugin.adldap.client.UnboundIdDirectoryConnection;
import io.kestra.plugin.adldap.models.Entry;
import io.kestra.plugin.adldap.models.User;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.util.List;
import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class UsersTest {
    private InMemoryDirectoryServer server;
    private Adldap directory;

    @BeforeAll
    void start() throws Exception {
        server = Commons.startDirectory();
        directory = new Adldap(
            new UnboundIdDirectoryConnection(server.getConnection()),
            DirectoryConfiguration.builder().accountSuffix("@acme.org").build()
        );
    }

    @AfterAll
    void stop() {
        directory.close();
        server.shutDown(true);
    }

    @Test
    void find_typed_user() {
        Entry entry = directory.users().find("jdoe").orElseThrow();

        assertThat(entry, instanceOf(User.class));
        User jdoe = (User) entry;
        assertThat(jdoe.getDn(), is(Commons.JDOE_DN));
        assertThat(jdoe.getEmail(), is(Optional.of("john.doe@acme.org")));
        assertThat(jdoe.getObjectSid(), is(Optional.of(Commons.DOMAIN_SID + "-1104")));
        assertThat(jdoe.isDisabled(), is(false));
    }

    @Test
    void account_suffix_is_stripped() {
        assertThat(directory.users().dn("asmith@ACME.org"), is(Optional.of(Commons.ASMITH_DN)));
        assertThat(((User) directory.users().find("asmith").orElseThrow()).isDisabled(), is(true));
    }

    @Test
    void unknown_or_blank_user() {
        assertThat(directory.users().find("nobody"), is(Optional.empty()));
        assertThat(directory.users().find(" "), is(Optional.empty()));
        assertThat(directory.users().groups("nobody"), is(Optional.empty()));
    }

    @Test
    void selected_fields_only() {
        Entry entry = directory.users().info("bwayne", List.of("givenName", "sn")).orElseThrow();

        assertThat(entry.getAttributes().keySet(), containsInAnyOrder("givenname", "sn"));
    }

    @Test
    void direct_groups() {
        assertThat(directory.users().groups("jdoe").orElseThrow(), containsInAnyOrder(Commons.SALES_DN, Commons.DOMAIN_USERS_DN));
    }

    @Test
    void base_dn_is_discovered() {
        assertThat(directory.getBaseDn(), is(Optional.of(Commons.BASE_DN)));
    }
}
