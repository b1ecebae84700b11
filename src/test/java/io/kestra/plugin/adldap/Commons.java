package io.kestra.plugin.adldap;

import com.amazon.ion.IonDatagram;
import com.amazon.ion.IonStruct;
import com.amazon.ion.IonSystem;
import com.amazon.ion.IonValue;
import com.amazon.ion.system.IonSystemBuilder;
import com.unboundid.ldap.listener.InMemoryDirectoryServer;
import com.unboundid.ldap.listener.InMemoryDirectoryServerConfig;
import com.unboundid.ldap.sdk.Attribute;
import com.unboundid.ldap.sdk.LDAPException;
import io.kestra.core.storages.StorageInterface;
import io.kestra.plugin.adldap.client.Adldap;
import io.kestra.plugin.adldap.client.DirectoryConfiguration;
import io.kestra.plugin.adldap.client.UnboundIdDirectoryConnection;

import java.io.InputStream;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

/**
 * Provides common tools for the adldap plugin testing.
 * @apiNote Runs an in-memory directory shaped like a small Active Directory domain. The server has no ANR nor
 * objectCategory short name resolution, so entries carry an {@code anr} attribute and a second, short
 * {@code objectCategory} value for the filters to match.
 */
public final class Commons {
    public static final String BASE_DN = "dc=acme,dc=org";
    public static final String USER = "cn=admin,dc=acme,dc=org";
    public static final String PASS = "GoodNewsEveryone";

    public static final String SALES_DN = "cn=Sales,ou=Groups,dc=acme,dc=org";
    public static final String SALES_EMEA_DN = "cn=Sales-EMEA,ou=Sales,ou=Groups,dc=acme,dc=org";
    public static final String DOMAIN_USERS_DN = "cn=Domain Users,ou=Groups,dc=acme,dc=org";
    public static final String NEWSLETTER_DN = "cn=Newsletter,ou=Groups,dc=acme,dc=org";
    public static final String JDOE_DN = "cn=John Doe,ou=Users,dc=acme,dc=org";
    public static final String ASMITH_DN = "cn=Alice Smith,ou=Users,dc=acme,dc=org";
    public static final String BWAYNE_DN = "cn=Bruce Wayne,ou=Users,dc=acme,dc=org";
    public static final String CONTACT_DN = "cn=External Partner,ou=Users,dc=acme,dc=org";

    public static final String DOMAIN_SID = "S-1-5-21-1004336348-1177238915-682003330";

    private static final String SCHEMA = ",CN=Schema,CN=Configuration,DC=acme,DC=org";

    private Commons() {
    }

    /**
     * Starts a listening directory loaded with the test domain.
     * @return The running server, to be shut down by the caller.
     */
    public static InMemoryDirectoryServer startDirectory() throws LDAPException {
        InMemoryDirectoryServerConfig config = new InMemoryDirectoryServerConfig(BASE_DN);
        config.setSchema(null);
        config.addAdditionalBindCredentials(USER, PASS);
        config.setCustomRootDSEAttributes(List.of(new Attribute("defaultNamingContext", BASE_DN)));

        InMemoryDirectoryServer server = new InMemoryDirectoryServer(config);
        server.addEntries(domain());
        server.startListening();
        return server;
    }

    /**
     * Opens a library level directory on the server.
     * @param baseDn : Configured base DN, null to discover it from the root DSE.
     */
    public static Adldap openAdldap(InMemoryDirectoryServer server, String baseDn) throws LDAPException {
        return new Adldap(
            new UnboundIdDirectoryConnection(server.getConnection()),
            DirectoryConfiguration.builder().baseDn(baseDn).build()
        );
    }

    /**
     * Reads every top-level struct of an ION result file.
     * @param file : The outputted URI of the task.
     * @param storageInterface : The StorageInterface that should contain the file.
     */
    public static List<IonStruct> readIon(URI file, StorageInterface storageInterface) throws Exception {
        assertThat("Result file should exist", storageInterface.exists(null, file), is(true));

        IonSystem ionSystem = IonSystemBuilder.standard().build();
        try (InputStream streamResult = storageInterface.get(null, file)) {
            IonDatagram datagram = ionSystem.getLoader().load(streamResult);
            List<IonStruct> structs = new ArrayList<>();
            for (IonValue value : datagram) {
                structs.add((IonStruct) value);
            }
            return structs;
        }
    }

    public static String[] domain() {
        return new String[]{
            "dn: dc=acme,dc=org",
            "objectClass: top",
            "objectClass: domain",
            "dc: acme",
            "",
            "dn: ou=Users,dc=acme,dc=org",
            "objectClass: top",
            "objectClass: organizationalUnit",
            "ou: Users",
            "",
            "dn: ou=Groups,dc=acme,dc=org",
            "objectClass: top",
            "objectClass: organizationalUnit",
            "ou: Groups",
            "",
            "dn: ou=Sales,ou=Groups,dc=acme,dc=org",
            "objectClass: top",
            "objectClass: organizationalUnit",
            "ou: Sales",
            "",
            "dn: ou=Computers,dc=acme,dc=org",
            "objectClass: top",
            "objectClass: organizationalUnit",
            "ou: Computers",
            "",
            "dn: " + JDOE_DN,
            "objectClass: top",
            "objectClass: person",
            "objectClass: organizationalPerson",
            "objectClass: user",
            "objectCategory: CN=Person" + SCHEMA,
            "objectCategory: person",
            "cn: John Doe",
            "sn: Doe",
            "givenName: John",
            "sAMAccountName: jdoe",
            "userPrincipalName: jdoe@acme.org",
            "mail: john.doe@acme.org",
            "department: Sales",
            "anr: jdoe",
            "anr: John Doe",
            "objectSid: " + DOMAIN_SID + "-1104",
            "primaryGroupID: 513",
            "userAccountControl: 512",
            "memberOf: " + SALES_DN,
            "memberOf: " + DOMAIN_USERS_DN,
            "",
            "dn: " + ASMITH_DN,
            "objectClass: top",
            "objectClass: person",
            "objectClass: organizationalPerson",
            "objectClass: user",
            "objectCategory: CN=Person" + SCHEMA,
            "objectCategory: person",
            "cn: Alice Smith",
            "sn: Smith",
            "givenName: Alice",
            "sAMAccountName: asmith",
            "userPrincipalName: asmith@acme.org",
            "mail: alice.smith@acme.org",
            "department: Sales",
            "anr: asmith",
            "anr: Alice Smith",
            "objectSid: " + DOMAIN_SID + "-1105",
            "primaryGroupID: 513",
            "userAccountControl: 514",
            "memberOf: " + SALES_EMEA_DN,
            "memberOf: " + DOMAIN_USERS_DN,
            "",
            "dn: " + BWAYNE_DN,
            "objectClass: top",
            "objectClass: person",
            "objectClass: organizationalPerson",
            "objectClass: user",
            "objectCategory: CN=Person" + SCHEMA,
            "objectCategory: person",
            "cn: Bruce Wayne",
            "sn: Wayne",
            "givenName: Bruce",
            "sAMAccountName: bwayne",
            "department: Board",
            "anr: bwayne",
            "anr: Bruce Wayne",
            "objectSid: " + DOMAIN_SID + "-1106",
            "primaryGroupID: 513",
            "memberOf: " + DOMAIN_USERS_DN,
            "",
            "dn: " + CONTACT_DN,
            "objectClass: top",
            "objectClass: person",
            "objectClass: contact",
            "objectCategory: CN=Person" + SCHEMA,
            "cn: External Partner",
            "mail: partner@example.com",
            "",
            "dn: " + SALES_DN,
            "objectClass: top",
            "objectClass: group",
            "objectCategory: CN=Group" + SCHEMA,
            "objectCategory: group",
            "cn: Sales",
            "sAMAccountName: Sales",
            "sAMAccountType: 268435456",
            "description: Sales department",
            "anr: Sales",
            "member: " + JDOE_DN,
            "member: " + SALES_EMEA_DN,
            "memberOf: " + SALES_EMEA_DN,
            "",
            "dn: " + SALES_EMEA_DN,
            "objectClass: top",
            "objectClass: group",
            "objectCategory: CN=Group" + SCHEMA,
            "objectCategory: group",
            "cn: Sales-EMEA",
            "sAMAccountName: Sales-EMEA",
            "sAMAccountType: 268435456",
            "anr: Sales-EMEA",
            "member: " + ASMITH_DN,
            "member: " + SALES_DN,
            "memberOf: " + SALES_DN,
            "",
            "dn: " + DOMAIN_USERS_DN,
            "objectClass: top",
            "objectClass: group",
            "objectCategory: CN=Group" + SCHEMA,
            "objectCategory: group",
            "cn: Domain Users",
            "sAMAccountName: Domain Users",
            "sAMAccountType: 268435456",
            "objectSid: " + DOMAIN_SID + "-513",
            "anr: Domain Users",
            "member: " + JDOE_DN,
            "member: " + ASMITH_DN,
            "member: " + BWAYNE_DN,
            "",
            "dn: " + NEWSLETTER_DN,
            "objectClass: top",
            "objectClass: group",
            "objectCategory: CN=Group" + SCHEMA,
            "objectCategory: group",
            "cn: Newsletter",
            "sAMAccountName: Newsletter",
            "sAMAccountType: 268435457",
            "anr: Newsletter",
            "",
            "dn: cn=WS01,ou=Computers,dc=acme,dc=org",
            "objectClass: top",
            "objectClass: computer",
            "objectCategory: CN=Computer" + SCHEMA,
            "objectCategory: computer",
            "cn: WS01",
            "sAMAccountName: WS01$",
            "operatingSystem: Windows 11 Enterprise",
            "dNSHostName: ws01.acme.org",
            "anr: WS01"
        };
    }
}
