package io.kestra.plugin.adldap;

import com.unboundid.ldap.sdk.BindRequest;
import com.unboundid.ldap.sdk.GSSAPIBindRequest;
import com.unboundid.ldap.sdk.GSSAPIBindRequestProperties;
import com.unboundid.ldap.sdk.LDAPConnection;
import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.SimpleBindRequest;
import com.unboundid.util.ssl.JVMDefaultTrustManager;
import com.unboundid.util.ssl.SSLUtil;
import com.unboundid.util.ssl.TrustAllTrustManager;
import io.kestra.core.exceptions.IllegalVariableEvaluationException;
import io.kestra.core.models.annotations.PluginProperty;
import io.kestra.core.models.tasks.Task;
import io.kestra.core.runners.RunContext;
import io.kestra.plugin.adldap.client.Adldap;
import io.kestra.plugin.adldap.client.DirectoryConfiguration;
import io.kestra.plugin.adldap.client.UnboundIdDirectoryConnection;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;
import org.slf4j.Logger;

import javax.net.ssl.SSLSocketFactory;
import java.security.GeneralSecurityException;
import java.util.List;

@SuperBuilder
@Getter
@NoArgsConstructor
public abstract class AdldapConnection extends Task {
    /** CONNECTION ---------------------------------------------------------------------------------------------- // **/

    @Schema(
        title = "Hostname",
        description = "Hostname of the domain controller."
    )
    @PluginProperty(dynamic = true)
    @NotNull
    protected String hostname;

    @Schema(
        title = "Port",
        description = "A whole number describing the port for connection."
    )
    @PluginProperty(dynamic = true)
    @NotNull
    protected String port;

    @Schema(
        title = "Use LDAPS",
        description = "Open the connection over TLS, trusting the certificates the JVM trusts."
    )
    @PluginProperty
    @Builder.Default
    protected Boolean ssl = false;

    @Schema(
        title = "Trust all certificates",
        description = "Open the connection over TLS without validating the server certificate. Implies `ssl`."
    )
    @PluginProperty
    @Builder.Default
    protected Boolean trustAllCertificates = false;

    /** AUTHENTICATION ------------------------------------------------------------------------------------------ // **/

    @Schema(
        title = "User",
        description = "DN or user principal name used to bind."
    )
    @PluginProperty(dynamic = true)
    @NotNull
    protected String userDn;

    @Schema(
        title = "Password",
        description = "User password for connection."
    )
    @PluginProperty(dynamic = true)
    @NotNull
    protected String password;

    @Schema(
        title = "Authentication method",
        description = "Authentication method to use with the domain controller.",
        allowableValues = {"simple", "gssapi"}
    )
    @PluginProperty(dynamic = true)
    @Builder.Default
    protected String authMethod = "simple";

    @Schema(
        title = "Kerberos key distribution center",
        description = """
            Needed for GSSAPI authentication method.
            If set, property realm must be set too.
            If this is not provided, an attempt will be made to determine the appropriate value from the system configuration."""
    )
    @PluginProperty(dynamic = true)
    protected String kdc;

    @Schema(
        title = "Realm",
        description = """
            Needed for GSSAPI authentication method.
            If set, property kdc must be set too.
            If this is not provided, an attempt will be made to determine the appropriate value from the system configuration."""
    )
    @PluginProperty(dynamic = true)
    protected String realm;

    /** DIRECTORY ----------------------------------------------------------------------------------------------- // **/

    @Schema(
        title = "Base DN",
        description = "Base DN of the domain, e.g. `dc=acme,dc=org`. Read from the root DSE `defaultNamingContext` when not set."
    )
    @PluginProperty(dynamic = true)
    protected String baseDn;

    @Schema(
        title = "Account suffix",
        description = "Suffix that account names may carry and that is stripped before lookups, e.g. `@acme.org`."
    )
    @PluginProperty(dynamic = true)
    protected String accountSuffix;

    @Schema(
        title = "Follow nested groups",
        description = "Default for group membership lookups that can follow nested groups."
    )
    @PluginProperty
    @Builder.Default
    protected Boolean recursiveGroups = true;

    /**
     * Opens and binds a connection with the task settings.
     *
     * @param runContext : A context that may evaluate pebble expressions regarding the connection informations.
     * @return A directory ready to query, to be closed by the caller.
     */
    protected Adldap openDirectory(RunContext runContext) throws LDAPException, GeneralSecurityException, IllegalVariableEvaluationException {
        Logger logger = runContext.logger();

        LDAPConnection connection = this.bind(runContext);

        DirectoryConfiguration configuration = DirectoryConfiguration.builder()
            .baseDn(runContext.render(this.baseDn))
            .accountSuffix(runContext.render(this.accountSuffix))
            .recursiveGroups(this.recursiveGroups == null || this.recursiveGroups)
            .build();

        logger.debug("Bound to {}:{}", connection.getConnectedAddress(), connection.getConnectedPort());
        return new Adldap(new UnboundIdDirectoryConnection(connection, logger), configuration);
    }

    private LDAPConnection bind(RunContext runContext) throws LDAPException, GeneralSecurityException, IllegalVariableEvaluationException {
        Logger logger = runContext.logger();

        String authMethodProperty = this.authMethod == null ? "simple" : runContext.render(this.authMethod);
        String rUserDn = runContext.render(this.userDn);
        String rPassword = runContext.render(this.password);

        BindRequest bindRequest;
        switch (authMethodProperty) {
            case "simple":
                bindRequest = new SimpleBindRequest(rUserDn, rPassword);
                break;
            case "gssapi":
                String kdcProperty = runContext.render(this.kdc);
                String realmProperty = runContext.render(this.realm);

                if ((kdcProperty == null) != (realmProperty == null)) {
                    throw new IllegalArgumentException("Property kdc and realm both must be set or neither must be set.");
                }

                GSSAPIBindRequestProperties gssapiProperties = new GSSAPIBindRequestProperties(rUserDn, rPassword);
                if (kdcProperty != null) {
                    gssapiProperties.setKDCAddress(kdcProperty);
                    gssapiProperties.setRealm(realmProperty);
                }

                bindRequest = new GSSAPIBindRequest(gssapiProperties);
                break;
            default:
                throw new IllegalArgumentException(String.format("Invalid authentication method \"%s\".", authMethodProperty));
        }

        LDAPConnection connection = this.createLdapConnection(
            runContext.render(this.hostname),
            Integer.parseInt(runContext.render(this.port)),
            Boolean.TRUE.equals(this.ssl),
            Boolean.TRUE.equals(this.trustAllCertificates)
        );

        try {
            connection.bind(bindRequest);
            return connection;
        } catch (LDAPException e) {
            logger.error("LDAP connection error: {}", e.getResultString());
            connection.close();
            throw e;
        }
    }

    LDAPConnection createLdapConnection(String hostname, int port, boolean ssl, boolean trustAllCertificates) throws LDAPException, GeneralSecurityException {
        if (!ssl && !trustAllCertificates) {
            return new LDAPConnection(hostname, port);
        }

        SSLUtil sslUtil = trustAllCertificates
            ? new SSLUtil(new TrustAllTrustManager())
            : new SSLUtil(JVMDefaultTrustManager.getInstance());
        SSLSocketFactory sslSocketFactory = sslUtil.createSSLSocketFactory();
        return new LDAPConnection(sslSocketFactory, hostname, port);
    }

    /**
     * Renders a list property, {@code null} staying an empty list.
     */
    protected static List<String> renderList(RunContext runContext, List<String> values) throws IllegalVariableEvaluationException {
        return values == null ? List.of() : runContext.render(values);
    }
}
