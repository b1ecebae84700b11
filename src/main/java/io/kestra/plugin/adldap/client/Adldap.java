package io.kestra.plugin.adldap.client;

import io.kestra.plugin.adldap.management.Groups;
import io.kestra.plugin.adldap.management.Users;
import io.kestra.plugin.adldap.query.Search;
import lombok.Getter;

import java.util.Optional;

/**
 * Entry point tying a bound {@link DirectoryConnection} to its {@link DirectoryConfiguration}.
 * Closing it closes the connection.
 */
@Getter
public class Adldap implements AutoCloseable {
    private final DirectoryConnection connection;
    private final DirectoryConfiguration configuration;

    public Adldap(DirectoryConnection connection, DirectoryConfiguration configuration) {
        this.connection = connection;
        this.configuration = configuration;
    }

    /**
     * @return a new search, each call starting from empty criteria.
     */
    public Search search() {
        return new Search(connection, configuration);
    }

    public Groups groups() {
        return new Groups(this);
    }

    public Users users() {
        return new Users(this);
    }

    public Optional<String> getBaseDn() {
        return this.search().getBaseDn();
    }

    @Override
    public void close() {
        connection.close();
    }
}
