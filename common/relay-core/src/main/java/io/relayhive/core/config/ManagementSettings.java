package io.relayhive.core.config;

import java.net.URI;
import java.util.Objects;

/**
 * Location and credentials of the RabbitMQ management HTTP API.
 *
 * @param url base URL of the management plugin, for example {@code http://localhost:15672}
 * @param username user for basic authentication
 * @param password password for basic authentication
 * @param vhost virtual host that operator policies are scoped to
 */
public record ManagementSettings(URI url, String username, String password, String vhost) {

    public static final String DEFAULT_VHOST = "/";

    public ManagementSettings {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(password, "password");
        if (vhost == null || vhost.isBlank()) {
            vhost = DEFAULT_VHOST;
        }
    }

    public static ManagementSettings of(String url, String username, String password) {
        return new ManagementSettings(URI.create(url), username, password, DEFAULT_VHOST);
    }

    public ManagementSettings withVhost(String virtualHost) {
        return new ManagementSettings(url, username, password, virtualHost);
    }

    @Override
    public String toString() {
        return "ManagementSettings{url=" + url + ", username='" + username + "', vhost='" + vhost + "'}";
    }
}
