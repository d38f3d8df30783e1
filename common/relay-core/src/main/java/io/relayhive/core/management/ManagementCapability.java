package io.relayhive.core.management;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for features that depend on the management API being configured and reachable.
 * <p>
 * Reachability is checked once in {@link #initialize()} and cached for the lifetime of the
 * instance. A capability without a client, or whose check failed, reports
 * {@link #isEnabled()} as {@code false} and its operations report failure.
 */
public abstract class ManagementCapability {

    private static final Logger log = LoggerFactory.getLogger(ManagementCapability.class);

    private final RabbitManagementClient client;
    private final String feature;
    private volatile Boolean enabled;

    protected ManagementCapability(RabbitManagementClient client, String feature) {
        this.client = client;
        this.feature = feature;
    }

    public final synchronized void initialize() {
        if (enabled != null) {
            return;
        }
        if (client == null) {
            log.warn("management API not configured, {} disabled", feature);
            enabled = false;
            return;
        }
        enabled = client.isAvailable();
        if (enabled) {
            log.info("management API reachable, {} enabled", feature);
        } else {
            log.warn("management API not reachable, {} disabled", feature);
        }
    }

    public final boolean isEnabled() {
        Boolean current = enabled;
        return current != null && current;
    }

    protected final Optional<RabbitManagementClient> client() {
        return isEnabled() ? Optional.of(client) : Optional.empty();
    }
}
