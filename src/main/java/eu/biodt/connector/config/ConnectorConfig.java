package eu.biodt.connector.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

/**
 * Connector settings. Read once at startup and never mutated afterwards.
 * Static-init safe because the JAX-RS auth filter is created during static init.
 */
@StaticInitSafe
@ConfigMapping(prefix = "connector")
public interface ConnectorConfig {

    Argo argo();

    Cordra cordra();

    Transfer transfer();

    Auth auth();

    Tracker tracker();

    /**
     * What to do when a run that is already known gets notified again.
     */
    @WithDefault("REPROCESS")
    RenotifyPolicy renotifyPolicy();

    interface Argo {

        /**
         * Base URL of the Argo server (no trailing slash).
         */
        String url();

        /**
         * Bearer token sent with every Argo request.
         */
        String token();

        /**
         * Namespace used when a notification does not name one.
         */
        @WithDefault("argo")
        String namespace();

        @WithDefault("true")
        boolean verifyTls();
    }

    interface Cordra {

        /**
         * Base URL of the Cordra repository (no trailing slash).
         */
        String url();

        String username();

        String password();

        @WithDefault("true")
        boolean verifyTls();

        /**
         * Group the objects stored for a run into a Dataset object.
         */
        @WithDefault("true")
        boolean createDataset();
    }

    interface Transfer {

        /**
         * Artifacts larger than this are skipped.
         */
        @WithDefault("104857600")
        long maxArtifactSize();

        /**
         * Number of runs transferred in parallel.
         */
        @WithDefault("2")
        int workers();

        @WithDefault("5m")
        Duration requestTimeout();

        /**
         * Directory for spooled artifact bodies. Defaults to the JVM temp directory.
         */
        Optional<String> spoolDir();
    }

    interface Tracker {

        /**
         * Runs kept for status queries; the oldest finished runs are dropped beyond this.
         */
        @WithDefault("1000")
        int maxRuns();
    }

    interface Auth {

        Optional<String> username();

        Optional<String> password();
    }

    enum RenotifyPolicy {
        REPROCESS,
        SKIP
    }
}
