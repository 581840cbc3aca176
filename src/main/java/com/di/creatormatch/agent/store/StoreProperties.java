package com.di.creatormatch.agent.store;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Candidate store selection and tuning.
 *
 * <pre>
 * creatormatch:
 *   store:
 *     persistence-enabled: false      # true = JdbcCandidateStore
 *     cache-enabled: true             # with persistence: Caffeine in front of JDBC
 *     seed-resource: data/creators.yaml
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "creatormatch.store")
public class StoreProperties {

    private boolean persistenceEnabled = false;
    private boolean cacheEnabled = false;

    /** Classpath YAML loaded into the in-memory store at start. Blank = start empty. */
    private String seedResource = "";

    // ------------------------------------------------------------------ //
    // Cache (only with persistence)                                       //
    // ------------------------------------------------------------------ //

    private Cache cache = new Cache();

    // ------------------------------------------------------------------ //
    // Datasource (only with persistence)                                  //
    // ------------------------------------------------------------------ //

    private Datasource datasource = new Datasource();

    @Data
    public static class Cache {
        private int byIdMaxSize = 5_000;
        private int byIdExpireAfterWriteMinutes = 30;
        private int queryMaxSize = 500;
        private int queryExpireAfterWriteMinutes = 5;
    }

    @Data
    public static class Datasource {
        private String url;
        private String username;
        private String password;
        private String driverClassName = "org.postgresql.Driver";
    }
}
