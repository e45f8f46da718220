package org.strata.options;

/**
 * Option keys and reserved names shared by the engine, the configuration loader and the CLI.
 */
public final class StrataOptions {

    private StrataOptions() {
    }

    /**
     * Profile-related settings.
     */
    public static final class Profile {
        private Profile() {}

        /**
         * Default profile name.
         */
        public static final String DEFAULT = "dev";

        /**
         * Profile environment variable name.
         */
        public static final String ENV_VAR = "STRATA_PROFILE";

        /**
         * Configuration file name.
         */
        public static final String CONFIG_FILE = "strata.yaml";
    }

    /**
     * Target store connection.
     */
    public static final class Database {
        private Database() {}

        public static final String URL_KEY = "strata.database.url";
        public static final String USERNAME_KEY = "strata.database.username";
        public static final String PASSWORD_KEY = "strata.database.password";
        public static final String DIALECT_KEY = "strata.database.dialect";
    }

    /**
     * Unit file discovery.
     */
    public static final class Migrations {
        private Migrations() {}

        public static final String DIRECTORY_KEY = "strata.migrations.directory";
        public static final String DIRECTORY_DEFAULT = "migrations";
    }

    /**
     * Reserved bookkeeping tables inside the target store.
     */
    public static final class State {
        private State() {}

        public static final String VERSION_TABLE = "strata_version";
        public static final String HISTORY_TABLE = "strata_version_history";
        public static final String LOCK_TABLE = "strata_lock";
    }
}
