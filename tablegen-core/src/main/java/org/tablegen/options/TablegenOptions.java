package org.tablegen.options;

/**
 * Defines configuration option constants used throughout tablegen.
 * The same keys are used by the CLI and by the {@code tablegen.yaml} loader so both
 * sources can be merged.
 */
public final class TablegenOptions {

    private TablegenOptions() {
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
        public static final String ENV_VAR = "TABLEGEN_PROFILE";

        /**
         * Configuration file name.
         */
        public static final String CONFIG_FILE = "tablegen.yaml";
    }

    public static final class Database {
        private Database() {}

        public static final String TYPE_KEY = "tablegen.database.type";
        public static final String TYPE_DEFAULT = "pg";
        public static final String HOST_KEY = "tablegen.database.host";
        public static final String HOST_DEFAULT = "127.0.0.1";
        public static final String PORT_KEY = "tablegen.database.port";
        public static final String USER_KEY = "tablegen.database.user";
        public static final String PASSWORD_KEY = "tablegen.database.password";
        public static final String NAME_KEY = "tablegen.database.name";
        public static final String SCHEMA_KEY = "tablegen.database.schema";
        public static final String SOCKET_KEY = "tablegen.database.socket";
        public static final String SSL_MODE_KEY = "tablegen.database.sslMode";
        public static final String SSL_MODE_DEFAULT = "disable";
        public static final String TABLES_KEY = "tablegen.database.tables";
    }

    public static final class Generator {
        private Generator() {}

        /**
         * Comma separated tag generator ids, applied in the given order.
         */
        public static final String TAGS_KEY = "tablegen.generator.tags";
        public static final String TAGS_DEFAULT = "db";
        public static final String NAMING_KEY = "tablegen.generator.naming";
        public static final String NAMING_DEFAULT = "camel";
        public static final String NULL_TYPE_KEY = "tablegen.generator.nullType";
        public static final String NULL_TYPE_DEFAULT = "sql";
    }

    public static final class Output {
        private Output() {}

        public static final String DIRECTORY_KEY = "tablegen.output.directory";
        public static final String DIRECTORY_DEFAULT = "output";
        public static final String PACKAGE_KEY = "tablegen.output.package";
        public static final String PACKAGE_DEFAULT = "dto";
        public static final String PREFIX_KEY = "tablegen.output.prefix";
        public static final String SUFFIX_KEY = "tablegen.output.suffix";
        public static final String FILE_NAME_FORMAT_KEY = "tablegen.output.fileNameFormat";
        public static final String FILE_NAME_FORMAT_DEFAULT = "snake";
    }
}
