package org.tablegen.loader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tablegen.database.CatalogBackend;
import org.tablegen.model.Table;

import java.util.List;

/**
 * Drives a backend through one load: connect, list the tables, prepare the column
 * statement once, then fetch the columns of every table in listing order.
 * <p>
 * The load is all or nothing. The first failure propagates unchanged and the backend
 * is closed on every exit path.
 */
public class SchemaLoader {

    private static final Logger log = LoggerFactory.getLogger(SchemaLoader.class);

    /**
     * @param allowList table names to restrict the load to; {@code null} or empty loads every table
     * @return tables ordered by name, each with its columns attached
     */
    public List<Table> load(CatalogBackend backend, List<String> allowList) {
        try (backend) {
            backend.connect();
            List<Table> tables = backend.listTables(allowList == null ? List.of() : allowList);
            log.debug("{} table(s) found in scope '{}'", tables.size(), backend.scope());

            backend.prepareColumnFetch();
            for (Table table : tables) {
                backend.fetchColumns(table);
                log.debug("Loaded {} column(s) of {}", table.getColumns().size(), table.getName());
            }
            return List.copyOf(tables);
        }
    }
}
