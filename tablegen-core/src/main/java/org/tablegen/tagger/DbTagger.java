package org.tablegen.tagger;

import org.tablegen.database.CatalogBackend;
import org.tablegen.model.Column;

/**
 * The standard {@code db} tag read by sqlx and database/sql scanners.
 */
public class DbTagger implements Tagger {

    public static final String ID = "db";

    @Override
    public String generateTag(CatalogBackend backend, Column column) {
        return "db:" + Tagger.quote(column.getName());
    }
}
