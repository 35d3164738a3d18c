package org.tablegen.tagger;

import org.tablegen.database.CatalogBackend;
import org.tablegen.model.Column;

/**
 * encoding/json tag; nullable columns are marked {@code omitempty}.
 */
public class JsonTagger implements Tagger {

    public static final String ID = "json";

    @Override
    public String generateTag(CatalogBackend backend, Column column) {
        String options = backend.isNullable(column) ? ",omitempty" : "";
        return "json:" + Tagger.quote(column.getName() + options);
    }
}
