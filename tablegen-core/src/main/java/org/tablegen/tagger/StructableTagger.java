package org.tablegen.tagger;

import org.tablegen.database.CatalogBackend;
import org.tablegen.model.Column;

/**
 * Tag for the Mastermind structable recorder: {@code stbl:"name[,PRIMARY_KEY][,SERIAL,AUTO_INCREMENT]"}.
 */
public class StructableTagger implements Tagger {

    public static final String ID = "stbl";

    @Override
    public String generateTag(CatalogBackend backend, Column column) {
        StringBuilder value = new StringBuilder(column.getName());
        if (backend.isPrimaryKey(column)) {
            value.append(",PRIMARY_KEY");
        }
        if (backend.isAutoIncrement(column)) {
            value.append(",SERIAL,AUTO_INCREMENT");
        }
        return "stbl:" + Tagger.quote(value.toString());
    }
}
