package org.tablegen.emit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tablegen.database.CatalogBackend;
import org.tablegen.model.Column;
import org.tablegen.model.Table;
import org.tablegen.model.TypeCategory;
import org.tablegen.spi.naming.FieldNamingStrategy;
import org.tablegen.tagger.Tagger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns loaded tables into struct declarations, one per table and one field per column.
 * <p>
 * Field types come from the backend's classification of each column, tags from the
 * active taggers in their configured order. Output depends only on the tables and the
 * configuration, so repeated runs over the same schema produce identical declarations.
 */
public class CodeEmitter {

    private static final Logger log = LoggerFactory.getLogger(CodeEmitter.class);

    private final List<Tagger> taggers;
    private final FieldNamingStrategy naming;
    private final GoTypeMapper typeMapper;
    private final String prefix;
    private final String suffix;

    public CodeEmitter(List<Tagger> taggers, FieldNamingStrategy naming, GoTypeMapper typeMapper, String prefix, String suffix) {
        this.taggers = List.copyOf(taggers);
        this.naming = naming;
        this.typeMapper = typeMapper;
        this.prefix = prefix == null ? "" : prefix;
        this.suffix = suffix == null ? "" : suffix;
    }

    public List<StructDeclaration> emit(CatalogBackend backend, List<Table> tables) {
        List<StructDeclaration> declarations = new ArrayList<>(tables.size());
        Set<String> structNames = new HashSet<>();
        for (Table table : tables) {
            StructDeclaration struct = emit(backend, table);
            String structName = uniqueStructName(struct.structName(), structNames, table);
            if (!structName.equals(struct.structName())) {
                struct = new StructDeclaration(struct.tableName(), structName, struct.fields(), struct.imports());
            }
            declarations.add(struct);
        }
        return declarations;
    }

    public StructDeclaration emit(CatalogBackend backend, Table table) {
        List<FieldDeclaration> fields = new ArrayList<>(table.getColumns().size());
        Set<String> imports = new TreeSet<>();
        Set<String> usedNames = new HashSet<>();

        for (Column column : table.getColumns()) {
            TypeCategory category = backend.classify(column);
            if (category == TypeCategory.UNKNOWN) {
                log.warn("Unknown data type '{}' of column {}.{}, falling back to interface{}",
                        column.getDataType(), table.getName(), column.getName());
            }
            GoTypeMapper.GoType goType = typeMapper.map(category, backend.isNullable(column));
            imports.addAll(goType.imports());

            String fieldName = uniqueName(naming.toFieldName(column.getName()), column, usedNames, table);
            fields.add(new FieldDeclaration(fieldName, goType.name(), tagOf(backend, column)));
        }

        String structName = prefix + naming.toStructName(table.getName()) + suffix;
        return new StructDeclaration(table.getName(), structName, fields, new ArrayList<>(imports));
    }

    private String tagOf(CatalogBackend backend, Column column) {
        List<String> fragments = new ArrayList<>(taggers.size());
        for (Tagger tagger : taggers) {
            fragments.add(tagger.generateTag(backend, column));
        }
        return String.join(" ", fragments);
    }

    /**
     * Two columns may map to the same field name ("user_id" and "userId"); later ones get
     * their ordinal position appended.
     */
    private String uniqueName(String candidate, Column column, Set<String> usedNames, Table table) {
        if (usedNames.add(candidate)) {
            return candidate;
        }
        int n = column.getOrdinalPosition();
        String name = candidate + n;
        while (!usedNames.add(name)) {
            name = candidate + ++n;
        }
        log.warn("Field name {} of {}.{} is already taken, using {}",
                candidate, table.getName(), column.getName(), name);
        return name;
    }

    /**
     * Tables whose names differ only in case or separators ("order_items", "OrderItems")
     * map to one struct name; later ones are numbered from 2.
     */
    private String uniqueStructName(String candidate, Set<String> usedNames, Table table) {
        if (usedNames.add(candidate)) {
            return candidate;
        }
        int n = 2;
        String name = candidate + n;
        while (!usedNames.add(name)) {
            name = candidate + ++n;
        }
        log.warn("Struct name {} of table {} is already taken, using {}", candidate, table.getName(), name);
        return name;
    }
}
