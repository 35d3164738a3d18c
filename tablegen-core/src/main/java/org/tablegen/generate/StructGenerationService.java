package org.tablegen.generate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tablegen.config.GeneratorSettings;
import org.tablegen.database.BackendRegistry;
import org.tablegen.database.CatalogBackend;
import org.tablegen.database.session.CatalogSessionFactory;
import org.tablegen.database.session.JdbcCatalogSession;
import org.tablegen.emit.CodeEmitter;
import org.tablegen.emit.GoStructRenderer;
import org.tablegen.emit.GoTypeMapper;
import org.tablegen.emit.NullType;
import org.tablegen.emit.StructDeclaration;
import org.tablegen.loader.SchemaLoader;
import org.tablegen.model.Table;
import org.tablegen.output.FileNameFormat;
import org.tablegen.output.SchemaSnapshotWriter;
import org.tablegen.output.StructFileWriter;
import org.tablegen.spi.naming.FieldNamingStrategy;
import org.tablegen.tagger.Tagger;
import org.tablegen.tagger.TaggerRegistry;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * One generation run: resolve the configuration, load the schema, emit the structs and
 * write them out.
 * <p>
 * Configuration errors (unknown database type, tagger, naming, null type or file name
 * format) are raised before any connection is opened. Nothing is written unless the
 * whole schema loaded.
 */
public class StructGenerationService {

    private static final Logger log = LoggerFactory.getLogger(StructGenerationService.class);

    private final CatalogSessionFactory sessionFactory;
    private final SchemaLoader schemaLoader;
    private final SchemaSnapshotWriter snapshotWriter;

    public StructGenerationService() {
        this(JdbcCatalogSession::open);
    }

    public StructGenerationService(CatalogSessionFactory sessionFactory) {
        this(sessionFactory, new SchemaLoader(), new SchemaSnapshotWriter());
    }

    StructGenerationService(CatalogSessionFactory sessionFactory, SchemaLoader schemaLoader, SchemaSnapshotWriter snapshotWriter) {
        this.sessionFactory = sessionFactory;
        this.schemaLoader = schemaLoader;
        this.snapshotWriter = snapshotWriter;
    }

    public GenerationResult generate(GeneratorSettings settings) throws IOException {
        List<Tagger> taggers = TaggerRegistry.resolve(settings.getTags());
        FieldNamingStrategy naming = FieldNamingStrategy.forId(settings.getNaming());
        GoTypeMapper typeMapper = new GoTypeMapper(NullType.fromId(settings.getNullType()));
        FileNameFormat fileNameFormat = FileNameFormat.fromId(settings.getFileNameFormat());
        CatalogBackend backend = BackendRegistry.create(settings, sessionFactory);

        if (settings.isVerbose()) {
            log.info("> dsn: {}", backend.dsn());
            log.info("> scope: {}", backend.scope());
        }

        List<Table> tables = schemaLoader.load(backend, settings.getTables());
        log.info("Loaded {} table(s) from {} '{}'", tables.size(), backend.getDatabaseType().id(), backend.scope());

        CodeEmitter emitter = new CodeEmitter(taggers, naming, typeMapper, settings.getPrefix(), settings.getSuffix());
        List<StructDeclaration> structs = emitter.emit(backend, tables);

        if (settings.getSchemaJson() != null) {
            writeSnapshot(settings.getSchemaJson(), backend, tables);
        }

        StructFileWriter writer = new StructFileWriter(
                settings.getOutputDirectory(), new GoStructRenderer(settings.getPackageName()), fileNameFormat);
        List<Path> files = writer.write(structs);
        log.info("Wrote {} file(s) to {}", files.size(), settings.getOutputDirectory());

        return new GenerationResult(tables, files);
    }

    private void writeSnapshot(Path file, CatalogBackend backend, List<Table> tables) throws IOException {
        snapshotWriter.write(new SchemaSnapshotWriter.SchemaSnapshot(backend.getDatabaseType().id(), backend.scope(), tables), file);
        log.info("Wrote schema snapshot to {}", file);
    }
}
