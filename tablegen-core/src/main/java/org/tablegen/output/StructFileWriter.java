package org.tablegen.output;

import org.tablegen.emit.GoStructRenderer;
import org.tablegen.emit.StructDeclaration;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes one {@code .go} file per struct into the output directory, replacing files
 * left by an earlier run.
 */
public class StructFileWriter {

    private final Path outputDir;
    private final GoStructRenderer renderer;
    private final FileNameFormat fileNameFormat;

    public StructFileWriter(Path outputDir, GoStructRenderer renderer, FileNameFormat fileNameFormat) {
        this.outputDir = outputDir;
        this.renderer = renderer;
        this.fileNameFormat = fileNameFormat;
    }

    /**
     * @return written files, in declaration order
     * @throws FileAlreadyExistsException when two tables map to the same file name
     */
    public List<Path> write(List<StructDeclaration> structs) throws IOException {
        Set<String> fileNames = new HashSet<>();
        for (StructDeclaration struct : structs) {
            String fileName = fileNameFormat.fileName(struct.tableName());
            if (!fileNames.add(fileName)) {
                throw new FileAlreadyExistsException(outputDir.resolve(fileName).toString(), null,
                        "more than one table maps to this file name");
            }
        }

        Files.createDirectories(outputDir);

        List<Path> written = new ArrayList<>(structs.size());
        for (StructDeclaration struct : structs) {
            Path file = outputDir.resolve(fileNameFormat.fileName(struct.tableName()));
            Files.writeString(file, renderer.render(struct));
            written.add(file);
        }
        return written;
    }
}
