package org.tablegen.generate;

import org.tablegen.model.Table;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a successful run.
 *
 * @param tables loaded tables, in generation order
 * @param files  written Go files, one per table
 */
public record GenerationResult(List<Table> tables, List<Path> files) {
}
