package com.sbomcheck.core.loader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Lists the documents of an input directory.
 *
 * <p>Files ending in {@code .spdx.json} (any case) become {@link FileDocumentSource}s; every
 * other file becomes an {@link UnrecognizedFileSource}, so it is reported rather than silently
 * skipped. Sources are sorted by path for deterministic reports.
 */
public final class SpdxFileDiscovery {

    private static final Logger log = LoggerFactory.getLogger(SpdxFileDiscovery.class);

    public static final String SPDX_EXTENSION = ".spdx.json";

    private SpdxFileDiscovery() {
    }

    /**
     * Discovers documents.
     *
     * @param input directory to list, or a single file
     * @param recursive true to descend into subdirectories
     * @return sources in path order
     * @throws IOException if the directory cannot be listed or does not exist
     */
    public static List<DocumentSource> discover(Path input, boolean recursive) throws IOException {
        if (!Files.exists(input)) {
            throw new IOException("Input path does not exist: " + input);
        }
        if (Files.isRegularFile(input)) {
            return List.of(toSource(input, input.getFileName().toString()));
        }

        try (Stream<Path> paths = recursive ? Files.walk(input) : Files.list(input)) {
            List<DocumentSource> sources = paths
                .filter(Files::isRegularFile)
                .sorted()
                .map(path -> toSource(path, documentId(input, path)))
                .toList();
            log.info("Discovered {} file(s) in {}", sources.size(), input);
            return sources;
        }
    }

    /**
     * Returns true if the file name marks an SPDX JSON document.
     *
     * @param path file path
     * @return true for names ending in {@code .spdx.json}, ignoring case
     */
    public static boolean isSpdxJson(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(SPDX_EXTENSION);
    }

    private static DocumentSource toSource(Path path, String documentId) {
        if (isSpdxJson(path)) {
            log.debug("SPDX file {} found", path);
            return new FileDocumentSource(path, documentId);
        }
        log.warn("File {} not recognized; SPDX JSON files must end with '{}'", path, SPDX_EXTENSION);
        return new UnrecognizedFileSource(path, documentId);
    }

    private static String documentId(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
