package com.panorama.osDirectoriesCreate;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

@Slf4j
public class CreateFolderOrFile {

    public static Path createFolder(Path path) throws IOException {
        if (Files.notExists(path)) {
            Files.createDirectories(path);
            log.info("Created directory {}", path.toAbsolutePath());
        }
        return path;
    }

    /** Deletes the regular files directly inside the folder; sub-folders are left alone. */
    public static int clearFolder(Path path) throws IOException {
        if (!Files.exists(path)) return 0;
        int deleted = 0;
        try (Stream<Path> files = Files.list(path)) {
            for (Path file : (Iterable<Path>) files.filter(Files::isRegularFile)::iterator) {
                Files.delete(file);
                deleted++;
            }
        }
        log.debug("Deleted {} files from {}", deleted, path);
        return deleted;
    }

    /** Deletes the folder after clearing it. The folder must not contain sub-folders. */
    public static void deleteFolder(Path path) throws IOException {
        clearFolder(path);
        Files.deleteIfExists(path);
    }
}
