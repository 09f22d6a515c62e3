package com.outreach.scoring.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.outreach.scoring.config.BulkUpdateProperties;
import com.outreach.scoring.exception.StorageException;
import com.outreach.scoring.model.bulk.ListCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;

/**
 * JSON file implementation of {@link ListStore}.
 *
 * Writes go to a temp file in the target directory, which is then renamed over the store file,
 * so a crash mid-write leaves the previous catalog intact.
 */
@Repository
public class FileListStore implements ListStore {

    private static final Logger log = LoggerFactory.getLogger(FileListStore.class);

    private final Path path;
    private final ObjectMapper objectMapper;

    @Autowired
    public FileListStore(BulkUpdateProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getStorePath()), objectMapper);
    }

    FileListStore(Path path, ObjectMapper objectMapper) {
        this.path = path.toAbsolutePath();
        this.objectMapper = objectMapper;
    }

    @Override
    public ListCatalog load() {
        if (!Files.exists(path)) {
            log.debug("List store {} does not exist yet, reading as empty", path);
            return new ListCatalog();
        }
        try {
            ListCatalog catalog = objectMapper.readValue(path.toFile(), ListCatalog.class);
            if (catalog.getLists() == null) {
                catalog.setLists(new ArrayList<>());
            }
            return catalog;
        } catch (IOException e) {
            log.error("Failed to read list store {}: {}", path, e.getMessage());
            throw new StorageException("Failed to read list store " + path.getFileName(), e);
        }
    }

    @Override
    public void save(ListCatalog catalog) {
        Path directory = path.getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "." + path.getFileName(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), catalog);
            move(temp, path);
            temp = null;
            log.info("List store {} written ({} lists)", path, catalog.getLists().size());
        } catch (IOException e) {
            log.error("Failed to write list store {}: {}", path, e.getMessage());
            throw new StorageException("Failed to save list store " + path.getFileName(), e);
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    log.warn("Could not remove temp file {}: {}", temp, e.getMessage());
                }
            }
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public Path getPath() {
        return path;
    }
}
