package com.outreach.scoring.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.outreach.scoring.exception.StorageException;
import com.outreach.scoring.model.bulk.ListCatalog;
import com.outreach.scoring.model.bulk.ListEntry;
import com.outreach.scoring.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileListStoreTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path dir;

    @Test
    void load_missingFile_emptyCatalog() {
        FileListStore store = new FileListStore(dir.resolve("lists_config.json"), objectMapper);

        assertThat(store.load().getLists()).isEmpty();
    }

    @Test
    void save_thenLoad_roundTripsKnownAndUnknownFields() {
        FileListStore store = new FileListStore(dir.resolve("nested/lists_config.json"), objectMapper);
        ListCatalog catalog = TestDataFactory.createCatalog("a.lvp", "b.csv");
        catalog.getLists().get(0).putExtra("total_emails", 1200);
        catalog.putExtra("version", "2.1");

        store.save(catalog);
        ListCatalog loaded = store.load();

        assertThat(loaded.getLists()).extracting(ListEntry::getFilename).containsExactly("a.lvp", "b.csv");
        assertThat(loaded.find("a.lvp").orElseThrow().getExtra()).containsEntry("total_emails", 1200);
        assertThat(loaded.getExtra()).containsEntry("version", "2.1");
    }

    @Test
    void save_leavesNoTempFilesBehind() throws Exception {
        FileListStore store = new FileListStore(dir.resolve("lists_config.json"), objectMapper);

        store.save(TestDataFactory.createCatalog("a.lvp"));
        store.save(TestDataFactory.createCatalog("a.lvp", "b.lvp"));

        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("lists_config.json");
        }
        assertThat(store.load().getLists()).hasSize(2);
    }

    @Test
    void load_readsDisplayNameInSnakeCase() throws Exception {
        Path file = dir.resolve("lists_config.json");
        Files.writeString(file, "{\"lists\": [{\"filename\": \"a.lvp\", \"display_name\": \"Alpha\", \"priority\": 70}]}",
                StandardCharsets.UTF_8);

        ListEntry entry = new FileListStore(file, objectMapper).load().getLists().get(0);

        assertThat(entry.getDisplayName()).isEqualTo("Alpha");
        assertThat(entry.getPriority()).isEqualTo(70);
    }

    @Test
    void load_corruptFile_storageException() throws Exception {
        Path file = dir.resolve("lists_config.json");
        Files.writeString(file, "{ broken", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> new FileListStore(file, objectMapper).load())
                .isInstanceOf(StorageException.class)
                .hasMessage("Failed to read list store lists_config.json");
    }
}
