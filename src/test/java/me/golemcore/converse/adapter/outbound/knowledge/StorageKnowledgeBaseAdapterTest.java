package me.golemcore.converse.adapter.outbound.knowledge;

import com.github.benmanes.caffeine.cache.Caffeine;
import me.golemcore.converse.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.converse.domain.model.KnowledgeDocument;
import me.golemcore.converse.infrastructure.config.AutoConfiguration;
import me.golemcore.converse.infrastructure.config.ConverseProperties;
import me.golemcore.converse.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class StorageKnowledgeBaseAdapterTest {

    @TempDir
    Path tempDir;

    private ConverseProperties properties;
    private LocalStorageAdapter storage;
    private StorageKnowledgeBaseAdapter adapter;
    private Path kbDir;

    @BeforeEach
    void setUp() throws Exception {
        properties = new ConverseProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        adapter = newAdapter(storage);
        kbDir = Files.createDirectories(tempDir.resolve("knowledge").resolve("kb-main"));
    }

    private StorageKnowledgeBaseAdapter newAdapter(StoragePort storagePort) {
        return new StorageKnowledgeBaseAdapter(storagePort, AutoConfiguration.objectMapper(), properties,
                Caffeine.newBuilder().<String, List<KnowledgeDocument>>build());
    }

    private List<KnowledgeDocument> sorted(List<KnowledgeDocument> documents) {
        return documents.stream().sorted(Comparator.comparing(KnowledgeDocument::getId)).toList();
    }

    @Test
    void readsJsonMarkdownAndTextDocuments() throws Exception {
        Files.writeString(kbDir.resolve("tarifs.json"), """
                {"title":"Tarifs transport maritime","content":"850 USD/CBM vers Douala","status":"PROCESSED"}
                """);
        Files.writeString(kbDir.resolve("a_propos.md"), "# Qui sommes-nous\nTransitaire depuis 2010.");
        Files.writeString(kbDir.resolve("horaires.txt"), "Lundi au vendredi, 8h-17h.");
        Files.writeString(kbDir.resolve("logo.png"), "not a document");

        List<KnowledgeDocument> documents = sorted(adapter.listDocuments("kb-main"));

        assertEquals(List.of("a_propos", "horaires", "tarifs"),
                documents.stream().map(KnowledgeDocument::getId).toList());
        assertEquals("a propos", documents.get(0).getTitle());
        assertEquals("Tarifs transport maritime", documents.get(2).getTitle());
        assertTrue(documents.stream().allMatch(d -> "kb-main".equals(d.getKnowledgeBaseId())));
        assertTrue(documents.stream().allMatch(d -> d.getStatus() == KnowledgeDocument.Status.PROCESSED));
    }

    @Test
    void jsonStatusIsKept() throws Exception {
        Files.writeString(kbDir.resolve("draft.json"),
                "{\"id\":\"draft-1\",\"title\":\"Draft\",\"content\":\"pending text\",\"status\":\"PENDING\"}");

        KnowledgeDocument document = adapter.listDocuments("kb-main").get(0);

        assertEquals("draft-1", document.getId());
        assertEquals(KnowledgeDocument.Status.PENDING, document.getStatus());
    }

    @Test
    void unreadableJsonIsSkipped() throws Exception {
        Files.writeString(kbDir.resolve("broken.json"), "{oops");
        Files.writeString(kbDir.resolve("ok.txt"), "fine");

        List<KnowledgeDocument> documents = adapter.listDocuments("kb-main");

        assertEquals(1, documents.size());
        assertEquals("ok", documents.get(0).getId());
    }

    @Test
    void unknownKnowledgeBaseIsEmpty() {
        assertTrue(adapter.listDocuments("kb-missing").isEmpty());
    }

    @Test
    void unsafeIdsAreRejected() {
        assertTrue(adapter.listDocuments("../conversations").isEmpty());
        assertTrue(adapter.listDocuments(".hidden").isEmpty());
        assertTrue(adapter.listDocuments(null).isEmpty());
    }

    // ==================== cache ====================

    @Test
    void documentsAreCachedUntilInvalidated() throws Exception {
        Files.writeString(kbDir.resolve("one.txt"), "first document");
        assertEquals(1, adapter.listDocuments("kb-main").size());

        Files.writeString(kbDir.resolve("two.txt"), "second document");
        assertEquals(1, adapter.listDocuments("kb-main").size());

        adapter.invalidate("kb-main");
        assertEquals(2, adapter.listDocuments("kb-main").size());
    }

    @Test
    void storageFailureSurfacesAsIllegalState() {
        StoragePort failing = mock(StoragePort.class);
        when(failing.listObjects(anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk gone")));
        StorageKnowledgeBaseAdapter failingAdapter = newAdapter(failing);

        assertThrows(IllegalStateException.class, () -> failingAdapter.listDocuments("kb-main"));
    }
}
