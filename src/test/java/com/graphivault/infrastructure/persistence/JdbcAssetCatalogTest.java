package com.graphivault.infrastructure.persistence;

import com.graphivault.config.VaultProperties;
import com.graphivault.domain.exception.DuplicateAssetException;
import com.graphivault.domain.model.Asset;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class JdbcAssetCatalogTest {

    @TempDir
    Path vaultRoot;

    private final MutableClock clock = MutableClock.startingAt("2024-05-01T08:00:00Z");
    private VaultDatabase database;
    private JdbcAssetCatalog catalog;
    private JdbcTagStore tagStore;
    private JdbcAnnotationStore annotationStore;

    @BeforeEach
    void openVault() {
        database = new SchemaManager(new VaultProperties.Database(), clock).initialize(vaultRoot);
        catalog = new JdbcAssetCatalog(database, clock);
        tagStore = new JdbcTagStore(database, clock);
        annotationStore = new JdbcAnnotationStore(database, clock);
    }

    @AfterEach
    void closeVault() {
        database.close();
    }

    @Test
    void first_asset_walkthrough_from_ingest_to_blocked_reingest() {
        long id = catalog.insert("abc123", "enc_1.bin", "encrypted/enc_1.bin", 2048);
        long tagId = tagStore.addTag(id, "vacation", null);

        assertEquals(1L, id);
        assertEquals(1L, tagId);

        List<Asset> assets = catalog.listActive();
        assertEquals(1, assets.size());
        Asset asset = assets.get(0);
        assertEquals("abc123", asset.getContentHash());
        assertEquals("enc_1.bin", asset.getEncryptedName());
        assertEquals("encrypted/enc_1.bin", asset.getStoragePath());
        assertEquals(2048L, asset.getSizeBytes());
        assertFalse(asset.isDeleted());
        assertEquals(Instant.parse("2024-05-01T08:00:00Z"), asset.getCreatedAt());
        assertEquals(asset.getCreatedAt(), asset.getUpdatedAt());

        assertEquals(List.of("vacation"),
            tagStore.listTags(id).stream().map(tag -> tag.getName()).collect(Collectors.toList()));

        assertTrue(catalog.softDelete(id));
        assertEquals(Optional.empty(), catalog.findById(1L));
        assertEquals(Optional.empty(), catalog.findByHash("abc123"));
        assertTrue(catalog.listActive().isEmpty());

        DuplicateAssetException ex = assertThrows(DuplicateAssetException.class,
            () -> catalog.insert("abc123", "enc_2.bin", "encrypted/enc_2.bin", 2048));
        assertEquals("abc123", ex.getContentHash());
    }

    @Test
    void duplicate_content_is_rejected() {
        catalog.insert("abc123", "enc_1.bin", "encrypted/enc_1.bin", 2048);

        DuplicateAssetException ex = assertThrows(DuplicateAssetException.class,
            () -> catalog.insert("abc123", "enc_2.bin", "encrypted/enc_2.bin", 10));
        assertEquals("abc123", ex.getContentHash());
        assertEquals(1, catalog.countActive());
    }

    @Test
    void soft_deleted_content_still_blocks_reingest() {
        long id = catalog.insert("abc123", "enc_1.bin", "encrypted/enc_1.bin", 2048);
        assertTrue(catalog.softDelete(id));

        assertThrows(DuplicateAssetException.class,
            () -> catalog.insert("abc123", "enc_2.bin", "encrypted/enc_2.bin", 2048));
        assertTrue(catalog.hashExists("abc123"));
        assertTrue(catalog.findByHash("abc123").isEmpty());
    }

    @Test
    void soft_delete_hides_the_asset_from_every_read() {
        long keep = catalog.insert("h-keep", "a.bin", "encrypted/a.bin", 1);
        long gone = catalog.insert("h-gone", "b.bin", "encrypted/b.bin", 2);
        tagStore.addTag(gone, "vacation", "event");

        clock.advance(Duration.ofMinutes(5));
        assertTrue(catalog.softDelete(gone));

        assertEquals(List.of(keep), ids(catalog.listActive()));
        assertTrue(catalog.listActiveByTag("vacation").isEmpty());
        assertEquals(Optional.empty(), catalog.findById(gone));
        assertEquals(Optional.empty(), catalog.findByHash("h-gone"));
        assertEquals(1, catalog.countActive());

        String updatedAt = database.getJdbcTemplate()
            .queryForObject("SELECT updated_at FROM images WHERE id = ?", String.class, gone);
        assertEquals("2024-05-01T08:05:00.000000Z", updatedAt);
    }

    @Test
    void soft_delete_is_idempotent() {
        long id = catalog.insert("abc123", "enc_1.bin", "encrypted/enc_1.bin", 2048);

        assertTrue(catalog.softDelete(id));
        assertFalse(catalog.softDelete(id));
        assertFalse(catalog.softDelete(9999));
    }

    @Test
    void listing_is_most_recent_first_with_id_tiebreak() {
        long first = catalog.insert("h1", "1.bin", "encrypted/1.bin", 1);
        clock.advance(Duration.ofSeconds(1));
        long second = catalog.insert("h2", "2.bin", "encrypted/2.bin", 1);
        long sameInstant = catalog.insert("h3", "3.bin", "encrypted/3.bin", 1);

        assertEquals(List.of(sameInstant, second, first), ids(catalog.listActive()));
    }

    @Test
    void listing_by_tag_matches_exact_names_only() {
        long beach = catalog.insert("h1", "1.bin", "encrypted/1.bin", 1);
        long city = catalog.insert("h2", "2.bin", "encrypted/2.bin", 1);
        tagStore.addTag(beach, "vacation", null);
        tagStore.addTag(beach, "beach", "place");
        tagStore.addTag(city, "Vacation", null);

        assertEquals(List.of(beach), ids(catalog.listActiveByTag("vacation")));
        assertTrue(catalog.listActiveByTag("vac").isEmpty());
    }

    @Test
    void purge_cascades_while_soft_delete_keeps_children() {
        long soft = catalog.insert("h1", "1.bin", "encrypted/1.bin", 1);
        long hard = catalog.insert("h2", "2.bin", "encrypted/2.bin", 1);
        for (long id : List.of(soft, hard)) {
            tagStore.addTag(id, "t", null);
            annotationStore.addAnnotation(id, "note");
        }

        catalog.softDelete(soft);
        assertTrue(catalog.purge(hard));

        assertEquals(1, tagStore.listTags(soft).size());
        assertEquals(1, annotationStore.listAnnotations(soft).size());
        assertTrue(tagStore.listTags(hard).isEmpty());
        assertTrue(annotationStore.listAnnotations(hard).isEmpty());
        assertFalse(catalog.hashExists("h2"), "purge frees the content hash");
        assertFalse(catalog.purge(hard));
    }

    @Test
    void find_by_id_and_hash_return_live_assets() {
        long id = catalog.insert("abc123", "enc_1.bin", "encrypted/enc_1.bin", 2048);

        assertEquals(id, catalog.findById(id).orElseThrow().getId());
        assertEquals(id, catalog.findByHash("abc123").orElseThrow().getId());
        assertTrue(catalog.findById(id + 1).isEmpty());
        assertFalse(catalog.hashExists("nope"));
    }

    private static List<Long> ids(List<Asset> assets) {
        return assets.stream().map(Asset::getId).collect(Collectors.toList());
    }
}
