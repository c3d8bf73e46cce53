package io.workledger.storage;

import io.workledger.error.DuplicateException;
import io.workledger.error.InvalidArgumentException;
import io.workledger.error.NotFoundException;
import io.workledger.model.ContentIdentity;
import io.workledger.model.ContentRecord;
import io.workledger.model.ContentStatus;
import io.workledger.model.ContentType;
import io.workledger.model.NewCollection;
import io.workledger.model.NewContent;
import io.workledger.model.NewTransform;
import io.workledger.model.TransformType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

final class ContentStoreTest {

    @Test
    void addThenGetAppliesDefaults() throws Exception {
        Path root = Files.createTempDirectory("workledger-test-content-");
        try {
            Database db = RequestStoreTest.openDatabase(root);
            ContentStore contents = new ContentStore(db);
            long collId = newCollection(db);

            long contentId = contents.add(NewContent.file(collId, "data17", "file.001.root"));
            ContentRecord loaded = contents.getContent(contentId);

            Assertions.assertEquals(collId, loaded.collId());
            Assertions.assertEquals(ContentType.FILE, loaded.contentType());
            Assertions.assertEquals(ContentStatus.NEW, loaded.status());
            Assertions.assertEquals(0L, loaded.bytes());
            Assertions.assertEquals(0, loaded.retries());
            Assertions.assertNull(loaded.minId());
            Assertions.assertNull(loaded.contentMetadata());
            Assertions.assertEquals(loaded.createdAtMs() + Duration.ofDays(30).toMillis(), loaded.expiredAtMs());

            long withMeta = contents.add(NewContent.range(collId, "data17", "events", ContentType.EVENT, 1, 100)
                    .withMetadata(Map.of("events", 100)));
            Assertions.assertEquals(100, contents.getContent(withMeta).contentMetadata().get("events"));
            Assertions.assertNull(contents.add(NewContent.file(collId, "data17", "file.002.root"), false));
        } finally {
            RequestStoreTest.deleteRecursively(root);
        }
    }

    @Test
    void duplicateIdentityIsRejected() throws Exception {
        Path root = Files.createTempDirectory("workledger-test-content-dup-");
        try {
            Database db = RequestStoreTest.openDatabase(root);
            ContentStore contents = new ContentStore(db);
            long collId = newCollection(db);

            contents.add(NewContent.range(collId, "s", "events", ContentType.EVENT, 1, 10));
            DuplicateException ranged = Assertions.assertThrows(DuplicateException.class,
                    () -> contents.add(NewContent.range(collId, "s", "events", ContentType.EVENT, 1, 10)));
            Assertions.assertTrue(ranged.getMessage().contains("(" + collId + ":s:events:EVENT:1:10)"), ranged.getMessage());
            contents.add(NewContent.range(collId, "s", "events", ContentType.EVENT, 11, 20));
            contents.add(NewContent.range(collId, "s", "events", ContentType.PSEUDO_CONTENT, 1, 10));

            contents.add(NewContent.range(collId, "s", "file.root", ContentType.FILE, 1, 10));
            DuplicateException dup = Assertions.assertThrows(DuplicateException.class,
                    () -> contents.add(NewContent.range(collId, "s", "file.root", ContentType.FILE, 5, 50)));
            Assertions.assertTrue(dup.getMessage().contains("content already exists"));
            Assertions.assertTrue(dup.getMessage().contains("(" + collId + ":s:file.root:FILE:5:50)"), dup.getMessage());
            Assertions.assertThrows(DuplicateException.class,
                    () -> contents.add(NewContent.file(collId, "s", "file.root")));
        } finally {
            RequestStoreTest.deleteRecursively(root);
        }
    }

    @Test
    void bulkInsertChunksAndReturnsIdsInOrder() throws Exception {
        Path root = Files.createTempDirectory("workledger-test-content-bulk-");
        try {
            Database db = RequestStoreTest.openDatabase(root);
            ContentStore contents = new ContentStore(db);
            long collId = newCollection(db);

            ContentStore.BulkInsert result = contents.insertBulk(files(collId, "a", 250), 100, true);
            Assertions.assertEquals(3, result.batches());
            Assertions.assertEquals(250, result.ids().size());
            for (int i = 0; i < 250; i++) {
                Assertions.assertEquals("a." + i, contents.getContent(result.ids().get(i)).name());
            }

            Assertions.assertEquals(1, contents.insertBulk(files(collId, "single", 40), 100, true).batches());
            Assertions.assertEquals(0, contents.insertBulk(List.of(), 100, true).batches());

            List<Long> nulls = contents.addContents(files(collId, "b", 250), 100, false);
            Assertions.assertEquals(250, nulls.size());
            Assertions.assertTrue(nulls.stream().allMatch(id -> id == null));
            Assertions.assertEquals(540L, contents.countByStatus(collId).get(ContentStatus.NEW));
        } finally {
            RequestStoreTest.deleteRecursively(root);
        }
    }

    @Test
    void bulkInsertWithDuplicateWritesNothing() throws Exception {
        Path root = Files.createTempDirectory("workledger-test-content-bulk-dup-");
        try {
            Database db = RequestStoreTest.openDatabase(root);
            ContentStore contents = new ContentStore(db);
            long collId = newCollection(db);

            List<NewContent> batch = new ArrayList<>(files(collId, "c", 150));
            batch.add(NewContent.file(collId, "s", "c.5"));

            DuplicateException dup = Assertions.assertThrows(DuplicateException.class,
                    () -> contents.addContents(batch, 100, true));
            Assertions.assertTrue(dup.getMessage().contains(":s:c.100:"), dup.getMessage());
            Assertions.assertTrue(dup.getMessage().contains(":s:c.5:"), dup.getMessage());
            Assertions.assertTrue(contents.countByStatus(collId).isEmpty());
        } finally {
            RequestStoreTest.deleteRecursively(root);
        }
    }

    @Test
    void contentIdLookupFollowsIdentityKind() throws Exception {
        Path root = Files.createTempDirectory("workledger-test-content-id-");
        try {
            Database db = RequestStoreTest.openDatabase(root);
            ContentStore contents = new ContentStore(db);
            long collId = newCollection(db);

            long file = contents.add(NewContent.range(collId, "s", "file.root", ContentType.FILE, 7, 8));
            long event = contents.add(NewContent.range(collId, "s", "events", ContentType.EVENT, 1, 10));

            Assertions.assertEquals(file, contents.getContentId(collId, "s", "file.root", ContentType.FILE, null, null));
            Assertions.assertEquals(event, contents.getContentId(collId, "s", "events", ContentType.EVENT, 1L, 10L));
            Assertions.assertEquals(event, contents.getContentId(collId, "s", "events", null, 1L, 10L));
            Assertions.assertEquals(event,
                    contents.getContent(ContentIdentity.of(collId, "s", "events", ContentType.EVENT, 1L, 10L)).contentId());

            Assertions.assertThrows(NotFoundException.class,
                    () -> contents.getContentId(collId, "s", "events", ContentType.EVENT, 1L, 11L));
            Assertions.assertThrows(NotFoundException.class,
                    () -> contents.getContentId(collId, "s", "events", ContentType.PSEUDO_CONTENT, 1L, 10L));
            Assertions.assertThrows(NotFoundException.class,
                    () -> contents.getContentId(collId, "s", "missing.root", ContentType.FILE, null, null));
        } finally {
            RequestStoreTest.deleteRecursively(root);
        }
    }

    @Test
    void matchContentsUsesRangeContainment() throws Exception {
        Path root = Files.createTempDirectory("workledger-test-content-match-");
        try {
            Database db = RequestStoreTest.openDatabase(root);
            ContentStore contents = new ContentStore(db);
            long collId = newCollection(db);

            long wide = contents.add(NewContent.range(collId, "s", "events", ContentType.EVENT, 1, 100));
            long narrow = contents.add(NewContent.range(collId, "s", "events", ContentType.EVENT, 40, 60));
            contents.add(NewContent.range(collId, "s", "events", ContentType.EVENT, 101, 200));

            List<ContentRecord> covering = contents.getMatchContents(collId, "s", "events", ContentType.EVENT, 45L, 55L);
            Assertions.assertEquals(List.of(wide, narrow), covering.stream().map(ContentRecord::contentId).toList());

            List<ContentRecord> onlyWide = contents.getMatchContents(collId, "s", "events", null, 10L, 90L);
            Assertions.assertEquals(List.of(wide), onlyWide.stream().map(ContentRecord::contentId).toList());

            Assertions.assertEquals(3, contents.getMatchContents(collId, "s", "events", null, null, null).size());
            Assertions.assertTrue(contents.getMatchContents(collId, "s", "events", ContentType.EVENT, 150L, 250L).isEmpty());
            Assertions.assertThrows(InvalidArgumentException.class,
                    () -> contents.getMatchContents(collId, "s", "events", ContentType.EVENT, null, 5L));
        } finally {
            RequestStoreTest.deleteRecursively(root);
        }
    }

    @Test
    void contentQueriesRequireAFilter() throws Exception {
        Path root = Files.createTempDirectory("workledger-test-content-query-");
        try {
            Database db = RequestStoreTest.openDatabase(root);
            ContentStore contents = new ContentStore(db);
            long collId = newCollection(db);
            contents.addContents(files(collId, "q", 4), 100, true);
            contents.add(NewContent.file(collId, "s", "other.root").withStatus(ContentStatus.AVAILABLE));

            Assertions.assertThrows(InvalidArgumentException.class, () -> contents.getContents(null, null, null, null));
            Assertions.assertThrows(InvalidArgumentException.class,
                    () -> contents.getContents("s", null, null, EnumSet.noneOf(ContentStatus.class)));

            Assertions.assertEquals(4, contents.getContents("s", "q.", null, null).size());
            Assertions.assertEquals(5, contents.getContents(null, null, collId, null).size());
            Assertions.assertEquals(1, contents.getContents(null, null, null, EnumSet.of(ContentStatus.AVAILABLE)).size());
            Assertions.assertEquals(1, contents.getContents("s", "root", collId, EnumSet.of(ContentStatus.AVAILABLE)).size());
        } finally {
            RequestStoreTest.deleteRecursively(root);
        }
    }

    @Test
    void countByStatusGroupsPerStatus() throws Exception {
        Path root = Files.createTempDirectory("workledger-test-content-stats-");
        try {
            Database db = RequestStoreTest.openDatabase(root);
            ContentStore contents = new ContentStore(db);
            long collId = newCollection(db);
            long otherColl = newCollection(db);

            List<NewContent> batch = new ArrayList<>(files(collId, "n", 3));
            batch.add(NewContent.file(collId, "s", "f.0").withStatus(ContentStatus.FAILED));
            batch.add(NewContent.file(collId, "s", "f.1").withStatus(ContentStatus.FAILED));
            contents.addContents(batch, 2, false);
            contents.add(NewContent.file(otherColl, "s", "elsewhere").withStatus(ContentStatus.LOST));

            Assertions.assertEquals(Map.of(ContentStatus.NEW, 3L, ContentStatus.FAILED, 2L), contents.countByStatus(collId));
            Assertions.assertEquals(Map.of(ContentStatus.NEW, 3L, ContentStatus.FAILED, 2L, ContentStatus.LOST, 1L),
                    contents.countByStatus(null));
        } finally {
            RequestStoreTest.deleteRecursively(root);
        }
    }

    @Test
    void updatesByIdAndByIdentity() throws Exception {
        Path root = Files.createTempDirectory("workledger-test-content-update-");
        try {
            Database db = RequestStoreTest.openDatabase(root);
            ContentStore contents = new ContentStore(db);
            long collId = newCollection(db);
            long file = contents.add(NewContent.file(collId, "s", "file.root"));
            long event = contents.add(NewContent.range(collId, "s", "events", ContentType.EVENT, 1, 10));

            contents.update(file, ContentUpdate.fromFields(Map.of("bytes", 2048, "md5", "abc", "status", "Available")));
            ContentRecord updated = contents.getContent(file);
            Assertions.assertEquals(2048L, updated.bytes());
            Assertions.assertEquals("abc", updated.md5());
            Assertions.assertEquals(ContentStatus.AVAILABLE, updated.status());

            contents.updateContents(List.of(
                    ContentStatusUpdate.byId(file, ContentStatus.PROCESSING, "/store/file.root"),
                    ContentStatusUpdate.byIdentity(collId, "s", "events", 1L, 10L, ContentStatus.FAILED, "/store/events")));
            Assertions.assertEquals(ContentStatus.PROCESSING, contents.getContent(file).status());
            Assertions.assertEquals("/store/file.root", contents.getContent(file).path());
            Assertions.assertEquals(ContentStatus.FAILED, contents.getContent(event).status());

            Assertions.assertThrows(NotFoundException.class, () -> contents.updateContents(List.of(
                    ContentStatusUpdate.byId(file, ContentStatus.LOST, null),
                    ContentStatusUpdate.byId(event + 100, ContentStatus.LOST, null))));
            Assertions.assertEquals(ContentStatus.PROCESSING, contents.getContent(file).status());

            contents.delete(event);
            Assertions.assertThrows(NotFoundException.class, () -> contents.getContent(event));
            Assertions.assertThrows(NotFoundException.class, () -> contents.update(event, ContentUpdate.create().retries(1)));
        } finally {
            RequestStoreTest.deleteRecursively(root);
        }
    }

    @Test
    void updateByIdentityTouchesExactlyOneContent() throws Exception {
        Path root = Files.createTempDirectory("workledger-test-content-update-identity-");
        try {
            Database db = RequestStoreTest.openDatabase(root);
            ContentStore contents = new ContentStore(db);
            long collId = newCollection(db);
            long event = contents.add(NewContent.range(collId, "s", "events", ContentType.EVENT, 1, 10));
            long pseudo = contents.add(NewContent.range(collId, "s", "events", ContentType.PSEUDO_CONTENT, 1, 10));
            long file = contents.add(NewContent.range(collId, "s", "file.root", ContentType.FILE, 1, 10));

            contents.updateContents(List.of(ContentStatusUpdate.byIdentity(
                    collId, "s", "events", ContentType.EVENT, 1L, 10L, ContentStatus.FAILED, null)));
            Assertions.assertEquals(ContentStatus.FAILED, contents.getContent(event).status());
            Assertions.assertEquals(ContentStatus.NEW, contents.getContent(pseudo).status());

            Assertions.assertThrows(InvalidArgumentException.class, () -> contents.updateContents(List.of(
                    ContentStatusUpdate.byIdentity(collId, "s", "events", 1L, 10L, ContentStatus.LOST, null))));
            Assertions.assertEquals(ContentStatus.FAILED, contents.getContent(event).status());
            Assertions.assertEquals(ContentStatus.NEW, contents.getContent(pseudo).status());

            contents.updateContents(List.of(ContentStatusUpdate.byIdentity(
                    collId, "s", "file.root", ContentType.FILE, null, null, ContentStatus.AVAILABLE, "/store/file.root")));
            Assertions.assertEquals(ContentStatus.AVAILABLE, contents.getContent(file).status());
            Assertions.assertEquals("/store/file.root", contents.getContent(file).path());

            Assertions.assertThrows(NotFoundException.class, () -> contents.updateContents(List.of(
                    ContentStatusUpdate.byIdentity(collId, "s", "events", ContentType.EVENT, 1L, 11L,
                            ContentStatus.LOST, null))));
        } finally {
            RequestStoreTest.deleteRecursively(root);
        }
    }

    private static long newCollection(Database db) {
        long transformId = new TransformStore(db).add(
                new NewTransform(TransformType.DERIVATION, null, null, null, null, null, null));
        return new CollectionStore(db).add(transformId, NewCollection.of("s", "coll." + transformId));
    }

    private static List<NewContent> files(long collId, String prefix, int count) {
        List<NewContent> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            out.add(NewContent.file(collId, "s", prefix + "." + i));
        }
        return out;
    }
}
