package com.novelsource.services.library;

import com.novelsource.common.model.BookInfo;
import com.novelsource.common.model.ChapterRef;
import com.novelsource.test.TestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class BookDatabaseTest extends TestBase {

    private BookDatabase db;

    @BeforeEach
    void openDatabase() {
        db = new BookDatabase("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;DATABASE_TO_UPPER=FALSE");
    }

    @Test
    void testSaveAndRead() throws Exception {
        BookInfo info = new BookInfo("Dune", "Frank Herbert", "Desert planet", null, "https://x.test/b/1/");
        List<ChapterRef> chapters = List.of(
                new ChapterRef("第一章", "https://x.test/b/1/1.html", 0),
                new ChapterRef("第二章", "https://x.test/b/1/2.html", 1));

        String id = db.save("x", info, chapters);

        StoredBook book = db.findBook(Long.parseLong(id)).orElseThrow();
        assertEquals("Dune", book.title());
        assertEquals("x", book.sourceId());
        assertNull(book.coverUrl());
        assertEquals(2, book.totalChapters());

        assertEquals(chapters, db.getChapters(book.id()), "Chapters come back in order with their ordinals");
    }

    @Test
    void testFindBySourceUrl() throws Exception {
        assertTrue(db.findBySourceUrl("https://x.test/b/1/").isEmpty());

        String id = db.save("x", new BookInfo("Dune", "", "", null, "https://x.test/b/1/"), List.of());

        assertEquals(id, db.findBySourceUrl("https://x.test/b/1/").orElseThrow());
        assertTrue(db.findBySourceUrl("https://x.test/b/2/").isEmpty());
    }

    @Test
    void testListBooksInInsertOrder() throws Exception {
        db.save("x", new BookInfo("First", "", "", null, "https://x.test/b/1/"), List.of());
        db.save("y", new BookInfo("Second", "", "", "https://y.test/c.jpg", "https://y.test/b/2/"), List.of());

        List<StoredBook> books = db.listBooks();
        assertEquals(2, books.size());
        assertEquals("First", books.get(0).title());
        assertEquals("https://y.test/c.jpg", books.get(1).coverUrl());
        assertTrue(db.findBook(999).isEmpty());
    }

    @Test
    void testSchemaCreationIsRepeatable() {
        String url = "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;DATABASE_TO_UPPER=FALSE";
        new BookDatabase(url);
        assertDoesNotThrow(() -> new BookDatabase(url));
    }
}
