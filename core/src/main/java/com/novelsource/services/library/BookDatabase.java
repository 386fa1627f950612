package com.novelsource.services.library;

import com.novelsource.api.BookSink;
import com.novelsource.common.error.ImportException;
import com.novelsource.common.model.BookInfo;
import com.novelsource.common.model.ChapterRef;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jdbi.v3.core.statement.PreparedBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Embedded H2 library of imported books and their chapter index.
 * Chapter text is not stored; it is fetched when read.
 */
public class BookDatabase implements BookSink {
    private static final Logger logger = LoggerFactory.getLogger(BookDatabase.class);

    private final Jdbi jdbi;

    public BookDatabase(String jdbcUrl) {
        this.jdbi = Jdbi.create(jdbcUrl);
        initializeSchema();
    }

    /**
     * File database at {@code path} (H2 appends .mv.db).
     */
    public static BookDatabase open(File path) {
        File parent = path.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            logger.warn("⚠️ Could not create database directory {}", parent);
        }
        String url = "jdbc:h2:file:" + path.getAbsolutePath()
                + ";DB_CLOSE_DELAY=-1"          // keep DB open
                + ";DATABASE_TO_UPPER=FALSE"    // case-sensitive names
                + ";AUTO_SERVER=TRUE";          // allow a second process
        BookDatabase db = new BookDatabase(url);
        logger.info("🗄️ Library database: {}", path);
        return db;
    }

    private void initializeSchema() {
        jdbi.useHandle(handle -> {
            handle.execute("""
                        CREATE TABLE IF NOT EXISTS books (
                            id BIGINT AUTO_INCREMENT PRIMARY KEY,
                            title VARCHAR(500) NOT NULL,
                            author VARCHAR(255),
                            description VARCHAR(2000),
                            cover_url VARCHAR(2000),
                            source_id VARCHAR(100),
                            source_url VARCHAR(2000) NOT NULL,
                            total_chapters INT DEFAULT 0,
                            created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        )
                    """);

            handle.execute("""
                        CREATE TABLE IF NOT EXISTS chapters (
                            id BIGINT AUTO_INCREMENT PRIMARY KEY,
                            book_id BIGINT NOT NULL,
                            title VARCHAR(500),
                            chapter_number INT,
                            source_url VARCHAR(2000),
                            is_cached BOOLEAN DEFAULT FALSE
                        )
                    """);

            handle.execute("CREATE INDEX IF NOT EXISTS idx_books_source_url ON books(source_url)");
            handle.execute("CREATE INDEX IF NOT EXISTS idx_chapters_book ON chapters(book_id, chapter_number)");
        });
    }

    @Override
    public Optional<String> findBySourceUrl(String sourceUrl) {
        return jdbi.withHandle(handle -> handle.createQuery("SELECT id FROM books WHERE source_url = :url")
                .bind("url", sourceUrl)
                .mapTo(Long.class)
                .findFirst()
                .map(String::valueOf));
    }

    /**
     * Book row plus all chapter rows in one transaction. Chapter numbers start at 1.
     */
    @Override
    public String save(String sourceId, BookInfo book, List<ChapterRef> chapters) throws ImportException {
        try {
            long id = jdbi.inTransaction(handle -> {
                long bookId = handle.createUpdate("""
                            INSERT INTO books (title, author, description, cover_url, source_id, source_url, total_chapters)
                            VALUES (:title, :author, :description, :cover, :sourceId, :sourceUrl, :total)
                        """)
                        .bind("title", book.title())
                        .bind("author", book.author())
                        .bind("description", book.description())
                        .bind("cover", book.coverUrl())
                        .bind("sourceId", sourceId)
                        .bind("sourceUrl", book.sourceUrl())
                        .bind("total", chapters.size())
                        .executeAndReturnGeneratedKeys("id")
                        .mapTo(Long.class)
                        .one();

                if (!chapters.isEmpty()) {
                    PreparedBatch batch = handle.prepareBatch("""
                                INSERT INTO chapters (book_id, title, chapter_number, source_url)
                                VALUES (:bookId, :title, :number, :url)
                            """);
                    for (ChapterRef chapter : chapters) {
                        batch.bind("bookId", bookId)
                                .bind("title", chapter.title())
                                .bind("number", chapter.ordinal() + 1)
                                .bind("url", chapter.url())
                                .add();
                    }
                    batch.execute();
                }
                return bookId;
            });
            logger.info("💾 Stored '{}' as book {} with {} chapter(s)", book.title(), id, chapters.size());
            return String.valueOf(id);
        } catch (JdbiException e) {
            throw new ImportException("Could not store book: " + e.getMessage(), sourceId, book.sourceUrl(), e);
        }
    }

    public Optional<StoredBook> findBook(long id) {
        return jdbi.withHandle(handle -> handle.createQuery("""
                    SELECT id, title, author, description, cover_url, source_id, source_url, total_chapters
                    FROM books WHERE id = :id
                """)
                .bind("id", id)
                .map((rs, ctx) -> toBook(rs))
                .findFirst());
    }

    public List<StoredBook> listBooks() {
        return jdbi.withHandle(handle -> handle.createQuery("""
                    SELECT id, title, author, description, cover_url, source_id, source_url, total_chapters
                    FROM books ORDER BY id
                """)
                .map((rs, ctx) -> toBook(rs))
                .list());
    }

    /**
     * Chapter index of a book in reading order, ordinals zero-based again.
     */
    public List<ChapterRef> getChapters(long bookId) {
        return jdbi.withHandle(handle -> handle.createQuery("""
                    SELECT title, source_url, chapter_number FROM chapters
                    WHERE book_id = :bookId ORDER BY chapter_number
                """)
                .bind("bookId", bookId)
                .map((rs, ctx) -> new ChapterRef(
                        rs.getString("title"),
                        rs.getString("source_url"),
                        rs.getInt("chapter_number") - 1))
                .list());
    }

    private static StoredBook toBook(ResultSet rs) throws SQLException {
        return new StoredBook(
                rs.getLong("id"),
                rs.getString("title"),
                rs.getString("author"),
                rs.getString("description"),
                rs.getString("cover_url"),
                rs.getString("source_id"),
                rs.getString("source_url"),
                rs.getInt("total_chapters"));
    }

    public Jdbi getJdbi() {
        return jdbi;
    }

    public void shutdown() {
        try {
            jdbi.useHandle(handle -> handle.execute("SHUTDOWN"));
        } catch (JdbiException e) {
            logger.warn("Error shutting down database: {}", e.getMessage());
        }
        logger.info("✅ Database shutdown complete");
    }
}
