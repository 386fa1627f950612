package com.novelsource.services.importing;

import com.novelsource.api.BookSink;
import com.novelsource.api.FetchResponse;
import com.novelsource.api.SourceParser;
import com.novelsource.api.Transport;
import com.novelsource.common.error.ConfigException;
import com.novelsource.common.error.FetchException;
import com.novelsource.common.error.ImportException;
import com.novelsource.common.error.SourceException;
import com.novelsource.common.model.BookInfo;
import com.novelsource.common.model.ChapterList;
import com.novelsource.common.util.UrlUtils;
import com.novelsource.core.batch.BatchImportCoordinator;
import com.novelsource.core.batch.BatchProgressListener;
import com.novelsource.core.batch.BatchRequest;
import com.novelsource.core.batch.BatchSummary;
import com.novelsource.core.config.SourceCatalog;
import com.novelsource.core.config.SourceConfig;
import com.novelsource.core.parser.ParserDescriptor;
import com.novelsource.core.parser.ParserMatch;
import com.novelsource.core.parser.ParserRegistry;
import com.novelsource.services.detect.SourceDetection;
import com.novelsource.services.detect.SourceDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Import, batch import, source probing and parser listing on top of the parsing core.
 */
public class ImportService {
    private static final Logger logger = LoggerFactory.getLogger(ImportService.class);
    static final String PROBE_KEYWORD = "测试";

    private final SourceCatalog catalog;
    private final ParserRegistry registry;
    private final BookSink sink;
    private final SourceDetector detector;
    private final Duration batchDelay;

    public ImportService(SourceCatalog catalog, ParserRegistry registry, BookSink sink,
                         SourceDetector detector, Duration batchDelay) {
        this.catalog = catalog;
        this.registry = registry;
        this.sink = sink;
        this.detector = detector;
        this.batchDelay = batchDelay;
    }

    /**
     * Reads book info and chapter list of {@code bookUrl} and stores them.
     * A url that was imported before is not fetched again.
     */
    public ImportResult importBook(String sourceId, String bookUrl) throws SourceException {
        if (sourceId == null || sourceId.isBlank() || bookUrl == null || bookUrl.isBlank()) {
            throw new ImportException("source_id and book_url are required", sourceId, bookUrl);
        }
        String url = bookUrl.trim();
        if (!UrlUtils.isHttpUrl(url)) {
            throw new ImportException("Invalid url", sourceId, url);
        }
        SourceConfig config = catalog.get(sourceId)
                .orElseThrow(() -> new ImportException("Unknown source", sourceId, url));

        Optional<String> existing = sink.findBySourceUrl(url);
        if (existing.isPresent()) {
            logger.info("📚 {} already imported as book {}", url, existing.get());
            return new ImportResult("Book already exists", existing.get(), 0, false, false, true);
        }

        SourceParser parser = parserForUrl(sourceId, url, config);
        logger.info("📥 Importing {} with source '{}'", url, sourceId);

        BookInfo info = parser.getBookInfo(url);
        logger.info("Book info: title={}, author={}", info.title(), info.author());

        ChapterList chapters = parser.getChapterList(url);
        String bookId = sink.save(sourceId, info, chapters.chapters());

        String message = String.format("Imported '%s' with %d chapter(s)%s", info.title(), chapters.size(),
                listNote(chapters));
        if (chapters.isPartial() || chapters.truncated()) {
            logger.warn("⚠️ {}", message);
        } else {
            logger.info("✅ {}", message);
        }
        return new ImportResult(message, bookId, chapters.size(), chapters.isPartial(), chapters.truncated(), false);
    }

    private static String listNote(ChapterList chapters) {
        if (chapters.isPartial()) return " (chapter list incomplete)";
        if (chapters.truncated()) return " (chapter list stopped at " + chapters.pagesWalked() + " page(s))";
        return "";
    }

    /**
     * Imports the urls one by one, see {@link BatchImportCoordinator}.
     */
    public BatchSummary batchImport(List<String> urls, String fixedSourceId, boolean autoDetect,
                                    BatchProgressListener listener, AtomicBoolean cancel) {
        return coordinator().run(new BatchRequest(urls, fixedSourceId, autoDetect), listener, cancel);
    }

    public BatchImportCoordinator coordinator() {
        return new BatchImportCoordinator(
                (sourceId, url) -> importBook(sourceId, url).message(),
                url -> detector.detect(url).map(SourceDetection::sourceId),
                batchDelay);
    }

    /**
     * Fetches the source's search page for a test keyword. Transport problems are reported
     * in the result, not thrown.
     */
    public SourceProbeResult probeSource(String sourceId) throws ImportException {
        SourceConfig config = catalog.get(sourceId)
                .orElseThrow(() -> new ImportException("Unknown source", sourceId, null));
        if (config.search == null || config.search.url == null || config.search.url.isBlank()) {
            return new SourceProbeResult(false, "Source has no search url", -1, 0);
        }

        String url = UrlUtils.searchUrl(config.search.url, PROBE_KEYWORD, config.charset());
        Transport transport = registry.getContext().transport();
        try {
            FetchResponse response = transport.fetch(url, config.headers == null ? Map.of() : config.headers);
            if (!response.isSuccessful()) {
                return new SourceProbeResult(false, "Source test failed: HTTP " + response.status(),
                        response.status(), response.size());
            }
            return new SourceProbeResult(true, "Source test passed", response.status(), response.size());
        } catch (FetchException e) {
            logger.warn("Probe of {} failed: {}", sourceId, e.getMessage());
            return new SourceProbeResult(false, "Source test failed: " + e.getMessage(), e.getStatusCode(), 0);
        }
    }

    /**
     * Names of the registered specialized parsers followed by the generic fallback.
     */
    public List<String> listParsers() {
        List<String> names = new ArrayList<>();
        for (ParserDescriptor d : registry.listParsers()) names.add(d.getName());
        names.add(ParserRegistry.GENERIC_PARSER);
        return names;
    }

    /**
     * Parser for a configured source, specialized when one is registered under its id.
     */
    public SourceParser parserFor(String sourceId) throws ConfigException {
        SourceConfig config = catalog.get(sourceId)
                .orElseThrow(() -> new ConfigException("No source config with id '" + sourceId + "'", sourceId));
        return registry.getParserForSource(sourceId, config);
    }

    public Optional<SourceDetection> detect(String url) {
        return detector.detect(url);
    }

    private SourceParser parserForUrl(String sourceId, String url, SourceConfig config) throws ConfigException {
        Optional<ParserMatch> match = registry.getParserForUrl(url, config);
        if (match.isPresent()) {
            logger.debug("Using parser {} ({})", match.get().descriptor().getName(), match.get().matchType().wireName());
            return match.get().parser();
        }
        return registry.getParserForSource(sourceId, config);
    }
}
