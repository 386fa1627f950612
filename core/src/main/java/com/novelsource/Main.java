package com.novelsource;

import com.novelsource.api.SourceParser;
import com.novelsource.common.error.SourceException;
import com.novelsource.common.model.BookInfo;
import com.novelsource.common.model.ChapterContent;
import com.novelsource.common.model.ChapterList;
import com.novelsource.common.model.ChapterRef;
import com.novelsource.common.model.SearchResult;
import com.novelsource.core.batch.BatchProgress;
import com.novelsource.core.batch.BatchProgressListener;
import com.novelsource.core.batch.BatchRequest;
import com.novelsource.core.batch.BatchSummary;
import com.novelsource.core.batch.ItemOutcome;
import com.novelsource.core.config.SourceConfig;
import com.novelsource.services.detect.SourceDetection;
import com.novelsource.services.importing.ErrorDetail;
import com.novelsource.services.importing.ImportResult;
import com.novelsource.services.importing.ImportService;
import com.novelsource.services.importing.SourceProbeResult;
import com.novelsource.services.library.StoredBook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.text.SimpleDateFormat;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

public class Main {
    // Initialize the logger only AFTER the streams have been redirected
    private static Logger logger;

    private static final String USAGE = String.join("\n",
            "Usage: novelsource <command> [args]",
            "  parsers                      registered parsers",
            "  sources                      configured sources",
            "  search <source> <keyword>    search a source",
            "  info <source> <url>          book info",
            "  chapters <source> <url>      chapter list",
            "  content <source> <url>       chapter text (all pages)",
            "  detect <url>                 source owning a book url",
            "  probe <source>               test a source's search page",
            "  import <source> <url>        import a book into the library",
            "  batch <file> [source]        import every url in file, detecting sources when none is given",
            "  books                        imported books");

    public static void main(String[] args) {
        File home = new File(System.getProperty("novelsource.home", "."));
        setupGlobalLogging(new File(home, "logs"));

        logger = LoggerFactory.getLogger(Main.class);
        if (args.length == 0) {
            System.out.println(USAGE);
            return;
        }

        logger.info("🚀 Starting NovelSource...");
        Kernel kernel = new Kernel(home);
        int exitCode = 0;
        try {
            kernel.start();
            exitCode = run(kernel, args[0], Arrays.copyOfRange(args, 1, args.length));
        } catch (SourceException e) {
            System.out.println("Error: " + ErrorDetail.of(e).detail());
            logger.debug("Command failed", e);
            exitCode = 1;
        } catch (IllegalArgumentException e) {
            System.out.println(e.getMessage());
            exitCode = 1;
        } catch (Exception e) {
            logger.error("CRITICAL FAILURE", e);
            exitCode = 2;
        } finally {
            kernel.stop();
        }
        System.exit(exitCode);
    }

    static int run(Kernel kernel, String command, String[] args) throws SourceException, IOException {
        ImportService service = kernel.getImportService();

        switch (command) {
            case "parsers":
                service.listParsers().forEach(System.out::println);
                return 0;

            case "sources":
                for (SourceConfig source : kernel.getCatalog().all()) {
                    System.out.printf("%-16s %-20s %s%n", source.getId(), source.name, source.url);
                }
                kernel.getCatalog().getLoadErrors().forEach(e -> System.out.println("(skipped) " + e));
                return 0;

            case "search": {
                require(args, 2);
                String keyword = String.join(" ", Arrays.copyOfRange(args, 1, args.length));
                List<SearchResult> results = service.parserFor(args[0]).search(keyword, 10);
                if (results.isEmpty()) System.out.println("No results.");
                for (SearchResult r : results) {
                    System.out.printf("%s | %s%n    %s%n", r.title(), r.author(), r.sourceUrl());
                }
                return 0;
            }

            case "info": {
                require(args, 2);
                BookInfo info = service.parserFor(args[0]).getBookInfo(args[1]);
                System.out.println("Title:       " + info.title());
                System.out.println("Author:      " + info.author());
                System.out.println("Cover:       " + Optional.ofNullable(info.coverUrl()).orElse("-"));
                System.out.println("Description: " + info.description());
                return 0;
            }

            case "chapters": {
                require(args, 2);
                ChapterList list = service.parserFor(args[0]).getChapterList(args[1]);
                for (ChapterRef c : list.chapters()) {
                    System.out.printf("%5d  %s  %s%n", c.ordinal() + 1, c.title(), c.url());
                }
                System.out.printf("%d chapter(s) from %d page(s)%s%n", list.size(), list.pagesWalked(),
                        list.isPartial() ? ", incomplete: " + list.failure().getMessage()
                                : list.truncated() ? ", stopped at page cap" : "");
                return 0;
            }

            case "content": {
                require(args, 2);
                SourceParser parser = service.parserFor(args[0]);
                ChapterContent content = parser.getChapterContent(args[1], true);
                System.out.println(content.cleanedText());
                return 0;
            }

            case "detect": {
                require(args, 1);
                Optional<SourceDetection> detection = service.detect(args[0]);
                if (detection.isPresent()) {
                    SourceDetection d = detection.get();
                    System.out.printf("%s (%s) [%s]%n", d.sourceId(), d.sourceName(), d.matchType().wireName());
                } else {
                    System.out.println("No matching source.");
                }
                return 0;
            }

            case "probe": {
                require(args, 1);
                SourceProbeResult probe = service.probeSource(args[0]);
                System.out.printf("%s (status %d, %d bytes)%n", probe.message(), probe.statusCode(), probe.responseSize());
                return probe.success() ? 0 : 1;
            }

            case "import": {
                require(args, 2);
                ImportResult result = service.importBook(args[0], args[1]);
                System.out.println(result.message() + " [book " + result.bookId() + "]");
                return 0;
            }

            case "batch":
                require(args, 1);
                return batch(service, args);

            case "books":
                for (StoredBook book : kernel.getBookDatabase().listBooks()) {
                    System.out.printf("%4d  %s / %s  (%d chapters)%n",
                            book.id(), book.title(), book.author(), book.totalChapters());
                }
                return 0;

            default:
                System.out.println(USAGE);
                return 1;
        }
    }

    private static int batch(ImportService service, String[] args) throws IOException {
        List<String> urls = BatchRequest.parseLines(Files.readString(new File(args[0]).toPath(), StandardCharsets.UTF_8));
        String fixedSource = args.length > 1 ? args[1] : null;

        AtomicBoolean cancel = new AtomicBoolean(false);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> cancel.set(true), "BatchCancel"));

        BatchSummary summary = service.batchImport(urls, fixedSource, fixedSource == null,
                new BatchProgressListener() {
                    @Override
                    public void onItemFinished(ItemOutcome outcome, BatchProgress progress) {
                        System.out.printf("[%3d%%] %-18s %s%n", progress.percent(), outcome.status(), outcome.url());
                    }
                }, cancel);

        System.out.printf("Done: %d succeeded, %d failed, %d skipped%n",
                summary.succeeded(), summary.failed(), summary.skipped());
        return summary.failed() == 0 ? 0 : 1;
    }

    private static void require(String[] args, int count) {
        if (args.length < count) throw new IllegalArgumentException("Missing arguments\n" + USAGE);
    }

    /**
     * Redirects System.out and System.err into log files BEFORE anything else happens.
     */
    private static void setupGlobalLogging(File logDir) {
        try {
            if (!logDir.exists()) logDir.mkdirs();

            String timeStamp = new SimpleDateFormat("yyyy-MM-dd_HH-mm-ss").format(new Date());
            File sessionLog = new File(logDir, "session-" + timeStamp + ".log");
            File latestLog = new File(logDir, "latest.log");

            FileOutputStream sessionStream = new FileOutputStream(sessionLog);
            FileOutputStream latestStream = new FileOutputStream(latestLog); // overwrites latest.log

            // Console + session file + latest file
            MultiOutputStream multiOut = new MultiOutputStream(System.out, sessionStream, latestStream);
            MultiOutputStream multiErr = new MultiOutputStream(System.err, sessionStream, latestStream);

            System.setOut(new PrintStream(multiOut, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(multiErr, true, StandardCharsets.UTF_8));
        } catch (IOException e) {
            System.err.println("FATAL: Could not initialize logging: " + e.getMessage());
        }
    }

    // Sends output to several targets (tee)
    static class MultiOutputStream extends OutputStream {
        private final OutputStream[] streams;

        MultiOutputStream(OutputStream... streams) {
            this.streams = streams;
        }

        @Override
        public void write(int b) throws IOException {
            for (OutputStream s : streams) s.write(b);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            for (OutputStream s : streams) s.write(b, off, len);
        }

        @Override
        public void flush() throws IOException {
            for (OutputStream s : streams) s.flush();
        }

        @Override
        public void close() throws IOException {
            for (OutputStream s : streams) s.close();
        }
    }
}
