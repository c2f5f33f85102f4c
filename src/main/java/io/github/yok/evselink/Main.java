package io.github.yok.evselink;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.yok.evselink.catalog.EnumCatalogLoader;
import io.github.yok.evselink.config.ImportConfig;
import io.github.yok.evselink.config.LocalizationConfig;
import io.github.yok.evselink.core.EnumRelationResolver;
import io.github.yok.evselink.core.EvseMapper;
import io.github.yok.evselink.core.ImportOrchestrator;
import io.github.yok.evselink.core.ImportSummary;
import io.github.yok.evselink.core.LocalizationExtractor;
import io.github.yok.evselink.core.OperatorResolver;
import io.github.yok.evselink.db.DbUnitConnectionFactory;
import io.github.yok.evselink.feed.FeedReader;
import io.github.yok.evselink.feed.FeedRoot;
import io.github.yok.evselink.lookup.CountryLanguageLookup;
import io.github.yok.evselink.persistence.TransactionalPlanExecutor;
import io.github.yok.evselink.util.ErrorHandler;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.util.Arrays;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.dbunit.database.IDatabaseConnection;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command-line option {@code --feed}/{@code -f}, reads the feed and imports it with
 * {@link ImportOrchestrator}.
 * </p>
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --feed <file>} or {@code -f <file>} names the JSON feed. If omitted, the
 * {@code import.feed-path} setting in {@code application.yml} is used.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 * @see ImportConfig
 * @see LocalizationConfig
 * @see DbUnitConnectionFactory
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    static final int FAILURE_EXIT_CODE = 1;

    private final ImportConfig importConfig;
    private final LocalizationConfig localizationConfig;
    private final FeedReader feedReader;
    private final CountryLanguageLookup languageLookup;
    private final EnumCatalogLoader catalogLoader;
    private final DbUnitConnectionFactory connectionFactory;

    private int exitCode;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        ConfigurableApplicationContext context = app.run(args);
        int exitCode = SpringApplication.exit(context);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        String feedPath = parseFeedPath(args);
        if (StringUtils.isBlank(feedPath)) {
            feedPath = importConfig.getFeedPath();
        }
        if (StringUtils.isBlank(feedPath)) {
            exitCode = FAILURE_EXIT_CODE;
            ErrorHandler.errorAndExit(
                    "Feed file is required: pass --feed <file> or set import.feed-path.");
            return;
        }
        Path feedFile = Paths.get(feedPath);
        log.info("Feed: {}, derivation threads: {}", feedFile, importConfig.getDerivationThreads());

        ExecutorService derivationPool =
                Executors.newFixedThreadPool(Math.max(1, importConfig.getDerivationThreads()),
                        new ThreadFactoryBuilder().setNameFormat("derive-%d").setDaemon(true)
                                .build());
        try (Connection jdbc = connectionFactory.openJdbc()) {
            FeedRoot feed = feedReader.read(feedFile);
            IDatabaseConnection dbConn = connectionFactory.create(jdbc);

            ImportOrchestrator orchestrator = new ImportOrchestrator(catalogLoader,
                    new OperatorResolver(), new EvseMapper(),
                    new LocalizationExtractor(languageLookup,
                            localizationConfig.getPrimaryAnchor(),
                            localizationConfig.getAlternateAnchor()),
                    new EnumRelationResolver(), new TransactionalPlanExecutor(), derivationPool);
            ImportSummary summary = orchestrator.execute(feed, dbConn);

            log.info("Import completed. Feed [{}], unresolved options: {}", feedFile,
                    summary.unresolvedCount());
        } catch (Exception e) {
            log.error("Fatal error occurred (feed={}): {}", feedFile, e.getMessage(), e);
            exitCode = FAILURE_EXIT_CODE;
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        } finally {
            derivationPool.shutdownNow();
        }
    }

    /**
     * Returns {@value #FAILURE_EXIT_CODE} after a fatal error, {@code 0} otherwise.
     *
     * @return process exit code
     */
    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Extracts the feed file from the arguments.
     *
     * @param args command-line arguments
     * @return feed file, or {@code null} if not given
     */
    static String parseFeedPath(String... args) {
        String feedPath = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--feed":
                case "-f":
                    feedPath = (i + 1 < args.length ? args[++i] : null);
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }
        return feedPath;
    }
}
