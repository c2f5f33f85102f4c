package io.github.yok.evselink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockConstruction;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.evselink.catalog.EnumCatalogLoader;
import io.github.yok.evselink.config.ImportConfig;
import io.github.yok.evselink.config.LocalizationConfig;
import io.github.yok.evselink.core.ImportException;
import io.github.yok.evselink.core.ImportOrchestrator;
import io.github.yok.evselink.core.ImportSummary;
import io.github.yok.evselink.db.DbUnitConnectionFactory;
import io.github.yok.evselink.feed.FeedReader;
import io.github.yok.evselink.feed.FeedRoot;
import io.github.yok.evselink.lookup.CountryLanguageLookup;
import io.github.yok.evselink.util.ErrorHandler;
import java.nio.file.Paths;
import java.sql.Connection;
import org.dbunit.database.IDatabaseConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.MockedConstruction;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Unit tests for {@link Main}.
 */
class MainTest {

    private ImportConfig importConfig;
    private FeedReader feedReader;
    private DbUnitConnectionFactory connectionFactory;
    private Connection jdbc;
    private IDatabaseConnection dbConn;
    private FeedRoot feed;

    private Main main;

    @BeforeEach
    void setup() throws Exception {
        ErrorHandler.disableExitForCurrentThread();

        importConfig = new ImportConfig();
        feedReader = mock(FeedReader.class);
        feed = new FeedRoot();
        when(feedReader.read(any())).thenReturn(feed);

        connectionFactory = mock(DbUnitConnectionFactory.class);
        jdbc = mock(Connection.class);
        dbConn = mock(IDatabaseConnection.class);
        when(connectionFactory.openJdbc()).thenReturn(jdbc);
        when(connectionFactory.create(jdbc)).thenReturn(dbConn);

        main = new Main(importConfig, new LocalizationConfig(), feedReader,
                mock(CountryLanguageLookup.class), new EnumCatalogLoader(), connectionFactory);
    }

    @AfterEach
    void tearDown() {
        ErrorHandler.restoreExitForCurrentThread();
    }

    @Test
    void main_正常ケース_SpringApplicationが起動されること() {
        try (MockedConstruction<SpringApplication> mocked =
                mockConstruction(SpringApplication.class, (mock, ctx) -> {
                    when(mock.run(any(String[].class)))
                            .thenReturn(mock(ConfigurableApplicationContext.class));
                })) {

            Main.main(new String[] {"--feed", "feed.json"});

            SpringApplication app = mocked.constructed().get(0);
            verify(app).setAddCommandLineProperties(false);
            verify(app).run(eq("--feed"), eq("feed.json"));
        }
    }

    @Test
    void run_正常ケース_feed指定_フィードが取り込まれ接続が閉じられること() throws Exception {
        try (MockedConstruction<ImportOrchestrator> mocked =
                mockConstruction(ImportOrchestrator.class, (mock, ctx) -> when(
                        mock.execute(any(), any())).thenReturn(new ImportSummary()))) {

            main.run("--feed", "feeds/evse.json");

            verify(feedReader).read(Paths.get("feeds/evse.json"));
            verify(mocked.constructed().get(0)).execute(feed, dbConn);
            verify(jdbc).close();
            assertEquals(0, main.getExitCode());
        }
    }

    @Test
    void run_正常ケース_引数なし_設定のフィードパスが使われること() throws Exception {
        importConfig.setFeedPath("configured.json");
        try (MockedConstruction<ImportOrchestrator> mocked =
                mockConstruction(ImportOrchestrator.class, (mock, ctx) -> when(
                        mock.execute(any(), any())).thenReturn(new ImportSummary()))) {

            main.run();

            verify(feedReader).read(Paths.get("configured.json"));
        }
    }

    @Test
    void run_異常ケース_フィード未指定_ErrorHandlerが呼ばれ終了コードが1になること() throws Exception {
        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> main.run());

        assertTrue(ex.getMessage().startsWith("Feed file is required"));
        assertEquals(1, main.getExitCode());
        verify(connectionFactory, never()).openJdbc();
    }

    @Test
    void run_異常ケース_取り込みに失敗する_ErrorHandlerが呼ばれ終了コードが1になること() throws Exception {
        when(feedReader.read(any())).thenThrow(new ImportException("Feed file does not exist"));

        IllegalStateException ex =
                assertThrows(IllegalStateException.class, () -> main.run("-f", "missing.json"));

        assertEquals("Fatal error: Feed file does not exist", ex.getMessage());
        assertTrue(ex.getCause() instanceof ImportException);
        assertEquals(1, main.getExitCode());
        verify(jdbc).close();
    }

    @Test
    void parseFeedPath_正常ケース_各種引数を指定する_フィードパスが抽出されること() {
        assertEquals("a.json", Main.parseFeedPath("-f", "a.json"));
        assertEquals("b.json", Main.parseFeedPath("--unknown", "--feed", "b.json"));
        assertNull(Main.parseFeedPath("--feed"));
        assertNull(Main.parseFeedPath());
    }
}
