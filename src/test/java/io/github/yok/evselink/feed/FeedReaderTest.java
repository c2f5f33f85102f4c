package io.github.yok.evselink.feed;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.evselink.core.ImportException;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FeedReaderTest {

    @TempDir
    Path tempDir;

    private final FeedReader reader = new FeedReader();

    private Path write(String json) throws IOException {
        Path file = tempDir.resolve("feed.json");
        Files.writeString(file, json, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void read_正常ケース_フィードを読み込む_各項目がマッピングされること() throws Exception {
        Path file = write("{\"EvseData\": {\"OperatorEvseData\": [{"
                + "\"OperatorID\": \"DE*TBA\", \"OperatorName\": \"Test Operator\","
                + "\"EvseDataRecord\": [{"
                + "  \"attributes\": {\"lastUpdate\": \"2019-05-01T10:00:00\"},"
                + "  \"EvseId\": \"DE*TBA*E1\","
                + "  \"ChargingStationName\": \"Dom\","
                + "  \"EnAdditionalInfo\": \"DEU:Inhalt|||\","
                + "  \"Address\": {\"Country\": \"DEU\", \"City\": \"Köln\"},"
                + "  \"GeoCoordinates\": {\"Google\": {\"Coordinates\": \"50.9 6.9\"}},"
                + "  \"Plugs\": {\"Plug\": [\"Type 2 Outlet\", \"CCS\"]},"
                + "  \"ChargingFacilities\": {\"ChargingFacility\": "
                + "     [{\"PowerType\": \"AC_3_PHASE\", \"Power\": 22}]},"
                + "  \"IsOpen24Hours\": \"true\","
                + "  \"SomethingNew\": 1"
                + "}]}]}}");

        FeedRoot root = reader.read(file);

        List<OperatorEvseData> blocks = root.operatorBlocks();
        assertEquals(1, blocks.size());
        assertEquals("DE*TBA", blocks.get(0).getOperatorId());
        assertEquals("Test Operator", blocks.get(0).getOperatorName());
        EvseDataRecord record = blocks.get(0).getEvseDataRecords().get(0);
        assertEquals("DE*TBA*E1", record.getEvseId());
        assertEquals("2019-05-01T10:00:00", record.lastUpdate());
        assertEquals("Köln", record.getAddress().getCity());
        assertEquals("50.9 6.9", record.getGeoCoordinates().getGoogle().getCoordinates());
        assertEquals(List.of("Type 2 Outlet", "CCS"), record.getPlugs().getNames());
        assertEquals(new ChargingFacilityOption("AC_3_PHASE", BigDecimal.valueOf(22)),
                record.getChargingFacilities().getOptions().get(0));
        assertEquals("true", record.getIsOpen24Hours());
        assertNull(record.getPaymentOptions());
    }

    @Test
    void read_正常ケース_出力が小数の数値と文字列で与えられる_切り捨てずに読み込まれること()
            throws Exception {
        Path file = write("{\"EvseData\": {\"OperatorEvseData\": {"
                + "\"OperatorID\": \"DE*TBA\","
                + "\"EvseDataRecord\": {\"EvseId\": \"DE*TBA*E1\","
                + "  \"ChargingFacilities\": {\"ChargingFacility\": ["
                + "     {\"PowerType\": \"AC_1_PHASE\", \"Power\": 3.7},"
                + "     {\"PowerType\": \"AC_1_PHASE\", \"Power\": \"7.4\"},"
                + "     {\"PowerType\": \"AC_3_PHASE\", \"Power\": \"\"}]}}}}}");

        FeedRoot root = reader.read(file);

        List<ChargingFacilityOption> options = root.operatorBlocks().get(0)
                .getEvseDataRecords().get(0).getChargingFacilities().getOptions();
        assertEquals(0, new BigDecimal("3.7").compareTo(options.get(0).getPower()));
        assertEquals(0, new BigDecimal("7.4").compareTo(options.get(1).getPower()));
        assertNull(options.get(2).getPower());
    }

    @Test
    void read_正常ケース_要素1件のリストが単一オブジェクトで表現される_リストとして読み込まれること()
            throws Exception {
        Path file = write("{\"EvseData\": {\"OperatorEvseData\": {"
                + "\"OperatorID\": \"DE*TBA\","
                + "\"EvseDataRecord\": {\"EvseId\": \"DE*TBA*E1\","
                + "  \"Plugs\": {\"Plug\": \"Type 2 Outlet\"}}}}}");

        FeedRoot root = reader.read(file);

        EvseDataRecord record = root.operatorBlocks().get(0).getEvseDataRecords().get(0);
        assertEquals(List.of("Type 2 Outlet"), record.getPlugs().getNames());
    }

    @Test
    void read_正常ケース_EvseDataがない_空のブロック一覧が返ること() throws Exception {
        assertTrue(reader.read(write("{}")).operatorBlocks().isEmpty());
    }

    @Test
    void read_異常ケース_ファイルが存在しない_ImportExceptionが送出されること() {
        ImportException ex = assertThrows(ImportException.class,
                () -> reader.read(tempDir.resolve("missing.json")));
        assertTrue(ex.getMessage().startsWith("Feed file does not exist"));
    }

    @Test
    void read_異常ケース_JSONとして不正_原因付きのImportExceptionが送出されること() throws Exception {
        Path file = write("{\"EvseData\": [");

        ImportException ex = assertThrows(ImportException.class, () -> reader.read(file));
        assertTrue(ex.getCause() instanceof IOException);
    }

    @Test
    void read_異常ケース_nullを指定する_NullPointerExceptionが送出されること() {
        assertThrows(NullPointerException.class, () -> reader.read(null));
    }
}
