package io.github.yok.evselink.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.evselink.catalog.EnumCatalog;
import io.github.yok.evselink.catalog.EnumCategory;
import io.github.yok.evselink.feed.ChargingFacilities;
import io.github.yok.evselink.feed.ChargingFacilityOption;
import io.github.yok.evselink.feed.EvseDataRecord;
import io.github.yok.evselink.feed.OptionNames;
import io.github.yok.evselink.model.EvseEntry;
import io.github.yok.evselink.model.EvseEnumRelation;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EnumRelationResolverTest {

    private final EnumRelationResolver resolver = new EnumRelationResolver();

    private final EnumCatalog catalog = EnumCatalog.builder()
            .add(EnumCategory.PLUG, 1, "Type 2 Outlet")
            .add(EnumCategory.PLUG, 2, "Type F Schuko")
            .add(EnumCategory.PAYMENT_OPTION, 10, "Contract")
            .add(EnumCategory.ACCESSIBILITY, 5, "Free publicly accessible")
            .addChargingFacility(100, "AC_3_PHASE", new BigDecimal("22.0"))
            .addChargingFacility(101, "DC", BigDecimal.valueOf(50))
            .addChargingFacility(102, "AC_1_PHASE", BigDecimal.valueOf(3))
            .build();

    private static EvseEntry entry(String evseId, EvseDataRecord record) {
        record.setEvseId(evseId);
        return new EvseEntry("DE*TBA", record);
    }

    @Test
    void resolve_正常ケース_名称が一致する_結合行が生成されること() {
        EvseDataRecord record = new EvseDataRecord();
        record.setPlugs(new OptionNames(List.of("Type 2 Outlet", "Type F Schuko")));

        EnumResolution result =
                resolver.resolve(EnumCategory.PLUG, List.of(entry("DE*TBA*E1", record)), catalog);

        assertEquals(EnumCategory.PLUG, result.getCategory());
        assertEquals(List.of(new EvseEnumRelation("DE*TBA*E1", 1),
                new EvseEnumRelation("DE*TBA*E1", 2)), result.getRows());
        assertTrue(result.getUnresolved().isEmpty());
    }

    @Test
    void resolve_正常ケース_同じ名称が重複する_結合行が1件にまとめられること() {
        EvseDataRecord record = new EvseDataRecord();
        record.setPlugs(new OptionNames(List.of("Type 2 Outlet", "Type 2 Outlet")));

        EnumResolution result =
                resolver.resolve(EnumCategory.PLUG, List.of(entry("DE*TBA*E1", record)), catalog);

        assertEquals(List.of(new EvseEnumRelation("DE*TBA*E1", 1)), result.getRows());
    }

    @Test
    void resolve_正常ケース_未知の名称を含む_除外され件数が集計されること() {
        EvseDataRecord first = new EvseDataRecord();
        first.setPlugs(new OptionNames(List.of("Type 2 Outlet", "CCS")));
        EvseDataRecord second = new EvseDataRecord();
        second.setPlugs(new OptionNames(List.of("CCS", "type 2 outlet")));

        EnumResolution result = resolver.resolve(EnumCategory.PLUG,
                List.of(entry("DE*TBA*E1", first), entry("DE*TBA*E2", second)), catalog);

        assertEquals(List.of(new EvseEnumRelation("DE*TBA*E1", 1)), result.getRows());
        assertEquals(Map.of("CCS", 2, "type 2 outlet", 1), result.getUnresolved());
    }

    @Test
    void resolve_正常ケース_一件も解決できない_空の結果が返ること() {
        EvseDataRecord record = new EvseDataRecord();
        record.setValueAddedServices(new OptionNames(List.of("Reservation")));

        EnumResolution result = resolver.resolve(EnumCategory.VALUE_ADDED_SERVICE,
                List.of(entry("DE*TBA*E1", record)), catalog);

        assertTrue(result.isEmpty());
        assertEquals(Map.of("Reservation", 1), result.getUnresolved());
    }

    @Test
    void resolve_正常ケース_オプションが未設定_空の結果が返ること() {
        EnumResolution result = resolver.resolve(EnumCategory.PAYMENT_OPTION,
                List.of(entry("DE*TBA*E1", new EvseDataRecord())), catalog);

        assertTrue(result.isEmpty());
        assertTrue(result.getUnresolved().isEmpty());
    }

    @Test
    void resolve_正常ケース_充電設備を指定する_種別と出力の組で照合されること() {
        EvseDataRecord record = new EvseDataRecord();
        record.setChargingFacilities(
                new ChargingFacilities(List.of(new ChargingFacilityOption("AC_3_PHASE", BigDecimal.valueOf(22)),
                        new ChargingFacilityOption("AC_3_PHASE", BigDecimal.valueOf(11)),
                        new ChargingFacilityOption("DC", new BigDecimal("50.0")))));

        EnumResolution result = resolver.resolve(EnumCategory.CHARGING_FACILITY,
                List.of(entry("DE*TBA*E1", record)), catalog);

        assertEquals(List.of(new EvseEnumRelation("DE*TBA*E1", 100),
                new EvseEnumRelation("DE*TBA*E1", 101)), result.getRows());
        assertEquals(1, result.getUnresolved().size());
    }

    @Test
    void resolve_正常ケース_小数の出力を指定する_整数部のみ一致する設備とは照合されないこと() {
        EvseDataRecord record = new EvseDataRecord();
        record.setChargingFacilities(new ChargingFacilities(
                List.of(new ChargingFacilityOption("AC_1_PHASE", new BigDecimal("3.7")))));

        EnumResolution result = resolver.resolve(EnumCategory.CHARGING_FACILITY,
                List.of(entry("DE*TBA*E1", record)), catalog);

        assertTrue(result.isEmpty());
        assertEquals(1, result.getUnresolved().size());
    }

    @Test
    void resolve_異常ケース_アクセシビリティを指定する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> resolver.resolve(EnumCategory.ACCESSIBILITY, List.of(), catalog));
    }

    @Test
    void resolveAccessibilityId_正常ケース_名称が一致する_IDが返ること() {
        assertEquals(5, EnumRelationResolver.resolveAccessibilityId(catalog,
                "Free publicly accessible"));
    }

    @Test
    void resolveAccessibilityId_正常ケース_未知またはnull_nullが返ること() {
        assertNull(EnumRelationResolver.resolveAccessibilityId(catalog, "Restricted access"));
        assertNull(EnumRelationResolver.resolveAccessibilityId(catalog, null));
    }
}
