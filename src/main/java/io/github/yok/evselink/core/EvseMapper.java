package io.github.yok.evselink.core;

import io.github.yok.evselink.catalog.EnumCatalog;
import io.github.yok.evselink.feed.Address;
import io.github.yok.evselink.feed.EvseDataRecord;
import io.github.yok.evselink.feed.GeoCoordinates;
import io.github.yok.evselink.model.Evse;
import io.github.yok.evselink.model.EvseEntry;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * Flattens feed records into {@code EVSE} rows.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class EvseMapper {

    /**
     * Maps all entries. The operator id of each row is the (possibly corrected) operator id of
     * its entry.
     *
     * @param entries resolved EVSE entries
     * @param catalog catalog snapshot, used for the accessibility id
     * @return EVSE rows in input order
     */
    public List<Evse> map(List<EvseEntry> entries, EnumCatalog catalog) {
        return entries.stream().map(e -> map(e, catalog)).collect(Collectors.toList());
    }

    /**
     * Maps one entry.
     *
     * @param entry resolved EVSE entry
     * @param catalog catalog snapshot
     * @return EVSE row
     */
    public Evse map(EvseEntry entry, EnumCatalog catalog) {
        EvseDataRecord r = entry.getRecord();
        Address address = r.getAddress() == null ? new Address() : r.getAddress();
        double[] geo = toLatLon(r.getGeoCoordinates());
        double[] entrance = toLatLon(r.getGeoChargingPointEntrance());

        return Evse.builder()
                .id(r.getEvseId())
                .country(address.getCountry())
                .city(address.getCity())
                .street(address.getStreet())
                .postalCode(address.getPostalCode())
                .houseNum(address.getHouseNum())
                .floor(address.getFloor())
                .region(address.getRegion())
                .timezone(address.getTimeZone())
                .latitude(geo == null ? null : geo[0])
                .longitude(geo == null ? null : geo[1])
                .entranceLatitude(entrance == null ? null : entrance[0])
                .entranceLongitude(entrance == null ? null : entrance[1])
                .maxCapacity(r.getMaxCapacity())
                .accessibilityId(
                        EnumRelationResolver.resolveAccessibilityId(catalog, r.getAccessibility()))
                .operatorId(entry.getOperatorId())
                .chargingStationId(r.getChargingStationId())
                .chargingStationName(r.getChargingStationName())
                .lastUpdate(r.lastUpdate())
                .additionalInfo(r.getAdditionalInfo())
                .isOpen24Hours(toIntFlag(r.getIsOpen24Hours()))
                .openingTime(r.getOpeningTime())
                .hubOperatorId(r.getHubOperatorId())
                .clearinghouseId(r.getClearinghouseId())
                .isHubjectCompatible(toIntFlag(r.getIsHubjectCompatible()))
                .dynamicInfoAvailable(r.getDynamicInfoAvailable())
                .hotlinePhoneNum(r.getHotlinePhoneNum())
                .build();
    }

    /**
     * Converts a boolean string to {@code 1}/{@code 0}.
     *
     * @param value {@code "true"} or {@code "false"}, case-insensitive
     * @return {@code 1}, {@code 0}, or {@code null} for anything else
     */
    static Integer toIntFlag(String value) {
        if ("true".equalsIgnoreCase(StringUtils.trim(value))) {
            return 1;
        }
        if ("false".equalsIgnoreCase(StringUtils.trim(value))) {
            return 0;
        }
        return null;
    }

    /**
     * Extracts latitude and longitude.
     *
     * @param coordinates coordinates in Google or decimal degree notation
     * @return {@code [latitude, longitude]}, or {@code null} if absent or unparseable
     */
    static double[] toLatLon(GeoCoordinates coordinates) {
        if (coordinates == null) {
            return null;
        }
        if (coordinates.getGoogle() != null
                && StringUtils.isNotBlank(coordinates.getGoogle().getCoordinates())) {
            // "lat lon"
            String[] parts = StringUtils.split(coordinates.getGoogle().getCoordinates().trim());
            if (parts.length == 2 && NumberUtils.isParsable(parts[0])
                    && NumberUtils.isParsable(parts[1])) {
                return new double[] {Double.parseDouble(parts[0]), Double.parseDouble(parts[1])};
            }
            log.warn("Unparseable Google coordinates: {}",
                    coordinates.getGoogle().getCoordinates());
            return null;
        }
        GeoCoordinates.DecimalDegree dd = coordinates.getDecimalDegree();
        if (dd != null) {
            String lat = StringUtils.trim(dd.getLatitude());
            String lon = StringUtils.trim(dd.getLongitude());
            if (NumberUtils.isParsable(lat) && NumberUtils.isParsable(lon)) {
                return new double[] {Double.parseDouble(lat), Double.parseDouble(lon)};
            }
            log.warn("Unparseable decimal degree coordinates: lat={}, lon={}", lat, lon);
        }
        return null;
    }
}
