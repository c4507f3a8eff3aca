package org.satplan.loaders;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.satplan.data.Antenna;
import org.satplan.data.DefaultStations;
import org.satplan.data.PlannerSettings;
import org.satplan.data.TtcStation;
import org.satplan.exceptions.ConfigLoadException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Reads the station network from a CSV file with one antenna per line:
 * <pre>
 * stationId,stationName,latitude,longitude,altitudeM,uplinkRateKbps,baseUplinkSec,perTaskUplinkSec,
 * antennaId,antennaName,maxRateMbps,bands,switchTimeSec
 * </pre>
 * Bands are separated by {@code ;}. Station columns are taken from the first line of each station.
 * Blank lines, {@code #} comments and the header line are ignored.
 */
@Slf4j
@UtilityClass
public class StationsLoader {
    private static final String ERROR_TEXT = "Failed to parse stations file ";
    private static final int COLUMN_COUNT = 13;

    public static List<TtcStation> loadStations(PlannerSettings settings) {
        if (settings.getStationsPath() == null || settings.getStationsPath().isBlank()) {
            log.info("No stations file configured, using the default station network.");
            return DefaultStations.create();
        }
        return loadStations(Path.of(settings.getStationsPath()));
    }

    public static List<TtcStation> loadStations(Path path) {
        try {
            final var builders = new LinkedHashMap<String, TtcStation.TtcStationBuilder>();
            for (final var rawLine : Files.readAllLines(path)) {
                final var line = rawLine.trim();
                if (line.isEmpty() || line.startsWith("#") || line.startsWith("stationId")) continue;
                final var parts = line.split(",");
                if (parts.length != COLUMN_COUNT) {
                    throw new ConfigLoadException("Expected " + COLUMN_COUNT + " columns but got " + parts.length + ": " + line);
                }
                final var stationId = parts[0].trim();
                final var builder = builders.computeIfAbsent(stationId, id -> TtcStation.builder()
                        .id(id)
                        .name(parts[1].trim())
                        .latitude(Double.parseDouble(parts[2].trim()))
                        .longitude(Double.parseDouble(parts[3].trim()))
                        .altitudeM(Double.parseDouble(parts[4].trim()))
                        .uplinkRateKbps(Double.parseDouble(parts[5].trim()))
                        .baseUplinkTimeSec(Double.parseDouble(parts[6].trim()))
                        .perTaskUplinkTimeSec(Double.parseDouble(parts[7].trim())));
                builder.antenna(Antenna.builder()
                        .id(parts[8].trim())
                        .name(parts[9].trim())
                        .stationId(stationId)
                        .maxDataRateMbps(Double.parseDouble(parts[10].trim()))
                        .supportedFrequencies(parseBands(parts[11]))
                        .satelliteSwitchTimeSec(Double.parseDouble(parts[12].trim()))
                        .build());
            }
            final var result = new ArrayList<TtcStation>();
            builders.values().forEach(builder -> result.add(builder.build()));
            log.info("Loaded " + result.size() + " stations from " + path.toAbsolutePath());
            return result;
        } catch (Exception e) {
            log.error(ERROR_TEXT + path.toAbsolutePath(), e);
            throw new ConfigLoadException(ERROR_TEXT + path.toAbsolutePath(), e);
        }
    }

    private static Set<String> parseBands(String value) {
        final var bands = new ArrayList<String>();
        for (final var band : value.split(";")) {
            if (!band.isBlank()) bands.add(band.trim());
        }
        return Set.copyOf(bands);
    }
}
