package org.satplan.loaders;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.satplan.data.AccessReportRecord;
import org.satplan.data.AntennaWindow;
import org.satplan.data.GroundTarget;
import org.satplan.data.PlannerSettings;
import org.satplan.data.Satellite;
import org.satplan.data.TtcStation;
import org.satplan.data.VisibilityWindow;
import org.satplan.exceptions.AccessReportParserException;
import org.satplan.utils.FileUtils;
import org.satplan.utils.TimeUtils;
import org.satplan.visibility.VisibilityProvider;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

@Slf4j
@Getter
@RequiredArgsConstructor
public class AccessReportLoader implements VisibilityProvider {
    private static final String ERROR_TEXT = "Failed to parse file ";
    private static final String HEADER_MARKER = "-----";
    private static final String BLOCK_MARKER = "-To-";

    private final List<AccessReportRecord> records;

    public static AccessReportLoader load(PlannerSettings settings) {
        if (settings.getAccessReportsPath() == null) {
            throw new AccessReportParserException(PlannerSettings.ACCESS_REPORTS_PATH + " is not configured");
        }
        return load(Path.of(settings.getAccessReportsPath()),
                settings.getTargetReportFileNameStart(),
                settings.getFacilityReportFileNameStart(),
                settings.getReportDateTimeFormatter());
    }

    public static AccessReportLoader load(Path directoryPath,
                                          String targetFilePrefix,
                                          String facilityFilePrefix,
                                          DateTimeFormatter formatter) {
        final var result = new ArrayList<AccessReportRecord>();
        for (final var file : FileUtils.getFilteredFilesFromDirectory(directoryPath, f -> f.getName().startsWith(targetFilePrefix))) {
            result.addAll(parseReportFile(file, AccessReportRecord.Kind.TARGET, formatter));
        }
        for (final var file : FileUtils.getFilteredFilesFromDirectory(directoryPath, f -> f.getName().startsWith(facilityFilePrefix))) {
            result.addAll(parseReportFile(file, AccessReportRecord.Kind.FACILITY, formatter));
        }
        log.info("Loaded " + result.size() + " access records from " + directoryPath.toAbsolutePath());
        return new AccessReportLoader(List.copyOf(result));
    }

    @Override
    public List<VisibilityWindow> computeAccess(Satellite satellite, GroundTarget target, Instant start, Instant end) {
        final var result = new ArrayList<VisibilityWindow>();
        for (final var record : records) {
            if (record.getKind() != AccessReportRecord.Kind.TARGET) continue;
            if (!matches(record.getSatelliteName(), satellite.getId(), satellite.getName())) continue;
            if (!matches(record.getFromName(), target.getId(), target.getName())) continue;
            final var windowStart = TimeUtils.max(record.getStartTime(), start);
            final var windowEnd = TimeUtils.min(record.getStopTime(), end);
            if (!windowStart.isBefore(windowEnd)) continue;
            result.add(new VisibilityWindow(
                    target.getId() + "_" + satellite.getId() + "_" + record.getAccess(),
                    satellite.getId(),
                    target.getId(),
                    windowStart,
                    windowEnd,
                    0.0,
                    0.0));
        }
        result.sort(Comparator.comparing(VisibilityWindow::getStartTime));
        return result;
    }

    @Override
    public List<AntennaWindow> computeGroundStationAccess(Satellite satellite, TtcStation station, Instant start, Instant end) {
        final var type = satellite.getSatelliteType();
        final var result = new ArrayList<AntennaWindow>();
        for (final var record : records) {
            if (record.getKind() != AccessReportRecord.Kind.FACILITY) continue;
            if (!matches(record.getSatelliteName(), satellite.getId(), satellite.getName())) continue;
            if (!matches(record.getFromName(), station.getId(), station.getName())) continue;
            final var windowStart = TimeUtils.max(record.getStartTime(), start);
            final var windowEnd = TimeUtils.min(record.getStopTime(), end);
            if (!windowStart.isBefore(windowEnd)) continue;
            for (final var antenna : station.getAntennas()) {
                final var compatible = type
                        .map(t -> t.getAntennaTypes().stream().anyMatch(antenna::supportsFrequency))
                        .orElse(true);
                if (!compatible) continue;
                final var rate = type
                        .map(t -> Math.min(t.getMaxDownlinkRateMbps(), antenna.getMaxDataRateMbps()))
                        .orElse(antenna.getMaxDataRateMbps());
                result.add(new AntennaWindow(station.getId(), antenna.getId(), satellite.getId(), windowStart, windowEnd, rate));
            }
        }
        result.sort(Comparator.comparing(AntennaWindow::getStartTime).thenComparing(AntennaWindow::getAntennaId));
        return result;
    }

    public Set<String> getSatelliteNames() {
        final var result = new TreeSet<String>();
        records.forEach(record -> result.add(record.getSatelliteName()));
        return result;
    }

    public Set<String> getTargetNames() {
        return namesOf(AccessReportRecord.Kind.TARGET);
    }

    public Set<String> getFacilityNames() {
        return namesOf(AccessReportRecord.Kind.FACILITY);
    }

    public Optional<Instant> getEarliestStart() {
        return records.stream().map(AccessReportRecord::getStartTime).min(Comparator.naturalOrder());
    }

    public Optional<Instant> getLatestStop() {
        return records.stream().map(AccessReportRecord::getStopTime).max(Comparator.naturalOrder());
    }

    private Set<String> namesOf(AccessReportRecord.Kind kind) {
        final var result = new TreeSet<String>();
        records.stream().filter(record -> record.getKind() == kind).forEach(record -> result.add(record.getFromName()));
        return result;
    }

    private static boolean matches(String reportName, String id, String name) {
        return reportName.equals(id) || reportName.equals(name);
    }

    static List<AccessReportRecord> parseReportFile(File file, AccessReportRecord.Kind kind, DateTimeFormatter formatter) {
        try {
            final var result = new ArrayList<AccessReportRecord>();
            final var lines = Files.readAllLines(file.toPath());
            String prevLine = null;
            var parserState = ParserState.SEARCH_BLOCK_START;
            String fromName = null;
            String satelliteName = null;
            for (final var currentLine : lines) {
                switch (parserState) {
                    case SEARCH_BLOCK_START -> {
                        if (currentLine.startsWith(HEADER_MARKER) && prevLine != null && prevLine.contains(BLOCK_MARKER)) {
                            final var headerParts = prevLine.trim().split(BLOCK_MARKER);
                            fromName = headerParts[0];
                            satelliteName = headerParts[1];
                            parserState = parserState.nextState();
                        }
                    }
                    case SEARCH_DATA_START -> {
                        if (currentLine.trim().startsWith(HEADER_MARKER)) {
                            parserState = parserState.nextState();
                        }
                    }
                    case PARSING_DATA -> {
                        if (currentLine.isBlank()) {
                            parserState = parserState.nextState();
                            break;
                        }
                        result.add(new AccessReportRecord(
                                kind,
                                fromName,
                                satelliteName,
                                Long.parseLong(currentLine.substring(0, 24).trim()),
                                parseTime(currentLine.substring(28, 52), formatter),
                                parseTime(currentLine.substring(56, 80), formatter),
                                Double.parseDouble(currentLine.substring(85, Math.min(98, currentLine.length())).trim())));
                    }
                }
                prevLine = currentLine;
            }
            return result;
        } catch (Exception e) {
            log.error(ERROR_TEXT + file.getAbsolutePath(), e);
            throw new AccessReportParserException(ERROR_TEXT + file.getAbsolutePath(), e);
        }
    }

    private static Instant parseTime(String text, DateTimeFormatter formatter) {
        return LocalDateTime.parse(text.trim(), formatter).toInstant(ZoneOffset.UTC);
    }

    private enum ParserState {
        SEARCH_BLOCK_START,
        SEARCH_DATA_START,
        PARSING_DATA;

        ParserState nextState() {
            return switch (this) {
                case SEARCH_BLOCK_START -> SEARCH_DATA_START;
                case SEARCH_DATA_START -> PARSING_DATA;
                case PARSING_DATA -> SEARCH_BLOCK_START;
            };
        }
    }
}
