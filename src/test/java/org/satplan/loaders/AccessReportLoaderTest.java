package org.satplan.loaders;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.satplan.data.AccessReportRecord;
import org.satplan.data.DefaultStations;
import org.satplan.data.GroundTarget;
import org.satplan.data.Satellite;
import org.satplan.data.SatelliteTypes;
import org.satplan.exceptions.AccessReportParserException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccessReportLoaderTest {
    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("d MMM uuuu HH:mm:ss.SSS", Locale.US);

    @TempDir
    Path reports;

    @Test
    void parsesTargetAndFacilityReports() throws IOException {
        writeFixtures();

        final var loader = AccessReportLoader.load(reports, "AreaTarget-", "Facility-", FORMATTER);

        assertThat(loader.getRecords()).hasSize(4);
        assertThat(loader.getSatelliteNames()).containsExactly("SAT1");
        assertThat(loader.getTargetNames()).containsExactly("Moscow");
        assertThat(loader.getFacilityNames()).containsExactly("BJGS");
        assertThat(loader.getEarliestStart()).contains(Instant.parse("2026-01-01T00:10:00Z"));
        assertThat(loader.getLatestStop()).contains(Instant.parse("2026-01-01T03:05:00Z"));

        final var first = loader.getRecords().stream()
                .filter(record -> record.getKind() == AccessReportRecord.Kind.TARGET)
                .findFirst()
                .orElseThrow();
        assertThat(first.getFromName()).isEqualTo("Moscow");
        assertThat(first.getAccess()).isEqualTo(1L);
        assertThat(first.getDurationSec()).isEqualTo(300.0);
    }

    @Test
    void targetAccessIsClippedToTheInterval() throws IOException {
        writeFixtures();
        final var loader = AccessReportLoader.load(reports, "AreaTarget-", "Facility-", FORMATTER);
        final var satellite = new Satellite("SAT1", "SAT1", SatelliteTypes.HR_OPTICAL);
        final var target = new GroundTarget("Moscow", "Moscow", 0.0, 0.0);

        final var windows = loader.computeAccess(satellite, target,
                Instant.parse("2026-01-01T00:12:00Z"), Instant.parse("2026-01-01T02:00:00Z"));

        assertThat(windows).hasSize(1);
        assertThat(windows.get(0).getStartTime()).isEqualTo(Instant.parse("2026-01-01T00:12:00Z"));
        assertThat(windows.get(0).getEndTime()).isEqualTo(Instant.parse("2026-01-01T00:15:00Z"));
        assertThat(windows.get(0).getTargetId()).isEqualTo("Moscow");
    }

    @Test
    void stationAccessYieldsOneWindowPerCompatibleAntenna() throws IOException {
        writeFixtures();
        final var loader = AccessReportLoader.load(reports, "AreaTarget-", "Facility-", FORMATTER);
        final var beijing = DefaultStations.create().get(0);
        final var start = Instant.parse("2026-01-01T00:00:00Z");
        final var end = Instant.parse("2026-01-02T00:00:00Z");

        final var optical = loader.computeGroundStationAccess(new Satellite("SAT1", "SAT1", SatelliteTypes.HR_OPTICAL),
                beijing, start, end);
        final var sar = loader.computeGroundStationAccess(new Satellite("SAT1", "SAT1", SatelliteTypes.UHR_SAR),
                beijing, start, end);

        assertThat(optical).hasSize(4);
        assertThat(optical).allSatisfy(window -> assertThat(window.getMaxDataRateMbps()).isEqualTo(800.0));
        assertThat(sar.get(0).getAntennaId()).isEqualTo("BJGS_ANT01");
        assertThat(sar.get(0).getMaxDataRateMbps()).isEqualTo(1200.0);
        assertThat(sar.get(1).getMaxDataRateMbps()).isEqualTo(800.0);
    }

    @Test
    void unknownSatelliteHasNoAccess() throws IOException {
        writeFixtures();
        final var loader = AccessReportLoader.load(reports, "AreaTarget-", "Facility-", FORMATTER);

        final var windows = loader.computeAccess(new Satellite("SAT9", "SAT9", null), new GroundTarget("Moscow", "Moscow", 0, 0),
                Instant.parse("2026-01-01T00:00:00Z"), Instant.parse("2026-01-02T00:00:00Z"));

        assertThat(windows).isEmpty();
    }

    @Test
    void malformedRowFailsTheLoad() throws IOException {
        Files.write(reports.resolve("AreaTarget-Broken-To-SAT1.txt"), List.of(
                "Broken-To-SAT1",
                "-----------------",
                "  Access   Start Time (UTCG)   Stop Time (UTCG)   Duration (sec)",
                "  ------   -----------------   ----------------   --------------",
                "       1   not a time"));

        assertThatThrownBy(() -> AccessReportLoader.load(reports, "AreaTarget-", "Facility-", FORMATTER))
                .isInstanceOf(AccessReportParserException.class)
                .hasMessageContaining("AreaTarget-Broken-To-SAT1.txt");
    }

    @Test
    void missingDirectoryFailsTheLoad() {
        assertThatThrownBy(() -> AccessReportLoader.load(reports.resolve("missing"), "AreaTarget-", "Facility-", FORMATTER))
                .isInstanceOf(AccessReportParserException.class);
    }

    private void writeFixtures() throws IOException {
        Files.write(reports.resolve("AreaTarget-Moscow-To-SAT1.txt"), block("Moscow-To-SAT1",
                row(1, "1 Jan 2026 00:10:00.000", "1 Jan 2026 00:15:00.000", 300.0),
                row(2, "1 Jan 2026 02:30:00.000", "1 Jan 2026 02:34:00.000", 240.0)));
        Files.write(reports.resolve("Facility-BJGS-To-SAT1.txt"), block("BJGS-To-SAT1",
                row(1, "1 Jan 2026 00:40:00.000", "1 Jan 2026 00:50:00.000", 600.0),
                row(2, "1 Jan 2026 03:00:00.000", "1 Jan 2026 03:05:00.000", 300.0)));
        Files.write(reports.resolve("notes.txt"), List.of("not a report"));
    }

    private static List<String> block(String header, String... rows) {
        final var lines = new ArrayList<String>();
        lines.add("1 Jan 2026 00:00:00   Access Report");
        lines.add("");
        lines.add(header);
        lines.add("------------------------------------------");
        lines.add("                  Access        Start Time (UTCG)           Stop Time (UTCG)        Duration (sec)");
        lines.add("                  ------    ------------------------    ------------------------    --------------");
        lines.addAll(List.of(rows));
        lines.add("");
        return lines;
    }

    private static String row(long access, String start, String stop, double durationSec) {
        return String.format(Locale.US, "%24d    %-24s    %-24s     %13.3f", access, start, stop, durationSec);
    }
}
