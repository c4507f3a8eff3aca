package org.satplan.loaders;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.satplan.Main;
import org.satplan.data.AwcsatConfig;
import org.satplan.data.PlannerSettings;
import org.satplan.data.SchedulerConfig;
import org.satplan.exceptions.ConfigLoadException;
import org.satplan.utils.TimeUtils;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Properties;
import java.util.function.Function;

import static org.satplan.data.PlannerSettings.*;

@Slf4j
@UtilityClass
public class ConfigLoader {
    private static final String DEFAULT_REPORT_DATE_TIME_PATTERN = "d MMM uuuu HH:mm:ss.SSS";

    public static PlannerSettings loadConfig() {
        final var currentFolder = getCurrentFolder();
        if (currentFolder != null) {
            final var settings = loadPropsFromCurrentDirectory(currentFolder);
            if (settings != null) return settings;
        }

        final var loader = Thread.currentThread().getContextClassLoader();
        try (final var resourceStream = loader.getResourceAsStream(CONFIG_FILE_NAME)) {
            if (resourceStream == null) throw new ConfigLoadException(CONFIG_FILE_NAME + " not found on classpath");
            final var props = new Properties();
            props.load(resourceStream);
            return fromProperties(props);
        } catch (ConfigLoadException e) {
            log.error("Failed to load config.", e);
            throw e;
        } catch (Exception e) {
            log.error("Failed to load config.", e);
            throw new ConfigLoadException("Failed to load config.", e);
        }
    }

    public static PlannerSettings fromProperties(Properties props) {
        final var awcsatDefaults = AwcsatConfig.defaults();
        final var awcsatConfig = AwcsatConfig.builder()
                .outerLoops(get(props, OUTER_LOOPS, Integer::parseInt, awcsatDefaults.getOuterLoops()))
                .initialInnerLoops(get(props, INITIAL_INNER_LOOPS, Integer::parseInt, awcsatDefaults.getInitialInnerLoops()))
                .tabuTenure(get(props, TABU_TENURE, Integer::parseInt, awcsatDefaults.getTabuTenure()))
                .initialTempCoef(get(props, INITIAL_TEMP_COEF, Double::parseDouble, awcsatDefaults.getInitialTempCoef()))
                .waveN(get(props, WAVE_N, Double::parseDouble, awcsatDefaults.getWaveN()))
                .waveC(get(props, WAVE_C, Double::parseDouble, awcsatDefaults.getWaveC()))
                .initialSampleSize(get(props, INITIAL_SAMPLE_SIZE, Integer::parseInt, awcsatDefaults.getInitialSampleSize()))
                .randomSeed(get(props, RANDOM_SEED, Long::valueOf, null))
                .timeLimitSec(get(props, TIME_LIMIT_SEC, Double::parseDouble, awcsatDefaults.getTimeLimitSec()))
                .stripExtensionMax(get(props, STRIP_EXTENSION_MAX, Double::parseDouble, awcsatDefaults.getStripExtensionMax()))
                .stripExtensionMin(get(props, STRIP_EXTENSION_MIN, Double::parseDouble, awcsatDefaults.getStripExtensionMin()))
                .minTemperature(get(props, MIN_TEMPERATURE, Double::parseDouble, awcsatDefaults.getMinTemperature()))
                .defaultTemperature(get(props, DEFAULT_TEMPERATURE, Double::parseDouble, awcsatDefaults.getDefaultTemperature()))
                .build();

        final var schedulerDefaults = SchedulerConfig.defaults();
        final var schedulerConfig = SchedulerConfig.builder()
                .minGapAfterUplinkSec(get(props, MIN_GAP_AFTER_UPLINK_SEC, Double::parseDouble, schedulerDefaults.getMinGapAfterUplinkSec()))
                .segmentOverheadSec(get(props, SEGMENT_OVERHEAD_SEC, Double::parseDouble, schedulerDefaults.getSegmentOverheadSec()))
                .maxAggregatedAntennas(get(props, MAX_AGGREGATED_ANTENNAS, Integer::parseInt, schedulerDefaults.getMaxAggregatedAntennas()))
                .maxSegments(get(props, MAX_SEGMENTS, Integer::parseInt, schedulerDefaults.getMaxSegments()))
                .preferAggregation(get(props, PREFER_AGGREGATION, Boolean::parseBoolean, schedulerDefaults.isPreferAggregation()))
                .imagingSwitchTimeSec(get(props, IMAGING_SWITCH_TIME_SEC, Double::parseDouble, schedulerDefaults.getImagingSwitchTimeSec()))
                .imagingToDownlinkTimeSec(get(props, IMAGING_TO_DOWNLINK_TIME_SEC, Double::parseDouble, schedulerDefaults.getImagingToDownlinkTimeSec()))
                .downlinkSwitchTimeSec(get(props, DOWNLINK_SWITCH_TIME_SEC, Double::parseDouble, schedulerDefaults.getDownlinkSwitchTimeSec()))
                .violationPenalty(get(props, VIOLATION_PENALTY, Double::parseDouble, schedulerDefaults.getViolationPenalty()))
                .stripExtensionBonus(get(props, STRIP_EXTENSION_BONUS, Double::parseDouble, schedulerDefaults.getStripExtensionBonus()))
                .build();

        return new PlannerSettings(
                awcsatConfig,
                schedulerConfig,
                props.getProperty(ACCESS_REPORTS_PATH),
                props.getProperty(TARGET_REPORT_FILENAME_START, "AreaTarget-"),
                props.getProperty(FACILITY_REPORT_FILENAME_START, "Facility-"),
                DateTimeFormatter.ofPattern(props.getProperty(REPORT_DATE_TIME_PATTERN, DEFAULT_REPORT_DATE_TIME_PATTERN), Locale.US),
                props.getProperty(STATIONS_PATH),
                props.getProperty(DEFAULT_SATELLITE_TYPE, "HR_OPTICAL"),
                get(props, HORIZON_START, ConfigLoader::parseInstant, null),
                get(props, HORIZON_END, ConfigLoader::parseInstant, null),
                get(props, TASK_VALUE, Double::parseDouble, 1.0),
                get(props, TASK_DATA_VOLUME_GB, Double::parseDouble, 5.0),
                get(props, TASK_IMAGING_SEC, Double::parseDouble, 10.0));
    }

    private static <T> T get(Properties props, String key, Function<String, T> parser, T defaultValue) {
        final var value = props.getProperty(key);
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return parser.apply(value.trim());
        } catch (RuntimeException e) {
            log.error("Invalid value for " + key + ": " + value);
            throw new ConfigLoadException("Invalid value for " + key + ": " + value, e);
        }
    }

    private static Instant parseInstant(String value) {
        return TimeUtils.parse(value);
    }

    private static PlannerSettings loadPropsFromCurrentDirectory(Path currentFolder) {
        final var configPath = currentFolder.resolve(CONFIG_FILE_NAME);
        log.info("Application properties path: " + configPath);
        if (configPath.toFile().isFile()) {
            try (final var propsReader = Files.newBufferedReader(configPath)) {
                final var props = new Properties();
                props.load(propsReader);
                return fromProperties(props);
            } catch (Exception ex) {
                log.warn("Failed to read application.properties from current directory, will try to use inner.");
            }
        }
        return null;
    }

    private static Path getCurrentFolder() {
        final var mainClass = Main.class;
        final var classResource = mainClass.getResource(mainClass.getSimpleName() + ".class");
        if (classResource == null) throw new ConfigLoadException("class resource is null");

        final var url = classResource.toString();
        if (url.startsWith("jar:file:")) {
            final var path = url.replaceAll("^jar:(file:.*[.]jar)!/.*", "$1");
            try {
                return Paths.get(URI.create(path)).getParent();
            } catch (Exception e) {
                throw new ConfigLoadException("Invalid Jar File URL String", e);
            }
        }
        return null;
    }
}
