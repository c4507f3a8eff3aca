package org.satplan.data;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.time.format.DateTimeFormatter;

@Getter
@AllArgsConstructor
@ToString
@SuppressWarnings("ClassCanBeRecord")
public class PlannerSettings {
    public static final String CONFIG_FILE_NAME = "application.properties";

    public static final String ACCESS_REPORTS_PATH = "accessReportsPath";
    public static final String TARGET_REPORT_FILENAME_START = "targetReportFileNameStart";
    public static final String FACILITY_REPORT_FILENAME_START = "facilityReportFileNameStart";
    public static final String REPORT_DATE_TIME_PATTERN = "reportDateTimePattern";
    public static final String STATIONS_PATH = "stationsPath";
    public static final String DEFAULT_SATELLITE_TYPE = "defaultSatelliteType";
    public static final String HORIZON_START = "horizonStart";
    public static final String HORIZON_END = "horizonEnd";
    public static final String TASK_VALUE = "task.value";
    public static final String TASK_DATA_VOLUME_GB = "task.dataVolumeGb";
    public static final String TASK_IMAGING_SEC = "task.imagingSec";

    public static final String OUTER_LOOPS = "awcsat.outerLoops";
    public static final String INITIAL_INNER_LOOPS = "awcsat.initialInnerLoops";
    public static final String TABU_TENURE = "awcsat.tabuTenure";
    public static final String INITIAL_TEMP_COEF = "awcsat.initialTempCoef";
    public static final String WAVE_N = "awcsat.waveN";
    public static final String WAVE_C = "awcsat.waveC";
    public static final String INITIAL_SAMPLE_SIZE = "awcsat.initialSampleSize";
    public static final String RANDOM_SEED = "awcsat.randomSeed";
    public static final String TIME_LIMIT_SEC = "awcsat.timeLimitSec";
    public static final String STRIP_EXTENSION_MAX = "awcsat.stripExtensionMax";
    public static final String STRIP_EXTENSION_MIN = "awcsat.stripExtensionMin";
    public static final String MIN_TEMPERATURE = "awcsat.minTemperature";
    public static final String DEFAULT_TEMPERATURE = "awcsat.defaultTemperature";

    public static final String MIN_GAP_AFTER_UPLINK_SEC = "scheduler.minGapAfterUplinkSec";
    public static final String SEGMENT_OVERHEAD_SEC = "scheduler.segmentOverheadSec";
    public static final String MAX_AGGREGATED_ANTENNAS = "scheduler.maxAggregatedAntennas";
    public static final String MAX_SEGMENTS = "scheduler.maxSegments";
    public static final String PREFER_AGGREGATION = "scheduler.preferAggregation";
    public static final String IMAGING_SWITCH_TIME_SEC = "scheduler.imagingSwitchTimeSec";
    public static final String IMAGING_TO_DOWNLINK_TIME_SEC = "scheduler.imagingToDownlinkTimeSec";
    public static final String DOWNLINK_SWITCH_TIME_SEC = "scheduler.downlinkSwitchTimeSec";
    public static final String VIOLATION_PENALTY = "objective.violationPenalty";
    public static final String STRIP_EXTENSION_BONUS = "objective.stripExtensionBonus";

    private final AwcsatConfig awcsatConfig;
    private final SchedulerConfig schedulerConfig;
    private final String accessReportsPath;
    private final String targetReportFileNameStart;
    private final String facilityReportFileNameStart;
    private final DateTimeFormatter reportDateTimeFormatter;
    private final String stationsPath;
    private final String defaultSatelliteType;
    private final Instant horizonStart;
    private final Instant horizonEnd;
    private final double taskValue;
    private final double taskDataVolumeGb;
    private final double taskImagingSec;
}
