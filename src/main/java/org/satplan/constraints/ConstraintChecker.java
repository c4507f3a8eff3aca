package org.satplan.constraints;

import lombok.extern.slf4j.Slf4j;
import org.satplan.data.Antenna;
import org.satplan.data.ConstraintViolation;
import org.satplan.data.DownlinkAction;
import org.satplan.data.ImagingAction;
import org.satplan.data.Satellite;
import org.satplan.data.SchedulerConfig;
import org.satplan.data.TtcStation;
import org.satplan.data.UplinkAction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

@Slf4j
public class ConstraintChecker {
    private final ActionTransitionConstraint transitionConstraint;
    private final AntennaResourceConstraint antennaConstraint = new AntennaResourceConstraint();
    private final UplinkPrecedenceConstraint uplinkConstraint;
    private final Map<String, Antenna> antennas = new HashMap<>();

    public ConstraintChecker(SchedulerConfig config, Collection<TtcStation> stations) {
        this.transitionConstraint = new ActionTransitionConstraint(config);
        this.uplinkConstraint = new UplinkPrecedenceConstraint(config.getMinGapAfterUplinkSec());
        stations.forEach(station -> station.getAntennas().forEach(antenna -> antennas.put(antenna.getId(), antenna)));
    }

    public ValidationReport validate(List<Satellite> satellites,
                                     List<ImagingAction> imagings,
                                     List<UplinkAction> uplinks,
                                     List<DownlinkAction> downlinks) {
        final var violations = new ArrayList<ConstraintViolation>();

        final var satellitesById = new HashMap<String, Satellite>();
        satellites.forEach(satellite -> satellitesById.put(satellite.getId(), satellite));
        final var satelliteIds = new LinkedHashSet<String>();
        imagings.forEach(imaging -> satelliteIds.add(imaging.getSatelliteId()));
        downlinks.forEach(downlink -> satelliteIds.add(downlink.getSatelliteId()));
        for (final var satelliteId : satelliteIds) {
            final var satellite = satellitesById.getOrDefault(satelliteId, new Satellite(satelliteId, satelliteId, null));
            violations.addAll(transitionConstraint.checkAll(satellite,
                    imagings.stream().filter(imaging -> imaging.getSatelliteId().equals(satelliteId)).toList(),
                    downlinks.stream().filter(downlink -> downlink.getSatelliteId().equals(satelliteId)).toList()));
        }

        violations.addAll(antennaConstraint.checkAll(AntennaResourceConstraint.groupActionsByAntenna(uplinks, downlinks), antennas));
        violations.addAll(uplinkConstraint.checkAll(imagings, uplinks));

        final var report = new ValidationReport(List.copyOf(violations));
        log.info("Validation: " + report.getErrors().size() + " errors, " + report.getWarnings().size() + " warnings");
        return report;
    }
}
