package org.satplan.visibility;

import org.satplan.data.AntennaWindow;
import org.satplan.data.GroundTarget;
import org.satplan.data.Satellite;
import org.satplan.data.TtcStation;
import org.satplan.data.VisibilityWindow;

import java.time.Instant;
import java.util.List;

public interface VisibilityProvider {

    List<VisibilityWindow> computeAccess(Satellite satellite, GroundTarget target, Instant start, Instant end);

    List<AntennaWindow> computeGroundStationAccess(Satellite satellite, TtcStation station, Instant start, Instant end);
}
