package org.satplan.constraints;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.satplan.data.ActionType;
import org.satplan.data.DownlinkAction;
import org.satplan.data.UplinkAction;

import java.time.Instant;
import java.util.List;

@Getter
@ToString
@RequiredArgsConstructor
@SuppressWarnings("ClassCanBeRecord")
public class AntennaAction {
    private final String id;
    private final ActionType actionType;
    private final String satelliteId;
    private final String antennaId;
    private final Instant startTime;
    private final Instant endTime;

    public static AntennaAction fromUplink(UplinkAction action) {
        return new AntennaAction(action.getId(), ActionType.UPLINK, action.getSatelliteId(), action.getAntennaId(),
                action.getStartTime(), action.getEndTime());
    }

    public static List<AntennaAction> fromDownlink(DownlinkAction action) {
        return action.getAntennaIds().stream()
                .map(antennaId -> new AntennaAction(action.getId(), ActionType.DOWNLINK, action.getSatelliteId(), antennaId,
                        action.getStartTime(), action.getEndTime()))
                .toList();
    }
}
