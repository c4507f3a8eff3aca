package org.satplan.data;

import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Set;

@UtilityClass
public class DefaultStations {

    public static List<TtcStation> create() {
        return List.of(beijing(), kashgar(), sanya(), jiamusi());
    }

    private static TtcStation beijing() {
        return TtcStation.builder()
                .id("BJGS")
                .name("Beijing TT&C station")
                .latitude(40.0)
                .longitude(116.4)
                .altitudeM(50.0)
                .antenna(antenna("BJGS_ANT01", "Beijing antenna 1", "BJGS", 1200.0, Set.of("X", "Ka"), 5.0))
                .antenna(antenna("BJGS_ANT02", "Beijing antenna 2", "BJGS", 800.0, Set.of("X"), 4.0))
                .build();
    }

    private static TtcStation kashgar() {
        return TtcStation.builder()
                .id("KSGS")
                .name("Kashgar TT&C station")
                .latitude(39.5)
                .longitude(76.0)
                .altitudeM(1300.0)
                .antenna(antenna("KSGS_ANT01", "Kashgar antenna 1", "KSGS", 1000.0, Set.of("X", "Ka"), 5.0))
                .antenna(antenna("KSGS_ANT02", "Kashgar antenna 2", "KSGS", 600.0, Set.of("X"), 4.0))
                .build();
    }

    private static TtcStation sanya() {
        return TtcStation.builder()
                .id("SYGS")
                .name("Sanya TT&C station")
                .latitude(18.2)
                .longitude(109.5)
                .altitudeM(10.0)
                .uplinkRateKbps(128.0)
                .antenna(antenna("SYGS_ANT01", "Sanya antenna 1", "SYGS", 1500.0, Set.of("X", "Ka", "S"), 5.0))
                .build();
    }

    private static TtcStation jiamusi() {
        return TtcStation.builder()
                .id("JMSGS")
                .name("Jiamusi TT&C station")
                .latitude(46.8)
                .longitude(130.3)
                .altitudeM(80.0)
                .antenna(antenna("JMSGS_ANT01", "Jiamusi antenna 1", "JMSGS", 800.0, Set.of("X"), 4.0))
                .build();
    }

    private static Antenna antenna(String id, String name, String stationId, double rateMbps,
                                   Set<String> bands, double switchTimeSec) {
        return Antenna.builder()
                .id(id)
                .name(name)
                .stationId(stationId)
                .maxDataRateMbps(rateMbps)
                .supportedFrequencies(bands)
                .satelliteSwitchTimeSec(switchTimeSec)
                .build();
    }
}
