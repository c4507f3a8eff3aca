package org.satplan.data;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Getter
@Builder
public class TtcStation {
    private final String id;
    private final String name;
    private final double latitude;
    private final double longitude;
    private final double altitudeM;
    @Singular
    private final List<Antenna> antennas;
    @Builder.Default
    private final double minElevationDeg = 5.0;
    @Builder.Default
    private final double uplinkRateKbps = 64.0;
    @Builder.Default
    private final double baseUplinkTimeSec = 5.0;
    @Builder.Default
    private final double perTaskUplinkTimeSec = 1.0;

    public double calculateUplinkDuration(int taskCount) {
        return baseUplinkTimeSec + perTaskUplinkTimeSec * taskCount;
    }

    public Optional<Antenna> getAntenna(String antennaId) {
        return antennas.stream().filter(antenna -> antenna.getId().equals(antennaId)).findFirst();
    }

    public List<Antenna> getAvailableAntennasAt(Instant time) {
        return antennas.stream().filter(antenna -> antenna.isAvailableAt(time)).toList();
    }

    public List<Antenna> getAvailableAntennasDuring(Instant startTime, Instant endTime) {
        return antennas.stream().filter(antenna -> antenna.isAvailableDuring(startTime, endTime)).toList();
    }

    public List<Antenna> getAntennasByFrequency(String frequency) {
        return antennas.stream().filter(antenna -> antenna.supportsFrequency(frequency)).toList();
    }

    public double getMaxDataRateMbps() {
        return antennas.stream().mapToDouble(Antenna::getMaxDataRateMbps).max().orElse(0.0);
    }

    public int getTotalAntennaCount() {
        return antennas.size();
    }

    @Override
    public String toString() {
        return String.format("TtcStation(%s, %s, (%.2f, %.2f), %d antennas)",
                id, name, latitude, longitude, antennas.size());
    }
}
