package org.satplan.loaders;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.satplan.data.TtcStation;
import org.satplan.exceptions.ConfigLoadException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StationsLoaderTest {

    @TempDir
    Path directory;

    @Test
    void groupsAntennasByStation() throws IOException {
        final var file = directory.resolve("stations.csv");
        Files.write(file, List.of(
                "stationId,stationName,latitude,longitude,altitudeM,uplinkRateKbps,baseUplinkSec,perTaskUplinkSec,antennaId,antennaName,maxRateMbps,bands,switchTimeSec",
                "# northern site",
                "N1,North,60.0,20.0,100,64,4,2,N1_A,North A,1000,X;Ka,5",
                "",
                "N1,North,60.0,20.0,100,64,4,2,N1_B,North B,600,X,3",
                "S1,South,-30.0,25.0,0,128,5,1,S1_A,South A,800,S,4"));

        final var stations = StationsLoader.loadStations(file);

        assertThat(stations).extracting(TtcStation::getId).containsExactly("N1", "S1");
        final var north = stations.get(0);
        assertThat(north.getTotalAntennaCount()).isEqualTo(2);
        assertThat(north.calculateUplinkDuration(3)).isEqualTo(10.0);
        assertThat(north.getAntenna("N1_A").orElseThrow().getSupportedFrequencies()).containsExactlyInAnyOrder("X", "Ka");
        assertThat(north.getAntenna("N1_B").orElseThrow().getSatelliteSwitchTimeSec()).isEqualTo(3.0);
        assertThat(north.getMaxDataRateMbps()).isEqualTo(1000.0);
        assertThat(stations.get(1).getUplinkRateKbps()).isEqualTo(128.0);
        assertThat(stations.get(1).getAntennasByFrequency("S")).hasSize(1);
    }

    @Test
    void rejectsRowsWithMissingColumns() throws IOException {
        final var file = directory.resolve("stations.csv");
        Files.write(file, List.of("N1,North,60.0,20.0,100,64,4,2,N1_A,North A,1000,X"));

        assertThatThrownBy(() -> StationsLoader.loadStations(file)).isInstanceOf(ConfigLoadException.class);
    }

    @Test
    void missingFileFailsTheLoad() {
        assertThatThrownBy(() -> StationsLoader.loadStations(directory.resolve("absent.csv")))
                .isInstanceOf(ConfigLoadException.class);
    }

    @Test
    void fallsBackToTheDefaultNetwork() {
        final var stations = StationsLoader.loadStations(ConfigLoader.fromProperties(new Properties()));

        assertThat(stations).extracting(TtcStation::getId).containsExactly("BJGS", "KSGS", "SYGS", "JMSGS");
        assertThat(stations.get(0).getAntennas()).hasSize(2);
        assertThat(stations.get(2).getUplinkRateKbps()).isEqualTo(128.0);
    }
}
