package org.satplan.resolvers;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.satplan.data.AntennaWindow;
import org.satplan.data.ImagingAction;
import org.satplan.data.ObservationTask;
import org.satplan.data.VisibilityWindow;

import java.time.Instant;

@Getter
@ToString
@RequiredArgsConstructor
@SuppressWarnings("ClassCanBeRecord")
public class DecodedTask {
    private final ObservationTask task;
    private final int imagingIndex;
    private final int downlinkIndex;
    private final VisibilityWindow imagingWindow;
    private final AntennaWindow downlinkWindow;
    private final Instant imagingStart;
    private final Instant imagingEnd;
    private final double stripExtensionRate;
    private final double dataVolumeGb;
    private final Instant earliestDownlink;

    public String getSatelliteId() {
        return imagingWindow.getSatelliteId();
    }

    public ImagingAction toImagingAction() {
        return new ImagingAction(task.getId(), getSatelliteId(), task.getTargetId(), imagingStart, imagingEnd,
                dataVolumeGb, stripExtensionRate);
    }
}
