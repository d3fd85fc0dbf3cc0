package com.comino.cranepose.fiducial;

import java.util.List;

import boofcv.struct.image.GrayU8;

/**
 * Marker detection as seen by the pose engines: grey image in, observations
 * with corners in the coordinates of the given image out. An image without
 * markers yields an empty list.
 */
public interface IMarkerDetector {

	List<MarkerObservation> detect(GrayU8 image, long tms);

}
