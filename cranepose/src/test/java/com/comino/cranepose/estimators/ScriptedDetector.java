package com.comino.cranepose.estimators;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

import com.comino.cranepose.fiducial.IMarkerDetector;
import com.comino.cranepose.fiducial.MarkerObservation;

import boofcv.struct.image.GrayU8;

/**
 * Returns one prepared marker list per call, nothing once the script is
 * exhausted.
 */
final class ScriptedDetector implements IMarkerDetector {

	private final Deque<List<MarkerObservation>> script = new ArrayDeque<>();

	int last_width  = -1;
	int last_height = -1;

	ScriptedDetector then(MarkerObservation... markers) {
		script.add(new ArrayList<>(Arrays.asList(markers)));
		return this;
	}

	@Override
	public List<MarkerObservation> detect(GrayU8 image, long tms) {
		last_width  = image.width;
		last_height = image.height;
		List<MarkerObservation> next = script.poll();
		return next != null ? next : new ArrayList<>();
	}

}
