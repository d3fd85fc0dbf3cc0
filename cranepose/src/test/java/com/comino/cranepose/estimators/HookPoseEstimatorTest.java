package com.comino.cranepose.estimators;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.comino.cranepose.config.HookSettings;
import com.comino.cranepose.fiducial.MarkerObservation;
import com.comino.cranepose.libcamera.CameraBackend;
import com.comino.cranepose.libcamera.CameraConfig;
import com.comino.cranepose.libcamera.CameraFrame;

import boofcv.struct.image.GrayU8;

final class HookPoseEstimatorTest {

	private static final double Z = CraneAbstractEstimator.DEFAULT_FX * 0.035 / 70;

	private final HookCalibrationState state = new HookCalibrationState(
			new HookSettings(35, 1, new CameraConfig(CameraBackend.GENERIC, "1")));

	@Test
	void markerOnOpticalAxis() {
		HookPoseSample s = process(MarkerObservation.square(1, CraneAbstractEstimator.DEFAULT_CX, CraneAbstractEstimator.DEFAULT_CY, 70, 0));

		assertTrue(s.isValid());
		assertEquals(1, s.getMarkerId());
		assertEquals(Z, s.getDistance(), 1e-9);
		assertEquals(CraneAbstractEstimator.DEFAULT_CX - 320, s.getDeviationX(), 1e-9);
		assertEquals(CraneAbstractEstimator.DEFAULT_CY - 240, s.getDeviationY(), 1e-9);
	}

	@Test
	void offAxisMarkerIsFurtherAway() {
		HookPoseSample s = process(MarkerObservation.square(1, 600, 400, 70, 0));

		double x = (600 - CraneAbstractEstimator.DEFAULT_CX) / CraneAbstractEstimator.DEFAULT_FX * Z;
		double y = (400 - CraneAbstractEstimator.DEFAULT_CY) / CraneAbstractEstimator.DEFAULT_FY * Z;
		assertEquals(Math.sqrt(x * x + y * y + Z * Z), s.getDistance(), 1e-9);
		assertEquals(280, s.getDeviationX(), 1e-9);
		assertEquals(160, s.getDeviationY(), 1e-9);
	}

	@Test
	void otherMarkersAreIgnored() {
		HookPoseSample s = process(MarkerObservation.square(2, 320, 240, 70, 0));
		assertFalse(s.isValid());
		assertEquals(1, s.getMarkerId());
	}

	@Test
	void emptyFrameIsInvalid() {
		assertFalse(process().isValid());
	}

	@Test
	void reloadChangesTarget() {
		state.update(new HookSettings(35, 2, new CameraConfig(CameraBackend.GENERIC, "1")));
		assertTrue(process(MarkerObservation.square(2, 320, 240, 70, 0)).isValid());
	}

	private HookPoseSample process(MarkerObservation... markers) {
		HookPoseEstimator estimator = new HookPoseEstimator(new ScriptedDetector().then(markers));
		return estimator.process(new CameraFrame(new GrayU8(640, 480), 0, 0), state);
	}

}
