package com.comino.cranepose.estimators;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.junit.jupiter.api.Test;

import com.comino.cranepose.config.BridgeSettings;
import com.comino.cranepose.fiducial.MarkerObservation;
import com.comino.cranepose.libcamera.CameraBackend;
import com.comino.cranepose.libcamera.CameraConfig;
import com.comino.cranepose.libcamera.CameraFrame;

import boofcv.struct.image.GrayU8;

final class BridgePoseEstimatorTest {

	private static final int WIDTH  = 640;
	private static final int HEIGHT = 480;

	@Test
	void xIncreasesAsMarkerMovesLeft() {
		ScriptedDetector detector = new ScriptedDetector();
		for(int i = 0; i < 20; i++)
			detector.then(MarkerObservation.square(3, 400 - i * 5, 240, 70, i));

		BridgePoseEstimator estimator = new BridgePoseEstimator(detector);
		BridgeCalibrationState state = new BridgeCalibrationState(settings(MovementDirection.INCREASING, RegionOfInterest.full(WIDTH, HEIGHT), Map.of(3, 10.0)));

		List<BridgePoseSample> valid = new ArrayList<>();
		for(int i = 0; i < 20; i++) {
			BridgePoseSample s = estimator.process(frame(i), state);
			if(i < MarkerConfirmationLedger.DEFAULT_THRESHOLD)
				assertFalse(s.isValid(), "unconfirmed at frame "+i);
			else
				assertTrue(s.isValid(), "confirmed at frame "+i);
			if(s.isValid())
				valid.add(s);
		}

		assertEquals(14, valid.size());
		for(int i = 1; i < valid.size(); i++)
			assertTrue(valid.get(i).getX() > valid.get(i - 1).getX());
		for(BridgePoseSample s : valid) {
			assertEquals(3, s.getMarkerId());
			// pinhole depth of a 35mm marker at 70px
			assertEquals(CraneAbstractEstimator.DEFAULT_FX * 0.035 / 70, s.getY(), 1e-9);
		}
	}

	@Test
	void tenEmptyFramesAreInvalid() {
		BridgePoseEstimator estimator = new BridgePoseEstimator(new ScriptedDetector());
		BridgeCalibrationState state = new BridgeCalibrationState(settings(MovementDirection.INCREASING, RegionOfInterest.full(WIDTH, HEIGHT), Map.of(3, 10.0)));
		for(int i = 0; i < 10; i++)
			assertFalse(estimator.process(frame(i), state).isValid());
	}

	@Test
	void pathPositionFollowsDirection() {
		double z = CraneAbstractEstimator.DEFAULT_FX * 0.035 / 70;
		double rel = 100 / CraneAbstractEstimator.DEFAULT_FX * z;

		BridgePoseSample inc = single(MovementDirection.INCREASING, MarkerObservation.square(3, 420, 240, 70, 0));
		assertEquals(10.0 - rel, inc.getX(), 1e-9);
		assertEquals(100.0, inc.getOffsetPx(), 1e-9);

		BridgePoseSample dec = single(MovementDirection.DECREASING, MarkerObservation.square(3, 420, 240, 70, 0));
		assertEquals(10.0 + rel, dec.getX(), 1e-9);
	}

	@Test
	void markerClosestToCentreWins() {
		BridgePoseSample s = single(MovementDirection.INCREASING,
				MarkerObservation.square(3, 500, 240, 70, 0),
				MarkerObservation.square(4, 330, 240, 70, 0));
		assertEquals(4, s.getMarkerId());
		assertEquals(12.0 - 10 / CraneAbstractEstimator.DEFAULT_FX * s.getY(), s.getX(), 1e-9);
	}

	@Test
	void unknownMarkersAreIgnored() {
		BridgePoseSample s = single(MovementDirection.INCREASING, MarkerObservation.square(9, 320, 240, 70, 0));
		assertFalse(s.isValid());
	}

	@Test
	void detectionRunsInsideRoi() {
		ScriptedDetector detector = new ScriptedDetector().then(MarkerObservation.square(3, 100, 100, 70, 0));
		BridgePoseEstimator estimator = new BridgePoseEstimator(detector);
		BridgeCalibrationState state = new BridgeCalibrationState(
				settings(MovementDirection.INCREASING, new RegionOfInterest(100, 50, 400, 300), Map.of(3, 10.0)),
				new MarkerConfirmationLedger(0));

		BridgePoseSample s = estimator.process(frame(0), state);

		assertEquals(400, detector.last_width);
		assertEquals(300, detector.last_height);
		assertTrue(s.isValid());
		// roi corner (100,50) shifts the centre to x=200
		assertEquals(200 - WIDTH / 2.0, s.getOffsetPx(), 1e-9);
	}

	@Test
	void roiLargerThanFrameIsClipped() {
		ScriptedDetector detector = new ScriptedDetector();
		BridgePoseEstimator estimator = new BridgePoseEstimator(detector);
		BridgeCalibrationState state = new BridgeCalibrationState(
				settings(MovementDirection.INCREASING, new RegionOfInterest(600, 400, 500, 500), Map.of(3, 10.0)));

		assertFalse(estimator.process(frame(0), state).isValid());
		assertEquals(40, detector.last_width);
		assertEquals(80, detector.last_height);
	}

	@Test
	void xIsNeverNegative() {
		BridgePoseSample s = single(MovementDirection.INCREASING, Map.of(3, 0.0), MarkerObservation.square(3, 600, 240, 70, 0));
		assertTrue(s.isValid());
		assertEquals(0.0, s.getX());
	}

	private static BridgePoseSample single(MovementDirection direction, MarkerObservation... markers) {
		return single(direction, Map.of(3, 10.0, 4, 12.0), markers);
	}

	private static BridgePoseSample single(MovementDirection direction, Map<Integer,Double> positions, MarkerObservation... markers) {
		BridgePoseEstimator estimator = new BridgePoseEstimator(new ScriptedDetector().then(markers));
		BridgeCalibrationState state = new BridgeCalibrationState(
				settings(direction, RegionOfInterest.full(WIDTH, HEIGHT), positions), new MarkerConfirmationLedger(0));
		return estimator.process(frame(0), state);
	}

	private static BridgeSettings settings(MovementDirection direction, RegionOfInterest roi, Map<Integer,Double> positions) {
		return new BridgeSettings(35, direction, new TreeMap<>(positions), roi, new CameraConfig(CameraBackend.GENERIC, "0"));
	}

	private static CameraFrame frame(long seq) {
		return new CameraFrame(new GrayU8(WIDTH, HEIGHT), seq * 125, seq);
	}

}
