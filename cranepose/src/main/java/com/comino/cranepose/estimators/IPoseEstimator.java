package com.comino.cranepose.estimators;

import com.comino.cranepose.libcamera.CameraFrame;

/**
 * Frame in, pose out. The calibration state is passed with every frame and
 * may be mutated by the engine.
 */
public interface IPoseEstimator<C, S extends PoseSample> {

	S process(CameraFrame frame, C state);

}
