package com.comino.cranepose.estimators;

/****************************************************************************
*
*   Copyright (c) 2026 Eike Mansfeld ecm@gmx.de. All rights reserved.
*
* Redistribution and use in source and binary forms, with or without
* modification, are permitted provided that the following conditions
* are met:
*
* 1. Redistributions of source code must retain the above copyright
*    notice, this list of conditions and the following disclaimer.
* 2. Redistributions in binary form must reproduce the above copyright
*    notice, this list of conditions and the following disclaimer in
*    the documentation and/or other materials provided with the
*    distribution.
* 3. Neither the name of the copyright holder nor the names of its
*    contributors may be used to endorse or promote products derived
*    from this software without specific prior written permission.
*
* THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS
* "AS IS" AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT
* LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS
* FOR A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL THE
* COPYRIGHT OWNER OR CONTRIBUTORS BE LIABLE FOR ANY DIRECT, INDIRECT,
* INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING,
* BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS
* OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED
* AND ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT
* LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN
* ANY WAY OUT OF THE USE OF THIS SOFTWARE, EVEN IF ADVISED OF THE
* POSSIBILITY OF SUCH DAMAGE.
*
****************************************************************************/

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.comino.cranepose.config.HookSettings;
import com.comino.cranepose.fiducial.IMarkerDetector;
import com.comino.cranepose.fiducial.MarkerObservation;
import com.comino.cranepose.libcamera.CameraFrame;

import boofcv.struct.calib.CameraPinholeBrown;
import boofcv.struct.image.GrayU8;

/**
 * Line of sight distance to the hook marker and the pixel deviation of its
 * centre from the image centre.
 */
public class HookPoseEstimator extends CraneAbstractEstimator<HookCalibrationState, HookPoseSample> {

	private static final Logger logger = LoggerFactory.getLogger(HookPoseEstimator.class);

	private static final double MIN_DEPTH = 1e-6;

	public HookPoseEstimator(IMarkerDetector detector) {
		super(detector);
	}

	public HookPoseEstimator(IMarkerDetector detector, CameraPinholeBrown intrinsics) {
		super(detector, intrinsics);
	}

	@Override
	public HookPoseSample process(CameraFrame frame, HookCalibrationState state) {

		final HookSettings settings = state.getSettings();
		final GrayU8 image  = frame.getImage();
		final int    target = settings.getMarkerId();

		MarkerObservation marker = null;
		for(MarkerObservation m : detector.detect(image, frame.getTms())) {
			if(m.getId() == target) {
				marker = m;
				break;
			}
		}

		if(marker == null) {
			logger.debug("[hook] marker id={} not found", target);
			return HookPoseSample.invalid(target, frame.getTms());
		}

		final double cx = marker.getCenterX();
		final double cy = marker.getCenterY();

		double z       = Math.max(MIN_DEPTH, depth(settings.getMarkerSizeM(), marker.getSizePx()));
		double x_m     = (cx - intrinsics.cx) / intrinsics.fx * z;
		double y_m     = (cy - intrinsics.cy) / intrinsics.fy * z;
		double lateral = Math.sqrt(x_m * x_m + y_m * y_m);
		double angle   = Math.atan2(lateral, z);
		double distance = z / Math.max(MIN_DEPTH, Math.cos(angle));

		HookPoseSample sample = new HookPoseSample(Math.max(0.0, distance),
				cx - image.width  / 2.0,
				cy - image.height / 2.0,
				target, frame.getTms());

		if(logger.isDebugEnabled())
			logger.debug(String.format("[hook] marker=%d distance=%.4fm dx=%.2fpx dy=%.2fpx",
					target, sample.getDistance(), sample.getDeviationX(), sample.getDeviationY()));
		return sample;
	}

}
