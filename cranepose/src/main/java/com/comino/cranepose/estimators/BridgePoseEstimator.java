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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.comino.cranepose.config.BridgeSettings;
import com.comino.cranepose.fiducial.IMarkerDetector;
import com.comino.cranepose.fiducial.MarkerObservation;
import com.comino.cranepose.libcamera.CameraFrame;

import boofcv.struct.calib.CameraPinholeBrown;
import boofcv.struct.image.GrayU8;

/**
 * Bridge position along the marker path.
 * <p>
 * Markers are searched inside the region of interest only. Of the confirmed
 * markers in view the one closest to the image centre column is used:
 * X is its mapped path position shifted by the lateral offset of the camera,
 * Y is its pinhole depth. Both are in meters, X is never negative.
 */
public class BridgePoseEstimator extends CraneAbstractEstimator<BridgeCalibrationState, BridgePoseSample> {

	private static final Logger logger = LoggerFactory.getLogger(BridgePoseEstimator.class);

	private final GrayU8 roi_image = new GrayU8(1,1);

	public BridgePoseEstimator(IMarkerDetector detector) {
		super(detector);
	}

	public BridgePoseEstimator(IMarkerDetector detector, CameraPinholeBrown intrinsics) {
		super(detector, intrinsics);
	}

	@Override
	public BridgePoseSample process(CameraFrame frame, BridgeCalibrationState state) {

		final BridgeSettings settings = state.getSettings();
		final GrayU8 image = frame.getImage();
		final long   tms   = frame.getTms();

		RegionOfInterest roi = settings.getRoi() != null ? settings.getRoi().clampTo(image.width, image.height)
				                                         : RegionOfInterest.full(image.width, image.height);

		image.subimage(roi.getX(), roi.getY(), roi.getX() + roi.getWidth(), roi.getY() + roi.getHeight(), roi_image);

		List<MarkerObservation> known = new ArrayList<>();
		for(MarkerObservation m : detector.detect(roi_image, tms)) {
			if(settings.isKnown(m.getId()))
				known.add(m.translate(roi.getX(), roi.getY()));
		}

		List<Integer> ids = new ArrayList<>(known.size());
		for(MarkerObservation m : known)
			ids.add(m.getId());
		final Set<Integer> confirmed = state.getLedger().update(ids);

		final double center_x = image.width / 2.0;
		BridgePoseSample best = null;

		for(MarkerObservation m : known) {
			if(!confirmed.contains(m.getId()))
				continue;

			double z         = depth(settings.getMarkerSizeM(), m.getSizePx());
			double offset_px = m.getCenterX() - center_x;
			double rel_x     = offset_px / intrinsics.fx * z;
			double marker_x  = settings.getMarkerPositions().get(m.getId());

			double x = settings.getDirection() == MovementDirection.DECREASING ? marker_x + rel_x : marker_x - rel_x;

			BridgePoseSample candidate = new BridgePoseSample(Math.max(0.0, x), Math.max(0.0, z), m.getId(), offset_px, tms);
			if(best == null || Math.abs(candidate.getOffsetPx()) < Math.abs(best.getOffsetPx()))
				best = candidate;
		}

		if(best == null) {
			logger.debug("[pose] no confirmed marker in ROI {}", roi);
			return BridgePoseSample.invalid(tms);
		}

		if(logger.isDebugEnabled())
			logger.debug(String.format("[pose] marker=%d X=%.4fm Y=%.4fm offset_px=%.1f",
					best.getMarkerId(), best.getX(), best.getY(), best.getOffsetPx()));
		return best;
	}

}
