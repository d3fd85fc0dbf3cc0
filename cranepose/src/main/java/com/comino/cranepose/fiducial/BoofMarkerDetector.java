package com.comino.cranepose.fiducial;

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

import boofcv.abst.fiducial.FiducialDetector;
import boofcv.factory.fiducial.ConfigFiducialBinary;
import boofcv.factory.fiducial.FactoryFiducial;
import boofcv.factory.filter.binary.ConfigThreshold;
import boofcv.factory.filter.binary.ThresholdType;
import boofcv.struct.image.GrayU8;
import georegression.struct.point.Point2D_F64;
import georegression.struct.shapes.Polygon2D_F64;

/**
 * Square binary fiducials found by BoofCV.
 */
public class BoofMarkerDetector implements IMarkerDetector {

	private static final int THRESHOLD_WINDOW = 25;

	private final FiducialDetector<GrayU8> detector;
	private final Polygon2D_F64            bounds = new Polygon2D_F64(4);

	public BoofMarkerDetector(double marker_size_m) {
		this.detector = FactoryFiducial.squareBinary(new ConfigFiducialBinary(marker_size_m),
				ConfigThreshold.local(ThresholdType.LOCAL_MEAN, THRESHOLD_WINDOW), GrayU8.class);
	}

	@Override
	public List<MarkerObservation> detect(GrayU8 image, long tms) {

		detector.detect(image);

		final int found = detector.totalFound();
		List<MarkerObservation> result = new ArrayList<>(found);
		for(int i = 0; i < found; i++) {
			detector.getBounds(i, bounds);
			if(bounds.size() != 4)
				continue;
			Point2D_F64[] corners = new Point2D_F64[4];
			for(int k = 0; k < 4; k++)
				corners[k] = bounds.get(k);
			result.add(new MarkerObservation((int)detector.getId(i), corners, tms));
		}
		return result;
	}

}
