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

import com.comino.cranepose.fiducial.IMarkerDetector;

import boofcv.struct.calib.CameraPinholeBrown;

public abstract class CraneAbstractEstimator<C, S extends PoseSample> implements IPoseEstimator<C, S> {

	// Default intrinsics of the crane cameras
	public static final double DEFAULT_FX = 661.62411664;
	public static final double DEFAULT_FY = 663.37101748;
	public static final double DEFAULT_CX = 345.05463892;
	public static final double DEFAULT_CY = 215.94757467;

	private static final double MIN_SIZE_PX = 1e-6;

	protected final IMarkerDetector    detector;
	protected final CameraPinholeBrown intrinsics;

	public CraneAbstractEstimator(IMarkerDetector detector) {
		this(detector, defaultIntrinsics());
	}

	public CraneAbstractEstimator(IMarkerDetector detector, CameraPinholeBrown intrinsics) {
		this.detector   = detector;
		this.intrinsics = intrinsics;
	}

	public static CameraPinholeBrown defaultIntrinsics() {
		CameraPinholeBrown in = new CameraPinholeBrown();
		in.fx = DEFAULT_FX;
		in.fy = DEFAULT_FY;
		in.cx = DEFAULT_CX;
		in.cy = DEFAULT_CY;
		return in;
	}

	public CameraPinholeBrown getIntrinsics() {
		return intrinsics;
	}

	/**
	 * Pinhole depth of a marker of known size from its apparent size.
	 */
	protected double depth(double marker_size_m, double size_px) {
		return intrinsics.fx * marker_size_m / Math.max(MIN_SIZE_PX, size_px);
	}

}
