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

import static com.comino.cranepose.modbus.RegisterMap.*;

import com.comino.cranepose.modbus.RegisterCodec;

public final class BridgePoseSample implements PoseSample {

	private final double  x_m;
	private final double  y_m;
	private final int     marker_id;
	private final boolean valid;
	private final double  offset_px;
	private final long    tms;

	public BridgePoseSample(double x_m, double y_m, int marker_id, double offset_px, long tms) {
		this(x_m, y_m, marker_id, offset_px, true, tms);
	}

	private BridgePoseSample(double x_m, double y_m, int marker_id, double offset_px, boolean valid, long tms) {
		this.x_m       = x_m;
		this.y_m       = y_m;
		this.marker_id = marker_id;
		this.offset_px = offset_px;
		this.valid     = valid;
		this.tms       = tms;
	}

	public static BridgePoseSample invalid(long tms) {
		return new BridgePoseSample(0, 0, -1, 0, false, tms);
	}

	public static BridgePoseSample fromRegisters(int[] r, int offset) {
		return new BridgePoseSample(
				RegisterCodec.getFloat(r, offset + BRIDGE_X),
				RegisterCodec.getFloat(r, offset + BRIDGE_Y),
				r[offset + BRIDGE_MARKER_ID], 0,
				r[offset + BRIDGE_VALID] != 0, 0);
	}

	/**
	 * Position along the bridge path in meters.
	 */
	public double getX() {
		return x_m;
	}

	/**
	 * Perpendicular distance to the marker plane in meters.
	 */
	public double getY() {
		return y_m;
	}

	public double getOffsetPx() {
		return offset_px;
	}

	@Override
	public int getMarkerId() {
		return marker_id;
	}

	@Override
	public boolean isValid() {
		return valid;
	}

	@Override
	public long getTms() {
		return tms;
	}

	@Override
	public int[] toRegisters() {
		int[] r = new int[BRIDGE_LENGTH];
		RegisterCodec.putFloat(r, BRIDGE_X, (float)x_m);
		RegisterCodec.putFloat(r, BRIDGE_Y, (float)y_m);
		r[BRIDGE_MARKER_ID] = RegisterCodec.toUnsigned16(marker_id);
		r[BRIDGE_VALID]     = valid ? 1 : 0;
		return r;
	}

	@Override
	public String toString() {
		if(!valid)
			return "Bridge[invalid]";
		return String.format("Bridge[marker=%d X=%.4fm Y=%.4fm offset=%.1fpx]", marker_id, x_m, y_m, offset_px);
	}

}
