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

public final class HookPoseSample implements PoseSample {

	private final double  distance_m;
	private final double  deviation_x_px;
	private final double  deviation_y_px;
	private final int     marker_id;
	private final boolean valid;
	private final long    tms;

	public HookPoseSample(double distance_m, double deviation_x_px, double deviation_y_px, int marker_id, long tms) {
		this(distance_m, deviation_x_px, deviation_y_px, marker_id, true, tms);
	}

	private HookPoseSample(double distance_m, double deviation_x_px, double deviation_y_px, int marker_id, boolean valid, long tms) {
		this.distance_m     = distance_m;
		this.deviation_x_px = deviation_x_px;
		this.deviation_y_px = deviation_y_px;
		this.marker_id      = marker_id;
		this.valid          = valid;
		this.tms            = tms;
	}

	public static HookPoseSample invalid(int marker_id, long tms) {
		return new HookPoseSample(0, 0, 0, marker_id, false, tms);
	}

	public static HookPoseSample fromRegisters(int[] r, int offset) {
		return new HookPoseSample(
				RegisterCodec.getFloat(r, offset + HOOK_DISTANCE),
				RegisterCodec.getFloat(r, offset + HOOK_DEVIATION_X),
				RegisterCodec.getFloat(r, offset + HOOK_DEVIATION_Y),
				r[offset + HOOK_MARKER_ID],
				r[offset + HOOK_VALID] != 0, 0);
	}

	public double getDistance() {
		return distance_m;
	}

	public double getDeviationX() {
		return deviation_x_px;
	}

	public double getDeviationY() {
		return deviation_y_px;
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
		int[] r = new int[HOOK_LENGTH];
		RegisterCodec.putFloat(r, HOOK_DISTANCE,    (float)distance_m);
		RegisterCodec.putFloat(r, HOOK_DEVIATION_X, (float)deviation_x_px);
		RegisterCodec.putFloat(r, HOOK_DEVIATION_Y, (float)deviation_y_px);
		r[HOOK_MARKER_ID] = RegisterCodec.toUnsigned16(marker_id);
		r[HOOK_VALID]     = valid ? 1 : 0;
		return r;
	}

	@Override
	public String toString() {
		if(!valid)
			return "Hook[marker "+marker_id+" not found]";
		return String.format("Hook[marker=%d distance=%.4fm dx=%.2fpx dy=%.2fpx]", marker_id, distance_m, deviation_x_px, deviation_y_px);
	}

}
