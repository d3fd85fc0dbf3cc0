package com.comino.cranepose.config;

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

import com.comino.cranepose.libcamera.CameraConfig;

public final class HookSettings {

	public static final int DEFAULT_MARKER_SIZE_MM = 35;
	public static final int DEFAULT_MARKER_ID      = 1;

	private final int          marker_size_mm;
	private final int          marker_id;
	private final CameraConfig camera;

	public HookSettings(int marker_size_mm, int marker_id, CameraConfig camera) {
		this.marker_size_mm = marker_size_mm > 0 ? marker_size_mm : DEFAULT_MARKER_SIZE_MM;
		this.marker_id      = marker_id;
		this.camera         = camera;
	}

	public int getMarkerSizeMm() {
		return marker_size_mm;
	}

	public double getMarkerSizeM() {
		return Math.max(0.001, marker_size_mm / 1000.0);
	}

	public int getMarkerId() {
		return marker_id;
	}

	public CameraConfig getCamera() {
		return camera;
	}

	public HookSettings withCamera(CameraConfig camera) {
		return new HookSettings(marker_size_mm, marker_id, camera);
	}

	@Override
	public String toString() {
		return "Hook[size="+marker_size_mm+"mm, marker="+marker_id+", camera="+camera+"]";
	}

}
