package com.comino.cranepose.libcamera;

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

import java.util.Locale;

/**
 * Capture backends a circuit camera can be driven by. Selected once from the
 * calibration store and never inspected above {@link CameraSourceFactory}.
 */
public enum CameraBackend {

	/** OpenCV capture by device index or path */
	GENERIC("generic"),
	/** GStreamer pipeline, either raw or built for the Jetson CSI sensor */
	PIPELINE("pipeline"),
	/** V4L2 device node opened through FFmpeg */
	DEVICE("device"),
	/** Luxonis OAK-D colour camera via DepthAI */
	VENDOR_SDK("vendor");

	private final String key;

	CameraBackend(String key) {
		this.key = key;
	}

	public String getKey() {
		return key;
	}

	public static CameraBackend fromKey(String key) {
		if(key == null || key.isBlank())
			return GENERIC;
		String k = key.trim().toLowerCase(Locale.ROOT);
		// alias
		if(k.equals("gstreamer"))
			return PIPELINE;
		for(CameraBackend b : values()) {
			if(b.key.equals(k) || b.name().toLowerCase(Locale.ROOT).equals(k))
				return b;
		}
		throw new IllegalArgumentException("Unknown camera backend: "+key);
	}

}
