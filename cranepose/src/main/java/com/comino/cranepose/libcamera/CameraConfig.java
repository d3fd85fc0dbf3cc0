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

import java.util.Objects;

/**
 * Immutable capture parameters of one circuit camera. A raw pipeline string,
 * if given, bypasses the structured parameters of the PIPELINE backend.
 */
public final class CameraConfig {

	public static final int DEFAULT_WIDTH  = 1280;
	public static final int DEFAULT_HEIGHT = 720;
	public static final int DEFAULT_FPS    = 30;

	private final CameraBackend backend;
	private final String        device;
	private final int           width;
	private final int           height;
	private final int           fps;
	private final String        pipeline;

	public CameraConfig(CameraBackend backend, String device, int width, int height, int fps, String pipeline) {
		this.backend  = Objects.requireNonNull(backend, "backend");
		this.device   = device == null || device.isBlank() ? "0" : device.trim();
		this.width    = width  > 0 ? width  : DEFAULT_WIDTH;
		this.height   = height > 0 ? height : DEFAULT_HEIGHT;
		this.fps      = fps    > 0 ? fps    : DEFAULT_FPS;
		this.pipeline = pipeline == null || pipeline.isBlank() ? null : pipeline.trim();
	}

	public CameraConfig(CameraBackend backend, String device) {
		this(backend, device, DEFAULT_WIDTH, DEFAULT_HEIGHT, DEFAULT_FPS, null);
	}

	public CameraConfig withDevice(String device) {
		return new CameraConfig(backend, device, width, height, fps, pipeline);
	}

	public CameraBackend getBackend() {
		return backend;
	}

	public String getDevice() {
		return device;
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	public int getFps() {
		return fps;
	}

	public String getPipeline() {
		return pipeline;
	}

	/**
	 * Device index for "3" or "/dev/video3", -1 if the identifier is a
	 * path that has to be opened by name.
	 */
	public int getDeviceIndex() {
		String d = device;
		if(d.startsWith("/dev/video"))
			d = d.substring("/dev/video".length());
		if(!d.isEmpty() && d.chars().allMatch(Character::isDigit))
			return Integer.parseInt(d);
		return -1;
	}

	public String getDevicePath() {
		int idx = getDeviceIndex();
		if(idx >= 0 && !device.startsWith("/"))
			return "/dev/video"+idx;
		return device;
	}

	public String getEffectivePipeline() {
		if(pipeline != null)
			return pipeline;
		int sensor_id = Math.max(0, getDeviceIndex());
		return "nvarguscamerasrc sensor-id="+sensor_id+" ! "
				+ "video/x-raw(memory:NVMM), width="+width+", height="+height+", framerate="+fps+"/1 ! "
				+ "nvvidconv ! video/x-raw, format=BGRx ! "
				+ "videoconvert ! video/x-raw, format=BGR ! "
				+ "appsink drop=1";
	}

	@Override
	public String toString() {
		if(backend == CameraBackend.PIPELINE)
			return backend.getKey()+"["+getEffectivePipeline()+"]";
		return backend.getKey()+"["+device+" "+width+"x"+height+"@"+fps+"]";
	}

}
