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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.comino.cranepose.estimators.MovementDirection;
import com.comino.cranepose.estimators.RegionOfInterest;
import com.comino.cranepose.libcamera.CameraBackend;
import com.comino.cranepose.libcamera.CameraConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads the circuit sections of the calibration file written by the
 * calibration tool. Unknown fields are ignored, missing ones take their
 * defaults.
 */
public final class CalibrationConfigLoader {

	private static final Logger logger = LoggerFactory.getLogger(CalibrationConfigLoader.class);

	public static final String BRIDGE_SECTION = "bridge_calibration";
	public static final String HOOK_SECTION   = "hook_calibration";

	public static final int DEFAULT_BRIDGE_CAMERA_ID = 0;
	public static final int DEFAULT_HOOK_CAMERA_ID   = 1;

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private CalibrationConfigLoader() {
	}

	public static BridgeSettings loadBridge(Path path) {
		return parseBridge(loadTree(path).path(BRIDGE_SECTION));
	}

	public static HookSettings loadHook(Path path) {
		return parseHook(loadTree(path).path(HOOK_SECTION));
	}

	public static JsonNode loadTree(Path path) {
		Objects.requireNonNull(path, "path");
		try {
			JsonNode root = MAPPER.readTree(path.toFile());
			if(root == null || !root.isObject())
				throw new IllegalArgumentException("Calibration file "+path+" is not a JSON object");
			return root;
		} catch(IOException e) {
			throw new UncheckedIOException("Failed to load calibration config from "+path, e);
		}
	}

	static BridgeSettings parseBridge(JsonNode bridge) {

		SortedMap<Integer,Double> positions = new TreeMap<>();
		Iterator<Map.Entry<String,JsonNode>> it = bridge.path("marker_positions_m").fields();
		while(it.hasNext()) {
			Map.Entry<String,JsonNode> e = it.next();
			try {
				int id = Integer.parseInt(e.getKey().trim());
				JsonNode v = e.getValue();
				double pos = v.isNumber() ? v.doubleValue() : Double.parseDouble(v.asText());
				positions.put(id, pos);
			} catch(NumberFormatException ex) {
				logger.warn("Skipping marker position {}={}", e.getKey(), e.getValue());
			}
		}

		JsonNode r = bridge.path("roi");
		RegionOfInterest roi = new RegionOfInterest(r.path("x").asInt(0), r.path("y").asInt(0), r.path("w").asInt(1), r.path("h").asInt(1));

		return new BridgeSettings(
				intOr(bridge.path("marker_size_mm"), BridgeSettings.DEFAULT_MARKER_SIZE_MM),
				MovementDirection.fromKey(bridge.path("movement_direction").asText(null)),
				positions, roi,
				parseCamera(bridge.path("camera"), DEFAULT_BRIDGE_CAMERA_ID));
	}

	static HookSettings parseHook(JsonNode hook) {
		return new HookSettings(
				intOr(hook.path("marker_size_mm"), HookSettings.DEFAULT_MARKER_SIZE_MM),
				intOr(hook.path("marker_id"), HookSettings.DEFAULT_MARKER_ID),
				parseCamera(hook.path("camera"), DEFAULT_HOOK_CAMERA_ID));
	}

	static CameraConfig parseCamera(JsonNode camera, int default_id) {
		String device = camera.hasNonNull("device") ? camera.get("device").asText()
				                                    : String.valueOf(camera.path("camera_id").asInt(default_id));
		return new CameraConfig(
				CameraBackend.fromKey(camera.path("backend").asText(null)),
				device,
				camera.path("width").asInt(0),
				camera.path("height").asInt(0),
				camera.path("fps").asInt(0),
				camera.path("pipeline").asText(null));
	}

	// zero, null and missing count as unset
	private static int intOr(JsonNode node, int def) {
		int v = node.asInt(0);
		return v != 0 ? v : def;
	}

}
