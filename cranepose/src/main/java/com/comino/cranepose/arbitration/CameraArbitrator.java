package com.comino.cranepose.arbitration;

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
import java.util.EnumMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.comino.cranepose.config.Circuit;
import com.comino.cranepose.libcamera.CameraConfig;
import com.comino.cranepose.libcamera.CameraSourceFactory;
import com.comino.cranepose.libcamera.CameraUnavailableException;
import com.comino.cranepose.libcamera.ICameraSource;

/**
 * Hands circuit cameras between the supervised telemetry processes and
 * interactive calibration sessions.
 * <p>
 * All transitions are serialized on this object. Telemetry is stopped and
 * confirmed gone before the calibration side opens the camera. Released
 * circuits are relaunched only while no circuit is held by a calibration
 * session; otherwise the relaunch is deferred to the next release.
 * <p>
 * There is no entry point for this class in this project. It is embedded by
 * the calibration tool, which opens one {@link CalibrationSession} per
 * interactive client and drives telemetry through a
 * {@link ProcessTelemetryControl}.
 */
public class CameraArbitrator {

	private static final Logger logger = LoggerFactory.getLogger(CameraArbitrator.class);

	private final ITelemetryControl   control;
	private final CameraSourceFactory factory;

	private final Map<Circuit,OwnershipState> states = new EnumMap<>(Circuit.class);

	public CameraArbitrator(ITelemetryControl control, CameraSourceFactory factory) {
		this.control = control;
		this.factory = factory;
		for(Circuit c : Circuit.values())
			states.put(c, OwnershipState.TELEMETRY_OWNS);
	}

	/**
	 * Takes the camera of the circuit away from telemetry and opens it for a
	 * calibration session. If the camera cannot be opened the circuit is
	 * left RELEASED.
	 */
	public synchronized ICameraSource acquire(Circuit circuit, CameraConfig config) throws CameraUnavailableException {

		if(states.get(circuit) == OwnershipState.CALIBRATION_OWNS)
			throw new IllegalStateException(circuit.getKey()+" camera is already held by a calibration session");

		if(states.get(circuit) == OwnershipState.TELEMETRY_OWNS) {
			if(!control.stop(circuit))
				throw new CameraUnavailableException(circuit.getKey()+" telemetry could not be stopped");
			transition(circuit, OwnershipState.RELEASED);
		}

		ICameraSource source = factory.open(config);
		transition(circuit, OwnershipState.CALIBRATION_OWNS);
		return source;
	}

	/**
	 * Ends the calibration hold of the circuit. The caller has closed the
	 * camera before.
	 */
	public synchronized void release(Circuit circuit) {
		if(states.get(circuit) == OwnershipState.CALIBRATION_OWNS)
			transition(circuit, OwnershipState.RELEASED);
		relaunchReleased();
	}

	public synchronized OwnershipState getState(Circuit circuit) {
		return states.get(circuit);
	}

	private void relaunchReleased() {
		for(Circuit c : Circuit.values()) {
			if(states.get(c) == OwnershipState.CALIBRATION_OWNS) {
				for(Circuit r : Circuit.values()) {
					if(states.get(r) == OwnershipState.RELEASED)
						logger.warn("Relaunch of {} deferred: {} camera still held by calibration", r.getKey(), c.getKey());
				}
				return;
			}
		}

		for(Circuit c : Circuit.values()) {
			if(states.get(c) != OwnershipState.RELEASED)
				continue;
			try {
				control.launch(c);
				transition(c, OwnershipState.TELEMETRY_OWNS);
			} catch(IOException e) {
				logger.error("Relaunch of {} telemetry failed: {}", c.getKey(), e.getMessage());
			}
		}
	}

	private void transition(Circuit circuit, OwnershipState state) {
		OwnershipState old = states.put(circuit, state);
		logger.info("{}: {} -> {}", circuit.getKey(), old, state);
	}

}
