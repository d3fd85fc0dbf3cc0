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

import com.comino.cranepose.config.Circuit;
import com.comino.cranepose.libcamera.CameraConfig;
import com.comino.cranepose.libcamera.CameraException;
import com.comino.cranepose.libcamera.CameraFrame;
import com.comino.cranepose.libcamera.ICameraSource;

/**
 * Camera access of one interactive calibration connection. The first tick
 * takes the camera over from telemetry, closing the session hands it back.
 */
public class CalibrationSession implements AutoCloseable {

	private final CameraArbitrator arbitrator;
	private final Circuit          circuit;
	private final CameraConfig     config;

	private ICameraSource source = null;
	private boolean       closed = false;

	public CalibrationSession(CameraArbitrator arbitrator, Circuit circuit, CameraConfig config) {
		this.arbitrator = arbitrator;
		this.circuit    = circuit;
		this.config     = config;
	}

	public synchronized CameraFrame tick() throws CameraException {
		if(closed)
			throw new IllegalStateException("Session closed");
		if(source == null)
			source = arbitrator.acquire(circuit, config);
		return source.read();
	}

	public synchronized boolean isOwner() {
		return source != null;
	}

	public Circuit getCircuit() {
		return circuit;
	}

	@Override
	public synchronized void close() {
		if(closed)
			return;
		closed = true;
		if(source != null) {
			source.close();
			source = null;
		}
		arbitrator.release(circuit);
	}

}
