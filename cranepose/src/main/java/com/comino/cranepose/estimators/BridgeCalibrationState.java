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

import com.comino.cranepose.config.BridgeSettings;

/**
 * Everything the bridge engine needs per frame: the static calibration and
 * the confirmation ledger mutated while the loop runs. Owned by exactly one
 * telemetry loop and never persisted.
 */
public class BridgeCalibrationState {

	private final MarkerConfirmationLedger ledger;

	private BridgeSettings settings;

	public BridgeCalibrationState(BridgeSettings settings) {
		this(settings, new MarkerConfirmationLedger());
	}

	public BridgeCalibrationState(BridgeSettings settings, MarkerConfirmationLedger ledger) {
		this.settings = settings;
		this.ledger   = ledger;
	}

	/**
	 * Replaces the static calibration after a reload. Ledger entries of ids
	 * no longer mapped are dropped.
	 */
	public void update(BridgeSettings settings) {
		this.settings = settings;
		ledger.retainOnly(settings.getMarkerPositions().keySet());
	}

	public BridgeSettings getSettings() {
		return settings;
	}

	public MarkerConfirmationLedger getLedger() {
		return ledger;
	}

}
