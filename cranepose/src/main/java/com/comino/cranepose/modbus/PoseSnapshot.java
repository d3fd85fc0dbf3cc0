package com.comino.cranepose.modbus;

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

import com.comino.cranepose.estimators.BridgePoseSample;
import com.comino.cranepose.estimators.HookPoseSample;

/**
 * Both register blocks as read in one poll, or the reason they could not be
 * read.
 */
public final class PoseSnapshot {

	private final BridgePoseSample bridge;
	private final HookPoseSample   hook;
	private final boolean          connected;
	private final String           error;
	private final long             tms;

	private PoseSnapshot(BridgePoseSample bridge, HookPoseSample hook, boolean connected, String error, long tms) {
		this.bridge    = bridge;
		this.hook      = hook;
		this.connected = connected;
		this.error     = error;
		this.tms       = tms;
	}

	public static PoseSnapshot of(BridgePoseSample bridge, HookPoseSample hook, long tms) {
		return new PoseSnapshot(bridge, hook, true, null, tms);
	}

	public static PoseSnapshot failed(boolean connected, String error, long tms) {
		return new PoseSnapshot(null, null, connected, error, tms);
	}

	public BridgePoseSample getBridge() {
		return bridge;
	}

	public HookPoseSample getHook() {
		return hook;
	}

	public boolean isConnected() {
		return connected;
	}

	public boolean hasData() {
		return bridge != null && hook != null;
	}

	public String getError() {
		return error;
	}

	public long getTms() {
		return tms;
	}

	@Override
	public String toString() {
		if(!hasData())
			return "Snapshot[connected="+connected+", error="+error+"]";
		return "Snapshot["+bridge+", "+hook+"]";
	}

}
