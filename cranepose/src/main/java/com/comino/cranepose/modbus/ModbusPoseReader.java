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

import java.io.IOException;

import com.comino.cranepose.estimators.BridgePoseSample;
import com.comino.cranepose.estimators.HookPoseSample;

/**
 * Diagnostic poller reading both pose blocks from the register server.
 * Never throws; failures end up in the snapshot.
 */
public class ModbusPoseReader implements AutoCloseable {

	private final ModbusTcpClient client;
	private final RegisterMap     map;

	public ModbusPoseReader(ModbusTcpClient client, RegisterMap map) {
		this.client = client;
		this.map    = map;
	}

	public PoseSnapshot read() {
		final long tms = System.currentTimeMillis();
		try {
			client.connect();
			int[] b = client.readHoldingRegisters(map.getBridgeBase(), RegisterMap.BRIDGE_LENGTH);
			int[] h = client.readHoldingRegisters(map.getHookBase(),   RegisterMap.HOOK_LENGTH);
			return PoseSnapshot.of(BridgePoseSample.fromRegisters(b, 0), HookPoseSample.fromRegisters(h, 0), tms);
		} catch(IOException e) {
			return PoseSnapshot.failed(client.isConnected(), e.getMessage(), tms);
		}
	}

	@Override
	public void close() {
		client.close();
	}

}
