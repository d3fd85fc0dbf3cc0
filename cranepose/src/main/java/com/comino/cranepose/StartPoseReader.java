package com.comino.cranepose;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.comino.cranepose.config.CraneConfig;
import com.comino.cranepose.config.CraneParams;
import com.comino.cranepose.modbus.ModbusPoseReader;
import com.comino.cranepose.modbus.ModbusTcpClient;
import com.comino.cranepose.modbus.PoseSnapshot;

/**
 * Prints the pose blocks of the register server.
 * {@code --reader.count=N} polls N times, {@code --reader.interval_ms} apart.
 */
public class StartPoseReader {

	private static final Logger logger = LoggerFactory.getLogger(StartPoseReader.class);

	public static void main(String[] args) throws InterruptedException {

		final CraneConfig config;
		try {
			config = CraneConfig.fromArgs(args);
		} catch(IllegalArgumentException e) {
			logger.error("Configuration error: {}", e.getMessage());
			System.exit(TelemetryRunner.EXIT_CONFIG);
			return;
		}

		int  count    = config.getIntProperty("reader.count", "1");
		long interval = config.getIntProperty("reader.interval_ms", "1000");

		ModbusTcpClient client = new ModbusTcpClient(
				config.getProperty(CraneParams.MODBUS_HOST, "127.0.0.1"),
				config.getIntProperty(CraneParams.MODBUS_PORT, "5020"),
				config.getIntProperty(CraneParams.MODBUS_UNIT_ID, "1"));

		boolean ok = true;
		try(ModbusPoseReader reader = new ModbusPoseReader(client, config.getRegisterMap())) {
			for(int i = 0; i < count; i++) {
				if(i > 0)
					Thread.sleep(interval);
				PoseSnapshot snapshot = reader.read();
				System.out.println(snapshot);
				ok = snapshot.hasData();
			}
		}
		System.exit(ok ? TelemetryRunner.EXIT_OK : TelemetryRunner.EXIT_REGISTER_SERVICE);
	}

}
