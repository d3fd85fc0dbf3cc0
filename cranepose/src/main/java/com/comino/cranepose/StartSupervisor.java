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

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.comino.cranepose.config.Circuit;
import com.comino.cranepose.config.CraneConfig;
import com.comino.cranepose.config.CraneParams;
import com.comino.cranepose.supervisor.PidRecordStore;
import com.comino.cranepose.supervisor.ProcessSupervisor;

/**
 * Supervisor process of one circuit.
 * <p>
 * {@code --supervisor.circuit=bridge|hook} selects the telemetry entry point,
 * {@code --supervisor.restart_delay_ms} the delay between restarts. All other
 * arguments are passed on to the telemetry process.
 */
public class StartSupervisor {

	private static final Logger logger = LoggerFactory.getLogger(StartSupervisor.class);

	private static final String SUPERVISOR_PREFIX = "--supervisor.";

	public static void main(String[] args) {

		final CraneConfig config;
		final Circuit     circuit;
		try {
			config  = CraneConfig.fromArgs(args);
			circuit = Circuit.fromKey(config.getProperty(CraneParams.SUPERVISOR_CIRCUIT, Circuit.BRIDGE.getKey()));
		} catch(IllegalArgumentException e) {
			logger.error("Configuration error: {}", e.getMessage());
			System.exit(TelemetryRunner.EXIT_CONFIG);
			return;
		}

		List<String> child_args = new ArrayList<>();
		for(String arg : config.toArgs()) {
			if(!arg.startsWith(SUPERVISOR_PREFIX))
				child_args.add(arg);
		}
		child_args.addAll(config.getPositional());

		final ProcessSupervisor supervisor = new ProcessSupervisor(circuit,
				ProcessSupervisor.javaCommand(circuit, child_args),
				config.getRestartDelayMs(),
				new PidRecordStore(config.getRuntimeDir()));

		Runtime.getRuntime().addShutdownHook(new Thread(supervisor::stop, "supervisor-shutdown"));

		supervisor.run();
	}

}
