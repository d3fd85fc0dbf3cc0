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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.comino.cranepose.config.Circuit;
import com.comino.cranepose.config.CraneParams;
import com.comino.cranepose.supervisor.PidRecord;
import com.comino.cranepose.supervisor.PidRecordStore;
import com.comino.cranepose.supervisor.ProcessSupervisor;
import com.comino.cranepose.supervisor.ProcessTerminator;

/**
 * Finds the supervised processes through their PID records and signals them.
 * The supervisor goes first so it cannot relaunch the child in between.
 */
public class ProcessTelemetryControl implements ITelemetryControl {

	private static final Logger logger = LoggerFactory.getLogger(ProcessTelemetryControl.class);

	public static final String SUPERVISOR_MAIN = "com.comino.cranepose.StartSupervisor";

	private final PidRecordStore store;
	private final List<String>   supervisor_args;
	private final long           grace_ms;

	public ProcessTelemetryControl(PidRecordStore store, List<String> supervisor_args) {
		this(store, supervisor_args, ProcessTerminator.DEFAULT_GRACE_MS);
	}

	public ProcessTelemetryControl(PidRecordStore store, List<String> supervisor_args, long grace_ms) {
		this.store           = store;
		this.supervisor_args = new ArrayList<>(supervisor_args);
		this.grace_ms        = grace_ms;
	}

	@Override
	public boolean stop(Circuit circuit) {
		Optional<PidRecord> record = store.read(circuit);
		if(record.isEmpty()) {
			logger.debug("No PID record for {}, nothing to stop", circuit.getKey());
			return true;
		}

		boolean stopped = terminate(record.get().getSupervisorPid(), "supervisor", circuit)
				        & terminate(record.get().getChildPid(), "telemetry", circuit);
		if(stopped) {
			store.delete(circuit);
			logger.info("{} telemetry stopped ({})", circuit.getKey(), record.get());
		}
		return stopped;
	}

	@Override
	public void launch(Circuit circuit) throws IOException {
		List<String> args = new ArrayList<>();
		args.add("--"+CraneParams.SUPERVISOR_CIRCUIT+"="+circuit.getKey());
		args.addAll(supervisor_args);

		ProcessBuilder pb = new ProcessBuilder(ProcessSupervisor.javaCommand(SUPERVISOR_MAIN, args));
		pb.redirectErrorStream(true);
		pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
		Process p = pb.start();
		logger.info("{} supervisor launched (pid {})", circuit.getKey(), p.pid());
	}

	@Override
	public boolean isRunning(Circuit circuit) {
		return store.read(circuit)
				.flatMap(r -> ProcessHandle.of(r.getSupervisorPid()))
				.map(ProcessHandle::isAlive)
				.orElse(false);
	}

	private boolean terminate(long pid, String role, Circuit circuit) {
		if(pid <= 0)
			return true;
		Optional<ProcessHandle> handle = ProcessHandle.of(pid);
		if(handle.isEmpty())
			return true;
		boolean gone = ProcessTerminator.terminate(handle.get(), grace_ms);
		if(!gone)
			logger.error("{} {} (pid {}) could not be stopped", circuit.getKey(), role, pid);
		return gone;
	}

}
