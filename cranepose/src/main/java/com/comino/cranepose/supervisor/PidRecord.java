package com.comino.cranepose.supervisor;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Liveness record of one supervised circuit: who supervises and which child
 * currently runs.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PidRecord {

	public static final int VERSION = 1;

	private final int    version;
	private final String circuit;
	private final long   supervisor_pid;
	private final long   child_pid;
	private final long   started_at;

	@JsonCreator
	public PidRecord(
			@JsonProperty("version")        int version,
			@JsonProperty("circuit")        String circuit,
			@JsonProperty("supervisor_pid") long supervisor_pid,
			@JsonProperty("child_pid")      long child_pid,
			@JsonProperty("started_at")     long started_at) {
		this.version        = version;
		this.circuit        = circuit;
		this.supervisor_pid = supervisor_pid;
		this.child_pid      = child_pid;
		this.started_at     = started_at;
	}

	public PidRecord(String circuit, long supervisor_pid, long child_pid) {
		this(VERSION, circuit, supervisor_pid, child_pid, System.currentTimeMillis());
	}

	@JsonProperty("version")
	public int getVersion() {
		return version;
	}

	@JsonProperty("circuit")
	public String getCircuit() {
		return circuit;
	}

	@JsonProperty("supervisor_pid")
	public long getSupervisorPid() {
		return supervisor_pid;
	}

	/**
	 * @return pid of the running telemetry process, 0 if none
	 */
	@JsonProperty("child_pid")
	public long getChildPid() {
		return child_pid;
	}

	@JsonProperty("started_at")
	public long getStartedAt() {
		return started_at;
	}

	@Override
	public String toString() {
		return "PidRecord[v"+version+" "+circuit+" supervisor="+supervisor_pid+" child="+child_pid+"]";
	}

}
