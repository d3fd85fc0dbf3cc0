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

import java.io.File;
import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.comino.cranepose.config.Circuit;

/**
 * Keeps one telemetry process running. Every exit of the child, clean or
 * not, is followed by a relaunch after the restart delay until
 * {@link #stop()} is called. The current pids are published through the
 * {@link PidRecordStore}.
 */
public class ProcessSupervisor implements Runnable {

	private static final Logger logger = LoggerFactory.getLogger(ProcessSupervisor.class);

	private final Circuit        circuit;
	private final List<String>   command;
	private final long           restart_delay_ms;
	private final PidRecordStore store;

	private ProcessBuilder.Redirect output = ProcessBuilder.Redirect.INHERIT;

	private final Object lock = new Object();

	private volatile boolean stopped    = false;
	private volatile boolean is_running = false;
	private volatile Process child      = null;
	private volatile Thread  loop       = null;
	private volatile int     launches   = 0;

	public ProcessSupervisor(Circuit circuit, List<String> command, long restart_delay_ms, PidRecordStore store) {
		if(command.isEmpty())
			throw new IllegalArgumentException("Empty command");
		this.circuit          = circuit;
		this.command          = Collections.unmodifiableList(new ArrayList<>(command));
		this.restart_delay_ms = restart_delay_ms;
		this.store            = store;
	}

	/**
	 * Command running {@code main_class} with the JVM and classpath of this
	 * process.
	 */
	public static List<String> javaCommand(String main_class, List<String> args) {
		List<String> cmd = new ArrayList<>();
		cmd.add(Paths.get(System.getProperty("java.home"), "bin", "java").toString());
		cmd.add("-cp");
		cmd.add(System.getProperty("java.class.path"));
		cmd.add(main_class);
		cmd.addAll(args);
		return cmd;
	}

	public static List<String> javaCommand(Circuit circuit, List<String> args) {
		return javaCommand(circuit.getMainClass(), args);
	}

	/**
	 * Output of the child, inherited by default.
	 */
	public void setOutput(ProcessBuilder.Redirect output) {
		this.output = output;
	}

	@Override
	public void run() {
		synchronized(lock) {
			if(stopped)
				return;
			is_running = true;
			loop = Thread.currentThread();
		}
		logger.info("Supervising {}: {}", circuit.getKey(), String.join(" ", command));

		try {
			while(true) {
				Process p = null;
				try {
					// stop() cannot slip in between the check and the start of the child
					synchronized(lock) {
						if(stopped)
							break;
						p = launch();
					}
				} catch(IOException e) {
					logger.error("Launching {} telemetry failed: {}", circuit.getKey(), e.getMessage());
				}

				if(p != null) {
					try {
						int code = p.waitFor();
						if(!stopped)
							logger.warn("{} telemetry exited with code {}, restarting in {}ms", circuit.getKey(), code, restart_delay_ms);
					} catch(InterruptedException e) {
						break;
					}
				}

				synchronized(lock) {
					if(stopped)
						break;
					writeRecord(0);
				}
				try {
					Thread.sleep(restart_delay_ms);
				} catch(InterruptedException e) {
					break;
				}
			}
		} finally {
			Process p;
			synchronized(lock) {
				is_running = false;
				loop       = null;
				p          = child;
			}
			if(p != null && p.isAlive())
				ProcessTerminator.terminate(p.toHandle(), ProcessTerminator.DEFAULT_GRACE_MS);
			logger.info("Supervisor of {} stopped", circuit.getKey());
		}
	}

	/**
	 * Stops the loop and the child and removes the PID record. A stop issued
	 * before {@link #run()} prevents the first launch.
	 */
	public void stop() {
		Thread  t;
		Process p;
		synchronized(lock) {
			if(stopped)
				return;
			stopped    = true;
			is_running = false;
			t          = loop;
			p          = child;
		}
		if(t != null && t != Thread.currentThread())
			t.interrupt();
		if(p != null)
			ProcessTerminator.terminate(p.toHandle(), ProcessTerminator.DEFAULT_GRACE_MS);
		if(t != null && t != Thread.currentThread()) {
			try {
				t.join(2 * ProcessTerminator.DEFAULT_GRACE_MS);
			} catch(InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}
		store.delete(circuit);
	}

	public boolean isRunning() {
		return is_running;
	}

	public int getLaunchCount() {
		return launches;
	}

	public Process getChild() {
		return child;
	}

	// called with lock held
	private Process launch() throws IOException {
		ProcessBuilder pb = new ProcessBuilder(command);
		pb.directory(new File(System.getProperty("user.dir")));
		pb.redirectErrorStream(true);
		pb.redirectOutput(output);

		Process p = pb.start();
		child = p;
		launches++;
		logger.info("Launched {} telemetry (pid {}, launch #{})", circuit.getKey(), p.pid(), launches);
		writeRecord(p.pid());
		return p;
	}

	private void writeRecord(long child_pid) {
		try {
			store.write(circuit, new PidRecord(circuit.getKey(), ProcessHandle.current().pid(), child_pid));
		} catch(IOException e) {
			logger.error("Writing PID record of {} failed: {}", circuit.getKey(), e.getMessage());
		}
	}

}
