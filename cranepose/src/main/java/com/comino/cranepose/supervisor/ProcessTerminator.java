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

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Graceful stop of an OS process: terminate, wait for the grace period, then
 * kill.
 */
public final class ProcessTerminator {

	private static final Logger logger = LoggerFactory.getLogger(ProcessTerminator.class);

	public static final long DEFAULT_GRACE_MS = 3000;

	private ProcessTerminator() {
	}

	/**
	 * @return true if the process is gone afterwards. A process that is not
	 *         alive counts as stopped.
	 */
	public static boolean terminate(ProcessHandle handle, long grace_ms) {
		if(!handle.isAlive())
			return true;

		handle.destroy();
		if(awaitExit(handle, grace_ms))
			return true;

		logger.warn("Process {} did not exit within {}ms, killing", handle.pid(), grace_ms);
		handle.destroyForcibly();
		return awaitExit(handle, grace_ms);
	}

	private static boolean awaitExit(ProcessHandle handle, long timeout_ms) {
		try {
			handle.onExit().get(timeout_ms, TimeUnit.MILLISECONDS);
			return true;
		} catch(TimeoutException e) {
			return !handle.isAlive();
		} catch(ExecutionException e) {
			logger.warn("Waiting for process {} failed: {}", handle.pid(), e.getMessage());
			return !handle.isAlive();
		} catch(InterruptedException e) {
			Thread.currentThread().interrupt();
			return !handle.isAlive();
		}
	}

}
