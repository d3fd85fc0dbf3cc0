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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.comino.cranepose.estimators.PoseSample;

/**
 * Publisher attached to the register server of another process. While the
 * connection is down samples are dropped and reconnects are attempted with
 * exponential backoff.
 */
public class RemotePosePublisher<S extends PoseSample> extends PosePublisher<S> {

	private static final Logger logger = LoggerFactory.getLogger(RemotePosePublisher.class);

	public static final long INITIAL_BACKOFF_MS     = 250;
	public static final long DEFAULT_MAX_BACKOFF_MS = 5000;

	private final ModbusTcpClient client;
	private final long            max_backoff_ms;

	private long backoff_ms      = INITIAL_BACKOFF_MS;
	private long next_attempt_ms = 0;
	private long dropped         = 0;
	private long rejected        = 0;
	private int  rejection_code  = 0;

	public RemotePosePublisher(ModbusTcpClient client, int base) {
		this(client, base, DEFAULT_MAX_BACKOFF_MS);
	}

	public RemotePosePublisher(ModbusTcpClient client, int base, long max_backoff_ms) {
		super(base);
		this.client         = client;
		this.max_backoff_ms = Math.max(INITIAL_BACKOFF_MS, max_backoff_ms);
	}

	@Override
	protected boolean write(int address, int[] block) {

		if(!client.isConnected()) {
			long now = System.currentTimeMillis();
			if(now < next_attempt_ms) {
				dropped++;
				return false;
			}
			try {
				client.connect();
				if(dropped > 0)
					logger.info("Reconnected to {}, {} samples dropped", client, dropped);
				backoff_ms = INITIAL_BACKOFF_MS;
				dropped    = 0;
			} catch(IOException e) {
				scheduleRetry(now, e);
				dropped++;
				return false;
			}
		}

		try {
			client.writeRegisters(address, block);
			rejection_code = 0;
			return true;
		} catch(ModbusException e) {
			rejected++;
			// a rejection repeats every frame until the server configuration changes
			if(e.getCode() != rejection_code)
				logger.warn("Register write rejected by {}: {}", client, e.getMessage());
			else
				logger.debug("Register write rejected by {}: {}", client, e.getMessage());
			rejection_code = e.getCode();
			return false;
		} catch(IOException e) {
			scheduleRetry(System.currentTimeMillis(), e);
			dropped++;
			return false;
		}
	}

	private void scheduleRetry(long now, IOException e) {
		logger.warn("Register server {} unreachable ({}), retry in {}ms", client, e.getMessage(), backoff_ms);
		next_attempt_ms = now + backoff_ms;
		backoff_ms = Math.min(max_backoff_ms, backoff_ms * 2);
	}

	public long getDropped() {
		return dropped;
	}

	/**
	 * Writes refused by the server with an exception response.
	 */
	public long getRejected() {
		return rejected;
	}

	@Override
	public void close() {
		client.close();
	}

}
