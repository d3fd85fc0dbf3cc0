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

import com.comino.cranepose.callback.IPoseCallback;
import com.comino.cranepose.estimators.PoseSample;

/**
 * Writes pose samples as one register block per sample.
 * <p>
 * An invalid sample never carries numbers of its own: the previously written
 * block is written again with the validity register cleared. The whole block
 * always goes out in one request.
 */
public abstract class PosePublisher<S extends PoseSample> implements IPoseCallback<S> {

	protected final int base;

	private int[] last_block = null;

	protected PosePublisher(int base) {
		this.base = base;
	}

	/**
	 * @return true if the block reached the register space
	 */
	public boolean publish(S sample) {
		int[] block;
		if(sample.isValid() || last_block == null) {
			block = sample.toRegisters();
		} else {
			block = last_block.clone();
		}
		if(!sample.isValid())
			block[block.length - 1] = 0;

		if(!write(base, block))
			return false;
		last_block = block;
		return true;
	}

	@Override
	public void process(S sample, long tms) {
		publish(sample);
	}

	public int getBase() {
		return base;
	}

	protected abstract boolean write(int address, int[] block);

	public void close() {
	}

}
