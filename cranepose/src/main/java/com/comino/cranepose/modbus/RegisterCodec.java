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

/**
 * Register encoding of pose values. A float32 occupies two consecutive
 * 16-bit registers, high word first, each word big-endian on the wire.
 */
public final class RegisterCodec {

	public static final int MAX_REGISTER_VALUE = 0xFFFF;

	private RegisterCodec() {
	}

	public static void putFloat(int[] registers, int offset, float value) {
		final int bits = Float.floatToRawIntBits(value);
		registers[offset]     = (bits >>> 16) & 0xFFFF;
		registers[offset + 1] =  bits         & 0xFFFF;
	}

	public static float getFloat(int[] registers, int offset) {
		return toFloat(registers[offset], registers[offset + 1]);
	}

	public static float toFloat(int hi, int lo) {
		return Float.intBitsToFloat(((hi & 0xFFFF) << 16) | (lo & 0xFFFF));
	}

	public static int[] fromFloat(float value) {
		int[] r = new int[2];
		putFloat(r, 0, value);
		return r;
	}

	/**
	 * Clamps to the unsigned 16-bit range.
	 */
	public static int toUnsigned16(long value) {
		if(value < 0)
			return 0;
		return (int)Math.min(value, MAX_REGISTER_VALUE);
	}

}
