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

import com.comino.cranepose.config.Circuit;

/**
 * Fixed layout of the shared register space. Each circuit owns one block
 * starting at its base address.
 */
public final class RegisterMap {

	public static final int DEFAULT_BRIDGE_BASE = 100;
	public static final int DEFAULT_HOOK_BASE   = 200;

	// Bridge block
	public static final int BRIDGE_X         = 0;
	public static final int BRIDGE_Y         = 2;
	public static final int BRIDGE_MARKER_ID = 4;
	public static final int BRIDGE_VALID     = 5;
	public static final int BRIDGE_LENGTH    = 6;

	// Hook block
	public static final int HOOK_DISTANCE    = 0;
	public static final int HOOK_DEVIATION_X = 2;
	public static final int HOOK_DEVIATION_Y = 4;
	public static final int HOOK_MARKER_ID   = 6;
	public static final int HOOK_VALID       = 7;
	public static final int HOOK_LENGTH      = 8;

	public static final int MIN_REGISTER_COUNT = 256;
	public static final int REGISTER_HEADROOM  = 64;
	public static final int ADDRESS_SPACE      = 0x10000;

	private final int bridge_base;
	private final int hook_base;

	public RegisterMap() {
		this(DEFAULT_BRIDGE_BASE, DEFAULT_HOOK_BASE);
	}

	public RegisterMap(int bridge_base, int hook_base) {
		check(bridge_base, BRIDGE_LENGTH, "bridge");
		check(hook_base, HOOK_LENGTH, "hook");
		if(overlaps(bridge_base, hook_base))
			throw new IllegalArgumentException("Register ranges overlap: bridge "+range(bridge_base, BRIDGE_LENGTH)
			+ " hook "+range(hook_base, HOOK_LENGTH));
		this.bridge_base = bridge_base;
		this.hook_base   = hook_base;
	}

	public static boolean overlaps(int bridge_base, int hook_base) {
		return bridge_base < hook_base + HOOK_LENGTH && hook_base < bridge_base + BRIDGE_LENGTH;
	}

	public int getBridgeBase() {
		return bridge_base;
	}

	public int getHookBase() {
		return hook_base;
	}

	public int getBase(Circuit circuit) {
		return circuit == Circuit.BRIDGE ? bridge_base : hook_base;
	}

	public static int getLength(Circuit circuit) {
		return circuit == Circuit.BRIDGE ? BRIDGE_LENGTH : HOOK_LENGTH;
	}

	/**
	 * Size of the holding register space the server has to host.
	 */
	public int getRequiredRegisterCount() {
		int count = Math.max(MIN_REGISTER_COUNT, Math.max(bridge_base, hook_base) + REGISTER_HEADROOM);
		return Math.min(count, ADDRESS_SPACE);
	}

	@Override
	public String toString() {
		return "RegisterMap[bridge="+range(bridge_base, BRIDGE_LENGTH)+", hook="+range(hook_base, HOOK_LENGTH)+"]";
	}

	private static void check(int base, int length, String name) {
		if(base < 0 || base + length > ADDRESS_SPACE)
			throw new IllegalArgumentException("Invalid "+name+" base register: "+base);
	}

	private static String range(int base, int length) {
		return base+".."+(base + length - 1);
	}

}
