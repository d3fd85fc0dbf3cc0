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

import java.util.Arrays;

/**
 * Holding register storage of the register server. Each call is atomic on
 * its own. A reader may still see one pose half updated when it splits the
 * block over two requests.
 */
public class ModbusRegisterBank {

	private final int[] registers;

	public ModbusRegisterBank(int size) {
		if(size <= 0 || size > RegisterMap.ADDRESS_SPACE)
			throw new IllegalArgumentException("Invalid register count: "+size);
		this.registers = new int[size];
	}

	public int size() {
		return registers.length;
	}

	public boolean contains(int address, int quantity) {
		return address >= 0 && quantity >= 0 && address + quantity <= registers.length;
	}

	public synchronized int[] read(int address, int quantity) {
		if(!contains(address, quantity))
			throw new IndexOutOfBoundsException("Registers "+address+"+"+quantity+" outside 0.."+(registers.length - 1));
		return Arrays.copyOfRange(registers, address, address + quantity);
	}

	public synchronized void write(int address, int[] values) {
		if(!contains(address, values.length))
			throw new IndexOutOfBoundsException("Registers "+address+"+"+values.length+" outside 0.."+(registers.length - 1));
		for(int i = 0; i < values.length; i++)
			registers[address + i] = values[i] & 0xFFFF;
	}

	public void write(int address, int value) {
		write(address, new int[] { value });
	}

}
