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

import static com.comino.cranepose.modbus.ModbusRegisterServer.*;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal blocking Modbus TCP client for holding registers. A transport
 * failure closes the connection; the caller decides when to reconnect.
 */
public class ModbusTcpClient implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(ModbusTcpClient.class);

	public static final int DEFAULT_TIMEOUT_MS = 2000;

	private final String host;
	private final int    port;
	private final int    unit_id;
	private final int    timeout_ms;

	private Socket          socket;
	private DataInputStream in;
	private OutputStream    out;
	private int             transaction = 0;

	public ModbusTcpClient(String host, int port, int unit_id) {
		this(host, port, unit_id, DEFAULT_TIMEOUT_MS);
	}

	public ModbusTcpClient(String host, int port, int unit_id, int timeout_ms) {
		this.host       = host;
		this.port       = port;
		this.unit_id    = unit_id;
		this.timeout_ms = timeout_ms;
	}

	public synchronized void connect() throws IOException {
		if(isConnected())
			return;
		Socket s = new Socket();
		try {
			s.connect(new InetSocketAddress(host, port), timeout_ms);
			s.setSoTimeout(timeout_ms);
			s.setTcpNoDelay(true);
		} catch(IOException e) {
			s.close();
			throw e;
		}
		this.socket = s;
		this.in     = new DataInputStream(new BufferedInputStream(s.getInputStream()));
		this.out    = s.getOutputStream();
		logger.info("Connected to register server {}:{}", host, port);
	}

	public synchronized boolean isConnected() {
		return socket != null && socket.isConnected() && !socket.isClosed();
	}

	public synchronized int[] readHoldingRegisters(int address, int quantity) throws IOException {
		if(quantity < 1 || quantity > MAX_READ_QUANTITY)
			throw new IllegalArgumentException("Quantity out of range: "+quantity);
		byte[] pdu = new byte[5];
		pdu[0] = (byte)FC_READ_HOLDING;
		put16(pdu, 1, address);
		put16(pdu, 3, quantity);

		byte[] r = request(pdu);
		int count = r[1] & 0xFF;
		if(count != quantity * 2 || r.length != 2 + count)
			throw new IOException("Unexpected read response length "+count+" for "+quantity+" registers");
		int[] values = new int[quantity];
		for(int i = 0; i < quantity; i++)
			values[i] = u16(r, 2 + i * 2);
		return values;
	}

	public synchronized void writeRegisters(int address, int[] values) throws IOException {
		if(values.length < 1 || values.length > MAX_WRITE_QUANTITY)
			throw new IllegalArgumentException("Quantity out of range: "+values.length);
		byte[] pdu = new byte[6 + values.length * 2];
		pdu[0] = (byte)FC_WRITE_MULTIPLE;
		put16(pdu, 1, address);
		put16(pdu, 3, values.length);
		pdu[5] = (byte)(values.length * 2);
		for(int i = 0; i < values.length; i++)
			put16(pdu, 6 + i * 2, values[i]);
		request(pdu);
	}

	public synchronized void writeRegister(int address, int value) throws IOException {
		byte[] pdu = new byte[5];
		pdu[0] = (byte)FC_WRITE_SINGLE;
		put16(pdu, 1, address);
		put16(pdu, 3, value);
		request(pdu);
	}

	/**
	 * Sends a raw request PDU and returns the response PDU.
	 *
	 * @throws ModbusException if the server answers with an exception response
	 * @throws IOException on transport failure; the connection is closed then
	 */
	synchronized byte[] request(byte[] pdu) throws IOException {
		if(!isConnected())
			throw new IOException("Not connected to "+host+":"+port);

		final int tid = transaction = (transaction + 1) & 0xFFFF;
		try {
			byte[] frame = new byte[7 + pdu.length];
			put16(frame, 0, tid);
			put16(frame, 2, 0);
			put16(frame, 4, pdu.length + 1);
			frame[6] = (byte)unit_id;
			System.arraycopy(pdu, 0, frame, 7, pdu.length);
			out.write(frame);
			out.flush();

			int r_tid    = in.readUnsignedShort();
			int protocol = in.readUnsignedShort();
			int length   = in.readUnsignedShort();
			in.readUnsignedByte();
			if(r_tid != tid || protocol != 0 || length < 2 || length - 1 > MAX_PDU_LENGTH)
				throw new IOException("Invalid response header (tid="+r_tid+"/"+tid+", protocol="+protocol+", length="+length+")");
			byte[] r = new byte[length - 1];
			in.readFully(r);

			if((r[0] & 0x80) != 0)
				throw new ModbusException(pdu[0] & 0xFF, r.length > 1 ? r[1] & 0xFF : 0);
			if(r[0] != pdu[0])
				throw new IOException("Response function 0x"+Integer.toHexString(r[0] & 0xFF)+" does not match request");
			return r;

		} catch(ModbusException e) {
			throw e;
		} catch(IOException e) {
			close();
			throw e;
		}
	}

	@Override
	public synchronized void close() {
		if(socket == null)
			return;
		try {
			socket.close();
		} catch(IOException e) {
			logger.debug("Closing connection failed: {}", e.getMessage());
		}
		socket = null;
		in     = null;
		out    = null;
	}

	public String getHost() {
		return host;
	}

	public int getPort() {
		return port;
	}

	@Override
	public String toString() {
		return host+":"+port+" (unit "+unit_id+")";
	}

}
