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

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Modbus TCP server hosting the shared holding register space.
 * <p>
 * Supported functions: read holding registers (0x03), read input registers
 * (0x04, served from the same bank), write single register (0x06) and write
 * multiple registers (0x10). Every client connection is served by its own
 * thread. A broken connection only ends its own handler.
 */
public class ModbusRegisterServer implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(ModbusRegisterServer.class);

	public static final int DEFAULT_PORT    = 5020;
	public static final int DEFAULT_UNIT_ID = 1;

	static final int FC_READ_HOLDING    = 0x03;
	static final int FC_READ_INPUT      = 0x04;
	static final int FC_WRITE_SINGLE    = 0x06;
	static final int FC_WRITE_MULTIPLE  = 0x10;

	static final int MAX_READ_QUANTITY  = 125;
	static final int MAX_WRITE_QUANTITY = 123;
	static final int MAX_PDU_LENGTH     = 253;

	private final String             bind_address;
	private final int                port;
	private final int                unit_id;
	private final ModbusRegisterBank bank;

	private final Set<Socket>   clients   = ConcurrentHashMap.newKeySet();
	private final AtomicInteger client_nr = new AtomicInteger();

	private volatile boolean is_running = false;
	private ServerSocket     listen_socket;

	public ModbusRegisterServer(String bind_address, int port, int unit_id, ModbusRegisterBank bank) {
		this.bind_address = bind_address;
		this.port         = port;
		this.unit_id      = unit_id;
		this.bank         = bank;
	}

	/**
	 * Binds the listening socket and starts accepting clients.
	 *
	 * @throws IOException if the endpoint cannot be bound
	 */
	public synchronized void start() throws IOException {
		if(is_running)
			return;
		ServerSocket s = new ServerSocket();
		try {
			s.setReuseAddress(true);
			s.bind(new InetSocketAddress(bind_address, port));
		} catch(IOException e) {
			s.close();
			throw e;
		}
		listen_socket = s;
		is_running = true;

		Thread t = new Thread(new Acceptor(), "modbus-accept");
		t.setDaemon(true);
		t.start();
		logger.info("Register server listening on {}:{} (unit {}, {} registers)", bind_address, getLocalPort(), unit_id, bank.size());
	}

	public synchronized void stop() {
		if(!is_running)
			return;
		is_running = false;
		try {
			listen_socket.close();
		} catch(IOException e) {
			logger.warn("Closing listen socket failed: {}", e.getMessage());
		}
		for(Socket c : clients)
			closeQuietly(c);
		clients.clear();
		logger.info("Register server stopped");
	}

	@Override
	public void close() {
		stop();
	}

	public boolean isRunning() {
		return is_running;
	}

	public int getLocalPort() {
		ServerSocket s = listen_socket;
		return s != null ? s.getLocalPort() : -1;
	}

	public int getUnitId() {
		return unit_id;
	}

	public int getClientCount() {
		return clients.size();
	}

	public ModbusRegisterBank getBank() {
		return bank;
	}

	/**
	 * Local write used by the process hosting the server.
	 */
	public void writeRegisters(int address, int[] values) {
		bank.write(address, values);
	}

	/**
	 * Handles one request PDU and returns the response PDU.
	 */
	byte[] handle(int unit, byte[] pdu) {

		final int fc = pdu[0] & 0xFF;

		if(unit != unit_id)
			return exception(fc, ModbusException.GATEWAY_TARGET_FAILED);

		switch(fc) {
		case FC_READ_HOLDING:
		case FC_READ_INPUT: {
			if(pdu.length != 5)
				return exception(fc, ModbusException.ILLEGAL_DATA_VALUE);
			int address  = u16(pdu, 1);
			int quantity = u16(pdu, 3);
			if(quantity < 1 || quantity > MAX_READ_QUANTITY)
				return exception(fc, ModbusException.ILLEGAL_DATA_VALUE);
			if(!bank.contains(address, quantity))
				return exception(fc, ModbusException.ILLEGAL_DATA_ADDRESS);
			int[] values = bank.read(address, quantity);
			byte[] r = new byte[2 + quantity * 2];
			r[0] = (byte)fc;
			r[1] = (byte)(quantity * 2);
			for(int i = 0; i < quantity; i++)
				put16(r, 2 + i * 2, values[i]);
			return r;
		}
		case FC_WRITE_SINGLE: {
			if(pdu.length != 5)
				return exception(fc, ModbusException.ILLEGAL_DATA_VALUE);
			int address = u16(pdu, 1);
			if(!bank.contains(address, 1))
				return exception(fc, ModbusException.ILLEGAL_DATA_ADDRESS);
			bank.write(address, u16(pdu, 3));
			return pdu.clone();
		}
		case FC_WRITE_MULTIPLE: {
			if(pdu.length < 6)
				return exception(fc, ModbusException.ILLEGAL_DATA_VALUE);
			int address  = u16(pdu, 1);
			int quantity = u16(pdu, 3);
			int count    = pdu[5] & 0xFF;
			if(quantity < 1 || quantity > MAX_WRITE_QUANTITY || count != quantity * 2 || pdu.length != 6 + count)
				return exception(fc, ModbusException.ILLEGAL_DATA_VALUE);
			if(!bank.contains(address, quantity))
				return exception(fc, ModbusException.ILLEGAL_DATA_ADDRESS);
			int[] values = new int[quantity];
			for(int i = 0; i < quantity; i++)
				values[i] = u16(pdu, 6 + i * 2);
			bank.write(address, values);
			byte[] r = new byte[5];
			r[0] = (byte)fc;
			put16(r, 1, address);
			put16(r, 3, quantity);
			return r;
		}
		default:
			return exception(fc, ModbusException.ILLEGAL_FUNCTION);
		}
	}

	static int u16(byte[] b, int offset) {
		return ((b[offset] & 0xFF) << 8) | (b[offset + 1] & 0xFF);
	}

	static void put16(byte[] b, int offset, int value) {
		b[offset]     = (byte)(value >> 8);
		b[offset + 1] = (byte)value;
	}

	private static byte[] exception(int fc, int code) {
		return new byte[] { (byte)(fc | 0x80), (byte)code };
	}

	private static void closeQuietly(Socket s) {
		try {
			s.close();
		} catch(IOException e) {
			logger.debug("Closing client socket failed: {}", e.getMessage());
		}
	}

	private class Acceptor implements Runnable {

		@Override
		public void run() {
			while(is_running) {
				try {
					Socket socket = listen_socket.accept();
					socket.setTcpNoDelay(true);
					clients.add(socket);
					Thread t = new Thread(new ClientHandler(socket), "modbus-client-"+client_nr.incrementAndGet());
					t.setDaemon(true);
					t.start();
				} catch(IOException e) {
					if(is_running)
						logger.warn("Accepting client failed: {}", e.getMessage());
				}
			}
		}
	}

	private class ClientHandler implements Runnable {

		private final Socket socket;

		ClientHandler(Socket socket) {
			this.socket = socket;
		}

		@Override
		public void run() {
			final String peer = String.valueOf(socket.getRemoteSocketAddress());
			logger.debug("Client {} connected", peer);
			try {
				DataInputStream  in  = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
				DataOutputStream out = new DataOutputStream(socket.getOutputStream());

				while(is_running) {
					int tid      = in.readUnsignedShort();
					int protocol = in.readUnsignedShort();
					int length   = in.readUnsignedShort();
					int unit     = in.readUnsignedByte();

					if(protocol != 0 || length < 2 || length - 1 > MAX_PDU_LENGTH) {
						logger.warn("Client {} sent malformed header (protocol={}, length={}), closing", peer, protocol, length);
						break;
					}

					byte[] pdu = new byte[length - 1];
					in.readFully(pdu);

					byte[] response = handle(unit, pdu);

					byte[] frame = new byte[7 + response.length];
					put16(frame, 0, tid);
					put16(frame, 2, 0);
					put16(frame, 4, response.length + 1);
					frame[6] = (byte)unit;
					System.arraycopy(response, 0, frame, 7, response.length);
					out.write(frame);
					out.flush();
				}
			} catch(EOFException | SocketException e) {
				logger.debug("Client {} disconnected", peer);
			} catch(IOException e) {
				logger.warn("Client {} failed: {}", peer, e.getMessage());
			} finally {
				clients.remove(socket);
				closeQuietly(socket);
			}
		}
	}

}
