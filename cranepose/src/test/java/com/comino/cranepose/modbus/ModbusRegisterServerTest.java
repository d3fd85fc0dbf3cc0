package com.comino.cranepose.modbus;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

final class ModbusRegisterServerTest {

	private ModbusRegisterServer server;
	private ModbusTcpClient      client;

	@BeforeEach
	void setUp() throws IOException {
		server = new ModbusRegisterServer("127.0.0.1", 0, 1, new ModbusRegisterBank(264));
		server.start();
		client = new ModbusTcpClient("127.0.0.1", server.getLocalPort(), 1);
		client.connect();
	}

	@AfterEach
	void tearDown() {
		client.close();
		server.stop();
	}

	@Test
	void writeMultipleThenRead() throws IOException {
		client.writeRegisters(200, new int[] { 0x449A, 0x522B, 1, 2, 3, 4, 5, 1 });
		assertArrayEquals(new int[] { 0x449A, 0x522B, 1, 2, 3, 4, 5, 1 }, client.readHoldingRegisters(200, 8));
		assertEquals(1234.5678f, RegisterCodec.toFloat(0x449A, 0x522B));
	}

	@Test
	void writeSingleRegister() throws IOException {
		client.writeRegister(105, 0xFFFF);
		assertEquals(0xFFFF, client.readHoldingRegisters(105, 1)[0]);
	}

	@Test
	void localWritesAreVisibleToClients() throws IOException {
		server.writeRegisters(100, new int[] { 7, 8, 9 });
		assertArrayEquals(new int[] { 7, 8, 9 }, client.readHoldingRegisters(100, 3));
	}

	@Test
	void addressOutsideBankIsIllegalAddress() {
		ModbusException e = assertThrows(ModbusException.class, () -> client.readHoldingRegisters(260, 10));
		assertEquals(ModbusException.ILLEGAL_DATA_ADDRESS, e.getCode());
		assertTrue(client.isConnected());
	}

	@Test
	void unsupportedFunctionIsIllegalFunction() throws IOException {
		ModbusException e = assertThrows(ModbusException.class, () -> client.request(new byte[] { 0x01, 0, 0, 0, 1 }));
		assertEquals(ModbusException.ILLEGAL_FUNCTION, e.getCode());
	}

	@Test
	void oversizedReadIsIllegalValue() {
		byte[] pdu = { 0x03, 0, 0, 0, (byte)126 };
		ModbusException e = assertThrows(ModbusException.class, () -> client.request(pdu));
		assertEquals(ModbusException.ILLEGAL_DATA_VALUE, e.getCode());
	}

	@Test
	void wrongUnitIdIsRejected() throws IOException {
		try(ModbusTcpClient other = new ModbusTcpClient("127.0.0.1", server.getLocalPort(), 9)) {
			other.connect();
			ModbusException e = assertThrows(ModbusException.class, () -> other.readHoldingRegisters(0, 1));
			assertEquals(ModbusException.GATEWAY_TARGET_FAILED, e.getCode());
		}
	}

	@Test
	void brokenClientDoesNotAffectOthers() throws Exception {
		try(Socket raw = new Socket("127.0.0.1", server.getLocalPort())) {
			OutputStream out = raw.getOutputStream();
			// half a header, then hang up
			out.write(new byte[] { 0, 1, 0 });
			out.flush();
		}
		client.writeRegisters(100, new int[] { 42 });
		assertEquals(42, client.readHoldingRegisters(100, 1)[0]);
	}

	@Test
	void malformedProtocolIdClosesOnlyThatConnection() throws Exception {
		try(Socket raw = new Socket("127.0.0.1", server.getLocalPort())) {
			raw.setSoTimeout(2000);
			raw.getOutputStream().write(new byte[] { 0, 1, 0, 5, 0, 6, 1 });
			raw.getOutputStream().flush();
			assertEquals(-1, raw.getInputStream().read());
		}
		assertTrue(server.isRunning());
		assertEquals(0, client.readHoldingRegisters(0, 1)[0]);
	}

	@Test
	void concurrentReaders() throws Exception {
		server.writeRegisters(100, new int[] { 1, 2, 3, 4, 5, 6 });

		ExecutorService executor = Executors.newFixedThreadPool(8);
		try {
			List<Future<int[]>> results = new ArrayList<>();
			for(int i = 0; i < 16; i++) {
				results.add(executor.submit((Callable<int[]>) () -> {
					try(ModbusTcpClient reader = new ModbusTcpClient("127.0.0.1", server.getLocalPort(), 1)) {
						reader.connect();
						int[] last = null;
						for(int k = 0; k < 20; k++)
							last = reader.readHoldingRegisters(100, 6);
						return last;
					}
				}));
			}
			for(Future<int[]> f : results)
				assertArrayEquals(new int[] { 1, 2, 3, 4, 5, 6 }, f.get(10, TimeUnit.SECONDS));
		} finally {
			executor.shutdownNow();
		}
	}

	@Test
	void stoppedServerDisconnectsClient() throws InterruptedException {
		server.stop();
		assertFalse(server.isRunning());
		assertThrows(IOException.class, () -> {
			// the first call may still succeed writing into a closing socket
			for(int i = 0; i < 3; i++)
				client.readHoldingRegisters(0, 1);
		});
		assertFalse(client.isConnected());
	}

}
