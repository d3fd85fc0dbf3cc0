package com.comino.cranepose.modbus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;

import org.junit.jupiter.api.Test;

import com.comino.cranepose.estimators.BridgePoseSample;
import com.comino.cranepose.estimators.HookPoseSample;

final class ModbusPoseReaderTest {

	@Test
	void readsBothBlocks() throws IOException {
		RegisterMap map = new RegisterMap();
		ModbusRegisterBank bank = new ModbusRegisterBank(map.getRequiredRegisterCount());
		try(ModbusRegisterServer server = new ModbusRegisterServer("127.0.0.1", 0, 1, bank)) {
			server.start();
			new LocalPosePublisher<BridgePoseSample>(bank, map.getBridgeBase()).publish(new BridgePoseSample(2.5, 1.25, 4, 10, 1));
			new LocalPosePublisher<HookPoseSample>(bank, map.getHookBase()).publish(HookPoseSample.invalid(1, 1));

			try(ModbusPoseReader reader = new ModbusPoseReader(new ModbusTcpClient("127.0.0.1", server.getLocalPort(), 1), map)) {
				PoseSnapshot snapshot = reader.read();
				assertTrue(snapshot.hasData());
				assertTrue(snapshot.isConnected());
				assertTrue(snapshot.getBridge().isValid());
				assertEquals(2.5, snapshot.getBridge().getX(), 1e-6);
				assertEquals(1.25, snapshot.getBridge().getY(), 1e-6);
				assertEquals(4, snapshot.getBridge().getMarkerId());
				assertFalse(snapshot.getHook().isValid());
				assertEquals(1, snapshot.getHook().getMarkerId());
			}
		}
	}

	@Test
	void unreachableServerGivesFailedSnapshot() throws IOException {
		ModbusRegisterServer server = new ModbusRegisterServer("127.0.0.1", 0, 1, new ModbusRegisterBank(256));
		server.start();
		int port = server.getLocalPort();
		server.stop();

		try(ModbusPoseReader reader = new ModbusPoseReader(new ModbusTcpClient("127.0.0.1", port, 1, 500), new RegisterMap())) {
			PoseSnapshot snapshot = reader.read();
			assertFalse(snapshot.hasData());
			assertFalse(snapshot.isConnected());
			assertNotNull(snapshot.getError());
		}
	}

}
