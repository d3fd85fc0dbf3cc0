package com.comino.cranepose.arbitration;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.comino.cranepose.config.Circuit;
import com.comino.cranepose.supervisor.PidRecord;
import com.comino.cranepose.supervisor.PidRecordStore;

final class ProcessTelemetryControlTest {

	@TempDir
	Path dir;

	@Test
	void stopWithoutRecordIsNoOp() {
		ProcessTelemetryControl control = new ProcessTelemetryControl(new PidRecordStore(dir), List.of());
		assertFalse(control.isRunning(Circuit.BRIDGE));
		assertTrue(control.stop(Circuit.BRIDGE));
	}

	@Test
	void stopOfDeadPidsIsNoOp() throws IOException {
		PidRecordStore store = new PidRecordStore(dir);
		Process p = new ProcessBuilder(java(), "-version").redirectErrorStream(true)
				.redirectOutput(ProcessBuilder.Redirect.DISCARD).start();
		p.onExit().join();
		store.write(Circuit.HOOK, new PidRecord("hook", p.pid(), 0));

		ProcessTelemetryControl control = new ProcessTelemetryControl(store, List.of());
		assertTrue(control.stop(Circuit.HOOK));
		assertFalse(store.read(Circuit.HOOK).isPresent());
	}

	@Test
	void stopTerminatesRecordedProcess() throws Exception {
		Path source = dir.resolve("Sleeper.java");
		Files.writeString(source,
				"public class Sleeper { public static void main(String[] a) throws Exception { Thread.sleep(60000); } }");
		Process p = new ProcessBuilder(java(), source.toString()).redirectErrorStream(true)
				.redirectOutput(ProcessBuilder.Redirect.DISCARD).start();
		try {
			PidRecordStore store = new PidRecordStore(dir.resolve("runtime"));
			store.write(Circuit.BRIDGE, new PidRecord("bridge", p.pid(), 0));

			ProcessTelemetryControl control = new ProcessTelemetryControl(store, List.of(), 2000);
			assertTrue(control.isRunning(Circuit.BRIDGE));
			assertTrue(control.stop(Circuit.BRIDGE));

			assertTrue(p.waitFor(5, TimeUnit.SECONDS));
			assertFalse(control.isRunning(Circuit.BRIDGE));
			assertFalse(store.read(Circuit.BRIDGE).isPresent());
		} finally {
			p.destroyForcibly();
		}
	}

	private static String java() {
		return Paths.get(System.getProperty("java.home"), "bin", "java").toString();
	}

}
