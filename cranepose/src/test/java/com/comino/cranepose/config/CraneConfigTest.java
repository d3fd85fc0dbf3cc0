package com.comino.cranepose.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.comino.cranepose.modbus.RegisterMap;

final class CraneConfigTest {

	@TempDir
	Path dir;

	@Test
	void classpathDefaults() {
		CraneConfig config = CraneConfig.fromArgs(new String[0]);
		assertEquals(5020, config.getIntProperty(CraneParams.MODBUS_PORT, "0"));
		assertEquals("127.0.0.1", config.getProperty(CraneParams.MODBUS_HOST, null));
		assertEquals(8.0f, config.getFps());
		assertEquals(1000, config.getRestartDelayMs());
		assertEquals(Paths.get("data/runtime"), config.getRuntimeDir());
		assertEquals(Paths.get("data/calibration_config.json"), config.getCalibrationFile());
		assertEquals(-1, config.getCameraIdOverride());

		RegisterMap map = config.getRegisterMap();
		assertEquals(100, map.getBridgeBase());
		assertEquals(200, map.getHookBase());
	}

	@Test
	void fileThenCommandLine() throws IOException {
		Path file = dir.resolve("crane.properties");
		Files.writeString(file, "modbus.port=6000\npose.fps=2\n");

		CraneConfig config = CraneConfig.fromArgs(new String[] {
				"--config-file="+file, "--pose.fps=0.1", "--camera.id=3", "extra" });

		assertEquals(6000, config.getIntProperty(CraneParams.MODBUS_PORT, "0"));
		assertEquals(CraneConfig.MIN_FPS, config.getFps());
		assertEquals(3, config.getCameraIdOverride());
		assertEquals(List.of("extra"), config.getPositional());
		assertEquals(Set.of("--modbus.port=6000", "--pose.fps=0.1", "--camera.id=3"), new HashSet<>(config.toArgs()));
	}

	@Test
	void restartDelayHasFloor() {
		CraneConfig config = CraneConfig.fromArgs(new String[] { "--supervisor.restart_delay_ms=5" });
		assertEquals(CraneConfig.MIN_RESTART_DELAY_MS, config.getRestartDelayMs());
	}

	@Test
	void invalidValuesAreReported() {
		CraneConfig config = CraneConfig.fromArgs(new String[] { "--modbus.port=abc" });
		assertThrows(IllegalArgumentException.class, () -> config.getIntProperty(CraneParams.MODBUS_PORT, "5020"));
		assertThrows(IllegalArgumentException.class, () -> CraneConfig.fromArgs(new String[] { "--verbose" }));
		assertThrows(IllegalArgumentException.class,
				() -> CraneConfig.fromArgs(new String[] { "--modbus.bridge_base=100", "--modbus.hook_base=102" }).getRegisterMap());
	}

}
