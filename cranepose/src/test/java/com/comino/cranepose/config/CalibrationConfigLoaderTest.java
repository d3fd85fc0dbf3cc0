package com.comino.cranepose.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.comino.cranepose.estimators.MovementDirection;
import com.comino.cranepose.estimators.RegionOfInterest;
import com.comino.cranepose.libcamera.CameraBackend;

final class CalibrationConfigLoaderTest {

	@TempDir
	Path dir;

	@Test
	void loadsBridgeSection() throws IOException {
		Path file = write("{\"bridge_calibration\": {"
				+ "\"marker_size_mm\": 50,"
				+ "\"movement_direction\": \"right_to_left\","
				+ "\"marker_positions_m\": {\"1\": 0.5, \"2\": \"1.5\", \"x\": 3, \"4\": \"n/a\"},"
				+ "\"roi\": {\"x\": -5, \"y\": 10, \"w\": 0, \"h\": 200},"
				+ "\"camera\": {\"camera_id\": 2, \"backend\": \"pipeline\", \"width\": 640, \"height\": 480, \"fps\": 15}"
				+ "}}");

		BridgeSettings s = CalibrationConfigLoader.loadBridge(file);

		assertEquals(50, s.getMarkerSizeMm());
		assertEquals(0.05, s.getMarkerSizeM(), 1e-12);
		assertEquals(MovementDirection.DECREASING, s.getDirection());
		assertEquals(2, s.getMarkerPositions().size());
		assertEquals(0.5, s.getMarkerPositions().get(1));
		assertEquals(1.5, s.getMarkerPositions().get(2));
		assertEquals(new RegionOfInterest(0, 10, 1, 200), s.getRoi());
		assertEquals(CameraBackend.PIPELINE, s.getCamera().getBackend());
		assertEquals("2", s.getCamera().getDevice());
		assertEquals(640, s.getCamera().getWidth());
		assertTrue(s.getCamera().getEffectivePipeline().startsWith("nvarguscamerasrc sensor-id=2 "));
		assertTrue(s.getCamera().getEffectivePipeline().contains("width=640, height=480, framerate=15/1"));
	}

	@Test
	void bridgeDefaults() throws IOException {
		BridgeSettings s = CalibrationConfigLoader.loadBridge(write("{\"bridge_calibration\": {\"marker_positions_m\": {\"3\": 2}}}"));
		assertEquals(35, s.getMarkerSizeMm());
		assertEquals(MovementDirection.INCREASING, s.getDirection());
		assertEquals(CameraBackend.GENERIC, s.getCamera().getBackend());
		assertEquals(0, s.getCamera().getDeviceIndex());
		assertNull(s.getCamera().getPipeline());
	}

	@Test
	void emptyMarkerMapIsAnError() throws IOException {
		Path file = write("{\"bridge_calibration\": {\"marker_positions_m\": {}}}");
		assertThrows(IllegalArgumentException.class, () -> CalibrationConfigLoader.loadBridge(file));
	}

	@Test
	void loadsHookSection() throws IOException {
		HookSettings s = CalibrationConfigLoader.loadHook(write(
				"{\"hook_calibration\": {\"marker_size_mm\": 80, \"marker_id\": 7,"
				+ " \"camera\": {\"backend\": \"device\", \"device\": \"/dev/video2\"}}}"));
		assertEquals(80, s.getMarkerSizeMm());
		assertEquals(7, s.getMarkerId());
		assertEquals(CameraBackend.DEVICE, s.getCamera().getBackend());
		assertEquals("/dev/video2", s.getCamera().getDevicePath());
		assertEquals(2, s.getCamera().getDeviceIndex());
	}

	@Test
	void hookDefaults() throws IOException {
		HookSettings s = CalibrationConfigLoader.loadHook(write("{}"));
		assertEquals(35, s.getMarkerSizeMm());
		assertEquals(1, s.getMarkerId());
		assertEquals("1", s.getCamera().getDevice());
	}

	@Test
	void brokenFilesFailToLoad() throws IOException {
		Path broken = write("{\"hook_calibration\": ");
		assertThrows(UncheckedIOException.class, () -> CalibrationConfigLoader.loadHook(broken));
		assertThrows(UncheckedIOException.class, () -> CalibrationConfigLoader.loadHook(dir.resolve("missing.json")));
		Path unknown = write("{\"bridge_calibration\": {\"marker_positions_m\": {\"1\": 1}, \"camera\": {\"backend\": \"usb3\"}}}");
		assertThrows(IllegalArgumentException.class, () -> CalibrationConfigLoader.loadBridge(unknown));
	}

	@Test
	void watcherReportsEachChangeOnce() throws IOException {
		Path file = write("{}");
		Files.setLastModifiedTime(file, FileTime.fromMillis(1_000_000));
		FileChangeWatcher watcher = new FileChangeWatcher(file);
		assertFalse(watcher.hasChanged());

		Files.setLastModifiedTime(file, FileTime.fromMillis(2_000_000));
		assertTrue(watcher.hasChanged());
		assertFalse(watcher.hasChanged());

		Files.delete(file);
		assertFalse(watcher.hasChanged());
	}

	private Path write(String json) throws IOException {
		Path file = Files.createTempFile(dir, "calibration", ".json");
		Files.writeString(file, json);
		return file;
	}

}
