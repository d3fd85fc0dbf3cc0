package com.comino.cranepose.libcamera;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

final class CameraSourceFactoryTest {

	private static final CameraConfig GENERIC = new CameraConfig(CameraBackend.GENERIC, "0");

	@Test
	void opensThroughRegisteredBackend() throws Exception {
		FakeSource source = new FakeSource(GENERIC);
		CameraSourceFactory factory = new CameraSourceFactory(1000).register(CameraBackend.GENERIC, c -> source);
		assertSame(source, factory.open(GENERIC));
	}

	@Test
	void missingBackendIsUnavailable() {
		CameraSourceFactory factory = new CameraSourceFactory(1000);
		assertThrows(CameraUnavailableException.class, () -> factory.open(GENERIC));
	}

	@Test
	void openerFailuresAreUnavailable() {
		CameraUnavailableException busy = new CameraUnavailableException("busy");
		CameraSourceFactory factory = new CameraSourceFactory(1000)
				.register(CameraBackend.GENERIC, c -> { throw busy; })
				.register(CameraBackend.DEVICE,  c -> { throw new IllegalStateException("driver"); });

		assertSame(busy, assertThrows(CameraUnavailableException.class, () -> factory.open(GENERIC)));

		CameraUnavailableException wrapped = assertThrows(CameraUnavailableException.class,
				() -> factory.open(new CameraConfig(CameraBackend.DEVICE, "/dev/video0")));
		assertTrue(wrapped.getCause() instanceof IllegalStateException);
	}

	@Test
	void slowOpenTimesOutAndIsClosedLater() throws Exception {
		CountDownLatch release = new CountDownLatch(1);
		FakeSource source = new FakeSource(GENERIC);
		CameraSourceFactory factory = new CameraSourceFactory(100).register(CameraBackend.GENERIC, c -> {
			try {
				release.await();
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
			return source;
		});

		long start = System.currentTimeMillis();
		assertThrows(CameraUnavailableException.class, () -> factory.open(GENERIC));
		assertTrue(System.currentTimeMillis() - start < 2000);

		release.countDown();
		assertTrue(source.closed.await(2, TimeUnit.SECONDS));
	}

	@Test
	void backendKeys() {
		assertEquals(CameraBackend.GENERIC, CameraBackend.fromKey(null));
		assertEquals(CameraBackend.PIPELINE, CameraBackend.fromKey("GStreamer"));
		assertEquals(CameraBackend.VENDOR_SDK, CameraBackend.fromKey("vendor_sdk"));
		assertEquals(CameraBackend.DEVICE, CameraBackend.fromKey(" device "));
		assertThrows(IllegalArgumentException.class, () -> CameraBackend.fromKey("firewire"));
	}

	@Test
	void deviceIdentifiers() {
		assertEquals(3, new CameraConfig(CameraBackend.GENERIC, "3").getDeviceIndex());
		assertEquals("/dev/video3", new CameraConfig(CameraBackend.GENERIC, "3").getDevicePath());
		assertEquals(4, new CameraConfig(CameraBackend.DEVICE, "/dev/video4").getDeviceIndex());
		assertEquals(-1, new CameraConfig(CameraBackend.DEVICE, "/dev/v4l/by-id/usb-cam").getDeviceIndex());
		assertEquals("0", new CameraConfig(CameraBackend.GENERIC, " ").getDevice());

		CameraConfig raw = new CameraConfig(CameraBackend.PIPELINE, "0", 0, 0, 0, "videotestsrc ! appsink");
		assertEquals("videotestsrc ! appsink", raw.getEffectivePipeline());
		assertEquals(CameraConfig.DEFAULT_WIDTH, raw.getWidth());
	}

	private static class FakeSource implements ICameraSource {

		final CountDownLatch closed = new CountDownLatch(1);
		final CameraConfig   config;

		FakeSource(CameraConfig config) {
			this.config = config;
		}

		@Override
		public CameraFrame read() throws CaptureException {
			throw new CaptureException("no frames");
		}

		@Override
		public CameraConfig getConfig() {
			return config;
		}

		@Override
		public boolean isOpen() {
			return closed.getCount() > 0;
		}

		@Override
		public void close() {
			closed.countDown();
		}
	}

}
