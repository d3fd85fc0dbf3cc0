package com.comino.cranepose.libcamera;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import boofcv.struct.image.GrayU8;

final class AbstractCameraSourceTest {

	private static final CameraConfig CONFIG = new CameraConfig(CameraBackend.GENERIC, "0");

	@Test
	void stuckGrabTimesOutAsTransientFailure() {
		SleepingSource source = new SleepingSource(2_000);
		try {
			long start = System.currentTimeMillis();
			assertThrows(CaptureException.class, source::read);
			assertThrows(CaptureException.class, source::read);
			assertTrue(System.currentTimeMillis() - start < 1_500);
			assertTrue(source.isOpen());
		} finally {
			source.close();
		}
	}

	@Test
	void framesAreNumberedInOrder() throws Exception {
		SleepingSource source = new SleepingSource(0);
		try {
			CameraFrame first  = source.read();
			CameraFrame second = source.read();
			assertEquals(1, first.getSequence());
			assertEquals(2, second.getSequence());
			assertEquals(4, first.getWidth());
		} finally {
			source.close();
		}
	}

	@Test
	void readAfterCloseIsLost() {
		SleepingSource source = new SleepingSource(0);
		source.close();
		source.close();

		assertFalse(source.isOpen());
		assertEquals(1, source.released);
		assertThrows(CameraLostException.class, source::read);
	}

	private static final class SleepingSource extends AbstractCameraSource {

		private final long delay_ms;
		int released = 0;

		SleepingSource(long delay_ms) {
			super(CONFIG, 100);
			this.delay_ms = delay_ms;
		}

		@Override
		protected GrayU8 grab() throws CaptureException {
			try {
				Thread.sleep(delay_ms);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new CaptureException("interrupted");
			}
			return new GrayU8(4, 3);
		}

		@Override
		protected void release() {
			released++;
		}
	}

}
