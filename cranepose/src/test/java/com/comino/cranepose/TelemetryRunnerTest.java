package com.comino.cranepose;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.comino.cranepose.estimators.BridgePoseSample;
import com.comino.cranepose.estimators.IPoseEstimator;
import com.comino.cranepose.libcamera.CameraBackend;
import com.comino.cranepose.libcamera.CameraConfig;
import com.comino.cranepose.libcamera.CameraFrame;
import com.comino.cranepose.libcamera.CameraLostException;
import com.comino.cranepose.libcamera.CaptureException;
import com.comino.cranepose.libcamera.ICameraSource;
import com.comino.cranepose.modbus.PosePublisher;

import boofcv.struct.image.GrayU8;

final class TelemetryRunnerTest {

	private static final float FAST = 500f;

	@Test
	void publishesEveryFrameUntilStopped() {
		ScriptedSource source = new ScriptedSource();
		RecordingPublisher publisher = new RecordingPublisher();
		TelemetryRunner<String, BridgePoseSample> runner = new TelemetryRunner<>(source, new AlternatingEstimator(), "state", publisher, FAST, 3);

		List<Long> seen = new ArrayList<>();
		runner.registerCallback((sample, tms) -> {
			seen.add(tms);
			if(seen.size() == 5)
				runner.stop();
		});

		assertEquals(TelemetryRunner.EXIT_OK, runner.run());
		assertEquals(5, publisher.samples.size());
		assertEquals(5, runner.getFrameCount());
		assertTrue(publisher.samples.get(0).isValid());
		assertFalse(publisher.samples.get(1).isValid());
		assertFalse(runner.isRunning());
	}

	@Test
	void tooManyCaptureFailuresEndTheLoop() {
		ScriptedSource source = new ScriptedSource();
		for(int i = 0; i < 10; i++)
			source.fail(new CaptureException("timeout"));

		RecordingPublisher publisher = new RecordingPublisher();
		TelemetryRunner<String, BridgePoseSample> runner = new TelemetryRunner<>(source, new AlternatingEstimator(), "state", publisher, FAST, 3);

		assertEquals(TelemetryRunner.EXIT_CAMERA_LOST, runner.run());
		assertEquals(4, source.reads);
		assertTrue(publisher.samples.isEmpty());
	}

	@Test
	void successfulReadResetsFailureCount() {
		ScriptedSource source = new ScriptedSource();
		for(int round = 0; round < 4; round++) {
			source.fail(new CaptureException("timeout"));
			source.fail(new CaptureException("timeout"));
			source.ok();
		}

		RecordingPublisher publisher = new RecordingPublisher();
		TelemetryRunner<String, BridgePoseSample> runner = new TelemetryRunner<>(source, new AlternatingEstimator(), "state", publisher, FAST, 2);
		runner.registerCallback((sample, tms) -> {
			if(publisher.samples.size() == 4)
				runner.stop();
		});

		assertEquals(TelemetryRunner.EXIT_OK, runner.run());
		assertEquals(8, runner.getFailureCount());
	}

	@Test
	void lostCameraEndsTheLoopImmediately() {
		ScriptedSource source = new ScriptedSource();
		source.ok();
		source.fail(new CameraLostException("unplugged"));

		TelemetryRunner<String, BridgePoseSample> runner = new TelemetryRunner<>(source, new AlternatingEstimator(), "state", new RecordingPublisher(), FAST, 100);
		assertEquals(TelemetryRunner.EXIT_CAMERA_LOST, runner.run());
		assertEquals(2, source.reads);
	}

	@Test
	void reloaderRunsOncePerFrame() {
		ScriptedSource source = new ScriptedSource();
		AtomicInteger reloads = new AtomicInteger();

		TelemetryRunner<String, BridgePoseSample> runner = new TelemetryRunner<>(source, new AlternatingEstimator(), "state", new RecordingPublisher(), FAST, 3);
		runner.setConfigReloader(reloads::incrementAndGet);
		runner.registerCallback((sample, tms) -> {
			if(runner.getFrameCount() == 2)
				runner.stop();
		});

		runner.run();
		assertEquals(3, reloads.get());
	}

	@Test
	void loopIsPacedToSampleRate() {
		ScriptedSource source = new ScriptedSource();
		TelemetryRunner<String, BridgePoseSample> runner = new TelemetryRunner<>(source, new AlternatingEstimator(), "state", new RecordingPublisher(), 20f, 3);
		runner.registerCallback((sample, tms) -> {
			if(runner.getFrameCount() == 4)
				runner.stop();
		});

		long start = System.currentTimeMillis();
		runner.run();
		// five frames, four pauses of 50ms
		assertTrue(System.currentTimeMillis() - start >= 190);
	}

	private static final class ScriptedSource implements ICameraSource {

		private final Deque<Exception> script = new ArrayDeque<>();

		int reads = 0;

		void fail(Exception e) {
			script.add(e);
		}

		void ok() {
			script.add(new Exception("ok"));
		}

		@Override
		public CameraFrame read() throws CaptureException, CameraLostException {
			reads++;
			Exception next = script.poll();
			if(next instanceof CaptureException)
				throw (CaptureException)next;
			if(next instanceof CameraLostException)
				throw (CameraLostException)next;
			return new CameraFrame(new GrayU8(4, 4), reads, reads);
		}

		@Override
		public CameraConfig getConfig() {
			return new CameraConfig(CameraBackend.GENERIC, "0");
		}

		@Override
		public boolean isOpen() {
			return true;
		}

		@Override
		public void close() {
		}
	}

	private static final class AlternatingEstimator implements IPoseEstimator<String, BridgePoseSample> {

		private int n = 0;

		@Override
		public BridgePoseSample process(CameraFrame frame, String state) {
			return (n++ % 2 == 0) ? new BridgePoseSample(n, 1, 3, 0, frame.getTms()) : BridgePoseSample.invalid(frame.getTms());
		}
	}

	private static final class RecordingPublisher extends PosePublisher<BridgePoseSample> {

		final List<BridgePoseSample> samples = new ArrayList<>();

		RecordingPublisher() {
			super(100);
		}

		@Override
		public boolean publish(BridgePoseSample sample) {
			samples.add(sample);
			return super.publish(sample);
		}

		@Override
		protected boolean write(int address, int[] block) {
			return true;
		}
	}

}
