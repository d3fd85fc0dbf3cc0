package com.comino.cranepose.supervisor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.comino.cranepose.config.Circuit;

final class ProcessSupervisorTest {

	@TempDir
	Path dir;

	@Test
	void restartsAfterEveryExit() throws Exception {
		PidRecordStore store = new PidRecordStore(dir);
		ProcessSupervisor supervisor = new ProcessSupervisor(Circuit.HOOK, List.of(java(), "-version"), 100, store);
		supervisor.setOutput(ProcessBuilder.Redirect.DISCARD);

		Thread t = new Thread(supervisor, "test-supervisor");
		t.start();
		try {
			long deadline = System.currentTimeMillis() + 30_000;
			while(supervisor.getLaunchCount() < 3 && System.currentTimeMillis() < deadline)
				Thread.sleep(20);
			assertTrue(supervisor.getLaunchCount() >= 3);

			Optional<PidRecord> record = store.read(Circuit.HOOK);
			assertTrue(record.isPresent());
			assertEquals(ProcessHandle.current().pid(), record.get().getSupervisorPid());
			assertEquals("hook", record.get().getCircuit());
		} finally {
			supervisor.stop();
			t.join(10_000);
		}

		assertFalse(t.isAlive());
		assertFalse(supervisor.isRunning());
		assertFalse(store.read(Circuit.HOOK).isPresent());
	}

	@Test
	void stopTerminatesRunningChild() throws Exception {
		PidRecordStore store = new PidRecordStore(dir);
		ProcessSupervisor supervisor = new ProcessSupervisor(Circuit.BRIDGE, SleepingProcess.command(dir), 100, store);
		supervisor.setOutput(ProcessBuilder.Redirect.DISCARD);

		Thread t = new Thread(supervisor, "test-supervisor");
		t.start();

		long deadline = System.currentTimeMillis() + 30_000;
		while(store.read(Circuit.BRIDGE).map(PidRecord::getChildPid).orElse(0L) == 0 && System.currentTimeMillis() < deadline)
			Thread.sleep(20);
		Process child = supervisor.getChild();
		assertTrue(child.isAlive());
		assertEquals(child.pid(), store.read(Circuit.BRIDGE).get().getChildPid());

		supervisor.stop();
		t.join(10_000);

		assertFalse(child.isAlive());
		assertEquals(1, supervisor.getLaunchCount());
		assertFalse(store.read(Circuit.BRIDGE).isPresent());
	}

	@Test
	void stopNeverLeavesChildBehind() throws Exception {
		List<String> sleeper = SleepingProcess.command(dir);
		List<String> crashing = List.of(java(), "-version");
		for(int i = 0; i < 20; i++) {
			PidRecordStore store = new PidRecordStore(dir);
			ProcessSupervisor supervisor = new ProcessSupervisor(Circuit.BRIDGE, i % 2 == 0 ? sleeper : crashing, 0, store);
			supervisor.setOutput(ProcessBuilder.Redirect.DISCARD);

			Thread t = new Thread(supervisor, "test-supervisor-"+i);
			t.start();
			long deadline = System.currentTimeMillis() + 10_000;
			while(!supervisor.isRunning() && t.isAlive() && System.currentTimeMillis() < deadline)
				Thread.yield();

			supervisor.stop();
			t.join(10_000);

			assertFalse(t.isAlive());
			Process child = supervisor.getChild();
			if(child != null) {
				child.waitFor(5, TimeUnit.SECONDS);
				assertFalse(child.isAlive(), "child "+child.pid()+" survived stop in round "+i);
			}
			assertFalse(store.read(Circuit.BRIDGE).isPresent());
		}
	}

	@Test
	void stopBeforeRunPreventsLaunch() throws Exception {
		PidRecordStore store = new PidRecordStore(dir);
		ProcessSupervisor supervisor = new ProcessSupervisor(Circuit.HOOK, SleepingProcess.command(dir), 0, store);

		supervisor.stop();
		Thread t = new Thread(supervisor, "test-supervisor");
		t.start();
		t.join(5_000);

		assertFalse(t.isAlive());
		assertEquals(0, supervisor.getLaunchCount());
		assertFalse(supervisor.isRunning());
		assertFalse(store.read(Circuit.HOOK).isPresent());
	}

	@Test
	void javaCommandUsesThisJvm() {
		List<String> cmd = ProcessSupervisor.javaCommand(Circuit.BRIDGE, List.of("--pose.fps=4"));
		assertEquals(java(), cmd.get(0));
		assertEquals("-cp", cmd.get(1));
		assertEquals("com.comino.cranepose.StartBridgePose", cmd.get(3));
		assertEquals("--pose.fps=4", cmd.get(4));
	}

	static String java() {
		return Paths.get(System.getProperty("java.home"), "bin", "java").toString();
	}

}
