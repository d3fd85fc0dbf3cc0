package com.comino.cranepose;

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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.comino.cranepose.concurrency.CranePool;
import com.comino.cranepose.config.CalibrationConfigLoader;
import com.comino.cranepose.config.CraneConfig;
import com.comino.cranepose.config.CraneParams;
import com.comino.cranepose.config.FileChangeWatcher;
import com.comino.cranepose.config.HookSettings;
import com.comino.cranepose.estimators.HookCalibrationState;
import com.comino.cranepose.estimators.HookPoseEstimator;
import com.comino.cranepose.estimators.HookPoseSample;
import com.comino.cranepose.fiducial.BoofMarkerDetector;
import com.comino.cranepose.libcamera.CameraSourceFactory;
import com.comino.cranepose.libcamera.CameraUnavailableException;
import com.comino.cranepose.libcamera.ICameraSource;
import com.comino.cranepose.modbus.ModbusTcpClient;
import com.comino.cranepose.modbus.RegisterMap;
import com.comino.cranepose.modbus.RemotePosePublisher;

/**
 * Hook telemetry process. Writes the hook block into the register server
 * hosted by the bridge process.
 */
public class StartHookPose {

	private static final Logger logger = LoggerFactory.getLogger(StartHookPose.class);

	public static void main(String[] args) {
		System.exit(run(args));
	}

	public static int run(String[] args) {

		final CraneConfig  config;
		final RegisterMap  map;
		final Path         calibration;
		final HookSettings settings;

		try {
			config      = CraneConfig.fromArgs(args);
			map         = config.getRegisterMap();
			calibration = config.getCalibrationFile();
			settings    = applyOverrides(CalibrationConfigLoader.loadHook(calibration), config);
		} catch(IllegalArgumentException | UncheckedIOException e) {
			logger.error("Configuration error: {}", e.getMessage());
			return TelemetryRunner.EXIT_CONFIG;
		}

		CameraSourceFactory factory = CameraSourceFactory.createDefault(
				config.getIntProperty(CraneParams.CAMERA_OPEN_TIMEOUT_MS, String.valueOf(CameraSourceFactory.DEFAULT_OPEN_TIMEOUT_MS)),
				config.getIntProperty(CraneParams.CAMERA_READ_TIMEOUT_MS, String.valueOf(CameraSourceFactory.DEFAULT_READ_TIMEOUT_MS)));

		final ICameraSource source;
		try {
			source = factory.open(settings.getCamera());
		} catch(CameraUnavailableException e) {
			logger.error("Camera open failed ({}): {}", settings.getCamera(), e.getMessage());
			CranePool.close();
			return TelemetryRunner.EXIT_CAMERA_UNAVAILABLE;
		}

		final ModbusTcpClient client = new ModbusTcpClient(
				config.getProperty(CraneParams.MODBUS_HOST, "127.0.0.1"),
				config.getIntProperty(CraneParams.MODBUS_PORT, "5020"),
				config.getIntProperty(CraneParams.MODBUS_UNIT_ID, "1"),
				config.getIntProperty(CraneParams.MODBUS_CONNECT_TIMEOUT_MS, String.valueOf(ModbusTcpClient.DEFAULT_TIMEOUT_MS)));
		try {
			client.connect();
		} catch(IOException e) {
			logger.warn("Register server {} not reachable yet ({}), retrying in background", client, e.getMessage());
		}

		final RemotePosePublisher<HookPoseSample> publisher = new RemotePosePublisher<>(client, map.getHookBase(),
				config.getIntProperty(CraneParams.MODBUS_RECONNECT_MAX_MS, String.valueOf(RemotePosePublisher.DEFAULT_MAX_BACKOFF_MS)));

		final HookCalibrationState state = new HookCalibrationState(settings);
		final TelemetryRunner<HookCalibrationState, HookPoseSample> runner = new TelemetryRunner<>(
				source,
				new HookPoseEstimator(new BoofMarkerDetector(settings.getMarkerSizeM())),
				state,
				publisher,
				config.getFps(),
				config.getIntProperty(CraneParams.CAMERA_MAX_RETRIES, String.valueOf(TelemetryRunner.DEFAULT_MAX_RETRIES)));

		final FileChangeWatcher watcher = new FileChangeWatcher(calibration);
		runner.setConfigReloader(() -> {
			if(!watcher.hasChanged())
				return;
			try {
				state.update(applyOverrides(CalibrationConfigLoader.loadHook(calibration), config));
				logger.info("Calibration reloaded: {}", state.getSettings());
			} catch(IllegalArgumentException | UncheckedIOException e) {
				logger.warn("Calibration reload failed, keeping previous: {}", e.getMessage());
			}
		});

		Runtime.getRuntime().addShutdownHook(new Thread(() -> {
			runner.stopAndWait(2000);
			publisher.close();
			source.close();
		}, "hook-shutdown"));

		logger.info("Running. camera={}, target_marker={}, register_server={}, hook_base={}",
				settings.getCamera(), settings.getMarkerId(), client, map.getHookBase());

		try {
			return runner.run();
		} finally {
			publisher.close();
			source.close();
			CranePool.close();
			logger.info("Stopped");
		}
	}

	static HookSettings applyOverrides(HookSettings settings, CraneConfig config) {
		int id = config.getCameraIdOverride();
		if(id < 0)
			return settings;
		return settings.withCamera(settings.getCamera().withDevice(String.valueOf(id)));
	}

}
