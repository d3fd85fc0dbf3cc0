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
import com.comino.cranepose.config.BridgeSettings;
import com.comino.cranepose.config.CalibrationConfigLoader;
import com.comino.cranepose.config.CraneConfig;
import com.comino.cranepose.config.CraneParams;
import com.comino.cranepose.config.FileChangeWatcher;
import com.comino.cranepose.estimators.BridgeCalibrationState;
import com.comino.cranepose.estimators.BridgePoseEstimator;
import com.comino.cranepose.estimators.BridgePoseSample;
import com.comino.cranepose.fiducial.BoofMarkerDetector;
import com.comino.cranepose.libcamera.CameraSourceFactory;
import com.comino.cranepose.libcamera.CameraUnavailableException;
import com.comino.cranepose.libcamera.ICameraSource;
import com.comino.cranepose.modbus.LocalPosePublisher;
import com.comino.cranepose.modbus.ModbusRegisterBank;
import com.comino.cranepose.modbus.ModbusRegisterServer;
import com.comino.cranepose.modbus.RegisterMap;

/**
 * Bridge telemetry process. Hosts the register server and writes the bridge
 * block into it.
 */
public class StartBridgePose {

	private static final Logger logger = LoggerFactory.getLogger(StartBridgePose.class);

	public static void main(String[] args) {
		System.exit(run(args));
	}

	public static int run(String[] args) {

		final CraneConfig    config;
		final RegisterMap    map;
		final Path           calibration;
		final BridgeSettings settings;

		try {
			config      = CraneConfig.fromArgs(args);
			map         = config.getRegisterMap();
			calibration = config.getCalibrationFile();
			settings    = applyOverrides(CalibrationConfigLoader.loadBridge(calibration), config);
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

		final ModbusRegisterBank   bank   = new ModbusRegisterBank(map.getRequiredRegisterCount());
		final ModbusRegisterServer server = new ModbusRegisterServer(
				config.getProperty(CraneParams.MODBUS_BIND, "0.0.0.0"),
				config.getIntProperty(CraneParams.MODBUS_PORT, String.valueOf(ModbusRegisterServer.DEFAULT_PORT)),
				config.getIntProperty(CraneParams.MODBUS_UNIT_ID, String.valueOf(ModbusRegisterServer.DEFAULT_UNIT_ID)),
				bank);
		try {
			server.start();
		} catch(IOException e) {
			logger.error("Register server failed to start: {}", e.getMessage());
			source.close();
			CranePool.close();
			return TelemetryRunner.EXIT_REGISTER_SERVICE;
		}

		final BridgeCalibrationState state = new BridgeCalibrationState(settings);
		final TelemetryRunner<BridgeCalibrationState, BridgePoseSample> runner = new TelemetryRunner<>(
				source,
				new BridgePoseEstimator(new BoofMarkerDetector(settings.getMarkerSizeM())),
				state,
				new LocalPosePublisher<>(bank, map.getBridgeBase()),
				config.getFps(),
				config.getIntProperty(CraneParams.CAMERA_MAX_RETRIES, String.valueOf(TelemetryRunner.DEFAULT_MAX_RETRIES)));

		final FileChangeWatcher watcher = new FileChangeWatcher(calibration);
		runner.setConfigReloader(() -> {
			if(!watcher.hasChanged())
				return;
			try {
				state.update(applyOverrides(CalibrationConfigLoader.loadBridge(calibration), config));
				logger.info("Calibration reloaded: {}", state.getSettings());
			} catch(IllegalArgumentException | UncheckedIOException e) {
				logger.warn("Calibration reload failed, keeping previous: {}", e.getMessage());
			}
		});

		Runtime.getRuntime().addShutdownHook(new Thread(() -> {
			runner.stopAndWait(2000);
			server.stop();
			source.close();
		}, "bridge-shutdown"));

		logger.info("Running. camera={}, roi={}, register_server={}:{}, bridge_base={}",
				settings.getCamera(), settings.getRoi(), config.getProperty(CraneParams.MODBUS_BIND, "0.0.0.0"),
				server.getLocalPort(), map.getBridgeBase());

		try {
			return runner.run();
		} finally {
			server.stop();
			source.close();
			CranePool.close();
			logger.info("Stopped");
		}
	}

	static BridgeSettings applyOverrides(BridgeSettings settings, CraneConfig config) {
		int id = config.getCameraIdOverride();
		if(id < 0)
			return settings;
		return settings.withCamera(settings.getCamera().withDevice(String.valueOf(id)));
	}

}
