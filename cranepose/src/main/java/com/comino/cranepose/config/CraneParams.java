package com.comino.cranepose.config;

public class CraneParams {

	// Register service
	public static final String MODBUS_HOST               = "modbus.host";
	public static final String MODBUS_BIND               = "modbus.bind";
	public static final String MODBUS_PORT               = "modbus.port";
	public static final String MODBUS_UNIT_ID            = "modbus.unit_id";
	public static final String MODBUS_BRIDGE_BASE        = "modbus.bridge_base";
	public static final String MODBUS_HOOK_BASE          = "modbus.hook_base";
	public static final String MODBUS_CONNECT_TIMEOUT_MS = "modbus.connect_timeout_ms";
	public static final String MODBUS_RECONNECT_MAX_MS   = "modbus.reconnect_max_ms";

	// Telemetry loop
	public static final String POSE_FPS                  = "pose.fps";

	// Camera
	public static final String CAMERA_ID                 = "camera.id";
	public static final String CAMERA_OPEN_TIMEOUT_MS    = "camera.open_timeout_ms";
	public static final String CAMERA_READ_TIMEOUT_MS    = "camera.read_timeout_ms";
	public static final String CAMERA_MAX_RETRIES        = "camera.max_retries";

	// Files
	public static final String CALIBRATION_FILE          = "calibration.file";
	public static final String RUNTIME_DIR               = "runtime.dir";

	// Supervisor
	public static final String SUPERVISOR_CIRCUIT        = "supervisor.circuit";
	public static final String SUPERVISOR_RESTART_DELAY  = "supervisor.restart_delay_ms";

	// Command line only
	public static final String CONFIG_FILE               = "config-file";

}
