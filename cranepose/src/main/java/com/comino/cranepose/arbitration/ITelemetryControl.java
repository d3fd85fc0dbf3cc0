package com.comino.cranepose.arbitration;

import java.io.IOException;

import com.comino.cranepose.config.Circuit;

/**
 * Control surface of the supervised telemetry processes.
 */
public interface ITelemetryControl {

	/**
	 * Stops supervisor and telemetry process of the circuit. Stopping a
	 * circuit that does not run is a no-op.
	 *
	 * @return true once both are confirmed gone
	 */
	boolean stop(Circuit circuit);

	void launch(Circuit circuit) throws IOException;

	boolean isRunning(Circuit circuit);

}
