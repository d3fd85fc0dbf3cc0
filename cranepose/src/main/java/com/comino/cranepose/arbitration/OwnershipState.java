package com.comino.cranepose.arbitration;

/**
 * Who may open the camera of a circuit.
 */
public enum OwnershipState {

	/** Supervised telemetry process runs and holds the camera */
	TELEMETRY_OWNS,
	/** Nobody holds the camera */
	RELEASED,
	/** An interactive calibration session holds the camera */
	CALIBRATION_OWNS

}
