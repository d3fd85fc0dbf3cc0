package com.comino.cranepose.libcamera;

/**
 * The capture device is gone. Fatal for the telemetry process.
 */
public class CameraLostException extends CameraException {

	private static final long serialVersionUID = 1L;

	public CameraLostException(String message) {
		super(message);
	}

	public CameraLostException(String message, Throwable cause) {
		super(message, cause);
	}

}
