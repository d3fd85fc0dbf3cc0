package com.comino.cranepose.libcamera;

/**
 * Camera could not be opened: hardware absent, already owned by another process or open timed out.
 */
public class CameraUnavailableException extends CameraException {

	private static final long serialVersionUID = 1L;

	public CameraUnavailableException(String message) {
		super(message);
	}

	public CameraUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}

}
