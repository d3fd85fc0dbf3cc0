package com.comino.cranepose.libcamera;

/**
 * A single frame could not be captured. Retried in place.
 */
public class CaptureException extends CameraException {

	private static final long serialVersionUID = 1L;

	public CaptureException(String message) {
		super(message);
	}

	public CaptureException(String message, Throwable cause) {
		super(message, cause);
	}

}
