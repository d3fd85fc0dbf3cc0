package com.comino.cranepose.libcamera;

import java.io.IOException;

public class CameraException extends IOException {

	private static final long serialVersionUID = 1L;

	public CameraException(String message) {
		super(message);
	}

	public CameraException(String message, Throwable cause) {
		super(message, cause);
	}

}
