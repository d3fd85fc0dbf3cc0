package com.comino.cranepose.libcamera;

public interface ICameraSource extends AutoCloseable {

	/**
	 * Blocks at most the configured read timeout.
	 *
	 * @throws CaptureException transient failure, the caller may retry
	 * @throws CameraLostException the device is gone, the source has to be reopened
	 */
	CameraFrame read() throws CaptureException, CameraLostException;

	CameraConfig getConfig();

	boolean isOpen();

	@Override
	void close();

}
