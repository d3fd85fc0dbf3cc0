package com.comino.cranepose.libcamera;

@FunctionalInterface
public interface ICameraOpener {

	ICameraSource open(CameraConfig config) throws CameraUnavailableException;

}
