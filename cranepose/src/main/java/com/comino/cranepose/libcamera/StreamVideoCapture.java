package com.comino.cranepose.libcamera;

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

import static org.bytedeco.opencv.global.opencv_imgproc.COLOR_BGR2GRAY;
import static org.bytedeco.opencv.global.opencv_imgproc.cvtColor;
import static org.bytedeco.opencv.global.opencv_videoio.CAP_GSTREAMER;
import static org.bytedeco.opencv.global.opencv_videoio.CAP_PROP_FPS;
import static org.bytedeco.opencv.global.opencv_videoio.CAP_PROP_FRAME_HEIGHT;
import static org.bytedeco.opencv.global.opencv_videoio.CAP_PROP_FRAME_WIDTH;

import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_videoio.VideoCapture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import boofcv.struct.image.GrayU8;

/**
 * OpenCV capture for the GENERIC backend (device index or path) and the
 * PIPELINE backend (GStreamer pipeline string).
 */
public class StreamVideoCapture extends AbstractCameraSource {

	private static final Logger logger = LoggerFactory.getLogger(StreamVideoCapture.class);

	private final VideoCapture capture;
	private final Mat          bgr  = new Mat();
	private final Mat          gray = new Mat();

	private StreamVideoCapture(CameraConfig config, VideoCapture capture, long read_timeout_ms) {
		super(config, read_timeout_ms);
		this.capture = capture;
	}

	public static StreamVideoCapture open(CameraConfig config, long read_timeout_ms) throws CameraUnavailableException {

		VideoCapture capture;
		try {
			if(config.getBackend() == CameraBackend.PIPELINE) {
				capture = new VideoCapture(config.getEffectivePipeline(), CAP_GSTREAMER);
			} else {
				int index = config.getDeviceIndex();
				capture = index >= 0 ? new VideoCapture(index) : new VideoCapture(config.getDevice());
				capture.set(CAP_PROP_FRAME_WIDTH,  config.getWidth());
				capture.set(CAP_PROP_FRAME_HEIGHT, config.getHeight());
				capture.set(CAP_PROP_FPS,          config.getFps());
			}
		} catch (RuntimeException | UnsatisfiedLinkError e) {
			throw new CameraUnavailableException("Camera open failed ("+config+"): "+e.getMessage(), e);
		}

		if(!capture.isOpened()) {
			capture.release();
			throw new CameraUnavailableException("Camera open failed ("+config+")");
		}

		logger.info("Camera {} opened", config);
		return new StreamVideoCapture(config, capture, read_timeout_ms);
	}

	@Override
	protected GrayU8 grab() throws CaptureException, CameraLostException {

		if(!capture.isOpened())
			throw new CameraLostException("Camera "+config+" no longer open");

		if(!capture.read(bgr) || bgr.empty())
			throw new CaptureException("Camera frame read failed");

		if(bgr.channels() == 1)
			bgr.copyTo(gray);
		else
			cvtColor(bgr, gray, COLOR_BGR2GRAY);

		Mat src = gray.isContinuous() ? gray : gray.clone();
		GrayU8 image = new GrayU8(src.cols(), src.rows());
		src.data().get(image.data, 0, image.width * image.height);
		return image;
	}

	@Override
	protected void release() {
		capture.release();
		bgr.release();
		gray.release();
	}

}
