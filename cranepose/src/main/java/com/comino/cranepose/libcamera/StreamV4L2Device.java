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

import java.awt.image.BufferedImage;

import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.Frame;
import org.bytedeco.javacv.FrameGrabber;
import org.bytedeco.javacv.Java2DFrameConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import boofcv.io.image.ConvertBufferedImage;
import boofcv.struct.image.GrayU8;

/**
 * DEVICE backend: a V4L2 node read through FFmpeg.
 */
public class StreamV4L2Device extends AbstractCameraSource {

	private static final Logger logger = LoggerFactory.getLogger(StreamV4L2Device.class);

	private final FFmpegFrameGrabber   grabber;
	private final Java2DFrameConverter converter = new Java2DFrameConverter();

	private StreamV4L2Device(CameraConfig config, FFmpegFrameGrabber grabber, long read_timeout_ms) {
		super(config, read_timeout_ms);
		this.grabber = grabber;
	}

	public static StreamV4L2Device open(CameraConfig config, long read_timeout_ms) throws CameraUnavailableException {
		FFmpegFrameGrabber grabber;
		try {
			grabber = new FFmpegFrameGrabber(config.getDevicePath());
			grabber.setFormat("video4linux2");
			grabber.setImageWidth(config.getWidth());
			grabber.setImageHeight(config.getHeight());
			grabber.setFrameRate(config.getFps());
			grabber.start();
		} catch (FrameGrabber.Exception | RuntimeException | UnsatisfiedLinkError e) {
			throw new CameraUnavailableException("Camera open failed ("+config+"): "+e.getMessage(), e);
		}
		logger.info("Camera {} opened", config);
		return new StreamV4L2Device(config, grabber, read_timeout_ms);
	}

	@Override
	protected GrayU8 grab() throws CaptureException, CameraLostException {
		Frame frame;
		try {
			frame = grabber.grabImage();
		} catch (FrameGrabber.Exception e) {
			throw new CaptureException("Camera frame read failed: "+e.getMessage(), e);
		}
		if(frame == null)
			throw new CameraLostException("End of stream on "+config.getDevicePath());

		BufferedImage image = converter.convert(frame);
		if(image == null)
			throw new CaptureException("Camera frame conversion failed");
		return ConvertBufferedImage.convertFrom(image, (GrayU8)null);
	}

	@Override
	protected void release() {
		try {
			grabber.stop();
			grabber.release();
		} catch (FrameGrabber.Exception e) {
			logger.warn("Stopping {} failed: {}", config.getDevicePath(), e.getMessage());
		}
	}

}
