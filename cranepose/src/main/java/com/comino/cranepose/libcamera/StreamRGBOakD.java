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

import java.nio.ByteBuffer;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

import org.bytedeco.depthai.ColorCamera;
import org.bytedeco.depthai.ColorCameraProperties;
import org.bytedeco.depthai.ColorCameraProperties.ColorOrder;
import org.bytedeco.depthai.DataOutputQueue;
import org.bytedeco.depthai.Device;
import org.bytedeco.depthai.ImgFrame;
import org.bytedeco.depthai.Pipeline;
import org.bytedeco.depthai.XLinkOut;
import org.bytedeco.depthai.presets.depthai.Callback;
import org.bytedeco.javacpp.PointerScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import boofcv.core.image.ConvertImage;
import boofcv.struct.image.GrayU8;
import boofcv.struct.image.Planar;

/**
 * VENDOR_SDK backend: OAK-D colour camera preview stream. The device queue
 * callback hands frames over to the grabbing thread through a bounded queue.
 */
public class StreamRGBOakD extends AbstractCameraSource {

	private static final Logger logger = LoggerFactory.getLogger(StreamRGBOakD.class);

	private final static boolean  USE_USB2 = true;

	private final Planar<GrayU8> rgb;
	private final BlockingQueue<ImgFrame> transfer = new ArrayBlockingQueue<ImgFrame>(30);

	private Device         device;
	private PreviewCallback callback;

	private long frameCount = 0;

	private StreamRGBOakD(CameraConfig config, long read_timeout_ms) {
		super(config, read_timeout_ms);
		this.rgb = new Planar<GrayU8>(GrayU8.class, config.getWidth(), config.getHeight(), 3);
	}

	public static StreamRGBOakD open(CameraConfig config, long read_timeout_ms) throws CameraUnavailableException {
		StreamRGBOakD oakd = new StreamRGBOakD(config, read_timeout_ms);
		try {
			oakd.callback = oakd.new PreviewCallback();
		} catch (RuntimeException | UnsatisfiedLinkError e) {
			throw new CameraUnavailableException("No OAK-D camera found: "+e.getMessage(), e);
		}
		if(oakd.device == null) {
			throw new CameraUnavailableException("No OAK-D camera found");
		}
		oakd.callback.deallocate(false);
		logger.info("OAK-D RGB pipeline started {}x{}", config.getWidth(), config.getHeight());
		return oakd;
	}

	public long getFrameCount() {
		return frameCount;
	}

	@Override
	protected GrayU8 grab() throws CaptureException, CameraLostException {
		try {
			try (PointerScope scope = new PointerScope()) {
				ImgFrame frame = transfer.take();
				if(frame == null || frame.isNull())
					throw new CaptureException("Empty OAK-D frame");
				bufferRgbToMsU8(frame.getData().asByteBuffer(), rgb);
				frameCount = frame.getSequenceNum();
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new CaptureException("OAK-D grab interrupted");
		}
		if(!device.isPipelineRunning())
			throw new CameraLostException("OAK-D pipeline stopped");
		return ConvertImage.average(rgb, (GrayU8)null);
	}

	@Override
	protected void release() {
		if(device != null)
			device.close();
	}

	private class PreviewCallback extends Callback {

		DataOutputQueue queue;

		public PreviewCallback() {

			final Pipeline p = new Pipeline();
			p.deallocate(false);

			XLinkOut xlinkOut = p.createXLinkOut();
			xlinkOut.deallocate(false);
			xlinkOut.setStreamName("preview");

			ColorCamera colorCam = p.createColorCamera();
			colorCam.deallocate(false);
			colorCam.setPreviewSize(rgb.width, rgb.height);
			colorCam.setResolution(ColorCameraProperties.SensorResolution.THE_1080_P);
			colorCam.setColorOrder(ColorOrder.RGB);
			colorCam.setInterleaved(false);
			colorCam.preview().link(xlinkOut.input());

			try {
				Device d = new Device(p, USE_USB2);
				d.deallocate(false);
				if(!d.isPipelineRunning()) {
					d.close();
					return;
				}
				device = d;
			} catch(RuntimeException e) {
				logger.warn("OAK-D device open failed: {}", e.getMessage());
				return;
			}

			queue = device.getOutputQueue("preview", 4, true);
			queue.deallocate(false);
			queue.addCallback(this);
		}

		public void call() {
			ImgFrame imgFrame = queue.getImgFrame();
			if(imgFrame != null && !imgFrame.isNull()) {
				// drop frames the telemetry loop did not consume
				if(!transfer.offer(imgFrame)) {
					transfer.poll();
					transfer.offer(imgFrame);
				}
			}
		}
	}

	private void bufferRgbToMsU8(ByteBuffer input, Planar<GrayU8> output) {
		input.get(output.getBand(0).data);
		input.get(output.getBand(1).data);
		input.get(output.getBand(2).data);
	}

}
