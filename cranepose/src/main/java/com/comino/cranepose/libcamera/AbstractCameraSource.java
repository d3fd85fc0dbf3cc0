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

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import boofcv.struct.image.GrayU8;

/**
 * Bounds every blocking grab of a backend by the read timeout. Grabs run on
 * one worker thread per source, so a grab that outlives its deadline delays
 * the next one instead of running concurrently with it.
 */
public abstract class AbstractCameraSource implements ICameraSource {

	private static final Logger logger = LoggerFactory.getLogger(AbstractCameraSource.class);

	protected final CameraConfig config;

	private final long            read_timeout_ms;
	private final ExecutorService grabber;

	private volatile boolean is_open = true;
	private long             seq     = 0;

	protected AbstractCameraSource(CameraConfig config, long read_timeout_ms) {
		this.config          = config;
		this.read_timeout_ms = read_timeout_ms;
		this.grabber         = Executors.newSingleThreadExecutor(r -> {
			Thread t = new Thread(r, "grab-"+config.getBackend().getKey());
			t.setDaemon(true);
			return t;
		});
	}

	/**
	 * Grabs one frame and converts it to grey scale.
	 */
	protected abstract GrayU8 grab() throws CaptureException, CameraLostException;

	protected abstract void release();

	@Override
	public CameraFrame read() throws CaptureException, CameraLostException {
		if(!is_open)
			throw new CameraLostException("Camera "+config+" is closed");

		Future<GrayU8> f = grabber.submit(this::grab);
		try {
			GrayU8 image = f.get(read_timeout_ms, TimeUnit.MILLISECONDS);
			return new CameraFrame(image, System.currentTimeMillis(), ++seq);
		} catch (TimeoutException e) {
			throw new CaptureException("Frame read timed out after "+read_timeout_ms+"ms");
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if(cause instanceof CameraLostException)
				throw (CameraLostException)cause;
			if(cause instanceof CaptureException)
				throw (CaptureException)cause;
			throw new CaptureException("Frame read failed: "+cause, cause);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new CaptureException("Frame read interrupted");
		}
	}

	@Override
	public CameraConfig getConfig() {
		return config;
	}

	@Override
	public boolean isOpen() {
		return is_open;
	}

	@Override
	public void close() {
		if(!is_open)
			return;
		is_open = false;
		grabber.shutdownNow();
		try {
			release();
		} catch (RuntimeException e) {
			logger.warn("Release of camera {} failed: {}", config, e.getMessage());
		}
		logger.info("Camera {} closed", config);
	}

}
