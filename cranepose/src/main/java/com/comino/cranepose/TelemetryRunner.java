package com.comino.cranepose;

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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.comino.cranepose.callback.IPoseCallback;
import com.comino.cranepose.estimators.IPoseEstimator;
import com.comino.cranepose.estimators.PoseSample;
import com.comino.cranepose.libcamera.CameraFrame;
import com.comino.cranepose.libcamera.CameraLostException;
import com.comino.cranepose.libcamera.CaptureException;
import com.comino.cranepose.libcamera.ICameraSource;
import com.comino.cranepose.modbus.PosePublisher;

/**
 * Capture, estimate and publish in one sequential loop paced to the sample
 * rate.
 * <p>
 * Failed reads are retried in place. More than {@code max_retries}
 * consecutive failures, or a lost camera, end the loop with
 * {@link #EXIT_CAMERA_LOST}.
 */
public class TelemetryRunner<C, S extends PoseSample> {

	private static final Logger logger = LoggerFactory.getLogger(TelemetryRunner.class);

	public static final int EXIT_OK                 = 0;
	public static final int EXIT_CONFIG             = 1;
	public static final int EXIT_CAMERA_UNAVAILABLE = 2;
	public static final int EXIT_REGISTER_SERVICE   = 3;
	public static final int EXIT_CAMERA_LOST        = 4;

	public static final int DEFAULT_MAX_RETRIES = 10;

	private final ICameraSource          source;
	private final IPoseEstimator<C, S>   estimator;
	private final C                      state;
	private final PosePublisher<S>       publisher;
	private final long                   period_ms;
	private final int                    max_retries;

	private final List<IPoseCallback<S>> callbacks = new ArrayList<>();
	private final CountDownLatch         finished  = new CountDownLatch(1);

	private Runnable reloader = null;

	private volatile boolean is_running = false;
	private volatile long    frames     = 0;
	private volatile long    failures   = 0;

	public TelemetryRunner(ICameraSource source, IPoseEstimator<C, S> estimator, C state, PosePublisher<S> publisher,
			float fps, int max_retries) {
		this.source      = source;
		this.estimator   = estimator;
		this.state       = state;
		this.publisher   = publisher;
		this.period_ms   = (long)(1000f / fps);
		this.max_retries = max_retries;
	}

	public void registerCallback(IPoseCallback<S> callback) {
		this.callbacks.add(callback);
	}

	/**
	 * Called once per captured frame before estimation.
	 */
	public void setConfigReloader(Runnable reloader) {
		this.reloader = reloader;
	}

	/**
	 * Runs until stopped or the camera is lost.
	 *
	 * @return process exit code
	 */
	public int run() {
		is_running = true;
		int consecutive = 0;
		try {
			while(is_running) {
				final long start = System.currentTimeMillis();

				try {
					CameraFrame frame = source.read();
					consecutive = 0;

					if(reloader != null)
						reloader.run();

					S sample = estimator.process(frame, state);
					publisher.publish(sample);
					for(IPoseCallback<S> callback : callbacks)
						callback.process(sample, frame.getTms());
					frames++;

				} catch(CaptureException e) {
					failures++;
					if(++consecutive > max_retries) {
						logger.error("Camera failed {} times in a row, giving up: {}", consecutive, e.getMessage());
						return EXIT_CAMERA_LOST;
					}
					logger.warn("Camera frame read failed ({}/{}): {}", consecutive, max_retries, e.getMessage());
				} catch(CameraLostException e) {
					logger.error("Camera lost: {}", e.getMessage());
					return EXIT_CAMERA_LOST;
				}

				long wait = period_ms - (System.currentTimeMillis() - start);
				if(wait > 0 && is_running) {
					try {
						Thread.sleep(wait);
					} catch(InterruptedException e) {
						Thread.currentThread().interrupt();
						break;
					}
				}
			}
			return EXIT_OK;
		} finally {
			is_running = false;
			finished.countDown();
		}
	}

	public void stop() {
		is_running = false;
	}

	/**
	 * Stops the loop and waits for the current frame to complete.
	 */
	public void stopAndWait(long timeout_ms) {
		stop();
		try {
			finished.await(timeout_ms, TimeUnit.MILLISECONDS);
		} catch(InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	public boolean isRunning() {
		return is_running;
	}

	public long getFrameCount() {
		return frames;
	}

	public long getFailureCount() {
		return failures;
	}

}
