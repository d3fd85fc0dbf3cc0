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

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.comino.cranepose.concurrency.CranePool;

/**
 * Opens a camera source for a {@link CameraConfig}. The backend is chosen by
 * {@link CameraConfig#getBackend()} only. Opening never blocks longer than the
 * open timeout; a backend that completes after the deadline is closed again.
 */
public class CameraSourceFactory {

	private static final Logger logger = LoggerFactory.getLogger(CameraSourceFactory.class);

	public static final long DEFAULT_OPEN_TIMEOUT_MS = 5000;
	public static final long DEFAULT_READ_TIMEOUT_MS = 1000;

	private final Map<CameraBackend, ICameraOpener> openers = new EnumMap<>(CameraBackend.class);
	private final long open_timeout_ms;

	public CameraSourceFactory(long open_timeout_ms) {
		this.open_timeout_ms = open_timeout_ms;
	}

	public static CameraSourceFactory createDefault(long open_timeout_ms, long read_timeout_ms) {
		return new CameraSourceFactory(open_timeout_ms)
				.register(CameraBackend.GENERIC,    c -> StreamVideoCapture.open(c, read_timeout_ms))
				.register(CameraBackend.PIPELINE,   c -> StreamVideoCapture.open(c, read_timeout_ms))
				.register(CameraBackend.DEVICE,     c -> StreamV4L2Device.open(c, read_timeout_ms))
				.register(CameraBackend.VENDOR_SDK, c -> StreamRGBOakD.open(c, read_timeout_ms));
	}

	public CameraSourceFactory register(CameraBackend backend, ICameraOpener opener) {
		openers.put(backend, opener);
		return this;
	}

	public ICameraSource open(CameraConfig config) throws CameraUnavailableException {

		final ICameraOpener opener = openers.get(config.getBackend());
		if(opener == null)
			throw new CameraUnavailableException("No backend registered for "+config.getBackend());

		Future<ICameraSource> f = CranePool.submit(() -> opener.open(config));
		try {
			return f.get(open_timeout_ms, TimeUnit.MILLISECONDS);
		} catch (TimeoutException e) {
			CranePool.submit(() -> closeLate(f, config));
			throw new CameraUnavailableException("Camera open timed out after "+open_timeout_ms+"ms ("+config+")");
		} catch (ExecutionException e) {
			Throwable cause = rootOf(e);
			if(cause instanceof CameraUnavailableException)
				throw (CameraUnavailableException)cause;
			throw new CameraUnavailableException("Camera open failed ("+config+"): "+cause, cause);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new CameraUnavailableException("Camera open interrupted ("+config+")");
		}
	}

	/**
	 * The pool wraps checked exceptions of a task, possibly more than once.
	 * Returns the first {@link CameraUnavailableException} in the cause chain,
	 * otherwise the innermost cause.
	 */
	static Throwable rootOf(ExecutionException e) {
		Throwable t = e.getCause() != null ? e.getCause() : e;
		while(!(t instanceof CameraUnavailableException) && t.getCause() != null && t.getCause() != t)
			t = t.getCause();
		return t;
	}

	private static void closeLate(Future<ICameraSource> f, CameraConfig config) {
		try {
			ICameraSource source = f.get();
			logger.warn("Camera {} opened after deadline, closing it", config);
			source.close();
		} catch (ExecutionException e) {
			logger.debug("Late open of {} failed: {}", config, rootOf(e).getMessage());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

}
