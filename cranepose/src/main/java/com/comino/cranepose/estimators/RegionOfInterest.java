package com.comino.cranepose.estimators;

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

public final class RegionOfInterest {

	private final int x;
	private final int y;
	private final int w;
	private final int h;

	public RegionOfInterest(int x, int y, int w, int h) {
		this.x = Math.max(0, x);
		this.y = Math.max(0, y);
		this.w = Math.max(1, w);
		this.h = Math.max(1, h);
	}

	public static RegionOfInterest full(int width, int height) {
		return new RegionOfInterest(0, 0, width, height);
	}

	/**
	 * Clips this region to a frame of the given size. The result is never
	 * empty as long as the frame is not.
	 */
	public RegionOfInterest clampTo(int width, int height) {
		int cx = Math.min(x, width  - 1);
		int cy = Math.min(y, height - 1);
		return new RegionOfInterest(cx, cy, Math.min(w, width - cx), Math.min(h, height - cy));
	}

	public int getX() {
		return x;
	}

	public int getY() {
		return y;
	}

	public int getWidth() {
		return w;
	}

	public int getHeight() {
		return h;
	}

	@Override
	public boolean equals(Object o) {
		if(!(o instanceof RegionOfInterest))
			return false;
		RegionOfInterest r = (RegionOfInterest)o;
		return r.x == x && r.y == y && r.w == w && r.h == h;
	}

	@Override
	public int hashCode() {
		return ((x * 31 + y) * 31 + w) * 31 + h;
	}

	@Override
	public String toString() {
		return "("+x+","+y+","+w+","+h+")";
	}

}
