package com.comino.cranepose.fiducial;

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

import georegression.struct.point.Point2D_F64;

/**
 * One detected marker in one frame: its identity and the four corner pixels
 * in detector order.
 */
public final class MarkerObservation {

	private final int           id;
	private final Point2D_F64[] corners;
	private final long          tms;

	public MarkerObservation(int id, Point2D_F64[] corners, long tms) {
		if(corners == null || corners.length != 4)
			throw new IllegalArgumentException("A marker needs exactly 4 corners");
		this.id      = id;
		this.corners = new Point2D_F64[4];
		for(int i = 0; i < 4; i++)
			this.corners[i] = corners[i].copy();
		this.tms     = tms;
	}

	/**
	 * Axis aligned square of side {@code size} centred at (cx,cy).
	 */
	public static MarkerObservation square(int id, double cx, double cy, double size, long tms) {
		double h = size / 2.0;
		return new MarkerObservation(id, new Point2D_F64[] {
				new Point2D_F64(cx - h, cy - h),
				new Point2D_F64(cx + h, cy - h),
				new Point2D_F64(cx + h, cy + h),
				new Point2D_F64(cx - h, cy + h) }, tms);
	}

	public int getId() {
		return id;
	}

	public long getTms() {
		return tms;
	}

	public Point2D_F64 getCorner(int i) {
		return corners[i].copy();
	}

	public double getCenterX() {
		return (corners[0].x + corners[1].x + corners[2].x + corners[3].x) / 4.0;
	}

	public double getCenterY() {
		return (corners[0].y + corners[1].y + corners[2].y + corners[3].y) / 4.0;
	}

	/**
	 * Mean side length in pixels.
	 */
	public double getSizePx() {
		double sum = 0;
		for(int i = 0; i < 4; i++)
			sum += corners[i].distance(corners[(i + 1) % 4]);
		return sum / 4.0;
	}

	public MarkerObservation translate(double dx, double dy) {
		Point2D_F64[] moved = new Point2D_F64[4];
		for(int i = 0; i < 4; i++)
			moved[i] = new Point2D_F64(corners[i].x + dx, corners[i].y + dy);
		return new MarkerObservation(id, moved, tms);
	}

	@Override
	public String toString() {
		return "Marker "+id+" @("+String.format("%.1f,%.1f", getCenterX(), getCenterY())+") "+String.format("%.1f", getSizePx())+"px";
	}

}
