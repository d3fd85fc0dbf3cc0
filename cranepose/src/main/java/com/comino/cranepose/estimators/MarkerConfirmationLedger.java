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

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Co-observation statistics deciding which bridge markers may be used for
 * pose output.
 * <p>
 * Every frame an unconfirmed visible marker gains one point for being seen,
 * one point per confirmed marker visible together with it (pair evidence)
 * and one point per pair of such confirmed markers (triple evidence). A
 * marker is promoted once its evidence exceeds the threshold and its id is
 * greater than the last promoted id. Candidates are promoted in ascending id
 * order within one frame. Evidence of a rejected candidate is kept and
 * saturates one above the threshold.
 * <p>
 * Not thread safe. One ledger belongs to one telemetry loop.
 */
public class MarkerConfirmationLedger {

	private static final Logger logger = LoggerFactory.getLogger(MarkerConfirmationLedger.class);

	public static final int DEFAULT_THRESHOLD = 6;

	private final int                   threshold;
	private final Map<Integer,Integer>  evidence  = new HashMap<>();
	private final SortedSet<Integer>    confirmed = new TreeSet<>();

	private int last_confirmed_id = -1;

	public MarkerConfirmationLedger() {
		this(DEFAULT_THRESHOLD);
	}

	public MarkerConfirmationLedger(int threshold) {
		if(threshold < 0)
			throw new IllegalArgumentException("Threshold must not be negative");
		this.threshold = threshold;
	}

	/**
	 * Folds the ids visible in one frame into the ledger.
	 *
	 * @param visible ids of known markers seen in this frame
	 * @return the visible ids that are confirmed after this frame
	 */
	public SortedSet<Integer> update(Collection<Integer> visible) {

		final SortedSet<Integer> seen = new TreeSet<>(visible);
		final SortedSet<Integer> seen_confirmed = new TreeSet<>(seen);
		seen_confirmed.retainAll(confirmed);

		final int k = seen_confirmed.size();
		final int gain = 1 + k + k * (k - 1) / 2;

		for(Integer id : seen) {
			if(confirmed.contains(id))
				continue;

			int count = evidence.merge(id, Math.min(gain, threshold + 1), (a, b) -> Math.min(threshold + 1, a + b));
			if(count <= threshold)
				continue;

			if(id > last_confirmed_id) {
				confirmed.add(id);
				last_confirmed_id = id;
				logger.info("Marker {} confirmed (evidence {})", id, count);
			} else {
				logger.debug("Marker {} rejected: not above last confirmed id {}", id, last_confirmed_id);
			}
		}

		seen.retainAll(confirmed);
		return seen;
	}

	public boolean isConfirmed(int id) {
		return confirmed.contains(id);
	}

	public int getEvidence(int id) {
		return evidence.getOrDefault(id, 0);
	}

	public int getLastConfirmedId() {
		return last_confirmed_id;
	}

	public int getThreshold() {
		return threshold;
	}

	public SortedSet<Integer> getConfirmed() {
		return Collections.unmodifiableSortedSet(confirmed);
	}

	/**
	 * Drops all statistics for ids not contained in {@code known}.
	 */
	public void retainOnly(Collection<Integer> known) {
		evidence.keySet().retainAll(known);
		confirmed.retainAll(known);
	}

	@Override
	public String toString() {
		return "Ledger[confirmed="+confirmed+", last="+last_confirmed_id+", evidence="+evidence+"]";
	}

}
