package com.comino.cranepose.estimators;

/**
 * Result of one processed frame. The last register of every encoded block is
 * the validity flag.
 */
public interface PoseSample {

	boolean isValid();

	int getMarkerId();

	long getTms();

	int[] toRegisters();

}
