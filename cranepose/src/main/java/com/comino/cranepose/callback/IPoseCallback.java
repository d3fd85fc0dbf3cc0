package com.comino.cranepose.callback;

import com.comino.cranepose.estimators.PoseSample;

public interface IPoseCallback<S extends PoseSample> {

	public void process(S sample, long tms);

}
