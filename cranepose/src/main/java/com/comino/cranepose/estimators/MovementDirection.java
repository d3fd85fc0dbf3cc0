package com.comino.cranepose.estimators;

/**
 * Sign of the bridge path coordinate relative to the image x axis.
 */
public enum MovementDirection {

	INCREASING("left_to_right"),
	DECREASING("right_to_left");

	private final String key;

	MovementDirection(String key) {
		this.key = key;
	}

	public String getKey() {
		return key;
	}

	/**
	 * Unknown or missing keys fall back to INCREASING.
	 */
	public static MovementDirection fromKey(String key) {
		if(key == null)
			return INCREASING;
		for(MovementDirection d : values()) {
			if(d.key.equalsIgnoreCase(key.trim()) || d.name().equalsIgnoreCase(key.trim()))
				return d;
		}
		return INCREASING;
	}

}
