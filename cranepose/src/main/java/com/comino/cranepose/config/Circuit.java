package com.comino.cranepose.config;

/**
 * The two measurement circuits of one crane.
 */
public enum Circuit {

	BRIDGE("bridge", "com.comino.cranepose.StartBridgePose"),
	HOOK  ("hook",   "com.comino.cranepose.StartHookPose");

	private final String key;
	private final String main_class;

	Circuit(String key, String main_class) {
		this.key        = key;
		this.main_class = main_class;
	}

	public String getKey() {
		return key;
	}

	/**
	 * Entry point of the telemetry process serving this circuit.
	 */
	public String getMainClass() {
		return main_class;
	}

	public static Circuit fromKey(String key) {
		if(key != null) {
			for(Circuit c : values()) {
				if(c.key.equalsIgnoreCase(key.trim()))
					return c;
			}
		}
		throw new IllegalArgumentException("Unknown circuit: "+key);
	}

}
