package com.comino.cranepose.modbus;

import java.io.IOException;

/**
 * Exception response returned by a Modbus server.
 */
public class ModbusException extends IOException {

	private static final long serialVersionUID = 3829120847462215907L;

	public static final int ILLEGAL_FUNCTION      = 0x01;
	public static final int ILLEGAL_DATA_ADDRESS  = 0x02;
	public static final int ILLEGAL_DATA_VALUE    = 0x03;
	public static final int SERVER_DEVICE_FAILURE = 0x04;
	public static final int GATEWAY_TARGET_FAILED = 0x0B;

	private final int function;
	private final int code;

	public ModbusException(int function, int code) {
		super("Modbus exception "+describe(code)+" for function 0x"+Integer.toHexString(function));
		this.function = function;
		this.code     = code;
	}

	public int getFunction() {
		return function;
	}

	public int getCode() {
		return code;
	}

	public static String describe(int code) {
		switch(code) {
		case ILLEGAL_FUNCTION:      return "ILLEGAL_FUNCTION";
		case ILLEGAL_DATA_ADDRESS:  return "ILLEGAL_DATA_ADDRESS";
		case ILLEGAL_DATA_VALUE:    return "ILLEGAL_DATA_VALUE";
		case SERVER_DEVICE_FAILURE: return "SERVER_DEVICE_FAILURE";
		case GATEWAY_TARGET_FAILED: return "GATEWAY_TARGET_FAILED";
		default:                    return "0x"+Integer.toHexString(code);
		}
	}

}
