package com.comino.cranepose.modbus;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

import com.comino.cranepose.estimators.BridgePoseSample;
import com.comino.cranepose.estimators.HookPoseSample;

final class RegisterCodecTest {

	@Test
	void floatSplitsHighWordFirst() {
		// 1.0f = 0x3F800000
		assertArrayEquals(new int[] { 0x3F80, 0x0000 }, RegisterCodec.fromFloat(1.0f));
		// -1.0f = 0xBF800000
		assertArrayEquals(new int[] { 0xBF80, 0x0000 }, RegisterCodec.fromFloat(-1.0f));
		// 1234.5678f = 0x449A522B
		assertArrayEquals(new int[] { 0x449A, 0x522B }, RegisterCodec.fromFloat(1234.5678f));
	}

	@Test
	void decodesWhatWasEncoded() {
		float[] values = { 0.0f, -1.0f, 1234.5678f, 1.0e-30f, -3.4e38f, Float.MIN_VALUE, Float.MAX_VALUE };
		for(float v : values) {
			int[] r = RegisterCodec.fromFloat(v);
			assertEquals(v, RegisterCodec.toFloat(r[0], r[1]));
		}
	}

	@Test
	void unsignedClamp() {
		assertEquals(0, RegisterCodec.toUnsigned16(-1));
		assertEquals(42, RegisterCodec.toUnsigned16(42));
		assertEquals(0xFFFF, RegisterCodec.toUnsigned16(70000));
	}

	@Test
	void bridgeBlockLayout() {
		int[] r = new BridgePoseSample(12.5, 3.25, 7, 10.0, 0).toRegisters();
		assertEquals(RegisterMap.BRIDGE_LENGTH, r.length);
		assertEquals(12.5f, RegisterCodec.getFloat(r, RegisterMap.BRIDGE_X));
		assertEquals(3.25f, RegisterCodec.getFloat(r, RegisterMap.BRIDGE_Y));
		assertEquals(7, r[RegisterMap.BRIDGE_MARKER_ID]);
		assertEquals(1, r[RegisterMap.BRIDGE_VALID]);

		int[] invalid = BridgePoseSample.invalid(0).toRegisters();
		assertEquals(0, invalid[RegisterMap.BRIDGE_MARKER_ID]);
		assertEquals(0, invalid[RegisterMap.BRIDGE_VALID]);
	}

	@Test
	void hookBlockLayout() {
		int[] r = new HookPoseSample(4.75, -12.5, 8.0, 3, 0).toRegisters();
		assertEquals(RegisterMap.HOOK_LENGTH, r.length);
		assertEquals(4.75f,  RegisterCodec.getFloat(r, RegisterMap.HOOK_DISTANCE));
		assertEquals(-12.5f, RegisterCodec.getFloat(r, RegisterMap.HOOK_DEVIATION_X));
		assertEquals(8.0f,   RegisterCodec.getFloat(r, RegisterMap.HOOK_DEVIATION_Y));
		assertEquals(3, r[RegisterMap.HOOK_MARKER_ID]);
		assertEquals(1, r[RegisterMap.HOOK_VALID]);

		HookPoseSample decoded = HookPoseSample.fromRegisters(r, 0);
		assertEquals(4.75, decoded.getDistance(), 1e-6);
		assertEquals(3, decoded.getMarkerId());
	}

}
