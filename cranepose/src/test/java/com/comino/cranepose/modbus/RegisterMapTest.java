package com.comino.cranepose.modbus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.comino.cranepose.config.Circuit;

final class RegisterMapTest {

	@Test
	void defaults() {
		RegisterMap map = new RegisterMap();
		assertEquals(100, map.getBase(Circuit.BRIDGE));
		assertEquals(200, map.getBase(Circuit.HOOK));
		assertEquals(264, map.getRequiredRegisterCount());
	}

	@Test
	void rangesEightApartNeverOverlap() {
		for(int bridge = 0; bridge < 64; bridge++) {
			for(int hook = 0; hook < 64; hook++) {
				if(Math.abs(bridge - hook) >= 8)
					assertFalse(RegisterMap.overlaps(bridge, hook), bridge+"/"+hook);
			}
		}
	}

	@Test
	void overlappingRangesRejected() {
		assertTrue(RegisterMap.overlaps(100, 95));
		assertTrue(RegisterMap.overlaps(100, 105));
		assertFalse(RegisterMap.overlaps(100, 106));
		assertFalse(RegisterMap.overlaps(100, 92));
		assertThrows(IllegalArgumentException.class, () -> new RegisterMap(100, 104));
		assertThrows(IllegalArgumentException.class, () -> new RegisterMap(-1, 200));
	}

	@Test
	void registerCountHasMinimum() {
		assertEquals(256, new RegisterMap(0, 10).getRequiredRegisterCount());
		assertEquals(1064, new RegisterMap(1000, 20).getRequiredRegisterCount());
	}

}
