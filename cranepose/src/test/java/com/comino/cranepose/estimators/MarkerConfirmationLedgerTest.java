package com.comino.cranepose.estimators;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.Set;

import org.junit.jupiter.api.Test;

final class MarkerConfirmationLedgerTest {

	@Test
	void singleSightingsNeedMoreThanThreshold() {
		MarkerConfirmationLedger ledger = new MarkerConfirmationLedger(6);
		for(int i = 0; i < 6; i++)
			assertTrue(ledger.update(Collections.singletonList(3)).isEmpty());
		assertFalse(ledger.isConfirmed(3));

		assertEquals(Set.of(3), ledger.update(Collections.singletonList(3)));
		assertEquals(3, ledger.getLastConfirmedId());
	}

	@Test
	void lowerIdIsNeverConfirmedAfterHigherOne() {
		MarkerConfirmationLedger ledger = new MarkerConfirmationLedger(6);
		for(int i = 0; i < 7; i++)
			ledger.update(Collections.singletonList(5));
		assertTrue(ledger.isConfirmed(5));

		for(int i = 0; i < 100; i++) {
			assertTrue(ledger.update(Arrays.asList(3, 5)).contains(5));
			assertFalse(ledger.isConfirmed(3));
		}
		// evidence of the rejected id is kept but saturates
		assertEquals(7, ledger.getEvidence(3));
		assertEquals(5, ledger.getLastConfirmedId());
	}

	@Test
	void pairEvidenceSpeedsUpConfirmation() {
		MarkerConfirmationLedger ledger = new MarkerConfirmationLedger(6);
		for(int i = 0; i < 7; i++)
			ledger.update(Collections.singletonList(5));

		// 1 sighting + 1 pair per frame
		for(int i = 0; i < 3; i++)
			ledger.update(Arrays.asList(5, 6));
		assertEquals(6, ledger.getEvidence(6));
		assertFalse(ledger.isConfirmed(6));

		ledger.update(Arrays.asList(5, 6));
		assertTrue(ledger.isConfirmed(6));
	}

	@Test
	void tripleEvidence() {
		MarkerConfirmationLedger ledger = new MarkerConfirmationLedger(6);
		for(int i = 0; i < 7; i++)
			ledger.update(Collections.singletonList(5));
		for(int i = 0; i < 4; i++)
			ledger.update(Arrays.asList(5, 6));

		// 1 sighting + 2 pairs + 1 triple per frame
		ledger.update(Arrays.asList(5, 6, 7));
		assertEquals(4, ledger.getEvidence(7));
		ledger.update(Arrays.asList(5, 6, 7));
		assertTrue(ledger.isConfirmed(7));
	}

	@Test
	void confirmedMarkersStayUsable() {
		MarkerConfirmationLedger ledger = new MarkerConfirmationLedger(0);
		ledger.update(Collections.singletonList(2));
		ledger.update(Collections.singletonList(4));
		assertEquals(Set.of(2), ledger.update(Collections.singletonList(2)));
	}

	@Test
	void retainOnlyDropsUnmappedIds() {
		MarkerConfirmationLedger ledger = new MarkerConfirmationLedger(0);
		ledger.update(Arrays.asList(1, 2));
		ledger.retainOnly(Set.of(2));
		assertFalse(ledger.isConfirmed(1));
		assertEquals(0, ledger.getEvidence(1));
		assertTrue(ledger.isConfirmed(2));
	}

}
