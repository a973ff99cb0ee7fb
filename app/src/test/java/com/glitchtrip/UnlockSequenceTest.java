package com.glitchtrip;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UnlockSequenceTest
{

	@Test
	void fullSequenceUnlocks()
	{
		UnlockSequence seq = new UnlockSequence();
		String keys = "uuddlrlrba";
		for (int i = 0; i < keys.length() - 1; i++)
		{
			assertFalse(seq.press(keys.charAt(i)));
		}

		assertTrue(seq.press('a'));
		assertTrue(seq.isUnlocked());
		assertEquals("", seq.entered());
	}

	@Test
	void overlongInputResets()
	{
		UnlockSequence seq = new UnlockSequence();
		for (char c : "UUUUUUUUUU".toCharArray())
		{
			seq.press(c);
		}

		seq.press('U');

		assertEquals("", seq.entered());
		assertFalse(seq.isUnlocked());
	}

	@Test
	void unlockIsSticky()
	{
		UnlockSequence seq = new UnlockSequence();
		for (char c : UnlockSequence.TARGET.toCharArray())
		{
			seq.press(c);
		}

		seq.press('L');
		seq.press('B');

		assertTrue(seq.isUnlocked());
		assertEquals("LB", seq.entered());
	}
}
