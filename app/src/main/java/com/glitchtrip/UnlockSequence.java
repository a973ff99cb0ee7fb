package com.glitchtrip;

/**
 * Accumulates keypad presses (U, D, L, R, B, A) and unlocks boost mode once
 * the full sequence has been entered. Unlocking is permanent for the session.
 */
public class UnlockSequence
{

	public static final String TARGET = "UUDDLRLRBA";
	public static final String KEYS = "UDLRBA";

	private final StringBuilder entered = new StringBuilder();
	private boolean unlocked;

	/**
	 * @return true if this press completed the sequence
	 */
	public boolean press(char key)
	{
		entered.append(Character.toUpperCase(key));
		if (entered.length() > TARGET.length())
		{
			entered.setLength(0);
		}
		if (TARGET.contentEquals(entered))
		{
			unlocked = true;
			entered.setLength(0);
			return true;
		}
		return false;
	}

	public boolean isUnlocked()
	{
		return unlocked;
	}

	String entered()
	{
		return entered.toString();
	}
}
