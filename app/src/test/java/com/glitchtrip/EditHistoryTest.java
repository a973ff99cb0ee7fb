package com.glitchtrip;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EditHistoryTest
{

	@Test
	void undoOnEmptyHistoryReturnsNull()
	{
		EditHistory<String> history = new EditHistory<>();

		assertNull(history.undo("current"));
		assertFalse(history.canRedo(), "Nothing was stepped back");
	}

	@Test
	void undoThenRedoRestoresState()
	{
		EditHistory<String> history = new EditHistory<>();
		history.push("a");
		history.push("b");

		assertEquals("b", history.undo("c"));
		assertEquals("a", history.undo("b"));
		assertEquals("b", history.redo("a"));
		assertEquals("c", history.redo("b"));
		assertFalse(history.canRedo());
		assertEquals(2, history.undoSize());
	}

	@Test
	void capacityDropsOldest()
	{
		EditHistory<Integer> history = new EditHistory<>();
		for (int i = 1; i <= 7; i++)
		{
			history.push(i);
		}

		assertEquals(EditHistory.DEFAULT_CAPACITY, history.undoSize());
		assertEquals(7, history.undo(8));
		assertEquals(6, history.undo(7));
		assertEquals(5, history.undo(6));
		assertEquals(4, history.undo(5));
		assertEquals(3, history.undo(4));
		assertNull(history.undo(3));
	}

	@Test
	void pushClearsRedoBranch()
	{
		EditHistory<String> history = new EditHistory<>();
		history.push("a");
		history.undo("b");
		assertTrue(history.canRedo());

		history.push("x");

		assertFalse(history.canRedo());
		assertNull(history.redo("y"));
	}

	@Test
	void rejectsZeroCapacity()
	{
		assertThrows(IllegalArgumentException.class, () -> new EditHistory<String>(0));
	}
}
