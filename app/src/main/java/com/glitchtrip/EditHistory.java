package com.glitchtrip;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bounded undo/redo stacks. Pushing a new entry discards the redo branch and,
 * past the capacity, the oldest undo entry.
 */
public class EditHistory<T>
{

	public static final int DEFAULT_CAPACITY = 5;

	private final int capacity;
	private final Deque<T> undo = new ArrayDeque<>();
	private final Deque<T> redo = new ArrayDeque<>();

	public EditHistory()
	{
		this(DEFAULT_CAPACITY);
	}

	public EditHistory(int capacity)
	{
		if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
		this.capacity = capacity;
	}

	public void push(T entry)
	{
		undo.addLast(entry);
		while (undo.size() > capacity)
		{
			undo.removeFirst();
		}
		redo.clear();
	}

	/**
	 * Steps back. {@code current} (if non-null) becomes redoable.
	 *
	 * @return the previous entry, or null when there is nothing to undo
	 */
	public T undo(T current)
	{
		if (undo.isEmpty()) return null;
		if (current != null) redo.addLast(current);
		return undo.removeLast();
	}

	/**
	 * Steps forward again. {@code current} (if non-null) becomes undoable
	 * without discarding the rest of the redo branch.
	 *
	 * @return the next entry, or null when there is nothing to redo
	 */
	public T redo(T current)
	{
		if (redo.isEmpty()) return null;
		if (current != null)
		{
			undo.addLast(current);
			while (undo.size() > capacity)
			{
				undo.removeFirst();
			}
		}
		return redo.removeLast();
	}

	public boolean canUndo()
	{
		return !undo.isEmpty();
	}

	public boolean canRedo()
	{
		return !redo.isEmpty();
	}

	public int undoSize()
	{
		return undo.size();
	}

	public void clear()
	{
		undo.clear();
		redo.clear();
	}
}
