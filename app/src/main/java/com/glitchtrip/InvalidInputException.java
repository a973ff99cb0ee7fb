package com.glitchtrip;

/**
 * Raised when the pipeline is handed a buffer it cannot process (missing or
 * zero-sized).
 */
public class InvalidInputException extends Exception
{
	public InvalidInputException(String message)
	{
		super(message);
	}
}
