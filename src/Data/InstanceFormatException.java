package Data;

import java.io.IOException;

/**
 * Raised when an instance file cannot be parsed into a valid {@link Instance}.
 */
public class InstanceFormatException extends IOException
{
	private static final long serialVersionUID = 1L;

	public InstanceFormatException(String message)
	{
		super(message);
	}

	public InstanceFormatException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
