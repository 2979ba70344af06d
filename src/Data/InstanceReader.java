package Data;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.StringTokenizer;

/**
 * Reads DCKP instance files.
 *
 * Format (whitespace separated):
 * <pre>
 * n capacity numConflicts
 * p_1 ... p_n
 * w_1 ... w_n
 * a b        (one conflicting pair per line, 1-based)
 * </pre>
 * Pairs with an endpoint outside [1, n] are skipped. The conflict list ends
 * at the first pair that is not two integers; a trailing odd token is ignored.
 */
public class InstanceReader
{
	public static Instance read(Path file) throws IOException
	{
		List<String> tokens = new ArrayList<String>();
		try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8))
		{
			String line;
			while ((line = reader.readLine()) != null)
			{
				StringTokenizer st = new StringTokenizer(line);
				while (st.hasMoreTokens())
					tokens.add(st.nextToken());
			}
		}

		String name = file.getFileName() == null ? file.toString() : file.getFileName().toString();
		return parse(name, tokens);
	}

	static Instance parse(String name, List<String> tokens) throws InstanceFormatException
	{
		if (tokens.size() < 3)
			throw new InstanceFormatException("Invalid data in " + name + ": missing header");

		int pos = 0;
		int numItems = toInt(name, tokens.get(pos++), "numItems");
		int capacity = toInt(name, tokens.get(pos++), "capacity");
		int declaredConflicts = toInt(name, tokens.get(pos++), "numConflicts");

		if (numItems <= 0 || capacity <= 0)
			throw new InstanceFormatException("Invalid data in " + name + ": numItems=" + numItems
					+ ", capacity=" + capacity);

		if (tokens.size() < pos + 2L * numItems)
			throw new InstanceFormatException("Invalid data in " + name + ": expected " + numItems
					+ " profits and weights");

		int profits[] = new int[numItems];
		int weights[] = new int[numItems];
		for (int i = 0; i < numItems; i++)
			profits[i] = toInt(name, tokens.get(pos++), "profit " + (i + 1));
		for (int i = 0; i < numItems; i++)
			weights[i] = toInt(name, tokens.get(pos++), "weight " + (i + 1));

		List<int[]> pairs = new ArrayList<int[]>(Math.max(declaredConflicts, 0));
		int skipped = 0;
		while (pos + 1 < tokens.size())
		{
			int item1, item2;
			try
			{
				item1 = Integer.parseInt(tokens.get(pos)) - 1;
				item2 = Integer.parseInt(tokens.get(pos + 1)) - 1;
			}
			catch (NumberFormatException e)
			{
				// the conflict list ends at the first pair that is not two integers
				System.err.println("Warning: Conflict list of " + name + " ends at non-integer pair '"
						+ tokens.get(pos) + " " + tokens.get(pos + 1) + "', " + (tokens.size() - pos)
						+ " tokens ignored");
				pos = tokens.size();
				break;
			}
			pos += 2;
			if (item1 >= 0 && item1 < numItems && item2 >= 0 && item2 < numItems)
				pairs.add(new int[] { item1, item2 });
			else
				skipped++;
		}

		if (pos < tokens.size())
			System.err.println("Warning: Dangling token '" + tokens.get(pos) + "' at the end of " + name
					+ " ignored");

		if (skipped > 0)
			System.err.println("Warning: " + skipped + " conflict pairs out of range skipped in " + name);

		try
		{
			return new Instance(name, capacity, profits, weights, pairs);
		}
		catch (IllegalArgumentException e)
		{
			throw new InstanceFormatException("Invalid data in " + name + ": " + e.getMessage(), e);
		}
	}

	private static int toInt(String name, String token, String field) throws InstanceFormatException
	{
		try
		{
			return Integer.parseInt(token);
		}
		catch (NumberFormatException e)
		{
			throw new InstanceFormatException("Invalid " + field + " '" + token + "' in " + name, e);
		}
	}
}
