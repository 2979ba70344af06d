package SearchMethod;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Writes experiment results as CSV.
 */
public class ResultsWriter
{
	public static final String HEADER = "Instance,Method,Profit,Weight,NumItems,Time,Feasible";

	public static void write(List<ExperimentResult> results, Path file) throws IOException
	{
		Path parent = file.toAbsolutePath().getParent();
		if (parent != null)
			Files.createDirectories(parent);

		try (PrintWriter out = new PrintWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8)))
		{
			out.println(HEADER);
			for (ExperimentResult r : results)
				out.println(toCsv(r));
		}
	}

	static String toCsv(ExperimentResult r)
	{
		return String.format(Locale.US, "%s,%s,%d,%d,%d,%.6f,%s",
				r.instanceName, r.method, r.profit, r.weight, r.numItems, r.time,
				r.feasible ? "Yes" : "No");
	}
}
