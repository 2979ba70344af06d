package Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import Constructive.GreedyStrategy;
import SearchMethod.Config;
import SearchMethod.ExecutionMode;
import SearchMethod.InputParameters;

public class TestInputParameters
{
	@TempDir
	Path tempDir;

	private String missingParametersFile()
	{
		return tempDir.resolve("none.txt").toString();
	}

	@Test
	public void testDefaults()
	{
		InputParameters reader = new InputParameters();
		reader.readingInput(new String[0], missingParametersFile());

		Config config = reader.getConfig();
		assertEquals(ExecutionMode.single, reader.getMode());
		assertEquals(0.3, config.getAlpha(), 1e-12);
		assertEquals(100, config.getGraspIterations());
		assertEquals(42, config.getSeed());
		assertEquals(0.1, config.getConflictPenaltyCoefficient(), 1e-12);
		assertEquals(100, config.getHcMaxIterations());
		assertEquals(1000, config.getVndMaxIterations());
		assertEquals("default", reader.getParameterSources().get("alpha"));
	}

	@Test
	public void testCommandLineOverrides() throws IOException
	{
		Path instance = tempDir.resolve("inst.txt");
		Files.write(instance, "1 1 0\n1\n1\n".getBytes(StandardCharsets.UTF_8));

		InputParameters reader = new InputParameters();
		reader.readingInput(new String[] { "-mode", "tune", "-file", instance.toString(), "-alpha", "0.5",
				"-graspIterations", "7", "-seed", "99", "-conflictPenalty", "0.25",
				"-greedyStrategies", "MinWeight,MaxProfit" }, missingParametersFile());

		Config config = reader.getConfig();
		assertEquals(ExecutionMode.tune, reader.getMode());
		assertEquals(instance.toString(), reader.getFile());
		assertEquals(0.5, config.getAlpha(), 1e-12);
		assertEquals(7, config.getGraspIterations());
		assertEquals(99, config.getSeed());
		assertEquals(0.25, config.getConflictPenaltyCoefficient(), 1e-12);
		assertArrayEquals(new GreedyStrategy[] { GreedyStrategy.MinWeight, GreedyStrategy.MaxProfit },
				config.getGreedyStrategies());
		assertEquals("CLI", reader.getParameterSources().get("alpha"));
	}

	@Test
	public void testInvalidValuesKeepPreviousSetting()
	{
		InputParameters reader = new InputParameters();
		reader.readingInput(new String[] { "-alpha", "2.0", "-graspIterations", "abc", "-mode", "fast",
				"-file", tempDir.resolve("missing").toString(), "-greedyStrategies", "Nope" },
				missingParametersFile());

		Config config = reader.getConfig();
		assertEquals(0.3, config.getAlpha(), 1e-12);
		assertEquals(100, config.getGraspIterations());
		assertEquals(ExecutionMode.single, reader.getMode());
		assertEquals("", reader.getFile());
		assertEquals(GreedyStrategy.values().length, config.getGreedyStrategies().length);
		assertEquals("default", reader.getParameterSources().get("alpha"));
	}

	@Test
	public void testParametersFileThenCommandLine() throws IOException
	{
		Path params = tempDir.resolve("parameters.txt");
		Files.write(params, ("# local search budgets\n"
				+ "hcIterations=10\n"
				+ "vndIterations = 20\n"
				+ "alpha=0.9\n"
				+ "broken line\n").getBytes(StandardCharsets.UTF_8));

		InputParameters reader = new InputParameters();
		reader.readingInput(new String[] { "-alpha", "0.1" }, params.toString());

		Config config = reader.getConfig();
		assertEquals(10, config.getHcMaxIterations());
		assertEquals(20, config.getVndMaxIterations());
		assertEquals(0.1, config.getAlpha(), 1e-12, "Command line wins over the file");
		assertEquals("parameters.txt", reader.getParameterSources().get("hcIterations"));
		assertEquals("CLI", reader.getParameterSources().get("alpha"));
	}
}
