package SearchMethod;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;

import Constructive.GreedyStrategy;

public class InputParameters
{
	public static final String PARAMETERS_FILE = "parameters.txt";

	private String file="";
	private String dir="";
	private String output="";
	private String solutionDir="";
	private ExecutionMode mode=ExecutionMode.single;
	private Config config =new Config();
	private HashMap<String, String> parameterSources = new HashMap<>();

	public void readingInput(String[] args)
	{
		readingInput(args, PARAMETERS_FILE);
	}

	public void readingInput(String[] args, String parametersFile)
	{
		initializeParameterSources();

		// parameters file first, then command line overrides it
		readParametersFile(parametersFile);

		for (int i = 0; i < args.length-1; i+=2)
		{
			switch(args[i])
			{
				case "-file": file=getAddress(args[i+1]);break;
				case "-dir": dir=getDirectory(args[i+1]);break;
				case "-output": output=args[i+1];break;
				case "-solutionDir": solutionDir=args[i+1];break;
				case "-mode": mode=getMode(args[i+1]);break;
				default:
					if (args[i].startsWith("-"))
						applyParameter(args[i].substring(1), args[i+1], "CLI");
					else
						System.err.println("Warning: Ignoring argument '" + args[i] + "'");
			}
		}

		System.out.println("Mode: "+mode);
		if (!file.isEmpty())
			System.out.println("File: "+file);
		if (!dir.isEmpty())
			System.out.println("Dir: "+dir);
		System.out.println(config.toString(parameterSources));
	}

	public String getAddress(String text)
	{
		File f=new File(text);
		if(f.exists()&&!f.isDirectory())
			return text;
		System.err.println("The -file parameter must contain the address of a valid file.");
		return "";
	}

	public String getDirectory(String text)
	{
		File f=new File(text);
		if(f.isDirectory())
			return text;
		System.err.println("The -dir parameter must contain the address of a valid directory.");
		return "";
	}

	public ExecutionMode getMode(String text)
	{
		try
		{
			return ExecutionMode.valueOf(text);
		}
		catch (IllegalArgumentException e)
		{
			System.err.println("The -mode parameter must have the values "+Arrays.toString(ExecutionMode.values())+".");
		}
		return mode;
	}

	public String getFile() {
		return file;
	}

	public String getDir() {
		return dir;
	}

	public String getOutput() {
		return output;
	}

	public String getSolutionDir() {
		return solutionDir;
	}

	public ExecutionMode getMode() {
		return mode;
	}

	public Config getConfig() {
		return config;
	}

	public HashMap<String, String> getParameterSources() {
		return parameterSources;
	}

	// ========== PARAMETER FILE READING AND SOURCE TRACKING ==========

	private void initializeParameterSources() {
		parameterSources.put("alpha", "default");
		parameterSources.put("graspIterations", "default");
		parameterSources.put("seed", "default");
		parameterSources.put("conflictPenalty", "default");
		parameterSources.put("zeroWeightScore", "default");
		parameterSources.put("tuneIterations", "default");
		parameterSources.put("greedyStrategies", "default");
		parameterSources.put("hcIterations", "default");
		parameterSources.put("vndIterations", "default");
	}

	/**
	 * Read parameters from the parameters file (if it exists).
	 * Format: parameterName=value (one per line, # for comments)
	 */
	private void readParametersFile(String filename) {
		if (filename == null)
			return;

		File paramFile = new File(filename);
		if (!paramFile.exists()) {
			return;
		}

		System.out.println("Loading parameters from: " + filename);

		try (BufferedReader reader = new BufferedReader(new FileReader(paramFile))) {
			String line;
			int lineNumber = 0;

			while ((line = reader.readLine()) != null) {
				lineNumber++;
				line = line.trim();

				if (line.isEmpty() || line.startsWith("#")) {
					continue;
				}

				String[] parts = line.split("=", 2);
				if (parts.length != 2) {
					System.err.println("Warning: Invalid format at line " + lineNumber + ": " + line);
					continue;
				}

				applyParameter(parts[0].trim(), parts[1].trim(), paramFile.getName());
			}
		} catch (IOException e) {
			System.err.println("Warning: Error reading " + filename + ": " + e.getMessage());
		}
	}

	/**
	 * Apply a parameter from file or CLI. Invalid values keep the previous setting.
	 */
	private void applyParameter(String key, String value, String source) {
		try {
			switch (key) {
				case "alpha":
					config.setAlpha(Double.parseDouble(value));
					break;
				case "graspIterations":
					config.setGraspIterations(Integer.parseInt(value));
					break;
				case "seed":
					config.setSeed(Long.parseLong(value));
					break;
				case "conflictPenalty":
					config.setConflictPenaltyCoefficient(Double.parseDouble(value));
					break;
				case "zeroWeightScore":
					config.setZeroWeightScore(Double.parseDouble(value));
					break;
				case "tuneIterations":
					config.setTuneIterations(Integer.parseInt(value));
					break;
				case "hcIterations":
					config.setHcMaxIterations(Integer.parseInt(value));
					break;
				case "vndIterations":
					config.setVndMaxIterations(Integer.parseInt(value));
					break;
				case "greedyStrategies":
					parseGreedyStrategies(value, source);
					return;
				default:
					System.err.println("Warning: Unknown parameter '" + key + "' in " + source);
					return;
			}
			parameterSources.put(key, source);
		} catch (NumberFormatException e) {
			System.err.println("Warning: Invalid value for parameter '" + key + "': " + value);
		} catch (IllegalArgumentException e) {
			System.err.println("Warning: Rejected value for parameter '" + key + "': " + e.getMessage());
		}
	}

	/**
	 * Parse comma-separated list of greedy strategies
	 * Format: MaxProfit,MinWeight,MaxProfitWeight,MinConflicts
	 */
	private void parseGreedyStrategies(String value, String source) {
		List<GreedyStrategy> strategies = new ArrayList<>();

		for (String part : value.split(",")) {
			String trimmed = part.trim();
			try {
				strategies.add(GreedyStrategy.valueOf(trimmed));
			} catch (IllegalArgumentException e) {
				System.err.println("Warning: Unknown greedy strategy '" + trimmed + "' in " + source);
				System.err.println("  Valid strategies: " + Arrays.toString(GreedyStrategy.values()));
			}
		}

		if (!strategies.isEmpty()) {
			config.setGreedyStrategies(strategies.toArray(new GreedyStrategy[0]));
			parameterSources.put("greedyStrategies", source);
		}
	}

}
