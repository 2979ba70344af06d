package SearchMethod;

import java.io.File;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import Constructive.GRASP;
import Constructive.Greedy;
import Data.Instance;
import Data.InstanceReader;
import Improvement.HillClimbing;
import Improvement.VND;
import Solution.Solution;

/**
 * Experiment driver: Greedy strategies, GRASP multi-start, then Hill Climbing
 * and VND seeded with the GRASP solution.
 */
public class DCKPSolver {
	Config config;
	private Solution lastBest;
	boolean print = true;
	DecimalFormat deci = new DecimalFormat("0.0000");

	public DCKPSolver(Config config) {
		this.config = config;
	}

	/**
	 * Runs every method on one instance.
	 *
	 * @return one result per method, in execution order
	 */
	public List<ExperimentResult> processInstance(Instance instance) {
		List<ExperimentResult> results = new ArrayList<ExperimentResult>();
		String instanceName = instance.getName();

		if (print) {
			System.out.println("\n========================================");
			System.out.println("[DCKP] Processing: " + instanceName);
			System.out.println("========================================");
			System.out.println(instance);
		}

		Greedy greedy = new Greedy(instance);
		greedy.setPrint(print);
		for (Solution s : greedy.constructAll(config.getGreedyStrategies()))
			results.add(new ExperimentResult(instanceName, s));

		GRASP grasp = new GRASP(instance, config);
		grasp.setPrint(print);
		Solution graspSolution = grasp.solve(config.getGraspIterations(), config.getAlpha());
		results.add(new ExperimentResult(instanceName, graspSolution));

		HillClimbing hillClimbing = new HillClimbing(instance);
		hillClimbing.setPrint(print);
		Solution hcSolution = hillClimbing.solve(graspSolution, config.getHcMaxIterations());
		results.add(new ExperimentResult(instanceName, hcSolution));

		VND vnd = new VND(instance);
		vnd.setPrint(print);
		Solution vndSolution = vnd.solve(graspSolution, config.getVndMaxIterations());
		results.add(new ExperimentResult(instanceName, vndSolution));

		lastBest = bestOf(hcSolution, vndSolution, graspSolution);

		if (print) {
			ExperimentResult best = Collections.max(results, (r1, r2) -> Integer.compare(r1.profit, r2.profit));
			System.out.println("[DCKP] Best method: " + best.method + " value: " + best.profit);
		}
		return results;
	}

	private static Solution bestOf(Solution... solutions) {
		Solution best = null;
		for (Solution s : solutions) {
			if (s.isFeasible() && (best == null || s.getTotalProfit() > best.getTotalProfit()))
				best = s;
		}
		return best;
	}

	/**
	 * @return best feasible refined solution of the last processInstance call
	 */
	public Solution getLastBest() {
		return lastBest;
	}

	/**
	 * Processes every regular file of the directory, in name order. Files that
	 * fail to load are reported and skipped.
	 */
	public List<ExperimentResult> processDirectory(Path directory, Path solutionDir) throws IOException {
		List<Path> files = new ArrayList<Path>();
		try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
			for (Path entry : stream) {
				if (Files.isRegularFile(entry))
					files.add(entry);
			}
		}
		Collections.sort(files);

		long start = System.currentTimeMillis();
		List<ExperimentResult> all = new ArrayList<ExperimentResult>();
		int failed = 0;
		for (Path file : files) {
			Instance instance;
			try {
				instance = InstanceReader.read(file);
			} catch (IOException e) {
				System.err.println("[DCKP] Failed to load " + file + ": " + e.getMessage());
				failed++;
				continue;
			}
			all.addAll(processInstance(instance));
			saveBest(instance, solutionDir);
		}

		if (print) {
			System.out.println("\n[DCKP] Directory done: " + files.size() + " files, " + failed + " failed, "
					+ all.size() + " results, time: "
					+ deci.format((System.currentTimeMillis() - start) / 1000.0) + "s");
		}
		return all;
	}

	void saveBest(Instance instance, Path solutionDir) throws IOException {
		if (solutionDir == null || lastBest == null)
			return;
		Path solutionFile = solutionDir.resolve(instance.getName() + ".sol");
		lastBest.printSolution(solutionFile);
		if (print)
			System.out.println("[DCKP] Solution saved to: " + solutionFile);
	}

	/**
	 * Alpha calibration: one GRASP multi-start per alpha in {0.0, 0.1, ..., 1.0}.
	 */
	public List<ExperimentResult> tune(Instance instance) {
		GRASP grasp = new GRASP(instance, config);
		grasp.setPrint(print);
		List<ExperimentResult> results = new ArrayList<ExperimentResult>();
		for (Solution s : grasp.tuneAlpha(config.getTuneIterations()))
			results.add(new ExperimentResult(instance.getName(), s));
		return results;
	}

	public boolean isPrint() {
		return print;
	}

	public void setPrint(boolean print) {
		this.print = print;
	}

	public static void main(String[] args) {
		InputParameters reader = new InputParameters();
		reader.readingInput(args);

		DCKPSolver solver = new DCKPSolver(reader.getConfig());
		Path solutionDir = reader.getSolutionDir().isEmpty() ? null : Paths.get(reader.getSolutionDir());

		try {
			switch (reader.getMode()) {
				case single: {
					if (reader.getFile().isEmpty()) {
						System.err.println("Usage: -mode single -file <instance> [-output <csv>]");
						System.exit(1);
					}
					Instance instance = InstanceReader.read(Paths.get(reader.getFile()));
					List<ExperimentResult> results = solver.processInstance(instance);
					solver.saveBest(instance, solutionDir);
					Path output = outputPath(reader, "results" + File.separator + "single_" + instance.getName() + ".csv");
					ResultsWriter.write(results, output);
					System.out.println("Results saved to: " + output);
					break;
				}
				case batch: {
					if (reader.getDir().isEmpty()) {
						System.err.println("Usage: -mode batch -dir <directory> [-output <csv>]");
						System.exit(1);
					}
					List<ExperimentResult> results = solver.processDirectory(Paths.get(reader.getDir()), solutionDir);
					Path output = outputPath(reader, "results" + File.separator + "results.csv");
					ResultsWriter.write(results, output);
					System.out.println("Results saved to: " + output);
					break;
				}
				case tune: {
					if (reader.getFile().isEmpty()) {
						System.err.println("Usage: -mode tune -file <instance> [-output <csv>]");
						System.exit(1);
					}
					Instance instance = InstanceReader.read(Paths.get(reader.getFile()));
					List<ExperimentResult> results = solver.tune(instance);
					Path output = outputPath(reader, "results" + File.separator + "alpha_tuning.csv");
					ResultsWriter.write(results, output);
					System.out.println("Results saved to: " + output);
					break;
				}
			}
		} catch (IOException e) {
			System.err.println("Error during execution: " + e.getMessage());
			System.exit(1);
		}
	}

	private static Path outputPath(InputParameters reader, String fallback) {
		return Paths.get(reader.getOutput().isEmpty() ? fallback : reader.getOutput());
	}
}
