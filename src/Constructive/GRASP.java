package Constructive;

import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Random;

import Data.Instance;
import SearchMethod.Config;
import Solution.Solution;
import Solution.Validator;

/**
 * Construction phase of GRASP for the DCKP.
 *
 * Each step scores every item that still fits and conflicts with nothing
 * selected, keeps those within alpha of the best score (the Restricted
 * Candidate List) and adds one of them uniformly at random. alpha=0 is pure
 * greedy, alpha=1 a uniform pick among all feasible items.
 *
 * The random stream is owned by this object and keeps advancing across calls;
 * {@link #setSeed(long)} restarts it.
 */
public class GRASP
{
	public static final long DEFAULT_SEED = 42;

	private static final double[] TUNING_ALPHAS = { 0.0, 0.1, 0.2, 0.3, 0.4, 0.5, 0.6, 0.7, 0.8, 0.9, 1.0 };

	private static final Comparator<Candidate> BY_SCORE_DESC = new Comparator<Candidate>()
	{
		@Override
		public int compare(Candidate c1, Candidate c2)
		{
			return Double.compare(c2.score, c1.score);
		}
	};

	Instance instance;
	Validator validator;
	Random rand;

	double conflictPenaltyCoefficient;
	double zeroWeightScore;

	// item order of the last constructSolution call
	private List<Integer> lastSelectionSequence = new ArrayList<Integer>();

	// ---------Print----------
	boolean print = true;
	DecimalFormat deci = new DecimalFormat("0.0000");

	public GRASP(Instance instance)
	{
		this(instance, DEFAULT_SEED);
	}

	public GRASP(Instance instance, long seed)
	{
		this(instance, seed, new Config());
	}

	public GRASP(Instance instance, Config config)
	{
		this(instance, config.getSeed(), config);
	}

	private GRASP(Instance instance, long seed, Config config)
	{
		this.instance = instance;
		this.validator = new Validator(instance);
		this.rand = new Random(seed);
		this.conflictPenaltyCoefficient = config.getConflictPenaltyCoefficient();
		this.zeroWeightScore = config.getZeroWeightScore();
	}

	/**
	 * Profit/weight ratio discounted by 1 / (1 + c * conflicts), where conflicts
	 * counts the selected items clashing with item plus the item's degree in the
	 * conflict graph.
	 */
	public double score(int item, Solution partialSolution)
	{
		double baseScore;
		if (instance.getWeight(item) > 0)
			baseScore = (double) instance.getProfit(item) / instance.getWeight(item);
		else
			baseScore = zeroWeightScore;

		int conflictCount = 0;
		for (int selected : partialSolution.getSelectedItems())
		{
			if (instance.hasConflict(item, selected))
				conflictCount++;
		}
		conflictCount += instance.getConflictDegree(item);

		double penaltyFactor = 1.0 / (1.0 + conflictPenaltyCoefficient * conflictCount);
		return baseScore * penaltyFactor;
	}

	/**
	 * @return items scoring at least max - alpha * (max - min), best first; empty
	 *         when nothing can be added to partialSolution
	 */
	public List<Integer> buildRCL(Solution partialSolution, double alpha)
	{
		checkAlpha(alpha);

		List<Candidate> candidates = new ArrayList<Candidate>(instance.getNumItems() - partialSolution.size());
		for (int i = 0; i < instance.getNumItems(); i++)
		{
			if (partialSolution.hasItem(i))
				continue;

			if (!validator.checkCapacity(partialSolution.getTotalWeight(), instance.getWeight(i)))
				continue;

			if (!validator.checkConflicts(i, partialSolution.getSelectedItems()))
				continue;

			candidates.add(new Candidate(i, score(i, partialSolution)));
		}

		if (candidates.isEmpty())
			return new ArrayList<Integer>();

		// stable: equal scores keep item order
		Collections.sort(candidates, BY_SCORE_DESC);

		double maxScore = candidates.get(0).score;
		double minScore = candidates.get(candidates.size() - 1).score;
		// endpoints exact, the formula can round past minScore at alpha=1
		double threshold;
		if (alpha == 0.0)
			threshold = maxScore;
		else if (alpha == 1.0)
			threshold = minScore;
		else
			threshold = maxScore - alpha * (maxScore - minScore);

		List<Integer> rcl = new ArrayList<Integer>(candidates.size());
		for (Candidate candidate : candidates)
		{
			if (candidate.score >= threshold)
				rcl.add(candidate.item);
		}
		return rcl;
	}

	/**
	 * @return a uniformly drawn item of rcl, or -1 when rcl is empty
	 */
	public int selectFromRCL(List<Integer> rcl)
	{
		if (rcl.isEmpty())
			return -1;
		return rcl.get(rand.nextInt(rcl.size()));
	}

	/**
	 * Builds one solution from scratch, then validates it.
	 */
	public Solution constructSolution(double alpha)
	{
		checkAlpha(alpha);
		long start = System.nanoTime();

		Solution solution = new Solution();
		solution.setMethodName("GRASP_alpha" + formatAlpha(alpha));
		lastSelectionSequence = new ArrayList<Integer>();

		while (true)
		{
			List<Integer> rcl = buildRCL(solution, alpha);
			if (rcl.isEmpty())
				break;

			int selectedItem = selectFromRCL(rcl);
			if (selectedItem == -1)
				break;

			solution.addItem(selectedItem, instance.getProfit(selectedItem), instance.getWeight(selectedItem));
			lastSelectionSequence.add(selectedItem);
		}

		validator.validate(solution);
		solution.setComputationTime((System.nanoTime() - start) / 1e9);
		return solution;
	}

	/**
	 * Multi-start: runs constructSolution iterations times and keeps the feasible
	 * solution with the highest profit (the first one on ties).
	 */
	public Solution solve(int iterations, double alpha)
	{
		if (iterations < 1)
			throw new IllegalArgumentException("iterations must be >= 1");
		checkAlpha(alpha);

		if (print)
			System.out.println("[GRASP] Multi-start alpha=" + formatAlpha(alpha) + " iterations=" + iterations);

		long start = System.nanoTime();

		Solution bestSolution = null;
		double totalProfitSum = 0.0;
		int validSolutions = 0;

		for (int iter = 0; iter < iterations; iter++)
		{
			Solution current = constructSolution(alpha);

			if (!current.isFeasible())
				continue;

			validSolutions++;
			totalProfitSum += current.getTotalProfit();

			if (bestSolution == null || current.getTotalProfit() > bestSolution.getTotalProfit())
			{
				bestSolution = current;
				if (print)
					System.out.println("[GRASP] iter:" + (iter + 1) + " | new best: " + current.getTotalProfit());
			}
		}

		double totalTime = (System.nanoTime() - start) / 1e9;

		if (bestSolution == null)
		{
			bestSolution = new Solution();
			bestSolution.setFeasible(false);
		}
		bestSolution.setComputationTime(totalTime);
		bestSolution.setMethodName("GRASP_MultiStart_" + iterations + "_alpha" + formatAlpha(alpha));

		double avgProfit = validSolutions > 0 ? totalProfitSum / validSolutions : 0.0;

		if (print)
			System.out.println("[GRASP] best: " + bestSolution.getTotalProfit()
					+ " avg: " + deci.format(avgProfit)
					+ " valid: " + validSolutions + "/" + iterations
					+ " time: " + deci.format(totalTime) + "s");

		return bestSolution;
	}

	/**
	 * Runs {@link #solve(int, double)} for alpha = 0.0, 0.1, ..., 1.0.
	 *
	 * @return best solution per alpha, in alpha order
	 */
	public List<Solution> tuneAlpha(int iterations)
	{
		List<Solution> results = new ArrayList<Solution>(TUNING_ALPHAS.length);
		for (double alpha : TUNING_ALPHAS)
			results.add(solve(iterations, alpha));

		int best = 0;
		for (int i = 1; i < results.size(); i++)
		{
			if (results.get(i).getTotalProfit() > results.get(best).getTotalProfit())
				best = i;
		}

		if (print)
		{
			System.out.println("\n=== Alpha calibration ===");
			for (int i = 0; i < TUNING_ALPHAS.length; i++)
			{
				System.out.println("  alpha " + formatAlpha(TUNING_ALPHAS[i]) + ": " + results.get(i).getTotalProfit()
						+ (i == best ? " <- BEST" : ""));
			}
			System.out.println("=========================\n");
		}
		return results;
	}

	public static double[] getTuningAlphas()
	{
		return TUNING_ALPHAS.clone();
	}

	public void setSeed(long seed)
	{
		rand.setSeed(seed);
	}

	public List<Integer> getLastSelectionSequence()
	{
		return Collections.unmodifiableList(lastSelectionSequence);
	}

	public boolean isPrint()
	{
		return print;
	}

	public void setPrint(boolean print)
	{
		this.print = print;
	}

	private static void checkAlpha(double alpha)
	{
		if (alpha < 0 || alpha > 1 || Double.isNaN(alpha))
			throw new IllegalArgumentException("alpha must be in [0,1], got " + alpha);
	}

	private static String formatAlpha(double alpha)
	{
		return String.format(Locale.US, "%.2f", alpha);
	}
}
