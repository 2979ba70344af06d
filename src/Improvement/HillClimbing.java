package Improvement;

import Data.Instance;
import Solution.Solution;

/**
 * Steepest-ascent hill climbing on the Swap(1-1) neighborhood.
 */
public class HillClimbing extends LocalSearch
{
	public static final int DEFAULT_MAX_ITERATIONS = 100;

	public HillClimbing(Instance instance)
	{
		super(instance);
	}

	/**
	 * Moves to the best improving swap until none exists or maxIterations moves
	 * have been accepted.
	 */
	@Override
	public Solution solve(Solution initialSolution, int maxIterations)
	{
		checkIterations(maxIterations);
		long start = System.nanoTime();

		Solution current = initialSolution.copy();
		current.setMethodName("HillClimbing");

		iterations = 0;
		improvements = 0;

		while (iterations < maxIterations)
		{
			Solution bestNeighbor = findBestNeighbor(current, NeighborhoodType.Swap11);
			if (bestNeighbor == null)
				break; // local optimum

			current = bestNeighbor;
			improvements++;
			iterations++;
		}

		validator.validate(current);
		current.setComputationTime((System.nanoTime() - start) / 1e9);

		if (print)
			System.out.println("[HC] value: " + current.getTotalProfit()
					+ " iterations: " + iterations
					+ " improvements: " + improvements
					+ " time: " + deci.format(current.getComputationTime()) + "s");

		return current;
	}

	@Override
	public int getDefaultMaxIterations()
	{
		return DEFAULT_MAX_ITERATIONS;
	}
}
