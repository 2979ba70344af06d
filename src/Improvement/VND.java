package Improvement;

import java.util.EnumMap;
import java.util.Map;

import Data.Instance;
import Solution.Solution;

/**
 * Variable Neighborhood Descent over N1 (Add/Drop), N2 (Swap 1-1) and
 * N3 (Swap 2-1).
 *
 * An improvement in any neighborhood restarts the descent from N1; failing in
 * N3 means the solution is a local optimum for all three. Each neighborhood
 * exploration uses one unit of the iteration budget.
 */
public class VND extends LocalSearch
{
	public static final int DEFAULT_MAX_ITERATIONS = 1000;

	private final Map<NeighborhoodType, Integer> improvementsByNeighborhood =
			new EnumMap<NeighborhoodType, Integer>(NeighborhoodType.class);

	public VND(Instance instance)
	{
		super(instance);
	}

	@Override
	public Solution solve(Solution initialSolution, int maxIterations)
	{
		checkIterations(maxIterations);
		long start = System.nanoTime();

		Solution current = initialSolution.copy();
		current.setMethodName("VND");

		iterations = 0;
		improvements = 0;
		for (NeighborhoodType type : NeighborhoodType.values())
			improvementsByNeighborhood.put(type, 0);

		NeighborhoodType k = NeighborhoodType.AddDrop;
		while (k != null && iterations < maxIterations)
		{
			Solution bestNeighbor = findBestNeighbor(current, k);

			if (bestNeighbor != null)
			{
				current = bestNeighbor;
				improvementsByNeighborhood.put(k, improvementsByNeighborhood.get(k) + 1);
				improvements++;
				k = NeighborhoodType.AddDrop;
			}
			else
			{
				k = k.next();
			}
			iterations++;
		}

		validator.validate(current);
		current.setComputationTime((System.nanoTime() - start) / 1e9);

		if (print)
			System.out.println("[VND] value: " + current.getTotalProfit()
					+ " iterations: " + iterations
					+ " improvements: " + improvements
					+ " " + improvementsByNeighborhood
					+ " time: " + deci.format(current.getComputationTime()) + "s");

		return current;
	}

	/**
	 * @return accepted moves per neighborhood during the last solve
	 */
	public int getImprovements(NeighborhoodType type)
	{
		Integer count = improvementsByNeighborhood.get(type);
		return count == null ? 0 : count;
	}

	@Override
	public int getDefaultMaxIterations()
	{
		return DEFAULT_MAX_ITERATIONS;
	}
}
