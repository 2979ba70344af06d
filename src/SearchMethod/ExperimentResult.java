package SearchMethod;

import Solution.Solution;

/**
 * One line of the results CSV.
 */
public class ExperimentResult
{
	public final String instanceName;
	public final String method;
	public final int profit;
	public final int weight;
	public final int numItems;
	public final double time;
	public final boolean feasible;

	public ExperimentResult(String instanceName, Solution solution)
	{
		this.instanceName = instanceName;
		this.method = solution.getMethodName();
		this.profit = solution.getTotalProfit();
		this.weight = solution.getTotalWeight();
		this.numItems = solution.size();
		this.time = solution.getComputationTime();
		this.feasible = solution.isFeasible();
	}

	@Override
	public String toString()
	{
		return instanceName + " " + method + " " + profit;
	}
}
