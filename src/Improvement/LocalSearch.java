package Improvement;

import java.text.DecimalFormat;
import java.util.List;

import Data.Instance;
import Solution.Solution;
import Solution.Validator;

/**
 * Best-improvement descent over the DCKP neighborhoods.
 *
 * Subclasses decide which neighborhoods are explored and in what order. Every
 * accepted move strictly increases profit, so a search never revisits a
 * solution and always terminates.
 */
public abstract class LocalSearch
{
	protected Instance instance;
	protected Validator validator;
	protected Neighborhoods neighborhoods;

	// ----------Metrics------------
	protected int iterations;
	protected int improvements;

	// ---------Print----------
	protected boolean print = true;
	protected DecimalFormat deci = new DecimalFormat("0.0000");

	public LocalSearch(Instance instance)
	{
		this.instance = instance;
		this.validator = new Validator(instance);
		this.neighborhoods = new Neighborhoods(instance, validator);
	}

	/**
	 * Refines a copy of initialSolution; the argument is never modified.
	 */
	public abstract Solution solve(Solution initialSolution, int maxIterations);

	public abstract int getDefaultMaxIterations();

	public Solution solve(Solution initialSolution)
	{
		return solve(initialSolution, getDefaultMaxIterations());
	}

	/**
	 * @return the move of largest profit gain among those strictly improving on
	 *         current (the first one on ties), or null when none improves
	 */
	public Move findBestMove(Solution current, List<Move> moves)
	{
		Move best = null;
		int bestDelta = 0;
		for (Move move : moves)
		{
			int delta = move.profitDelta(instance);
			if (delta > bestDelta)
			{
				best = move;
				bestDelta = delta;
			}
		}
		return best;
	}

	/**
	 * Best improving neighbor of current in the given neighborhood.
	 *
	 * @return the neighbor, or null at a local optimum of that neighborhood
	 */
	public Solution findBestNeighbor(Solution current, NeighborhoodType type)
	{
		Move best = findBestMove(current, neighborhoods.generate(type, current));
		if (best == null)
			return null;
		return best.apply(current, instance);
	}

	protected static void checkIterations(int maxIterations)
	{
		if (maxIterations < 0)
			throw new IllegalArgumentException("maxIterations must be >= 0, got " + maxIterations);
	}

	public int getIterations()
	{
		return iterations;
	}

	public int getImprovements()
	{
		return improvements;
	}

	public Neighborhoods getNeighborhoods()
	{
		return neighborhoods;
	}

	public boolean isPrint()
	{
		return print;
	}

	public void setPrint(boolean print)
	{
		this.print = print;
	}
}
