package Constructive;

import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import Data.Instance;
import Solution.Solution;
import Solution.Validator;

/**
 * Single-pass greedy constructor: sorts all items by a {@link GreedyStrategy}
 * and inserts each one that still fits and has no conflict.
 */
public class Greedy
{
	Instance instance;
	Validator validator;

	boolean print = true;
	DecimalFormat deci = new DecimalFormat("0.0000");

	public Greedy(Instance instance)
	{
		this.instance = instance;
		this.validator = new Validator(instance);
	}

	public List<Integer> sortItemsByStrategy(GreedyStrategy strategy)
	{
		List<Candidate> scores = new ArrayList<Candidate>(instance.getNumItems());
		for (int i = 0; i < instance.getNumItems(); i++)
			scores.add(new Candidate(i, strategy.score(instance, i)));

		Collections.sort(scores, (c1, c2) -> Double.compare(c2.score, c1.score));

		List<Integer> order = new ArrayList<Integer>(scores.size());
		for (Candidate c : scores)
			order.add(c.item);
		return order;
	}

	public Solution construct(GreedyStrategy strategy)
	{
		long start = System.nanoTime();

		Solution solution = new Solution();
		solution.setMethodName("Greedy_" + strategy);

		for (int item : sortItemsByStrategy(strategy))
		{
			if (!validator.checkCapacity(solution.getTotalWeight(), instance.getWeight(item)))
				continue;

			if (!validator.checkConflicts(item, solution.getSelectedItems()))
				continue;

			solution.addItem(item, instance.getProfit(item), instance.getWeight(item));
		}

		validator.validate(solution);
		solution.setComputationTime((System.nanoTime() - start) / 1e9);

		if (print)
			System.out.println("[Greedy] " + strategy + ": value=" + solution.getTotalProfit()
					+ " items=" + solution.size()
					+ " time=" + deci.format(solution.getComputationTime()) + "s");

		return solution;
	}

	public List<Solution> constructAll()
	{
		return constructAll(GreedyStrategy.values());
	}

	public List<Solution> constructAll(GreedyStrategy[] strategies)
	{
		List<Solution> solutions = new ArrayList<Solution>(strategies.length);
		Solution best = null;
		for (GreedyStrategy strategy : strategies)
		{
			Solution s = construct(strategy);
			solutions.add(s);
			if (best == null || s.getTotalProfit() > best.getTotalProfit())
				best = s;
		}

		if (print && best != null)
			System.out.println("[Greedy] best: " + best.getMethodName() + " = " + best.getTotalProfit());

		return solutions;
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
