package Constructive;

import Data.Instance;

/**
 * Ranking criteria for the single-pass greedy constructor. Higher score is
 * inserted first.
 */
public enum GreedyStrategy
{
	MaxProfit,       // highest profit
	MinWeight,       // lightest item
	MaxProfitWeight, // best profit/weight ratio
	MinConflicts;    // fewest conflicts in the graph

	public double score(Instance instance, int item)
	{
		switch(this)
		{
			case MaxProfit:
				return instance.getProfit(item);
			case MinWeight:
				return -instance.getWeight(item);
			case MaxProfitWeight:
				if(instance.getWeight(item) == 0)
					return instance.getProfit(item) * 1000.0;
				return (double) instance.getProfit(item) / instance.getWeight(item);
			case MinConflicts:
				return -instance.getConflictDegree(item);
			default:
				return 0.0;
		}
	}
}
