package Data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable DCKP instance: item profits and weights, knapsack capacity and the
 * conflict graph.
 *
 * The conflict relation is kept as one ascending, duplicate-free adjacency array
 * per item, so {@link #hasConflict(int, int)} is a binary search on the shorter
 * of the two arrays.
 */
public class Instance
{
	private final String name;
	private final int numItems;
	private final int capacity;
	private final int profits[];
	private final int weights[];
	private final int conflictGraph[][];
	private final List<int[]> conflicts;

	public Instance(String name, int capacity, int profits[], int weights[], List<int[]> conflictPairs)
	{
		if (profits == null || weights == null)
			throw new IllegalArgumentException("profits and weights must not be null");
		if (profits.length <= 0)
			throw new IllegalArgumentException("Instance must contain at least one item");
		if (profits.length != weights.length)
			throw new IllegalArgumentException("profits (" + profits.length + ") and weights (" + weights.length
					+ ") differ in length");
		if (capacity <= 0)
			throw new IllegalArgumentException("capacity must be > 0, got " + capacity);

		this.name = name == null ? "unnamed" : name;
		this.numItems = profits.length;
		this.capacity = capacity;
		this.profits = profits.clone();
		this.weights = weights.clone();

		for (int i = 0; i < numItems; i++)
		{
			if (this.profits[i] < 0 || this.weights[i] < 0)
				throw new IllegalArgumentException("Item " + i + " has a negative profit or weight");
		}

		this.conflicts = new ArrayList<int[]>();
		this.conflictGraph = buildConflictGraph(conflictPairs == null ? Collections.<int[]>emptyList() : conflictPairs);
	}

	private int[][] buildConflictGraph(List<int[]> conflictPairs)
	{
		int degree[] = new int[numItems];
		for (int[] pair : conflictPairs)
		{
			if (pair.length != 2)
				throw new IllegalArgumentException("Conflict pair must have two items: " + Arrays.toString(pair));
			int a = pair[0];
			int b = pair[1];
			if (a < 0 || a >= numItems || b < 0 || b >= numItems)
				throw new IllegalArgumentException("Conflict pair out of range: " + a + " " + b);
			if (a == b)
				continue;
			degree[a]++;
			degree[b]++;
		}

		int adjacency[][] = new int[numItems][];
		int fill[] = new int[numItems];
		for (int i = 0; i < numItems; i++)
			adjacency[i] = new int[degree[i]];

		for (int[] pair : conflictPairs)
		{
			if (pair[0] == pair[1])
				continue;
			adjacency[pair[0]][fill[pair[0]]++] = pair[1];
			adjacency[pair[1]][fill[pair[1]]++] = pair[0];
		}

		// sort and drop repeated pairs
		for (int i = 0; i < numItems; i++)
		{
			int adj[] = adjacency[i];
			Arrays.sort(adj);
			int unique = 0;
			for (int j = 0; j < adj.length; j++)
			{
				if (unique == 0 || adj[unique - 1] != adj[j])
					adj[unique++] = adj[j];
			}
			adjacency[i] = unique == adj.length ? adj : Arrays.copyOf(adj, unique);

			for (int j = 0; j < adjacency[i].length; j++)
			{
				if (i < adjacency[i][j])
					conflicts.add(new int[] { i, adjacency[i][j] });
			}
		}
		return adjacency;
	}

	public boolean hasConflict(int item1, int item2)
	{
		if (item1 < 0 || item1 >= numItems || item2 < 0 || item2 >= numItems)
			return false;

		int adj[];
		int target;
		if (conflictGraph[item1].length <= conflictGraph[item2].length)
		{
			adj = conflictGraph[item1];
			target = item2;
		}
		else
		{
			adj = conflictGraph[item2];
			target = item1;
		}
		return Arrays.binarySearch(adj, target) >= 0;
	}

	public int getConflictDegree(int item)
	{
		return conflictGraph[item].length;
	}

	public int[] getConflicts(int item)
	{
		return conflictGraph[item].clone();
	}

	/**
	 * @return number of distinct conflicting pairs
	 */
	public int getNumConflicts()
	{
		return conflicts.size();
	}

	public List<int[]> getConflictPairs()
	{
		List<int[]> copy = new ArrayList<int[]>(conflicts.size());
		for (int[] pair : conflicts)
			copy.add(pair.clone());
		return copy;
	}

	/**
	 * Percentage of item pairs that are in conflict, in [0, 100].
	 */
	public double getConflictDensity()
	{
		if (numItems <= 1)
			return 0.0;
		return (200.0 * conflicts.size()) / ((double) numItems * (numItems - 1));
	}

	public int getProfit(int item)
	{
		return profits[item];
	}

	public int getWeight(int item)
	{
		return weights[item];
	}

	public int[] getProfits()
	{
		return profits.clone();
	}

	public int[] getWeights()
	{
		return weights.clone();
	}

	public int getNumItems()
	{
		return numItems;
	}

	public int getCapacity()
	{
		return capacity;
	}

	public String getName()
	{
		return name;
	}

	@Override
	public String toString()
	{
		int minProfit = Integer.MAX_VALUE, maxProfit = Integer.MIN_VALUE;
		int minWeight = Integer.MAX_VALUE, maxWeight = Integer.MIN_VALUE;
		double sumProfit = 0, sumWeight = 0;
		for (int i = 0; i < numItems; i++)
		{
			minProfit = Math.min(minProfit, profits[i]);
			maxProfit = Math.max(maxProfit, profits[i]);
			minWeight = Math.min(minWeight, weights[i]);
			maxWeight = Math.max(maxWeight, weights[i]);
			sumProfit += profits[i];
			sumWeight += weights[i];
		}

		return String.format(java.util.Locale.US,
				"Instance %s: n=%d, W=%d, conflicts=%d (%.2f%%)"
						+ "\n  Profit: [%d-%d], avg=%.2f"
						+ "\n  Weight: [%d-%d], avg=%.2f",
				name, numItems, capacity, conflicts.size(), getConflictDensity(),
				minProfit, maxProfit, sumProfit / numItems,
				minWeight, maxWeight, sumWeight / numItems);
	}
}
