package Solution;

import java.util.Set;

import Data.Instance;

/**
 * Capacity and conflict checks against an {@link Instance}.
 *
 * The incremental checks are pure. {@link #validate(Solution)} recomputes the
 * solution's metrics from scratch and sets its feasible flag; violations are
 * reported on stderr, never thrown.
 */
public class Validator
{
	private final Instance instance;

	public Validator(Instance instance)
	{
		this.instance = instance;
	}

	/**
	 * @return true if adding an item of itemWeight keeps the load within capacity
	 */
	public boolean checkCapacity(int currentWeight, int itemWeight)
	{
		return (long) currentWeight + itemWeight <= instance.getCapacity();
	}

	/**
	 * @return true if item conflicts with none of the selected items
	 */
	public boolean checkConflicts(int item, Set<Integer> selectedItems)
	{
		for (int selected : selectedItems)
		{
			if (instance.hasConflict(item, selected))
				return false;
		}
		return true;
	}

	/**
	 * Same as {@link #checkConflicts(int, Set)} but ignoring the items in excluded,
	 * i.e. the items a move takes out of the solution.
	 */
	public boolean checkConflicts(int item, Set<Integer> selectedItems, int... excluded)
	{
		for (int selected : selectedItems)
		{
			if (isExcluded(selected, excluded))
				continue;
			if (instance.hasConflict(item, selected))
				return false;
		}
		return true;
	}

	private static boolean isExcluded(int item, int[] excluded)
	{
		for (int e : excluded)
		{
			if (e == item)
				return true;
		}
		return false;
	}

	/**
	 * Full check of the solution. Running it twice on an unchanged solution
	 * leaves every field as the first call set it.
	 */
	public boolean validate(Solution solution)
	{
		recalculateMetrics(solution);

		boolean valid = true;

		if (solution.totalWeight > instance.getCapacity())
		{
			System.err.println("[Validator] Capacity exceeded: " + solution.totalWeight + " > "
					+ instance.getCapacity() + " (overrun " + (solution.totalWeight - instance.getCapacity()) + ")");
			valid = false;
		}

		int items[] = solution.toArray();
		for (int i = 0; i < items.length; i++)
		{
			if (items[i] < 0 || items[i] >= instance.getNumItems())
			{
				System.err.println("[Validator] Unknown item: " + (items[i] + 1));
				valid = false;
				continue;
			}
			for (int j = i + 1; j < items.length; j++)
			{
				if (instance.hasConflict(items[i], items[j]))
				{
					System.err.println("[Validator] Conflict: " + (items[i] + 1) + " <-> " + (items[j] + 1));
					valid = false;
				}
			}
		}

		solution.feasible = valid;
		return valid;
	}

	/**
	 * Recomputes profit and weight from the selected items, discarding any drift.
	 * Items outside the instance contribute nothing.
	 */
	public void recalculateMetrics(Solution solution)
	{
		int profit = 0, weight = 0;
		for (int item : solution.getSelectedItems())
		{
			if (item >= 0 && item < instance.getNumItems())
			{
				profit += instance.getProfit(item);
				weight += instance.getWeight(item);
			}
		}
		solution.totalProfit = profit;
		solution.totalWeight = weight;
	}

	/**
	 * Diagnostic summary of the solution. Does not modify it.
	 */
	public String validateDetailed(Solution solution)
	{
		int conflictCount = 0;
		int items[] = solution.toArray();
		for (int i = 0; i < items.length; i++)
		{
			for (int j = i + 1; j < items.length; j++)
			{
				if (instance.hasConflict(items[i], items[j]))
					conflictCount++;
			}
		}

		boolean capacityOk = solution.totalWeight <= instance.getCapacity();

		return "Items: " + items.length
				+ ", Weight: " + solution.totalWeight + "/" + instance.getCapacity()
				+ ", Profit: " + solution.totalProfit
				+ " | Capacity: " + (capacityOk ? "OK" : "VIOLATED")
				+ " | Conflicts: " + conflictCount
				+ " | " + ((capacityOk && conflictCount == 0) ? "FEASIBLE" : "INFEASIBLE");
	}

	public Instance getInstance()
	{
		return instance;
	}
}
