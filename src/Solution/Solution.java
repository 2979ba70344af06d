package Solution;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.DecimalFormat;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Candidate DCKP solution: the selected items with incrementally maintained
 * profit and weight.
 *
 * The feasible flag is only authoritative after {@link Validator#validate(Solution)}.
 * Search components never share a Solution; neighbors are built with
 * {@link #copy()}.
 */
public class Solution implements Comparable<Solution>
{
	private final TreeSet<Integer> selectedItems;
	int totalProfit;
	int totalWeight;
	boolean feasible;
	double computationTime;
	String methodName;

	public Solution()
	{
		this.selectedItems = new TreeSet<Integer>();
		this.totalProfit = 0;
		this.totalWeight = 0;
		this.feasible = true;
		this.computationTime = 0.0;
		this.methodName = "Unknown";
	}

	public Solution(Solution reference)
	{
		this.selectedItems = new TreeSet<Integer>(reference.selectedItems);
		this.totalProfit = reference.totalProfit;
		this.totalWeight = reference.totalWeight;
		this.feasible = reference.feasible;
		this.computationTime = reference.computationTime;
		this.methodName = reference.methodName;
	}

	public Solution copy()
	{
		return new Solution(this);
	}

	/**
	 * Adds the item and its contribution. Adding an item already present is a no-op.
	 */
	public void addItem(int item, int profit, int weight)
	{
		if (selectedItems.add(item))
		{
			totalProfit += profit;
			totalWeight += weight;
		}
	}

	/**
	 * Removes the item and its contribution. Removing an absent item is a no-op.
	 */
	public void removeItem(int item, int profit, int weight)
	{
		if (selectedItems.remove(item))
		{
			totalProfit -= profit;
			totalWeight -= weight;
		}
	}

	public boolean hasItem(int item)
	{
		return selectedItems.contains(item);
	}

	public int size()
	{
		return selectedItems.size();
	}

	public boolean isEmpty()
	{
		return selectedItems.isEmpty();
	}

	public void clear()
	{
		selectedItems.clear();
		totalProfit = 0;
		totalWeight = 0;
		feasible = true;
		computationTime = 0.0;
	}

	/**
	 * @return read-only view of the selected items in ascending order
	 */
	public Set<Integer> getSelectedItems()
	{
		return Collections.unmodifiableSet(selectedItems);
	}

	public int[] toArray()
	{
		int items[] = new int[selectedItems.size()];
		int i = 0;
		for (int item : selectedItems)
			items[i++] = item;
		return items;
	}

	public int getTotalProfit()
	{
		return totalProfit;
	}

	public int getTotalWeight()
	{
		return totalWeight;
	}

	public boolean isFeasible()
	{
		return feasible;
	}

	public void setFeasible(boolean feasible)
	{
		this.feasible = feasible;
	}

	public double getComputationTime()
	{
		return computationTime;
	}

	public void setComputationTime(double computationTime)
	{
		this.computationTime = computationTime;
	}

	public String getMethodName()
	{
		return methodName;
	}

	public void setMethodName(String methodName)
	{
		this.methodName = methodName;
	}

	// ------------------------Output-------------------------

	/**
	 * Writes the solution file: "profit weight count" followed by the 1-based items.
	 */
	public void printSolution(Path file) throws IOException
	{
		Path parent = file.toAbsolutePath().getParent();
		if (parent != null)
			Files.createDirectories(parent);

		try (PrintWriter out = new PrintWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8)))
		{
			out.println(totalProfit + " " + totalWeight + " " + selectedItems.size());
			StringBuilder items = new StringBuilder();
			for (int item : selectedItems)
				items.append(item + 1).append(' ');
			out.println(items.toString().trim());
		}
	}

	@Override
	public int compareTo(Solution other)
	{
		return Integer.compare(totalProfit, other.totalProfit);
	}

	@Override
	public String toString()
	{
		DecimalFormat deci = new DecimalFormat("0.0000");
		return "[" + methodName + "] "
				+ "Profit=" + totalProfit
				+ ", Weight=" + totalWeight
				+ ", Items=" + selectedItems.size()
				+ ", " + (feasible ? "Feasible" : "Infeasible")
				+ ", " + deci.format(computationTime) + "s";
	}
}
