package Improvement;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import Data.Instance;
import Solution.Solution;
import Solution.Validator;

/**
 * Feasible move generation for the DCKP neighborhoods.
 *
 * Every generated move keeps the solution within capacity and conflict free,
 * provided the base solution is. Moves are listed in ascending item order.
 */
public class Neighborhoods
{
	private static final int MAX_SWAP21_CAPACITY = 1 << 16;

	private final Instance instance;
	private final Validator validator;

	public Neighborhoods(Instance instance, Validator validator)
	{
		this.instance = instance;
		this.validator = validator;
	}

	public List<Move> generate(NeighborhoodType type, Solution current)
	{
		switch (type)
		{
			case AddDrop:
				return addDrop(current);
			case Swap11:
				return swap11(current);
			case Swap21:
				return swap21(current);
			default:
				throw new IllegalArgumentException("Unknown neighborhood " + type);
		}
	}

	/**
	 * Materializes every move of the neighborhood as a new solution.
	 */
	public List<Solution> neighbors(NeighborhoodType type, Solution current)
	{
		List<Move> moves = generate(type, current);
		List<Solution> result = new ArrayList<Solution>(moves.size());
		for (Move move : moves)
			result.add(move.apply(current, instance));
		return result;
	}

	/**
	 * N1: Add for every unselected item that fits without conflict, Drop for
	 * every selected item.
	 */
	public List<Move> addDrop(Solution current)
	{
		Set<Integer> selected = current.getSelectedItems();
		List<Move> moves = new ArrayList<Move>(instance.getNumItems());

		for (int i = 0; i < instance.getNumItems(); i++)
		{
			if (current.hasItem(i))
				continue;
			if (!validator.checkCapacity(current.getTotalWeight(), instance.getWeight(i)))
				continue;
			if (!validator.checkConflicts(i, selected))
				continue;
			moves.add(Move.add(i));
		}

		for (int item : selected)
			moves.add(Move.drop(item));

		return moves;
	}

	/**
	 * N2: swap one selected item for one unselected item.
	 */
	public List<Move> swap11(Solution current)
	{
		Set<Integer> selected = current.getSelectedItems();
		int unselected[] = unselectedItems(current);
		List<Move> moves = new ArrayList<Move>(selected.size() * unselected.length);

		for (int itemOut : selected)
		{
			int freedWeight = current.getTotalWeight() - instance.getWeight(itemOut);

			for (int itemIn : unselected)
			{
				if (!validator.checkCapacity(freedWeight, instance.getWeight(itemIn)))
					continue;
				if (!validator.checkConflicts(itemIn, selected, itemOut))
					continue;
				moves.add(Move.swap11(itemOut, itemIn));
			}
		}
		return moves;
	}

	/**
	 * N3: drop two selected items and add one unselected item whose profit is
	 * strictly above the pair's. Empty with fewer than two selected items.
	 */
	public List<Move> swap21(Solution current)
	{
		int selected[] = current.toArray();
		if (selected.length < 2)
			return new ArrayList<Move>(0);

		int unselected[] = unselectedItems(current);
		Set<Integer> selectedSet = current.getSelectedItems();
		// pruning keeps few of the pairs x unselected combinations
		long combinations = (long) selected.length * (selected.length - 1) / 2 * unselected.length;
		List<Move> moves = new ArrayList<Move>((int) Math.min(combinations / 4, MAX_SWAP21_CAPACITY));

		for (int i = 0; i < selected.length; i++)
		{
			for (int j = i + 1; j < selected.length; j++)
			{
				int itemOut1 = selected[i];
				int itemOut2 = selected[j];
				int freedProfit = instance.getProfit(itemOut1) + instance.getProfit(itemOut2);
				int freedWeight = current.getTotalWeight() - instance.getWeight(itemOut1)
						- instance.getWeight(itemOut2);

				for (int itemIn : unselected)
				{
					// cannot improve
					if (instance.getProfit(itemIn) <= freedProfit)
						continue;
					if (!validator.checkCapacity(freedWeight, instance.getWeight(itemIn)))
						continue;
					if (!validator.checkConflicts(itemIn, selectedSet, itemOut1, itemOut2))
						continue;
					moves.add(Move.swap21(itemOut1, itemOut2, itemIn));
				}
			}
		}
		return moves;
	}

	private int[] unselectedItems(Solution current)
	{
		int unselected[] = new int[Math.max(0, instance.getNumItems() - current.size())];
		int count = 0;
		for (int i = 0; i < instance.getNumItems() && count < unselected.length; i++)
		{
			if (!current.hasItem(i))
				unselected[count++] = i;
		}
		return count == unselected.length ? unselected : Arrays.copyOf(unselected, count);
	}
}
