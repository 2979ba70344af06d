package Improvement;

import Data.Instance;
import Solution.Solution;

/**
 * One elementary change of a solution. Unused item slots hold -1.
 */
public class Move
{
	public final MoveType type;
	public final int itemOut1;
	public final int itemOut2;
	public final int itemIn;

	private Move(MoveType type, int itemOut1, int itemOut2, int itemIn)
	{
		this.type = type;
		this.itemOut1 = itemOut1;
		this.itemOut2 = itemOut2;
		this.itemIn = itemIn;
	}

	public static Move add(int itemIn)
	{
		return new Move(MoveType.Add, -1, -1, itemIn);
	}

	public static Move drop(int itemOut)
	{
		return new Move(MoveType.Drop, itemOut, -1, -1);
	}

	public static Move swap11(int itemOut, int itemIn)
	{
		return new Move(MoveType.Swap11, itemOut, -1, itemIn);
	}

	public static Move swap21(int itemOut1, int itemOut2, int itemIn)
	{
		return new Move(MoveType.Swap21, itemOut1, itemOut2, itemIn);
	}

	public int profitDelta(Instance instance)
	{
		int delta = 0;
		if (itemIn >= 0)
			delta += instance.getProfit(itemIn);
		if (itemOut1 >= 0)
			delta -= instance.getProfit(itemOut1);
		if (itemOut2 >= 0)
			delta -= instance.getProfit(itemOut2);
		return delta;
	}

	public int weightDelta(Instance instance)
	{
		int delta = 0;
		if (itemIn >= 0)
			delta += instance.getWeight(itemIn);
		if (itemOut1 >= 0)
			delta -= instance.getWeight(itemOut1);
		if (itemOut2 >= 0)
			delta -= instance.getWeight(itemOut2);
		return delta;
	}

	/**
	 * @return a new solution equal to base with this move applied; base is untouched
	 */
	public Solution apply(Solution base, Instance instance)
	{
		Solution neighbor = base.copy();
		if (itemOut1 >= 0)
			neighbor.removeItem(itemOut1, instance.getProfit(itemOut1), instance.getWeight(itemOut1));
		if (itemOut2 >= 0)
			neighbor.removeItem(itemOut2, instance.getProfit(itemOut2), instance.getWeight(itemOut2));
		if (itemIn >= 0)
			neighbor.addItem(itemIn, instance.getProfit(itemIn), instance.getWeight(itemIn));
		neighbor.setFeasible(true);
		return neighbor;
	}

	@Override
	public String toString()
	{
		switch (type)
		{
			case Add:
				return "Add(" + itemIn + ")";
			case Drop:
				return "Drop(" + itemOut1 + ")";
			case Swap11:
				return "Swap11(" + itemOut1 + " -> " + itemIn + ")";
			default:
				return "Swap21(" + itemOut1 + "," + itemOut2 + " -> " + itemIn + ")";
		}
	}
}
