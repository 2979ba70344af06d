package Improvement;

/**
 * VND neighborhoods in exploration order, from the smallest move to the largest.
 */
public enum NeighborhoodType
{
	AddDrop(1), // N1: add or drop one item
	Swap11(2),  // N2: one item out, one in
	Swap21(3);  // N3: two items out, one in

	final int index;

	NeighborhoodType(int index)
	{
		this.index=index;
	}

	public int getIndex()
	{
		return index;
	}

	/**
	 * @return the neighborhood explored after this one, or null after the last
	 */
	public NeighborhoodType next()
	{
		return fromIndex(index + 1);
	}

	/**
	 * @return the neighborhood with index k, or null when k is past the last one
	 */
	public static NeighborhoodType fromIndex(int k)
	{
		for (NeighborhoodType type : values())
		{
			if (type.index == k)
				return type;
		}
		return null;
	}
}
