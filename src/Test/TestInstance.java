package Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import Data.Instance;

public class TestInstance
{
	@Test
	public void testConflictsAreSymmetric()
	{
		Instance instance = new Instance("sym", 10, new int[] { 1, 2, 3, 4 }, new int[] { 1, 1, 1, 1 },
				InstanceFixtures.pairs(new int[] { 0, 3 }, new int[] { 2, 1 }));

		assertTrue(instance.hasConflict(0, 3));
		assertTrue(instance.hasConflict(3, 0));
		assertTrue(instance.hasConflict(1, 2));
		assertTrue(instance.hasConflict(2, 1));
		assertFalse(instance.hasConflict(0, 1));
		assertFalse(instance.hasConflict(3, 2));
	}

	@Test
	public void testDuplicatesAndSelfLoopsAreDropped()
	{
		Instance instance = new Instance("dup", 10, new int[] { 1, 2, 3 }, new int[] { 1, 1, 1 },
				InstanceFixtures.pairs(new int[] { 0, 2 }, new int[] { 2, 0 }, new int[] { 0, 2 }, new int[] { 1, 1 }));

		assertEquals(1, instance.getConflictDegree(0), "Repeated pairs should count once");
		assertEquals(0, instance.getConflictDegree(1), "Self conflict should be ignored");
		assertFalse(instance.hasConflict(1, 1));
		assertEquals(1, instance.getNumConflicts());
		assertArrayEquals(new int[] { 0 }, instance.getConflicts(2));
	}

	@Test
	public void testAdjacencyIsSorted()
	{
		Instance instance = new Instance("sorted", 10, new int[] { 1, 1, 1, 1, 1 }, new int[] { 1, 1, 1, 1, 1 },
				InstanceFixtures.pairs(new int[] { 2, 4 }, new int[] { 2, 0 }, new int[] { 3, 2 }, new int[] { 1, 2 }));

		assertArrayEquals(new int[] { 0, 1, 3, 4 }, instance.getConflicts(2));
		assertEquals(4, instance.getConflictDegree(2));
	}

	@Test
	public void testOutOfRangeQueryIsNoConflict()
	{
		Instance instance = InstanceFixtures.threeItems();
		assertFalse(instance.hasConflict(-1, 0));
		assertFalse(instance.hasConflict(0, 3));
	}

	@Test
	public void testConflictDensity()
	{
		Instance instance = InstanceFixtures.threeItems();
		// 1 of 3 possible pairs
		assertEquals(100.0 / 3.0, instance.getConflictDensity(), 1e-9);

		Instance single = new Instance("one", 5, new int[] { 3 }, new int[] { 2 }, null);
		assertEquals(0.0, single.getConflictDensity(), 0.0);
	}

	@Test
	public void testInstanceIsImmutable()
	{
		int profits[] = { 10, 20, 15 };
		Instance instance = new Instance("copy", 10, profits, new int[] { 5, 8, 6 }, null);
		profits[0] = 999;
		instance.getProfits()[1] = 999;

		assertEquals(10, instance.getProfit(0));
		assertEquals(20, instance.getProfit(1));
	}

	@Test
	public void testInvalidDataIsRejected()
	{
		assertThrows(IllegalArgumentException.class,
				() -> new Instance("cap", 0, new int[] { 1 }, new int[] { 1 }, null));
		assertThrows(IllegalArgumentException.class,
				() -> new Instance("empty", 5, new int[0], new int[0], null));
		assertThrows(IllegalArgumentException.class,
				() -> new Instance("length", 5, new int[] { 1, 2 }, new int[] { 1 }, null));
		assertThrows(IllegalArgumentException.class,
				() -> new Instance("negative", 5, new int[] { -1 }, new int[] { 1 }, null));
		assertThrows(IllegalArgumentException.class,
				() -> new Instance("range", 5, new int[] { 1 }, new int[] { 1 },
						InstanceFixtures.pairs(new int[] { 0, 1 })));
	}
}
