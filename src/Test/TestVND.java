package Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import Constructive.GRASP;
import Data.Instance;
import Improvement.HillClimbing;
import Improvement.NeighborhoodType;
import Improvement.VND;
import Solution.Solution;
import Solution.Validator;

public class TestVND
{
	private VND vnd;

	@BeforeEach
	public void setUp()
	{
		vnd = new VND(InstanceFixtures.threeItems());
		vnd.setPrint(false);
	}

	@Test
	public void testImprovesThroughSwapNeighborhood()
	{
		Solution initial = new Solution();
		initial.addItem(2, 15, 6);

		Solution result = vnd.solve(initial);

		assertEquals(Arrays.asList(1), new ArrayList<Integer>(result.getSelectedItems()));
		assertEquals(20, result.getTotalProfit());
		assertEquals("VND", result.getMethodName());
		assertEquals(0, vnd.getImprovements(NeighborhoodType.AddDrop));
		assertEquals(1, vnd.getImprovements(NeighborhoodType.Swap11));
		assertEquals(0, vnd.getImprovements(NeighborhoodType.Swap21));
		// N1, N2 (improves), N1, N2, N3
		assertEquals(5, vnd.getIterations());
		assertEquals(15, initial.getTotalProfit(), "Initial solution must be untouched");
	}

	@Test
	public void testFillsEmptySolution()
	{
		Solution result = vnd.solve(new Solution());

		assertEquals(20, result.getTotalProfit());
		assertTrue(vnd.getImprovements(NeighborhoodType.AddDrop) >= 1);
	}

	@Test
	public void testBudgetCountsExplorations()
	{
		Solution initial = new Solution();
		initial.addItem(2, 15, 6);

		Solution result = vnd.solve(initial, 1);

		assertEquals(1, vnd.getIterations());
		assertEquals(15, result.getTotalProfit(), "Only N1 was explored and it cannot improve");
		assertThrows(IllegalArgumentException.class, () -> vnd.solve(initial, -5));
	}

	@Test
	public void testSwap21ReplacesTwoItems()
	{
		Instance instance = new Instance("pair", 10, new int[] { 4, 5, 12 }, new int[] { 5, 5, 9 },
				InstanceFixtures.pairs(new int[] { 0, 2 }));
		VND pairVnd = new VND(instance);
		pairVnd.setPrint(false);

		Solution initial = new Solution();
		initial.addItem(0, 4, 5);
		initial.addItem(1, 5, 5);

		Solution result = pairVnd.solve(initial);

		assertEquals(Arrays.asList(2), new ArrayList<Integer>(result.getSelectedItems()));
		assertEquals(12, result.getTotalProfit());
		assertEquals(1, pairVnd.getImprovements(NeighborhoodType.Swap21));
	}

	@Test
	public void testLocalOptimumForAllNeighborhoods()
	{
		for (long seed = 1; seed <= 5; seed++)
		{
			Instance random = InstanceFixtures.random(seed, 50, 0.08);
			GRASP grasp = new GRASP(random, seed);
			grasp.setPrint(false);
			VND v = new VND(random);
			v.setPrint(false);
			Validator validator = new Validator(random);

			Solution initial = grasp.constructSolution(0.3);
			Solution result = v.solve(initial);

			assertTrue(result.getTotalProfit() >= initial.getTotalProfit(), "Profit decreased for seed " + seed);
			assertTrue(validator.validate(result), "Infeasible result for seed " + seed);
			for (NeighborhoodType type : NeighborhoodType.values())
				assertNull(v.findBestNeighbor(result, type), type + " still improves for seed " + seed);
		}
	}

	@Test
	public void testRefinersNeverLoseProfit()
	{
		Instance random = InstanceFixtures.random(33, 60, 0.05);
		GRASP grasp = new GRASP(random, 33);
		grasp.setPrint(false);
		Solution initial = grasp.constructSolution(0.0);

		HillClimbing hc = new HillClimbing(random);
		hc.setPrint(false);
		VND v = new VND(random);
		v.setPrint(false);

		assertTrue(v.solve(initial).getTotalProfit() >= initial.getTotalProfit());
		assertTrue(hc.solve(initial).getTotalProfit() >= initial.getTotalProfit());
	}
}
