package Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import java.util.TreeSet;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import Data.Instance;
import Solution.Solution;
import Solution.Validator;

public class TestValidator
{
	private Instance instance;
	private Validator validator;

	@BeforeEach
	public void setUp()
	{
		this.instance = InstanceFixtures.threeItems();
		this.validator = new Validator(instance);
	}

	@Test
	public void testCheckCapacity()
	{
		assertTrue(validator.checkCapacity(5, 5), "Exactly full is allowed");
		assertFalse(validator.checkCapacity(5, 6));
		assertTrue(validator.checkCapacity(0, 0));
		assertFalse(validator.checkCapacity(Integer.MAX_VALUE, 1), "Must not overflow");
	}

	@Test
	public void testCheckConflicts()
	{
		Set<Integer> selected = new TreeSet<Integer>();
		selected.add(1);

		assertFalse(validator.checkConflicts(0, selected));
		assertTrue(validator.checkConflicts(2, selected));
		assertTrue(validator.checkConflicts(0, new TreeSet<Integer>()));
		assertTrue(validator.checkConflicts(0, selected, 1), "Excluded items are not checked");
	}

	@Test
	public void testValidateFeasible()
	{
		Solution solution = new Solution();
		solution.addItem(2, 15, 6);

		assertTrue(validator.validate(solution));
		assertTrue(solution.isFeasible());
	}

	@Test
	public void testValidateCapacityViolation()
	{
		Solution solution = new Solution();
		solution.addItem(1, 20, 8);
		solution.addItem(2, 15, 6);

		assertFalse(validator.validate(solution));
		assertFalse(solution.isFeasible(), "Overweight solution must be flagged");
		assertEquals(14, solution.getTotalWeight(), "Solution is still returned with its metrics");
	}

	@Test
	public void testValidateConflictViolation()
	{
		Instance roomy = new Instance("roomy", 100, new int[] { 10, 20, 15 }, new int[] { 5, 8, 6 },
				InstanceFixtures.pairs(new int[] { 0, 1 }));
		Validator roomyValidator = new Validator(roomy);

		Solution solution = new Solution();
		solution.addItem(0, 10, 5);
		solution.addItem(1, 20, 8);

		assertFalse(roomyValidator.validate(solution));
		assertFalse(solution.isFeasible());
	}

	@Test
	public void testValidateRecomputesMetrics()
	{
		Solution solution = new Solution();
		// wrong contributions on purpose
		solution.addItem(2, 1, 1);
		solution.addItem(0, 1, 1);

		validator.validate(solution);

		assertEquals(25, solution.getTotalProfit());
		assertEquals(11, solution.getTotalWeight());
		assertFalse(solution.isFeasible(), "True weight 11 exceeds capacity 10");
	}

	@Test
	public void testValidateIsIdempotent()
	{
		Instance random = InstanceFixtures.random(3, 40, 0.1);
		Validator randomValidator = new Validator(random);

		Solution solution = new Solution();
		for (int i = 0; i < random.getNumItems(); i += 3)
			solution.addItem(i, random.getProfit(i), random.getWeight(i));

		boolean first = randomValidator.validate(solution);
		int profit = solution.getTotalProfit();
		int weight = solution.getTotalWeight();
		Set<Integer> items = new TreeSet<Integer>(solution.getSelectedItems());

		boolean second = randomValidator.validate(solution);

		assertEquals(first, second);
		assertEquals(first, solution.isFeasible());
		assertEquals(profit, solution.getTotalProfit());
		assertEquals(weight, solution.getTotalWeight());
		assertEquals(items, solution.getSelectedItems());
	}

	@Test
	public void testValidateDetailedDoesNotModify()
	{
		Solution solution = new Solution();
		solution.addItem(0, 10, 5);
		solution.addItem(1, 20, 8);
		solution.setFeasible(true);

		String report = validator.validateDetailed(solution);

		assertTrue(report.contains("Capacity: VIOLATED"), report);
		assertTrue(report.contains("Conflicts: 1"), report);
		assertTrue(report.endsWith("INFEASIBLE"), report);
		assertTrue(solution.isFeasible(), "validateDetailed must not touch the flag");
	}
}
