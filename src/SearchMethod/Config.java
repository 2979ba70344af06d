package SearchMethod;

import java.text.DecimalFormat;
import java.util.Arrays;
import java.util.HashMap;

import Constructive.GreedyStrategy;

public class Config implements Cloneable {
	DecimalFormat deci = new DecimalFormat("0.000");

	// --------------------GRASP-------------------
	double alpha;
	int graspIterations;
	long seed;
	double conflictPenaltyCoefficient;
	double zeroWeightScore;
	int tuneIterations;

	// --------------------Greedy-------------------
	GreedyStrategy greedyStrategies[];

	// --------------------Local search-------------------
	int hcMaxIterations;
	int vndMaxIterations;

	public Config() {
		this.alpha = 0.3;
		this.graspIterations = 100;
		this.seed = 42;
		// empirical weight of the conflict count in the GRASP score
		this.conflictPenaltyCoefficient = 0.1;
		this.zeroWeightScore = 1e9;
		this.tuneIterations = 20;

		this.greedyStrategies = GreedyStrategy.values();

		this.hcMaxIterations = 100;
		this.vndMaxIterations = 1000;
	}

	public Config clone() {
		try {
			Config copy = (Config) super.clone();
			copy.greedyStrategies = greedyStrategies.clone();
			return copy;
		} catch (CloneNotSupportedException e) {
			throw new IllegalStateException(e);
		}
	}

	@Override
	public String toString() {
		return toString(new HashMap<String, String>());
	}

	/**
	 * toString with parameter source tracking
	 */
	public String toString(HashMap<String, String> sources) {
		return "Config "
				+ "\nalpha: " + deci.format(alpha) + " (" + sources.getOrDefault("alpha", "default") + ")"
				+ "\ngraspIterations: " + graspIterations + " ("
				+ sources.getOrDefault("graspIterations", "default") + ")"
				+ "\nseed: " + seed + " (" + sources.getOrDefault("seed", "default") + ")"
				+ "\nconflictPenalty: " + deci.format(conflictPenaltyCoefficient) + " ("
				+ sources.getOrDefault("conflictPenalty", "default") + ")"
				+ "\nzeroWeightScore: " + zeroWeightScore + " ("
				+ sources.getOrDefault("zeroWeightScore", "default") + ")"
				+ "\ntuneIterations: " + tuneIterations + " ("
				+ sources.getOrDefault("tuneIterations", "default") + ")"
				+ "\ngreedyStrategies: " + Arrays.toString(greedyStrategies) + " ("
				+ sources.getOrDefault("greedyStrategies", "default") + ")"
				+ "\nhcIterations: " + hcMaxIterations + " ("
				+ sources.getOrDefault("hcIterations", "default") + ")"
				+ "\nvndIterations: " + vndMaxIterations + " ("
				+ sources.getOrDefault("vndIterations", "default") + ")";
	}

	public double getAlpha() {
		return alpha;
	}

	public void setAlpha(double alpha) {
		if (alpha < 0 || alpha > 1 || Double.isNaN(alpha))
			throw new IllegalArgumentException("alpha must be in [0,1]");
		this.alpha = alpha;
	}

	public int getGraspIterations() {
		return graspIterations;
	}

	public void setGraspIterations(int graspIterations) {
		if (graspIterations < 1) throw new IllegalArgumentException("graspIterations must be >= 1");
		this.graspIterations = graspIterations;
	}

	public long getSeed() {
		return seed;
	}

	public void setSeed(long seed) {
		this.seed = seed;
	}

	public double getConflictPenaltyCoefficient() {
		return conflictPenaltyCoefficient;
	}

	public void setConflictPenaltyCoefficient(double conflictPenaltyCoefficient) {
		if (conflictPenaltyCoefficient < 0 || Double.isNaN(conflictPenaltyCoefficient))
			throw new IllegalArgumentException("conflictPenalty must be >= 0");
		this.conflictPenaltyCoefficient = conflictPenaltyCoefficient;
	}

	public double getZeroWeightScore() {
		return zeroWeightScore;
	}

	public void setZeroWeightScore(double zeroWeightScore) {
		if (zeroWeightScore <= 0) throw new IllegalArgumentException("zeroWeightScore must be > 0");
		this.zeroWeightScore = zeroWeightScore;
	}

	public int getTuneIterations() {
		return tuneIterations;
	}

	public void setTuneIterations(int tuneIterations) {
		if (tuneIterations < 1) throw new IllegalArgumentException("tuneIterations must be >= 1");
		this.tuneIterations = tuneIterations;
	}

	public GreedyStrategy[] getGreedyStrategies() {
		return greedyStrategies;
	}

	public void setGreedyStrategies(GreedyStrategy[] greedyStrategies) {
		if (greedyStrategies == null || greedyStrategies.length == 0)
			throw new IllegalArgumentException("at least one greedy strategy is required");
		this.greedyStrategies = greedyStrategies;
	}

	public int getHcMaxIterations() {
		return hcMaxIterations;
	}

	public void setHcMaxIterations(int hcMaxIterations) {
		if (hcMaxIterations < 0) throw new IllegalArgumentException("hcIterations must be >= 0");
		this.hcMaxIterations = hcMaxIterations;
	}

	public int getVndMaxIterations() {
		return vndMaxIterations;
	}

	public void setVndMaxIterations(int vndMaxIterations) {
		if (vndMaxIterations < 0) throw new IllegalArgumentException("vndIterations must be >= 0");
		this.vndMaxIterations = vndMaxIterations;
	}
}
