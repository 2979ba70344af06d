package Constructive;

/**
 * Item scored during an RCL build. Only lives inside one construction step.
 */
public class Candidate
{
	public final int item;
	public final double score;

	public Candidate(int item, double score)
	{
		this.item = item;
		this.score = score;
	}

	@Override
	public String toString()
	{
		return "Candidate [item=" + item + ", score=" + score + "]";
	}
}
