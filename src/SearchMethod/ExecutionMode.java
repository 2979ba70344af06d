package SearchMethod;

public enum ExecutionMode
{
	single, // one instance file
	batch,  // every instance in a directory
	tune;   // GRASP alpha calibration on one instance
}
