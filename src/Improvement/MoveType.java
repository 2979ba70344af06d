package Improvement;

public enum MoveType
{
	Add,
	Drop,
	Swap11,
	Swap21
}
