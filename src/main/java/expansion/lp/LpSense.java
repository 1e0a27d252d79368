package expansion.lp;

/**
 * Direction of a linear constraint relative to its right-hand side.
 */
public enum LpSense {LE, GE, EQ}
