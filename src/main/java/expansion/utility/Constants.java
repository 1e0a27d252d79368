package expansion.utility;

public class Constants {
    public final static double EPS = 1e-9;
    public final static double MINIMUM_CUT_VIOLATION = 1e-6;
    public final static double PROBABILITY_TOLERANCE = 1e-6;
    public final static int ERROR_CODE = 17;
    public final static long ACTOR_POLL_INTERVAL_IN_MS = 10;
}
