package expansion.actor;

import akka.actor.ActorRef;
import akka.actor.ActorSystem;
import akka.pattern.Patterns;
import akka.routing.RoundRobinPool;
import akka.util.Timeout;
import expansion.solver.BendersData;
import expansion.solver.SubSolverRunnable;
import expansion.utility.Constants;
import expansion.utility.OptException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import scala.concurrent.Await;
import scala.concurrent.Future;

import java.util.concurrent.TimeUnit;

public class ActorManager {
    private final static Logger logger = LogManager.getLogger(ActorManager.class);
    private final ActorSystem actorSystem;
    private ActorRef router;
    private ActorRef bendersDataHolder;

    public ActorManager() {
        actorSystem = ActorSystem.create("benders");
    }

    public final void createActors(int numThreads) {
        bendersDataHolder = actorSystem.actorOf(BendersDataHolder.props());
        router = actorSystem.actorOf(
            new RoundRobinPool(numThreads).props(SubModelActor.props(bendersDataHolder)));
    }

    public final void initBendersData(BendersData bendersData) throws OptException {
        askAndWait(bendersDataHolder, new BendersDataHolder.InitBendersData(bendersData));
    }

    /**
     * Sends every model to the actor pool and blocks until the data holder has a result for each of them.
     *
     * @param models      one runnable per scenario.
     * @param timeoutInMs maximum time to wait for all results.
     * @return the complete BendersData of the iteration.
     * @throws OptException if the deadline passes or the wait is interrupted.
     */
    public final BendersData solveModels(SubSolverRunnable[] models, long timeoutInMs) throws OptException {
        for (SubSolverRunnable model : models)
            router.tell(new SubModelActor.SolveModel(model), ActorRef.noSender());

        final long deadline = System.currentTimeMillis() + timeoutInMs;
        boolean done = false;
        while (!done) {
            if (System.currentTimeMillis() > deadline) {
                logger.error("second-stage results not complete after " + timeoutInMs + " ms");
                throw new OptException("timed out when waiting for 2nd stage solution");
            }
            try {
                Thread.sleep(Constants.ACTOR_POLL_INTERVAL_IN_MS);
                done = askAndWait(bendersDataHolder, new BendersDataHolder.Done());
            } catch (InterruptedException ex) {
                logger.error(ex);
                Thread.currentThread().interrupt();
                throw new OptException("interruption when waiting for 2nd stage solution", ex);
            }
        }

        return askAndWait(bendersDataHolder, new BendersDataHolder.GetBendersData());
    }

    public void end() {
        actorSystem.terminate();
    }

    @SuppressWarnings("unchecked")
    private static <T, M> T askAndWait(ActorRef r, M message) throws OptException {
        try {
            Timeout timeout = new Timeout(5, TimeUnit.SECONDS);
            Future<Object> future = Patterns.ask(r, message, timeout);
            return (T) Await.result(future, timeout.duration());
        } catch (InterruptedException ex) {
            logger.error(ex);
            Thread.currentThread().interrupt();
            throw new OptException("interruption when querying BendersDataHolder for status", ex);
        } catch (Exception ex) {
            logger.error(ex);
            throw new OptException("error when querying BendersDataHolder for status", ex);
        }
    }
}
