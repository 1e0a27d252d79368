package expansion.actor;

import akka.actor.AbstractActor;
import akka.actor.ActorRef;
import akka.actor.Props;
import expansion.solver.SubSolverRunnable;

public class SubModelActor extends AbstractActor {
    private final ActorRef bendersDataHolder;

    private SubModelActor(ActorRef bendersDataHolder) {
        this.bendersDataHolder = bendersDataHolder;
    }

    static Props props(ActorRef bendersDataHolder) {
        return Props.create(SubModelActor.class, () -> new SubModelActor(bendersDataHolder));
    }

    // SubModelActor messages
    static class SolveModel {
        private final SubSolverRunnable subSolverRunnable;

        SolveModel(SubSolverRunnable subSolverRunnable) {
            this.subSolverRunnable = subSolverRunnable;
        }
    }

    @Override
    public Receive createReceive() {
        return receiveBuilder()
            .match(SolveModel.class, this::handle)
            .build();
    }

    private void handle(SolveModel solveModel) {
        SubSolverRunnable subSolverRunnable = solveModel.subSolverRunnable;
        subSolverRunnable.run();
        bendersDataHolder.tell(new BendersDataHolder.AddResult(subSolverRunnable), getSelf());
    }
}
