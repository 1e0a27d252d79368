package expansion.actor;

import akka.actor.AbstractActor;
import akka.actor.Props;
import expansion.solver.BendersData;
import expansion.solver.SubSolverRunnable;

/**
 * Collects second-stage results of the current iteration. All updates to the BendersData object happen inside
 * this actor.
 */
public class BendersDataHolder extends AbstractActor {
    private BendersData bendersData;

    private BendersDataHolder() {
        bendersData = null;
    }

    static Props props() {
        return Props.create(BendersDataHolder.class, BendersDataHolder::new);
    }

    // messages
    static class InitBendersData {
        private final BendersData bendersData;

        InitBendersData(BendersData bendersData) {
            this.bendersData = bendersData;
        }
    }

    static class AddResult {
        private final SubSolverRunnable subSolverRunnable;

        AddResult(SubSolverRunnable subSolverRunnable) {
            this.subSolverRunnable = subSolverRunnable;
        }
    }

    static class Done {}

    static class GetBendersData {}

    @Override
    public Receive createReceive() {
        return receiveBuilder()
            .match(InitBendersData.class, this::handle)
            .match(AddResult.class, this::handle)
            .match(Done.class, __ -> replyToDoneQuestion())
            .match(GetBendersData.class, __ -> sendBendersData())
            .build();
    }

    private void handle(InitBendersData initBendersData) {
        this.bendersData = initBendersData.bendersData;
        getSender().tell(true, getSelf());
    }

    private void handle(AddResult addResult) {
        bendersData.addResult(addResult.subSolverRunnable);
    }

    private void replyToDoneQuestion() {
        getSender().tell(bendersData != null && bendersData.isComplete(), getSelf());
    }

    private void sendBendersData() {
        getSender().tell(bendersData, getSelf());
    }
}
