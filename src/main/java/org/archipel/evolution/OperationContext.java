package org.archipel.evolution;

import org.archipel.migration.IMessageRouter;
import org.archipel.migration.Mailbox;
import org.archipel.runner.Roster;
import org.archipel.runner.WorkerAddress;

/**
 * Per-worker ambient data handed to every operation.
 *
 * <p>Outside of a run (for instance when a pipeline is applied directly) only the objective
 * is set; {@code roster}, {@code self}, {@code mailbox} and {@code router} are {@code null}.</p>
 *
 * @param objective The fitness function of the model.
 * @param roster    The addresses of all populations in the run.
 * @param self      The address of the applying worker.
 * @param mailbox   The inbox of the applying worker.
 * @param router    Delivers messages to peer workers.
 */
public record OperationContext(IObjective objective,
                               Roster roster,
                               WorkerAddress self,
                               Mailbox mailbox,
                               IMessageRouter router) {

    public OperationContext {
        if (objective == null) {
            throw new IllegalArgumentException("objective must not be null");
        }
    }

    /**
     * Creates a context for applying operations outside of a run.
     *
     * @param objective The fitness function.
     * @return A context without roster or messaging.
     */
    public static OperationContext standalone(IObjective objective) {
        return new OperationContext(objective, null, null, null, null);
    }

    /**
     * @return The number of populations in the run, 1 outside of a run.
     */
    public int numPopulations() {
        return roster == null ? 1 : roster.size();
    }

    /**
     * @return The index of the applying population within the roster, 0 outside of a run.
     */
    public int selfIndex() {
        return self == null ? 0 : self.index();
    }
}
