package dk.cloudcreate.cqrskit.persistence;

import dk.cloudcreate.cqrskit.types.Precondition;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Thrown by {@link EventStoreAdapter#publishEvents(java.util.List, java.util.List)} when a {@link Precondition} isn't fulfilled.
 * None of the events in the batch have been published.
 */
public class PreconditionFailedException extends EventStoreException {
    public final Precondition precondition;

    public PreconditionFailedException(String message, Precondition precondition) {
        super(message);
        this.precondition = requireNonNull(precondition, "No precondition provided");
    }
}
