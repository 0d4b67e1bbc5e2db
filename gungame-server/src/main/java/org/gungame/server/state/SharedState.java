package org.gungame.server.state;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Guards the single {@link ServerState} with one reader/writer lock.
 *
 * <p>Every access is a single call made while the lock is held. Callers
 * must not perform network I/O inside the callback; collect what needs to
 * be sent and send it after the call returns.</p>
 */
public class SharedState
{
    private final ServerState state;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public SharedState(ServerState state)
    {
        this.state = Objects.requireNonNull(state, "state");
    }

    public SharedState()
    {
        this(new ServerState());
    }

    /**
     * Runs a read-only query under the shared lock.
     *
     * @param query the query
     * @param <T>   result type
     * @return the query result
     */
    public <T> T read(Function<ServerState, T> query)
    {
        lock.readLock().lock();
        try
        {
            return query.apply(state);
        }
        finally
        {
            lock.readLock().unlock();
        }
    }

    /**
     * Runs a mutation under the exclusive lock.
     *
     * @param mutation the mutation
     * @param <T>      result type
     * @return the mutation result
     */
    public <T> T write(Function<ServerState, T> mutation)
    {
        lock.writeLock().lock();
        try
        {
            return mutation.apply(state);
        }
        finally
        {
            lock.writeLock().unlock();
        }
    }

    /**
     * Runs a mutation with no result under the exclusive lock.
     *
     * @param mutation the mutation
     */
    public void update(Consumer<ServerState> mutation)
    {
        write(s ->
        {
            mutation.accept(s);
            return null;
        });
    }
}
