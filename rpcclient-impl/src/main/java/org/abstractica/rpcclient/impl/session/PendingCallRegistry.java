package org.abstractica.rpcclient.impl.session;

import org.abstractica.rpcclient.impl.future.DefaultResponseFuture;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tracks outstanding calls by message id.
 *
 * <p>Every record leaves the registry exactly once: on its response, on
 * timeout, on a connection failure or when the session closes. Removal is
 * what guarantees a call is completed at most once.</p>
 *
 * <p>Not thread-safe.</p>
 */
public class PendingCallRegistry
{
    /**
     * An awaiting call selected by a scan of the registry.
     *
     * @param msgid  the message id
     * @param future the call's future
     */
    public record AwaitingEntry(int msgid, DefaultResponseFuture future)
    {
        public AwaitingEntry
        {
            Objects.requireNonNull(future, "future");
        }
    }

    private final Map<Integer, PendingCall> pending;

    /**
     * Creates an empty registry.
     */
    public PendingCallRegistry()
    {
        this.pending = new LinkedHashMap<>();
    }

    /**
     * Registers an outstanding call.
     *
     * @param msgid the message id the response will carry
     * @param call  the call record
     * @throws IllegalStateException if the id is already outstanding
     */
    public void register(int msgid, PendingCall call)
    {
        Objects.requireNonNull(call, "call");

        PendingCall previous = pending.putIfAbsent(msgid, call);
        if (previous != null)
        {
            throw new IllegalStateException("Message id already outstanding: " + msgid);
        }
    }

    /**
     * Removes the record for a message id.
     *
     * @param msgid the message id
     * @return the removed record, or null if the id is not outstanding
     */
    public PendingCall remove(int msgid)
    {
        return pending.remove(msgid);
    }

    /**
     * Returns whether a message id is outstanding.
     *
     * @param msgid the message id
     * @return true if a record exists
     */
    public boolean contains(int msgid)
    {
        return pending.containsKey(msgid);
    }

    /**
     * Returns a snapshot of the awaiting calls, in registration order.
     *
     * <p>The snapshot is detached from the registry, so callers may remove
     * entries while walking it.</p>
     *
     * @return the awaiting calls
     */
    public List<AwaitingEntry> awaiting()
    {
        List<AwaitingEntry> result = new ArrayList<>();
        for (Map.Entry<Integer, PendingCall> entry : pending.entrySet())
        {
            if (entry.getValue() instanceof PendingCall.Awaiting awaiting)
            {
                result.add(new AwaitingEntry(entry.getKey(), awaiting.future()));
            }
        }
        return result;
    }

    /**
     * Removes every awaiting call and returns them.
     *
     * <p>Callback records stay registered.</p>
     *
     * @return the removed calls, in registration order
     */
    public List<AwaitingEntry> removeAwaiting()
    {
        List<AwaitingEntry> removed = new ArrayList<>();
        Iterator<Map.Entry<Integer, PendingCall>> it = pending.entrySet().iterator();

        while (it.hasNext())
        {
            Map.Entry<Integer, PendingCall> entry = it.next();
            if (entry.getValue() instanceof PendingCall.Awaiting awaiting)
            {
                removed.add(new AwaitingEntry(entry.getKey(), awaiting.future()));
                it.remove();
            }
        }
        return removed;
    }

    /**
     * Drops all records without completing them.
     */
    public void clear()
    {
        pending.clear();
    }

    /**
     * Returns the number of outstanding calls.
     *
     * @return awaiting and callback records combined
     */
    public int size()
    {
        return pending.size();
    }

    /**
     * Returns the number of outstanding future-based calls.
     *
     * @return awaiting records
     */
    public int awaitingCount()
    {
        int count = 0;
        for (PendingCall call : pending.values())
        {
            if (call instanceof PendingCall.Awaiting)
            {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns the number of outstanding callback-based calls.
     *
     * @return callback records
     */
    public int callbackCount()
    {
        return pending.size() - awaitingCount();
    }

    /**
     * Returns whether no call is outstanding.
     *
     * @return true if empty
     */
    public boolean isEmpty()
    {
        return pending.isEmpty();
    }
}
