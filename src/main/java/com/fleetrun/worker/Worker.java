package com.fleetrun.worker;

import com.fleetrun.core.model.WorkItem;

/**
 * Coordinator-side view of one worker: its channel plus busy/idle bookkeeping.
 *
 * <p>Not thread-safe. Only the run's coordinator thread reads or mutates it.
 * {@code currentWork} is present exactly when {@code busy} is true.
 */
public final class Worker {

    private final int id;
    private final WorkerChannel channel;
    private boolean busy;
    private WorkItem currentWork;
    private boolean lost;

    public Worker(int id, WorkerChannel channel) {
        this.id = id;
        this.channel = channel;
    }

    public int id() { return id; }
    public WorkerChannel channel() { return channel; }
    public boolean isBusy() { return busy; }
    public WorkItem currentWork() { return currentWork; }
    public boolean isLost() { return lost; }

    /**
     * Marks the worker busy with {@code item}.
     *
     * @throws IllegalStateException if the worker already holds work
     */
    public void assign(WorkItem item) {
        if (busy) {
            throw new IllegalStateException("Worker " + id + " is already executing "
                    + currentWork.id() + ", cannot take " + item.id());
        }
        busy = true;
        currentWork = item;
    }

    /**
     * Frees the worker and returns the item it held, or {@code null} if idle.
     */
    public WorkItem release() {
        WorkItem item = currentWork;
        busy = false;
        currentWork = null;
        return item;
    }

    /**
     * Takes the worker out of rotation; it will not be assigned work again.
     */
    public void markLost() {
        lost = true;
    }

    public boolean isAvailable() {
        return !busy && !lost;
    }

    @Override
    public String toString() {
        return "Worker[" + id + (busy ? ", busy=" + currentWork.id() : ", idle") + (lost ? ", lost" : "") + "]";
    }
}
