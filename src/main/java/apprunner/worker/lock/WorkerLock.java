package apprunner.worker.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Binary, non-queueing lock guarding the worker's single build/run slot.
 *
 * {@link #tryAcquire(String)} never blocks: it either hands out a {@link Lease}
 * or returns empty. Only a lease can release the lock, so releasing without
 * holding cannot be expressed.
 */
public final class WorkerLock {

    private static final Logger log = LoggerFactory.getLogger(WorkerLock.class);

    private final AtomicReference<String> holder = new AtomicReference<>();

    /**
     * Try to take the lock for {@code owner} (usually a ticket).
     *
     * @return the lease, or empty if the lock is already held
     */
    public Optional<Lease> tryAcquire(String owner) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("lock owner is required");
        }
        if (!holder.compareAndSet(null, owner)) {
            log.debug("Lock busy: requested by {}, held by {}", owner, holder.get());
            return Optional.empty();
        }
        log.info("Lock acquired by {}", owner);
        return Optional.of(new Lease(owner));
    }

    public boolean isLocked() {
        return holder.get() != null;
    }

    /** Current owner, if any. Advisory only. */
    public Optional<String> holder() {
        return Optional.ofNullable(holder.get());
    }

    /**
     * Proof of holding the lock. Closing it releases the lock; closing twice is a no-op.
     */
    public final class Lease implements AutoCloseable {

        private final String owner;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Lease(String owner) {
            this.owner = owner;
        }

        public String owner() {
            return owner;
        }

        public boolean isReleased() {
            return released.get();
        }

        @Override
        public void close() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            if (holder.compareAndSet(owner, null)) {
                log.info("Lock released by {}", owner);
            } else {
                log.error("Lock held by {} when lease of {} was released", holder.get(), owner);
            }
        }
    }
}
