package de.bsommerfeld.dbqueue.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The lifetime of one queue block. Cursors opened inside the block register
 * here and are closed when the block returns; from then on the scope reports
 * itself inactive and every cursor bound to it refuses to move.
 *
 * <p>
 * Scopes nest: a cursor of an enclosing block stays usable inside a nested
 * block, because the enclosing block is still running.
 */
final class ExecutionScope {

    private static final Logger LOG = LoggerFactory.getLogger(ExecutionScope.class);

    private final Thread thread;
    private final List<Cursor<?>> cursors = new ArrayList<>();
    private boolean active = true;

    ExecutionScope(Thread thread) {
        this.thread = thread;
    }

    /** True while the block runs and the caller is on the block's thread. */
    boolean isCurrent() {
        return active && Thread.currentThread() == thread;
    }

    void register(Cursor<?> cursor) {
        cursors.add(cursor);
    }

    void end() {
        active = false;
        for (Cursor<?> cursor : cursors) {
            try {
                cursor.release();
            } catch (RuntimeException e) {
                LOG.warn("Failed to release cursor at end of database block", e);
            }
        }
        cursors.clear();
    }
}
