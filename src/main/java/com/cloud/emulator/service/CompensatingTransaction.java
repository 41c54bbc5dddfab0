package com.cloud.emulator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Undo log for a handler that mutates the state store and the resource graph in
 * several steps. Each completed step leaves behind an undo action; if a later step
 * throws, or the handler leaves the block without {@link #markSuccess()}, the undo
 * actions run newest first.
 *
 * <pre>
 * try (CompensatingTransaction tx = new CompensatingTransaction("AttachRolePolicy")) {
 *     tx.execute("write attachment list", () -> addName(key, arn), () -> removeName(key, arn));
 *     tx.execute("link policy to role", () -> link(policy, role, ASSOCIATED_WITH),
 *             () -> unlink(policy, role, ASSOCIATED_WITH));
 *     tx.markSuccess();
 * }
 * </pre>
 *
 * <p>Instances are confined to the handler call that created them.</p>
 */
public class CompensatingTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CompensatingTransaction.class);

    private final String action;
    private final Deque<UndoStep> undoLog = new ArrayDeque<>();
    private boolean success;
    private boolean closed;
    private int failedCompensations;

    public CompensatingTransaction(String action) {
        this.action = action;
    }

    /**
     * Runs one step. On failure the steps completed so far are undone and the
     * step's exception is rethrown unchanged.
     *
     * @throws IllegalStateException if the transaction is already closed
     */
    public void execute(String step, Runnable operation, Runnable undo) {
        if (closed) {
            throw new IllegalStateException(action + ": cannot run '" + step + "' after close");
        }
        log.debug("{}: {}", action, step);
        try {
            operation.run();
        } catch (RuntimeException e) {
            log.warn("{}: '{}' failed ({}), undoing {} completed step(s)",
                    action, step, e.getMessage(), undoLog.size());
            unwind();
            throw e;
        }
        undoLog.push(new UndoStep(step, undo));
    }

    public void markSuccess() {
        success = true;
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * Number of completed steps that would be undone if the transaction closed now.
     */
    public int pendingCompensations() {
        return undoLog.size();
    }

    /**
     * Number of undo actions that threw while unwinding.
     */
    public int failedCompensations() {
        return failedCompensations;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!success && !undoLog.isEmpty()) {
            log.warn("{}: not completed, undoing {} step(s)", action, undoLog.size());
            unwind();
        }
    }

    private void unwind() {
        while (!undoLog.isEmpty()) {
            UndoStep undo = undoLog.pop();
            try {
                undo.action().run();
            } catch (RuntimeException e) {
                failedCompensations++;
                log.error("{}: undo of '{}' failed: {}", action, undo.step(), e.getMessage());
            }
        }
    }

    private record UndoStep(String step, Runnable action) {}
}
