package org.endowsim.runtime.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Oldest-first ledger of credit batches used when credit expiry is enabled.
 * <p>
 * Batches are appended in step order, so both expiry and spending only ever touch the head of
 * the queue: expiry stops at the first batch that is still young enough, and spending consumes
 * the oldest credits first.
 * </p>
 */
public class CreditLedger {

    private final Deque<CreditBatch> batches = new ArrayDeque<>();

    /**
     * Appends newly earned credits.
     *
     * @param step the step the credits were earned
     * @param amount the amount; non-positive amounts are ignored
     */
    public void add(long step, double amount) {
        if (amount <= 0) {
            return;
        }
        CreditBatch last = batches.peekLast();
        if (last != null && last.stepCreated() > step) {
            throw new IllegalStateException("Credit batch for step " + step + " added after batch for step " + last.stepCreated());
        }
        batches.addLast(new CreditBatch(step, amount));
    }

    /**
     * Removes every batch older than {@code expiryWeeks} at {@code currentStep}.
     *
     * @param currentStep the current step
     * @param expiryWeeks maximum age a batch may reach
     * @return the total amount removed
     */
    public double expire(long currentStep, int expiryWeeks) {
        double expired = 0.0;
        while (!batches.isEmpty()) {
            CreditBatch oldest = batches.peekFirst();
            if (currentStep - oldest.stepCreated() <= expiryWeeks) {
                break;
            }
            expired += oldest.amount();
            batches.removeFirst();
        }
        return expired;
    }

    /**
     * Consumes {@code amount} credits, oldest batches first. If the ledger holds less than the
     * requested amount it is simply emptied.
     *
     * @param amount the amount to consume
     * @return the amount actually taken from batches
     */
    public double consume(double amount) {
        double remaining = amount;
        while (remaining > 0 && !batches.isEmpty()) {
            CreditBatch oldest = batches.removeFirst();
            if (oldest.amount() > remaining) {
                batches.addFirst(new CreditBatch(oldest.stepCreated(), oldest.amount() - remaining));
                remaining = 0;
            } else {
                remaining -= oldest.amount();
            }
        }
        return amount - Math.max(remaining, 0.0);
    }

    /**
     * @return the sum of all batch amounts
     */
    public double total() {
        double sum = 0.0;
        for (CreditBatch batch : batches) {
            sum += batch.amount();
        }
        return sum;
    }

    public int size() {
        return batches.size();
    }

    public boolean isEmpty() {
        return batches.isEmpty();
    }

    /**
     * @return a copy of the batches, oldest first
     */
    public List<CreditBatch> snapshot() {
        return List.copyOf(new ArrayList<>(batches));
    }
}
