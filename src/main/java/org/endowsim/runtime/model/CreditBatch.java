package org.endowsim.runtime.model;

/**
 * Credits earned in one step, tracked separately so they can expire.
 *
 * @param stepCreated the step the credits were earned
 * @param amount remaining credits of this batch
 */
public record CreditBatch(long stepCreated, double amount) {}
