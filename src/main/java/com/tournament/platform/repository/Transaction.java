package com.tournament.platform.repository;

/**
 * Reads see the transaction's own pending writes. Writes become visible together
 * when the transaction commits, or not at all.
 */
public interface Transaction extends DocumentAccess {
}
