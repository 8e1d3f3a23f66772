/*
 * Copyright 2026 Babak Farhang
 */
/**
 * Hash-chained evidence ledger entries, their canonical encoding and
 * hashing, and chain verification. Storage independent.
 */
package io.riskledger.ledger;
