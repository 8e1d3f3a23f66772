/*
 * Copyright 2026 Babak Farhang
 */
/**
 * Risk council governance on a relational database.
 * 
 * <h2>Councils</h2>
 * <p>
 * A council votes on the assessments assigned to it under its quorum
 * policy. Members are added, reactivated, and revoked; every vote on an
 * assessment cast by a currently active member counts toward its verdict.
 * </p>
 * <h2>Evidence Ledgers</h2>
 * <p>
 * Every vote, and every other governance event on an assessment, is
 * appended to that assessment's hash-chained evidence ledger in the same
 * transaction it is recorded in. Ledgers are append-only and can be
 * verified at any time.
 * </p>
 * <p>
 * The entry point is {@linkplain io.riskledger.council.RiskCouncil}.
 * </p>
 */
package io.riskledger.council;
