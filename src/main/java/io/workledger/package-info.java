/**
 * WorkLedger source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.workledger.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.workledger.cli.WorkLedgerCommand} maps commands to runtime calls.</li>
 *   <li>{@code io.workledger.lease.LeasingEngine} claims requests and recovers abandoned claims.</li>
 *   <li>{@code io.workledger.commit.TransformCommitter} writes transforms and collections in one transaction.</li>
 *   <li>{@code io.workledger.storage} holds the SQLite-backed entity stores.</li>
 * </ul>
 */
package io.workledger;
