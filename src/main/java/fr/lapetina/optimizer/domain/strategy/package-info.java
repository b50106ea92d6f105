/**
 * Worker selection strategies for the session load balancer.
 *
 * <h2>Available Strategies</h2>
 * <table border="1">
 *   <tr><th>Strategy</th><th>Description</th><th>Best For</th></tr>
 *   <tr><td>{@code least-loaded}</td><td>Lowest load/capacity ratio, oldest heartbeat on ties</td><td>Default, mixed capacities</td></tr>
 *   <tr><td>{@code round-robin}</td><td>Rotates through workers in id order</td><td>Homogeneous workers</td></tr>
 * </table>
 *
 * <p>Implement {@link fr.lapetina.optimizer.domain.strategy.WorkerSelectionStrategy} and register
 * it with {@link fr.lapetina.optimizer.domain.strategy.StrategyFactory} to add one.
 */
package fr.lapetina.optimizer.domain.strategy;
