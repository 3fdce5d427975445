/**
 * JDBC commons stores.
 *
 * <ul>
 *   <li>{@link wasteland.jdbc.store.DoltCommonsStore}: Dolt sql-server, with real branches
 *       and remotes</li>
 *   <li>{@link wasteland.jdbc.store.H2CommonsStore}: embedded emulation with branches as
 *       schemas, for offline use and tests</li>
 * </ul>
 *
 * <p>{@link wasteland.jdbc.store.JdbcCommonsStores} picks a store by JDBC URL.
 */
package wasteland.jdbc.store;
