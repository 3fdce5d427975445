/**
 * JDBC plumbing for commons stores: connection providers, a small JDBC helper and the
 * commons schema bootstrap.
 *
 * @see wasteland.jdbc.store
 */
package wasteland.jdbc;
