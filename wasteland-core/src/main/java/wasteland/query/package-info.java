/**
 * Read-side queries over the commons tables.
 */
package wasteland.query;
