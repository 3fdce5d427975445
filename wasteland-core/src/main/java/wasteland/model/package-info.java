/**
 * Rows and projections of the commons tables: wanted items, completions and stamps.
 */
package wasteland.model;
