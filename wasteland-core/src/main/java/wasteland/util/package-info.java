/**
 * Small shared helpers.
 */
package wasteland.util;
