/**
 * Branch state resolution: how an item looks once a rig's pending branch is taken into
 * account, and which branch operations are offered for it.
 */
package wasteland.resolve;
