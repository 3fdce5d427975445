/**
 * Transition authority for wanted items: the state machine, who may fire which edge,
 * the guarded statements each edge runs, and the branch and delta naming built on it.
 */
package wasteland.lifecycle;
