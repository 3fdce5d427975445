package wasteland.resolve;

import wasteland.model.WantedStatus;

/**
 * An item whose status on a rig's mutation branch differs from main.
 */
public record BranchOverride(String wantedId, String branch, WantedStatus status) {
}
