package wasteland;

/**
 * A commons the rig has joined.
 *
 * @param upstream upstream commons, e.g. {@code hop/wl-commons}
 * @param forkOrg  organization holding the rig's fork
 * @param forkDb   database name of the fork
 * @param mode     workflow mode used for this upstream
 */
public record UpstreamInfo(String upstream, String forkOrg, String forkDb, Mode mode) {
}
